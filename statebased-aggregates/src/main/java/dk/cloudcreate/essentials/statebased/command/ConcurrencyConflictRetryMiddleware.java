package dk.cloudcreate.essentials.statebased.command;

import dk.cloudcreate.essentials.statebased.repository.OptimisticConcurrencyException;
import dk.cloudcreate.essentials.statebased.transaction.*;
import org.slf4j.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Re-runs the rest of the chain when a command fails with a retryable {@link FailureReason#CONCURRENCY_CONFLICT}, either as a
 * failed {@link OperationResult} or as a thrown {@link OptimisticConcurrencyException}.<br>
 * Before each retry the active {@link UnitOfWork} (if any) is cleared, so the events of the failed attempt are never dispatched,
 * and the command handler loads a fresh copy of the aggregate.<br>
 * When the retries are exhausted the last result is returned, or the last exception rethrown.
 */
public class ConcurrencyConflictRetryMiddleware implements CommandMiddleware {
    private static final Logger log = LoggerFactory.getLogger(ConcurrencyConflictRetryMiddleware.class);

    private final UnitOfWorkFactory   unitOfWorkFactory;
    private final ConflictRetryPolicy retryPolicy;

    public ConcurrencyConflictRetryMiddleware(UnitOfWorkFactory unitOfWorkFactory, ConflictRetryPolicy retryPolicy) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.retryPolicy = requireNonNull(retryPolicy, "No retryPolicy provided");
    }

    @Override
    public <R> OperationResult<R> intercept(Command<R> command, NextCommandHandler next) {
        var retryNumber = 0;
        while (true) {
            try {
                var result = next.handle(command);
                if (!result.isRetryable() || retryNumber >= retryPolicy.maximumNumberOfRetries) {
                    return result;
                }
                log.debug("[{}] Attempt {} failed with {}: {}", command.getClass().getSimpleName(), retryNumber + 1, result.failureReason().get(), result.detail());
            } catch (OptimisticConcurrencyException e) {
                if (retryNumber >= retryPolicy.maximumNumberOfRetries) {
                    throw e;
                }
                log.debug("[{}] Attempt {} failed: {}", command.getClass().getSimpleName(), retryNumber + 1, e.getMessage());
            }

            unitOfWorkFactory.getCurrentUnitOfWork().ifPresent(UnitOfWork::clear);
            var delay = retryPolicy.calculateRetryDelay(retryNumber);
            retryNumber++;
            log.info("[{}] Retrying after a concurrency conflict (retry {} of {}) in {} ms",
                     command.getClass().getSimpleName(),
                     retryNumber,
                     retryPolicy.maximumNumberOfRetries,
                     delay.toMillis());
            if (!sleep(delay.toMillis())) {
                return OperationResult.failure(FailureReason.CONCURRENCY_CONFLICT,
                                               "Interrupted while waiting to retry " + command.getClass().getSimpleName());
            }
        }
    }

    private static boolean sleep(long delayInMillis) {
        if (delayInMillis <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayInMillis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to retry");
            return false;
        }
    }
}
