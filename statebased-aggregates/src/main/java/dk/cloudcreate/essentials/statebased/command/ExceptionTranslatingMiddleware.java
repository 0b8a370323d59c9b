package dk.cloudcreate.essentials.statebased.command;

import dk.cloudcreate.essentials.statebased.aggregates.AggregateValidationException;
import dk.cloudcreate.essentials.statebased.repository.*;
import dk.cloudcreate.essentials.statebased.serializer.StateSerializationException;
import dk.cloudcreate.essentials.statebased.store.DocumentStoreException;
import org.slf4j.*;

/**
 * Translates the expected aggregate, repository and storage exceptions into failed {@link OperationResult}'s:
 * <table>
 *     <tr><td>{@link AggregateValidationException}</td><td>{@link FailureReason#VALIDATION_FAILED}</td></tr>
 *     <tr><td>{@link AggregateNotFoundException}</td><td>{@link FailureReason#NOT_FOUND}</td></tr>
 *     <tr><td>{@link DuplicateAggregateException}</td><td>{@link FailureReason#ALREADY_EXISTS}</td></tr>
 *     <tr><td>{@link OptimisticConcurrencyException}</td><td>{@link FailureReason#CONCURRENCY_CONFLICT}</td></tr>
 *     <tr><td>{@link DocumentStoreException}</td><td>{@link FailureReason#STORAGE_UNAVAILABLE}</td></tr>
 * </table>
 * {@link StateSerializationException}'s and any other exception propagate unchanged.<br>
 * Should be the innermost middleware, so the outer middlewares see the translated result
 */
public class ExceptionTranslatingMiddleware implements CommandMiddleware {
    private static final Logger log = LoggerFactory.getLogger(ExceptionTranslatingMiddleware.class);

    @Override
    public <R> OperationResult<R> intercept(Command<R> command, NextCommandHandler next) {
        try {
            return next.handle(command);
        } catch (StateSerializationException e) {
            throw e;
        } catch (AggregateValidationException e) {
            log.debug("[{}] Validation failed: {}", command.getClass().getSimpleName(), e.getMessage());
            return OperationResult.failure(FailureReason.VALIDATION_FAILED, e.getMessage());
        } catch (AggregateNotFoundException e) {
            log.debug("[{}] Aggregate not found: {}", command.getClass().getSimpleName(), e.getMessage());
            return OperationResult.failure(FailureReason.NOT_FOUND, e.getMessage());
        } catch (DuplicateAggregateException e) {
            log.debug("[{}] Aggregate already exists: {}", command.getClass().getSimpleName(), e.getMessage());
            return OperationResult.failure(FailureReason.ALREADY_EXISTS, e.getMessage());
        } catch (OptimisticConcurrencyException e) {
            log.debug("[{}] Concurrency conflict: {}", command.getClass().getSimpleName(), e.getMessage());
            return OperationResult.failure(FailureReason.CONCURRENCY_CONFLICT, e.getMessage());
        } catch (DocumentStoreException e) {
            log.warn("[{}] Document store unavailable: {}", command.getClass().getSimpleName(), e.getMessage());
            return OperationResult.failure(FailureReason.STORAGE_UNAVAILABLE, e.getMessage());
        }
    }
}
