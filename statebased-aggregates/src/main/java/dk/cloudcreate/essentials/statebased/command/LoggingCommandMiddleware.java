package dk.cloudcreate.essentials.statebased.command;

import org.slf4j.*;

/**
 * Logs every command together with its outcome and duration
 */
public class LoggingCommandMiddleware implements CommandMiddleware {
    private static final Logger log = LoggerFactory.getLogger(LoggingCommandMiddleware.class);

    @Override
    public <R> OperationResult<R> intercept(Command<R> command, NextCommandHandler next) {
        var commandType = command.getClass().getSimpleName();
        log.debug("[{}] Handling {}", commandType, command);
        var start = System.nanoTime();
        try {
            var result = next.handle(command);
            var durationInMillis = (System.nanoTime() - start) / 1_000_000;
            if (result.isSuccess()) {
                log.info("[{}] Succeeded with status {} in {} ms", commandType, result.statusCode(), durationInMillis);
            } else {
                log.info("[{}] Failed with status {} ({}) in {} ms: {}", commandType, result.statusCode(), result.failureReason().get(), durationInMillis, result.detail());
            }
            return result;
        } catch (RuntimeException e) {
            log.error("[{}] Failed with {} after {} ms", commandType, e.getClass().getSimpleName(), (System.nanoTime() - start) / 1_000_000, e);
            throw e;
        }
    }
}
