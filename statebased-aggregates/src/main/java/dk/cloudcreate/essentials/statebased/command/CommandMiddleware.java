package dk.cloudcreate.essentials.statebased.command;

/**
 * Cross cutting behaviour around command handling. Middlewares are composed into a chain once, when the
 * {@link CommandPipeline} is built, in the order they were added: the first added middleware is the outermost.<br>
 * A middleware decides whether, and how often, to call {@link NextCommandHandler#handle(Command)}
 */
public interface CommandMiddleware {
    /**
     * Intercept the handling of a command
     *
     * @param command the command
     * @param next    the rest of the chain (further middlewares followed by the command handler)
     * @param <R>     the result value type
     * @return the result
     */
    <R> OperationResult<R> intercept(Command<R> command, NextCommandHandler next);

    /**
     * The remainder of a middleware chain
     */
    interface NextCommandHandler {
        <R> OperationResult<R> handle(Command<R> command);
    }
}
