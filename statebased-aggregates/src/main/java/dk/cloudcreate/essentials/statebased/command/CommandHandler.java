package dk.cloudcreate.essentials.statebased.command;

/**
 * Handles one command type. A handler loads and changes aggregates, persists them through a repository and
 * registers them with the active unit of work. The handler reports the outcome as an {@link OperationResult};
 * aggregate and repository exceptions may simply be thrown and are translated by the {@link ExceptionTranslatingMiddleware}
 *
 * @param <C> the command type
 * @param <R> the result value type
 */
@FunctionalInterface
public interface CommandHandler<C extends Command<R>, R> {
    OperationResult<R> handle(C command);
}
