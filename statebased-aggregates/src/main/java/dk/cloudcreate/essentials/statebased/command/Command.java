package dk.cloudcreate.essentials.statebased.command;

/**
 * Marker interface for commands sent through a {@link CommandPipeline}
 *
 * @param <R> the type of the value a successful command returns
 */
public interface Command<R> {
}
