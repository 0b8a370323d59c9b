package dk.cloudcreate.essentials.statebased.dispatch;

import dk.cloudcreate.essentials.statebased.aggregates.DomainEvent;

/**
 * Handles one kind of {@link DomainEvent}. Handlers are called synchronously, one at a time,
 * after the command that raised the event has succeeded. An exception thrown by a handler
 * never affects the command result or the other handlers
 *
 * @param <E> the event kind
 */
@FunctionalInterface
public interface DomainEventHandler<E extends DomainEvent<?>> {
    void handle(E event) throws Exception;
}
