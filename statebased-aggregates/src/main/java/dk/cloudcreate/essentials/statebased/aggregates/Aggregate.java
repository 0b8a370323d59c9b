package dk.cloudcreate.essentials.statebased.aggregates;

import java.util.List;

/**
 * Common interface that all state based aggregates must implement. Most concrete implementations choose to extend the {@link StateAggregateRoot} class
 *
 * @param <ID> the aggregate id type
 */
public interface Aggregate<ID> extends Identifiable<ID> {
    /**
     * Snapshot of the events registered since the aggregate was loaded, created or last cleared.<br>
     * The returned list is a copy, so it's safe to keep after {@link #clearPendingEvents()} has been called
     *
     * @return the pending events in the order they were registered
     */
    List<DomainEvent<ID>> uncommittedEvents();

    /**
     * Drop all pending events. Called after the events have been dispatched (or discarded)
     */
    void clearPendingEvents();

    /**
     * Does the aggregate have any pending events
     */
    boolean hasPendingEvents();
}
