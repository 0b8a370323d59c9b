package dk.cloudcreate.essentials.statebased.repository;

import dk.cloudcreate.essentials.statebased.aggregates.*;

/**
 * Rebuilds an aggregate around a state that has been loaded from the document store
 *
 * @param <STATE>     the state type
 * @param <AGGREGATE> the aggregate type
 */
@FunctionalInterface
public interface AggregateFactory<STATE extends AggregateState<?>, AGGREGATE extends Aggregate<?>> {
    /**
     * Create the aggregate instance. The returned aggregate must have no pending events
     *
     * @param state the loaded state
     * @return the aggregate
     */
    AGGREGATE create(STATE state);
}
