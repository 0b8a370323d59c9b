package dk.cloudcreate.essentials.statebased.repository;

import dk.cloudcreate.essentials.statebased.aggregates.*;
import dk.cloudcreate.essentials.statebased.store.CollectionName;

import java.time.Clock;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Configuration for a {@link StateRepository}: where an aggregate type is stored and how it's rebuilt
 *
 * @param <ID>        the aggregate id type
 * @param <STATE>     the aggregate state type
 * @param <AGGREGATE> the aggregate type
 */
public class StateRepositoryConfiguration<ID, STATE extends AggregateState<ID>, AGGREGATE extends StateAggregateRoot<ID, STATE, AGGREGATE>> {
    /**
     * The collection the aggregate states are stored in
     */
    public final CollectionName                     collectionName;
    /**
     * The aggregate implementation type
     */
    public final Class<AGGREGATE>                   aggregateType;
    /**
     * The state type that persisted documents are deserialized into
     */
    public final Class<STATE>                       stateType;
    /**
     * Rebuilds the aggregate from a loaded state
     */
    public final AggregateFactory<STATE, AGGREGATE> aggregateFactory;
    /**
     * The clock used for the <code>created_at</code> and <code>last_modified</code> timestamps
     */
    public final Clock                              clock;

    public StateRepositoryConfiguration(CollectionName collectionName,
                                        Class<AGGREGATE> aggregateType,
                                        Class<STATE> stateType,
                                        AggregateFactory<STATE, AGGREGATE> aggregateFactory,
                                        Clock clock) {
        this.collectionName = requireNonNull(collectionName, "No collectionName provided");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.stateType = requireNonNull(stateType, "No stateType provided");
        this.aggregateFactory = requireNonNull(aggregateFactory, "No aggregateFactory provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    /**
     * Create a configuration that uses the UTC system clock
     */
    public static <ID, STATE extends AggregateState<ID>, AGGREGATE extends StateAggregateRoot<ID, STATE, AGGREGATE>> StateRepositoryConfiguration<ID, STATE, AGGREGATE> of(CollectionName collectionName,
                                                                                                                                                                         Class<AGGREGATE> aggregateType,
                                                                                                                                                                         Class<STATE> stateType,
                                                                                                                                                                         AggregateFactory<STATE, AGGREGATE> aggregateFactory) {
        return new StateRepositoryConfiguration<>(collectionName,
                                                  aggregateType,
                                                  stateType,
                                                  aggregateFactory,
                                                  Clock.systemUTC());
    }

    /**
     * Create a copy of this configuration that uses another clock
     */
    public StateRepositoryConfiguration<ID, STATE, AGGREGATE> withClock(Clock clock) {
        return new StateRepositoryConfiguration<>(collectionName,
                                                  aggregateType,
                                                  stateType,
                                                  aggregateFactory,
                                                  clock);
    }

    @Override
    public String toString() {
        return "StateRepositoryConfiguration{" +
                "collectionName=" + collectionName +
                ", aggregateType=" + aggregateType.getName() +
                ", stateType=" + stateType.getName() +
                '}';
    }
}
