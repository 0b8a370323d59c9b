package dk.cloudcreate.essentials.statebased.aggregates;

/**
 * The single identity capability shared by {@link AggregateState} and {@link Aggregate}.<br>
 * Repositories, the unit of work and event dispatch only ever resolve identity through {@link #aggregateId()}
 *
 * @param <ID> the type of aggregate id
 */
public interface Identifiable<ID> {
    /**
     * The id of the aggregate
     *
     * @return the id of the aggregate
     */
    ID aggregateId();
}
