package dk.cloudcreate.essentials.statebased.repository;

import dk.cloudcreate.essentials.statebased.aggregates.AggregateException;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an update was based on a stale state version, i.e. another update was persisted
 * between the aggregate being loaded and being saved. The operation can be retried by reloading the aggregate
 */
public class OptimisticConcurrencyException extends AggregateException {
    public final Object   aggregateId;
    public final Class<?> aggregateType;
    public final long     expectedVersion;
    public final long     actualVersion;

    public OptimisticConcurrencyException(Object aggregateId, Class<?> aggregateType, long expectedVersion, long actualVersion) {
        super(msg("Expected state_version '{}' for '{}' with id '{}' but found '{}' (actual state_version) in the document store",
                  expectedVersion,
                  aggregateType.getName(),
                  aggregateId,
                  actualVersion));
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
