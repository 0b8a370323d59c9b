package dk.cloudcreate.essentials.statebased.repository;

import dk.cloudcreate.essentials.statebased.aggregates.AggregateException;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when adding an aggregate whose id is already in use
 */
public class DuplicateAggregateException extends AggregateException {
    public final Object   aggregateId;
    public final Class<?> aggregateType;

    public DuplicateAggregateException(Object aggregateId, Class<?> aggregateType, Throwable cause) {
        super(msg("A '{}' aggregate with id '{}' already exists",
                  aggregateType.getName(),
                  aggregateId), cause);
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
    }
}
