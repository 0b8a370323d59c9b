package dk.cloudcreate.essentials.statebased.aggregates;

import java.time.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Base class for immutable domain events raised by a {@link StateAggregateRoot}.<br>
 * The concrete subclass is the event kind, the subclass fields are its payload.<br>
 * Events have identity semantics: two events raised with the same aggregate id at the same instant are still different events.
 *
 * @param <ID> the type of aggregate id
 */
public abstract class DomainEvent<ID> {
    private final ID             aggregateId;
    private final OffsetDateTime occurredAt;

    protected DomainEvent(ID aggregateId) {
        this(aggregateId, OffsetDateTime.now(ZoneOffset.UTC));
    }

    protected DomainEvent(ID aggregateId, OffsetDateTime occurredAt) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.occurredAt = requireNonNull(occurredAt, "No occurredAt provided").withOffsetSameInstant(ZoneOffset.UTC);
    }

    /**
     * The id of the aggregate that raised this event
     */
    public ID aggregateId() {
        return aggregateId;
    }

    /**
     * When the event was raised (UTC)
     */
    public OffsetDateTime occurredAt() {
        return occurredAt;
    }

    /**
     * The event kind, i.e. the simple name of the concrete event class
     */
    public String eventType() {
        return getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return eventType() + "{" +
                "aggregateId=" + aggregateId +
                ", occurredAt=" + occurredAt +
                '}';
    }
}
