package dk.cloudcreate.essentials.statebased.aggregates;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * State based aggregate root. The aggregate owns exactly one {@link AggregateState} (the persisted part)
 * together with a transient queue of pending {@link DomainEvent}'s that are dispatched after the command
 * that produced them has succeeded.<br>
 * <br>
 * Business methods validate first (see {@link #validate(boolean, String, Object...)} and {@link #validate(BusinessRule)}), then mutate the
 * {@link #state()} and register the corresponding event using {@link #registerEvent(DomainEvent)}:
 * <pre>{@code
 * public void confirm() {
 *     validate(state().status == OrderStatus.PENDING, "Cannot confirm an order with status '{}'", state().status);
 *     state().status = OrderStatus.CONFIRMED;
 *     registerEvent(new OrderConfirmed(aggregateId()));
 * }
 * }</pre>
 * Loading an aggregate from a repository always yields an empty event queue.
 *
 * @param <ID>        the aggregate id type
 * @param <STATE>     the aggregate state type
 * @param <AGGREGATE> the aggregate self type
 */
public abstract class StateAggregateRoot<ID, STATE extends AggregateState<ID>, AGGREGATE extends StateAggregateRoot<ID, STATE, AGGREGATE>> implements Aggregate<ID> {
    private final STATE                           state;
    private final transient List<DomainEvent<ID>> pendingEvents;

    protected StateAggregateRoot(STATE state) {
        this.state = requireNonNull(state, "No state provided");
        this.pendingEvents = new ArrayList<>();
    }

    public STATE state() {
        return state;
    }

    @Override
    public ID aggregateId() {
        return state.aggregateId();
    }

    /**
     * Register a new event as pending
     *
     * @param event the event
     * @param <E>   the event type
     * @return the same <code>event</code> instance
     */
    protected <E extends DomainEvent<ID>> E registerEvent(E event) {
        requireNonNull(event, "No event provided");
        pendingEvents.add(event);
        return event;
    }

    @Override
    public List<DomainEvent<ID>> uncommittedEvents() {
        return List.copyOf(pendingEvents);
    }

    @Override
    public void clearPendingEvents() {
        pendingEvents.clear();
    }

    @Override
    public boolean hasPendingEvents() {
        return !pendingEvents.isEmpty();
    }

    /**
     * Guard a state transition. Must be called before the state is mutated or any event is registered
     *
     * @param condition   the condition that must hold
     * @param message     the failure message, which may contain '{}' placeholders
     * @param messageArgs the placeholder values
     * @throws AggregateValidationException if <code>condition</code> is false
     */
    protected void validate(boolean condition, String message, Object... messageArgs) {
        if (!condition) {
            throw new AggregateValidationException(aggregateId(),
                                                   getClass(),
                                                   msg(message, messageArgs));
        }
    }

    /**
     * Guard a state transition with a {@link BusinessRule} checked against the {@link #state()}.
     * Must be called before the state is mutated or any event is registered
     *
     * @param rule the rule that must be satisfied
     * @throws AggregateValidationException with all {@link BusinessRule.Violation}'s if the rule is broken
     */
    protected void validate(BusinessRule<? super STATE> rule) {
        requireNonNull(rule, "No rule provided");
        var violations = rule.check(state);
        if (!violations.isEmpty()) {
            throw new AggregateValidationException(aggregateId(), getClass(), violations);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "aggregateId=" + aggregateId() +
                ", stateVersion=" + state.stateVersion() +
                ", pendingEvents=" + pendingEvents.size() +
                '}';
    }
}
