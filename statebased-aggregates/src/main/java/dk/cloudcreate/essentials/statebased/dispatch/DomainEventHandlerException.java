package dk.cloudcreate.essentials.statebased.dispatch;

import dk.cloudcreate.essentials.statebased.aggregates.DomainEvent;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown towards the {@link dk.cloudcreate.essentials.reactive.LocalEventBus} when a {@link DomainEventHandler} fails.
 * The cause is what the handler threw
 */
public class DomainEventHandlerException extends RuntimeException {
    public final DomainEventSubscriptions.Subscription subscription;
    public final DomainEvent<?>                        event;

    public DomainEventHandlerException(DomainEventSubscriptions.Subscription subscription, DomainEvent<?> event, Throwable cause) {
        super(msg("Handler '{}' failed to handle '{}' for aggregate '{}'",
                  subscription.handlerName,
                  event.eventType(),
                  event.aggregateId()), cause);
        this.subscription = subscription;
        this.event = event;
    }
}
