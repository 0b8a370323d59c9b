package dk.cloudcreate.essentials.statebased.dispatch;

import dk.cloudcreate.essentials.statebased.aggregates.DomainEvent;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Immutable registry of event kind to handlers, built once at startup:
 * <pre>{@code
 * var subscriptions = DomainEventSubscriptions.builder()
 *                                             .subscribe(OrderConfirmed.class, kitchenNotifier::onOrderConfirmed)
 *                                             .subscribe(OrderEvent.class, "audit-log", auditLog::append)
 *                                             .build();
 * }</pre>
 * A handler subscribed to a base event type receives all subtypes. Handlers for an event are returned in subscription order
 */
public final class DomainEventSubscriptions {
    private static final Logger log = LoggerFactory.getLogger(DomainEventSubscriptions.class);

    private final List<Subscription>                          subscriptions;
    private final ConcurrentMap<Class<?>, List<Subscription>> subscriptionsPerEventType = new ConcurrentHashMap<>();

    private DomainEventSubscriptions(List<Subscription> subscriptions) {
        this.subscriptions = List.copyOf(subscriptions);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registry without any subscriptions
     */
    public static DomainEventSubscriptions none() {
        return new DomainEventSubscriptions(List.of());
    }

    /**
     * Resolve the subscriptions that should receive the given event
     *
     * @param event the event
     * @return the matching subscriptions in subscription order (may be empty)
     */
    public List<Subscription> subscriptionsFor(DomainEvent<?> event) {
        requireNonNull(event, "No event provided");
        return subscriptionsPerEventType.computeIfAbsent(event.getClass(), eventType -> {
            var matching = new ArrayList<Subscription>();
            for (Subscription subscription : subscriptions) {
                if (subscription.eventType.isAssignableFrom(eventType)) {
                    matching.add(subscription);
                }
            }
            log.trace("Resolved {} subscription(s) for event type '{}'", matching.size(), eventType.getName());
            return List.copyOf(matching);
        });
    }

    public List<Subscription> allSubscriptions() {
        return subscriptions;
    }

    public static final class Subscription {
        public final Class<?>                           eventType;
        public final String                             handlerName;
        public final DomainEventHandler<DomainEvent<?>> handler;

        private Subscription(Class<?> eventType, String handlerName, DomainEventHandler<DomainEvent<?>> handler) {
            this.eventType = eventType;
            this.handlerName = handlerName;
            this.handler = handler;
        }

        @Override
        public String toString() {
            return "Subscription{" +
                    "eventType=" + eventType.getSimpleName() +
                    ", handlerName='" + handlerName + '\'' +
                    '}';
        }
    }

    public static final class Builder {
        private final List<Subscription> subscriptions = new ArrayList<>();

        private Builder() {
        }

        public <E extends DomainEvent<?>> Builder subscribe(Class<E> eventType, DomainEventHandler<? super E> handler) {
            requireNonNull(handler, "No handler provided");
            return subscribe(eventType, handler.getClass().getName(), handler);
        }

        @SuppressWarnings("unchecked")
        public <E extends DomainEvent<?>> Builder subscribe(Class<E> eventType, String handlerName, DomainEventHandler<? super E> handler) {
            requireNonNull(eventType, "No eventType provided");
            requireNonNull(handlerName, "No handlerName provided");
            requireNonNull(handler, "No handler provided");
            subscriptions.add(new Subscription(eventType, handlerName, (DomainEventHandler<DomainEvent<?>>) (DomainEventHandler<?>) handler));
            return this;
        }

        public DomainEventSubscriptions build() {
            log.debug("Building DomainEventSubscriptions with {} subscription(s)", subscriptions.size());
            return new DomainEventSubscriptions(subscriptions);
        }
    }
}
