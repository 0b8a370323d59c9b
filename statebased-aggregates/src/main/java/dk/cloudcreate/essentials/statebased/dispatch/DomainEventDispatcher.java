package dk.cloudcreate.essentials.statebased.dispatch;

import dk.cloudcreate.essentials.reactive.LocalEventBus;
import dk.cloudcreate.essentials.statebased.aggregates.DomainEvent;
import org.slf4j.*;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Delivers domain events to the handlers in a {@link DomainEventSubscriptions} registry.<br>
 * Every subscription is added as a synchronous subscriber to a {@link LocalEventBus}, in subscription order, so
 * events are delivered in the order given and for each event the handlers are invoked one at a time, each to completion,
 * on the calling thread.<br>
 * A failing handler is reported to the bus' error handler, which hands it to the {@link EventHandlerFailurePolicy}.
 * Handler failures never propagate to the caller
 */
public class DomainEventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(DomainEventDispatcher.class);

    private final DomainEventSubscriptions   subscriptions;
    private final EventHandlerFailurePolicy  failurePolicy;
    private final LocalEventBus              localEventBus;
    /**
     * Failure counter of the publish call in progress on the current thread
     */
    private final ThreadLocal<AtomicInteger> failuresOfCurrentPublish = new ThreadLocal<>();

    public DomainEventDispatcher(DomainEventSubscriptions subscriptions) {
        this(subscriptions, EventHandlerFailurePolicy.logAndContinue());
    }

    public DomainEventDispatcher(DomainEventSubscriptions subscriptions, EventHandlerFailurePolicy failurePolicy) {
        this.subscriptions = requireNonNull(subscriptions, "No subscriptions provided");
        this.failurePolicy = requireNonNull(failurePolicy, "No failurePolicy provided");
        localEventBus = new LocalEventBus("DomainEventDispatcher", 1, this::onErrorHandler);
        for (DomainEventSubscriptions.Subscription subscription : subscriptions.allSubscriptions()) {
            localEventBus.addSyncSubscriber(event -> deliver(subscription, event));
        }
        log.debug("Added {} subscription(s) as synchronous subscribers", subscriptions.allSubscriptions().size());
    }

    /**
     * Dispatch the events in order
     *
     * @param events the events to dispatch
     * @return the number of handler invocations that failed
     */
    public int dispatch(List<? extends DomainEvent<?>> events) {
        requireNonNull(events, "No events provided");
        log.debug("Dispatching {} event(s)", events.size());
        var failures = 0;
        for (DomainEvent<?> event : events) {
            failures += publish(event);
        }
        return failures;
    }

    /**
     * Dispatch a single event
     *
     * @param event the event
     * @return the number of handler invocations that failed
     */
    public int publish(DomainEvent<?> event) {
        requireNonNull(event, "No event provided");
        if (subscriptions.subscriptionsFor(event).isEmpty()) {
            log.trace("No handlers subscribed to '{}'", event.eventType());
            return 0;
        }
        var outerPublishFailures = failuresOfCurrentPublish.get();
        var failures             = new AtomicInteger();
        failuresOfCurrentPublish.set(failures);
        try {
            localEventBus.publish(event);
        } finally {
            if (outerPublishFailures != null) {
                failuresOfCurrentPublish.set(outerPublishFailures);
            } else {
                failuresOfCurrentPublish.remove();
            }
        }
        return failures.get();
    }

    private void deliver(DomainEventSubscriptions.Subscription subscription, Object event) {
        if (!subscription.eventType.isInstance(event)) {
            return;
        }
        var domainEvent = (DomainEvent<?>) event;
        log.trace("Delivering '{}' for aggregate '{}' to '{}'", domainEvent.eventType(), domainEvent.aggregateId(), subscription.handlerName);
        try {
            subscription.handler.handle(domainEvent);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            throw new DomainEventHandlerException(subscription, domainEvent, e);
        }
    }

    private void onErrorHandler(Object failingSubscriber, Object event, Exception exception) {
        if (!(exception instanceof DomainEventHandlerException)) {
            log.error(msg("Subscriber '{}' failed to handle '{}'", failingSubscriber, event), exception);
            countFailure();
            return;
        }
        var handlerException = (DomainEventHandlerException) exception;
        if (!failurePolicy.onFailure(handlerException.event, handlerException.subscription, handlerException.getCause())) {
            countFailure();
        }
    }

    private void countFailure() {
        var failures = failuresOfCurrentPublish.get();
        if (failures != null) {
            failures.incrementAndGet();
        }
    }
}
