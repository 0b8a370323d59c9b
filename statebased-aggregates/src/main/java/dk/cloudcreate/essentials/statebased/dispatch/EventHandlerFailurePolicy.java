package dk.cloudcreate.essentials.statebased.dispatch;

import dk.cloudcreate.essentials.statebased.aggregates.DomainEvent;
import org.slf4j.*;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Decides what happens when a handler has failed to handle an event.<br>
 * A policy never throws: once it gives up, the failure is logged and dispatch continues with the next handler
 */
public interface EventHandlerFailurePolicy {
    /**
     * Called after the first attempt of the subscription's handler failed
     *
     * @param event        the event
     * @param subscription the subscription whose handler failed
     * @param failure      what the handler threw
     * @return true if the handler eventually handled the event, false if the policy gave up
     */
    boolean onFailure(DomainEvent<?> event, DomainEventSubscriptions.Subscription subscription, Throwable failure);

    /**
     * Log the failure and continue
     */
    static EventHandlerFailurePolicy logAndContinue() {
        return new RetryingFailurePolicy(1, Duration.ZERO);
    }

    /**
     * Invoke the handler up to <code>maxAttempts</code> times in total, waiting <code>delayBetweenAttempts</code> between attempts.
     * If the last attempt fails, the failure is logged and dispatch continues
     *
     * @param maxAttempts          the maximum number of attempts (1 means no retries)
     * @param delayBetweenAttempts delay between attempts
     */
    static EventHandlerFailurePolicy retry(int maxAttempts, Duration delayBetweenAttempts) {
        return new RetryingFailurePolicy(maxAttempts, delayBetweenAttempts);
    }

    class RetryingFailurePolicy implements EventHandlerFailurePolicy {
        private static final Logger log = LoggerFactory.getLogger(EventHandlerFailurePolicy.class);

        public final int      maxAttempts;
        public final Duration delayBetweenAttempts;

        public RetryingFailurePolicy(int maxAttempts, Duration delayBetweenAttempts) {
            requireTrue(maxAttempts >= 1, "maxAttempts must be 1 or larger");
            this.maxAttempts = maxAttempts;
            this.delayBetweenAttempts = requireNonNull(delayBetweenAttempts, "No delayBetweenAttempts provided");
        }

        @Override
        public boolean onFailure(DomainEvent<?> event, DomainEventSubscriptions.Subscription subscription, Throwable failure) {
            requireNonNull(event, "No event provided");
            requireNonNull(subscription, "No subscription provided");
            var lastFailure = failure;
            for (int attempt = 2; attempt <= maxAttempts; attempt++) {
                log.warn("Handler '{}' failed to handle '{}' for aggregate '{}' (attempt {} of {}), retrying in {}: {}",
                         subscription.handlerName,
                         event.eventType(),
                         event.aggregateId(),
                         attempt - 1,
                         maxAttempts,
                         delayBetweenAttempts,
                         lastFailure.getMessage());
                if (!sleep()) {
                    log.error(msg("Interrupted while waiting to retry handler '{}' for '{}'. Giving up", subscription.handlerName, event.eventType()), lastFailure);
                    return false;
                }
                try {
                    subscription.handler.handle(event);
                    return true;
                } catch (VirtualMachineError e) {
                    throw e;
                } catch (Throwable e) {
                    lastFailure = e;
                }
            }
            log.error(msg("Handler '{}' failed to handle '{}' for aggregate '{}' (attempt {} of {}). Continuing with the next handler",
                          subscription.handlerName,
                          event.eventType(),
                          event.aggregateId(),
                          maxAttempts,
                          maxAttempts), lastFailure);
            return false;
        }

        private boolean sleep() {
            if (delayBetweenAttempts.isZero()) {
                return true;
            }
            try {
                Thread.sleep(delayBetweenAttempts.toMillis());
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }

        @Override
        public String toString() {
            return "RetryingFailurePolicy{" +
                    "maxAttempts=" + maxAttempts +
                    ", delayBetweenAttempts=" + delayBetweenAttempts +
                    '}';
        }
    }
}
