package dk.cloudcreate.essentials.statebased.transaction;

import dk.cloudcreate.essentials.statebased.aggregates.*;
import org.slf4j.*;

import java.util.*;

/**
 * Tracks the aggregates modified while handling a single command, so their pending events can be
 * collected and dispatched once the command has succeeded.<br>
 * A {@link UnitOfWork} is confined to the thread handling the command and is obtained from a {@link UnitOfWorkFactory}.<br>
 * Command handlers register every aggregate they add or update:
 * <pre>{@code
 * var order = orderRepository.load(command.orderId);
 * order.confirm();
 * orderRepository.update(order);
 * unitOfWorkFactory.getRequiredUnitOfWork().register(order);
 * }</pre>
 */
public interface UnitOfWork {
    /**
     * Register an aggregate. Registering the same aggregate instance more than once has no effect, and <code>null</code> is ignored
     *
     * @param aggregate the aggregate to track
     */
    void register(Aggregate<?> aggregate);

    /**
     * The registered aggregates in registration order
     */
    List<Aggregate<?>> registeredAggregates();

    /**
     * The pending events of all registered aggregates, in registration order of the aggregates and
     * registration order of the events within each aggregate
     */
    List<DomainEvent<?>> pendingEvents();

    /**
     * Does any registered aggregate have pending events
     */
    boolean hasChanges();

    /**
     * Clear the pending events of every registered aggregate and forget the registrations
     */
    void clear();

    /**
     * Default {@link UnitOfWork} that tracks aggregates by instance identity
     */
    class DefaultUnitOfWork implements UnitOfWork {
        private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);

        private final List<Aggregate<?>> aggregates = new ArrayList<>();
        private final Set<Aggregate<?>>  identities = Collections.newSetFromMap(new IdentityHashMap<>());

        @Override
        public void register(Aggregate<?> aggregate) {
            if (aggregate == null) {
                log.trace("Ignoring registration of a null aggregate");
                return;
            }
            if (identities.add(aggregate)) {
                aggregates.add(aggregate);
                log.trace("Registered '{}' with id '{}'", aggregate.getClass().getSimpleName(), aggregate.aggregateId());
            }
        }

        @Override
        public List<Aggregate<?>> registeredAggregates() {
            return List.copyOf(aggregates);
        }

        @Override
        public List<DomainEvent<?>> pendingEvents() {
            var events = new ArrayList<DomainEvent<?>>();
            for (Aggregate<?> aggregate : aggregates) {
                events.addAll(aggregate.uncommittedEvents());
            }
            return events;
        }

        @Override
        public boolean hasChanges() {
            for (Aggregate<?> aggregate : aggregates) {
                if (aggregate.hasPendingEvents()) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public void clear() {
            log.trace("Clearing {} registered aggregate(s)", aggregates.size());
            aggregates.forEach(Aggregate::clearPendingEvents);
            aggregates.clear();
            identities.clear();
        }

        @Override
        public String toString() {
            return "DefaultUnitOfWork{" +
                    "registeredAggregates=" + aggregates.size() +
                    '}';
        }
    }
}
