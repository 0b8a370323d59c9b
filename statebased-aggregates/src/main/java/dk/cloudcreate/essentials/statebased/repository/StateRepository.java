package dk.cloudcreate.essentials.statebased.repository;

import dk.cloudcreate.essentials.statebased.aggregates.*;
import dk.cloudcreate.essentials.statebased.serializer.json.*;
import dk.cloudcreate.essentials.statebased.store.*;
import org.slf4j.*;

import java.time.OffsetDateTime;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Repository that persists the {@link AggregateState} of {@link StateAggregateRoot}'s as documents in a {@link DocumentStore},
 * using optimistic concurrency control based on {@link AggregateState#stateVersion()}:
 * <ul>
 *     <li>{@link #add(StateAggregateRoot)} persists the state with <code>state_version</code> 0</li>
 *     <li>{@link #update(StateAggregateRoot)} replaces the stored document if, and only if, its <code>state_version</code> still
 *     is the version the aggregate was loaded with. The new document carries the version incremented by exactly one, no matter how many
 *     events the aggregate registered</li>
 *     <li>if the stored version has moved on, the update fails with {@link OptimisticConcurrencyException} and neither the stored document nor
 *     the in-memory state is changed</li>
 * </ul>
 * The repository never touches the aggregate's pending events, and aggregates it returns always have an empty event queue.<br>
 * <br>
 * Example:
 * <pre>{@code
 * var orders = StateRepository.from(documentStore,
 *                                   new JacksonJSONSerializer(),
 *                                   StateRepositoryConfiguration.of(CollectionName.of("orders"),
 *                                                                   Order.class,
 *                                                                   OrderState.class,
 *                                                                   Order::new));
 * var order = orders.load(orderId);
 * order.confirm();
 * orders.update(order);
 * }</pre>
 *
 * @param <ID>        the aggregate id type
 * @param <STATE>     the aggregate state type
 * @param <AGGREGATE> the aggregate type
 */
public interface StateRepository<ID, STATE extends AggregateState<ID>, AGGREGATE extends StateAggregateRoot<ID, STATE, AGGREGATE>> {

    static <ID, STATE extends AggregateState<ID>, AGGREGATE extends StateAggregateRoot<ID, STATE, AGGREGATE>> StateRepository<ID, STATE, AGGREGATE> from(DocumentStore documentStore,
                                                                                                                                                       JSONSerializer jsonSerializer,
                                                                                                                                                       StateRepositoryConfiguration<ID, STATE, AGGREGATE> configuration) {
        return new DefaultStateRepository<>(documentStore, jsonSerializer, configuration);
    }

    /**
     * The configuration of this repository
     */
    StateRepositoryConfiguration<ID, STATE, AGGREGATE> configuration();

    /**
     * Try to load the aggregate with the given id
     *
     * @param aggregateId the id of the aggregate
     * @return the aggregate (with no pending events) or {@link Optional#empty()} if it doesn't exist
     */
    Optional<AGGREGATE> get(ID aggregateId);

    /**
     * Load the aggregate with the given id
     *
     * @param aggregateId the id of the aggregate
     * @return the aggregate (with no pending events)
     * @throws AggregateNotFoundException if the aggregate doesn't exist
     */
    default AGGREGATE load(ID aggregateId) {
        return get(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId,
                                                                                 configuration().aggregateType,
                                                                                 configuration().collectionName));
    }

    /**
     * Does an aggregate with the given id exist
     */
    boolean contains(ID aggregateId);

    /**
     * Persist a new aggregate with <code>state_version</code> 0. Sets <code>created_at</code> (unless already set) and <code>last_modified</code>
     *
     * @param aggregate the new aggregate
     * @return the same aggregate instance
     * @throws DuplicateAggregateException if an aggregate with the same id already exists
     */
    AGGREGATE add(AGGREGATE aggregate);

    /**
     * Persist the changes to an existing aggregate using optimistic concurrency control.<br>
     * After a successful update the aggregate's state carries the new <code>state_version</code> and <code>last_modified</code>
     *
     * @param aggregate the changed aggregate
     * @return the same aggregate instance
     * @throws OptimisticConcurrencyException if the aggregate was changed by someone else after it was loaded
     * @throws AggregateNotFoundException     if the aggregate doesn't exist
     */
    AGGREGATE update(AGGREGATE aggregate);

    /**
     * Remove the aggregate with the given id
     *
     * @param aggregateId the id of the aggregate
     * @throws AggregateNotFoundException if the aggregate doesn't exist
     */
    void remove(ID aggregateId);

    /**
     * Find all aggregates whose persisted state matches the filter. The filter is evaluated by the {@link DocumentStore}
     * and query values are converted to their persisted form first, so e.g. enum constants can be used directly as values:
     * <pre>{@code
     * orders.find(DocumentFilter.where("status", OrderStatus.READY));
     * }</pre>
     *
     * @param filter the filter using persisted (snake_case) field names
     * @return the matching aggregates
     */
    List<AGGREGATE> find(DocumentFilter filter);

    /**
     * Find all aggregates
     */
    default List<AGGREGATE> findAll() {
        return find(DocumentFilter.all());
    }

    class DefaultStateRepository<ID, STATE extends AggregateState<ID>, AGGREGATE extends StateAggregateRoot<ID, STATE, AGGREGATE>> implements StateRepository<ID, STATE, AGGREGATE> {
        private static final Logger log = LoggerFactory.getLogger(StateRepository.class);

        private final DocumentStore                                      documentStore;
        private final JSONSerializer                                     jsonSerializer;
        private final StateRepositoryConfiguration<ID, STATE, AGGREGATE> configuration;

        public DefaultStateRepository(DocumentStore documentStore,
                                      JSONSerializer jsonSerializer,
                                      StateRepositoryConfiguration<ID, STATE, AGGREGATE> configuration) {
            this.documentStore = requireNonNull(documentStore, "No documentStore provided");
            this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
            this.configuration = requireNonNull(configuration, "No configuration provided");
            log.debug("Created repository for '{}' using {}", configuration.aggregateType.getName(), configuration);
        }

        @Override
        public StateRepositoryConfiguration<ID, STATE, AGGREGATE> configuration() {
            return configuration;
        }

        @Override
        public Optional<AGGREGATE> get(ID aggregateId) {
            requireNonNull(aggregateId, "No aggregateId provided");
            var document = documentStore.findById(configuration.collectionName, documentId(aggregateId));
            if (document.isEmpty()) {
                log.trace("[{}] Didn't find '{}' with id '{}'", configuration.collectionName, configuration.aggregateType.getSimpleName(), aggregateId);
                return Optional.empty();
            }
            return Optional.of(toAggregate(document.get()));
        }

        @Override
        public boolean contains(ID aggregateId) {
            requireNonNull(aggregateId, "No aggregateId provided");
            return documentStore.exists(configuration.collectionName, documentId(aggregateId));
        }

        @Override
        public AGGREGATE add(AGGREGATE aggregate) {
            requireNonNull(aggregate, "No aggregate provided");
            var aggregateId = requireNonNull(aggregate.aggregateId(), "The aggregate doesn't have an aggregateId");
            var state       = aggregate.state();
            var now         = OffsetDateTime.now(configuration.clock);

            var document = jsonSerializer.serializeToDocument(state);
            document.put(AggregateState.STATE_VERSION_FIELD, 0L);
            document.putIfAbsent(AggregateState.CREATED_AT_FIELD, UtcTimestamps.format(now));
            document.put(AggregateState.LAST_MODIFIED_FIELD, UtcTimestamps.format(now));

            try {
                documentStore.insert(configuration.collectionName, documentId(aggregateId), document);
            } catch (DuplicateDocumentException e) {
                throw new DuplicateAggregateException(aggregateId, configuration.aggregateType, e);
            }
            state.assignStateVersion(0);
            state.markCreated(now);
            state.markModified(now);
            log.debug("[{}] Added '{}' with id '{}'", configuration.collectionName, configuration.aggregateType.getSimpleName(), aggregateId);
            return aggregate;
        }

        @Override
        public AGGREGATE update(AGGREGATE aggregate) {
            requireNonNull(aggregate, "No aggregate provided");
            var aggregateId     = requireNonNull(aggregate.aggregateId(), "The aggregate doesn't have an aggregateId");
            var state           = aggregate.state();
            var expectedVersion = state.stateVersion();
            var newVersion      = expectedVersion + 1;
            var now             = OffsetDateTime.now(configuration.clock);

            var document = jsonSerializer.serializeToDocument(state);
            document.put(AggregateState.STATE_VERSION_FIELD, newVersion);
            document.put(AggregateState.LAST_MODIFIED_FIELD, UtcTimestamps.format(now));

            var id = documentId(aggregateId);
            if (!documentStore.replace(configuration.collectionName, id, expectedVersionCondition(expectedVersion), document)) {
                var storedDocument = documentStore.findById(configuration.collectionName, id)
                                                  .orElseThrow(() -> new AggregateNotFoundException(aggregateId,
                                                                                                    configuration.aggregateType,
                                                                                                    configuration.collectionName));
                var actualVersion = storedStateVersion(storedDocument);
                log.debug("[{}] Optimistic concurrency conflict for '{}' with id '{}'. Expected state_version {} but found {}",
                          configuration.collectionName,
                          configuration.aggregateType.getSimpleName(),
                          aggregateId,
                          expectedVersion,
                          actualVersion);
                throw new OptimisticConcurrencyException(aggregateId,
                                                         configuration.aggregateType,
                                                         expectedVersion,
                                                         actualVersion);
            }
            state.assignStateVersion(newVersion);
            state.markModified(now);
            log.debug("[{}] Updated '{}' with id '{}' to state_version {}", configuration.collectionName, configuration.aggregateType.getSimpleName(), aggregateId, newVersion);
            return aggregate;
        }

        @Override
        public void remove(ID aggregateId) {
            requireNonNull(aggregateId, "No aggregateId provided");
            if (!documentStore.delete(configuration.collectionName, documentId(aggregateId))) {
                throw new AggregateNotFoundException(aggregateId, configuration.aggregateType, configuration.collectionName);
            }
            log.debug("[{}] Removed '{}' with id '{}'", configuration.collectionName, configuration.aggregateType.getSimpleName(), aggregateId);
        }

        @Override
        public List<AGGREGATE> find(DocumentFilter filter) {
            requireNonNull(filter, "No filter provided");
            var persistedFormFilter = filter.mapValues(jsonSerializer::serializeValue);
            var documents           = documentStore.find(configuration.collectionName, persistedFormFilter);
            var aggregates          = new ArrayList<AGGREGATE>(documents.size());
            for (Map<String, Object> document : documents) {
                aggregates.add(toAggregate(document));
            }
            log.trace("[{}] Found {} '{}' matching {}", configuration.collectionName, aggregates.size(), configuration.aggregateType.getSimpleName(), persistedFormFilter);
            return aggregates;
        }

        private AGGREGATE toAggregate(Map<String, Object> document) {
            var state     = jsonSerializer.deserialize(document, configuration.stateType);
            var aggregate = configuration.aggregateFactory.create(state);
            if (aggregate == null) {
                throw new AggregateException(msg("The aggregateFactory for '{}' returned null", configuration.aggregateType.getName()));
            }
            aggregate.clearPendingEvents();
            return aggregate;
        }

        private String documentId(ID aggregateId) {
            return String.valueOf(jsonSerializer.serializeValue(aggregateId));
        }

        /**
         * A document without a top level <code>state_version</code> (e.g. a legacy envelope document) is treated as version 0
         */
        private static DocumentFilter expectedVersionCondition(long expectedVersion) {
            if (expectedVersion == 0) {
                return DocumentFilter.whereIn(AggregateState.STATE_VERSION_FIELD, Arrays.asList(0L, null));
            }
            return DocumentFilter.where(AggregateState.STATE_VERSION_FIELD, expectedVersion);
        }

        private static long storedStateVersion(Map<String, Object> storedDocument) {
            var stateVersion = storedDocument.get(AggregateState.STATE_VERSION_FIELD);
            if (stateVersion instanceof Number) {
                return ((Number) stateVersion).longValue();
            }
            if (stateVersion instanceof String) {
                return Long.parseLong((String) stateVersion);
            }
            return 0;
        }
    }
}
