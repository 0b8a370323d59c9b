package dk.cloudcreate.essentials.statebased.store.postgresql;

import dk.cloudcreate.essentials.statebased.command.*;
import dk.cloudcreate.essentials.statebased.dispatch.*;
import dk.cloudcreate.essentials.statebased.repository.*;
import dk.cloudcreate.essentials.statebased.serializer.json.JacksonJSONSerializer;
import dk.cloudcreate.essentials.statebased.store.*;
import dk.cloudcreate.essentials.statebased.test_data.*;
import dk.cloudcreate.essentials.statebased.test_data.OrderCommandHandlers.*;
import dk.cloudcreate.essentials.statebased.test_data.OrderCommands.*;
import dk.cloudcreate.essentials.statebased.transaction.UnitOfWorkFactory;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

@Testcontainers
class PostgresqlDocumentStoreIT extends AbstractDocumentStoreTest<PostgresqlDocumentStore> {
    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("document-db")
            .withUsername("test-user")
            .withPassword("secret-password");

    private Jdbi jdbi;

    @Override
    protected PostgresqlDocumentStore createDocumentStore() {
        jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                           postgreSQLContainer.getUsername(),
                           postgreSQLContainer.getPassword());
        return new PostgresqlDocumentStore(jdbi);
    }

    @Test
    void verify_that_each_collection_is_stored_in_its_own_table() {
        // Given
        documentStore.insert(ORDERS, "order-1", document("id", "order-1"));
        documentStore.insert(CollectionName.of("customers"), "customer-1", document("id", "customer-1"));

        // When
        var tables = jdbi.withHandle(handle -> handle.createQuery("SELECT table_name FROM information_schema.tables WHERE table_schema = 'public'")
                                                     .mapTo(String.class)
                                                     .list());

        // Then
        assertThat(tables).contains("orders", "customers");
        var storedJson = jdbi.withHandle(handle -> handle.createQuery("SELECT document->>'id' FROM orders WHERE id = :id")
                                                         .bind("id", "order-1")
                                                         .mapTo(String.class)
                                                         .one());
        assertThat(storedJson).isEqualTo("order-1");
    }

    @Test
    void verify_that_a_collection_name_that_isnt_a_valid_table_name_is_rejected() {
        assertThatThrownBy(() -> documentStore.insert(CollectionName.of("orders; DROP TABLE orders"), "order-1", document("id", "order-1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_that_decimals_keep_their_precision() {
        // Given
        documentStore.insert(ORDERS, "order-1", document("id", "order-1", "total", new BigDecimal("38.97")));

        // When
        var found = documentStore.findById(ORDERS, "order-1").get();

        // Then
        assertThat(found.get("total")).isEqualTo(new BigDecimal("38.97"));
    }

    @Test
    void verify_that_an_unreachable_database_is_reported_as_a_document_store_exception() {
        // Given
        var unreachableStore = new PostgresqlDocumentStore(Jdbi.create("jdbc:postgresql://localhost:1/document-db", "test-user", "secret-password"));

        // When / Then
        assertThatThrownBy(() -> unreachableStore.findById(ORDERS, "order-1"))
                .isInstanceOf(DocumentStoreException.class);
    }

    @Test
    void verify_optimistic_concurrency_for_aggregates_stored_in_postgresql() {
        // Given
        var orders = newOrderRepository();
        var orderId = OrderId.random();
        var order   = Order.place(orderId, CustomerId.random());
        order.addItem(new OrderItem("Margherita", PizzaSize.LARGE, new BigDecimal("12.99")));
        orders.add(order);

        var firstCopy  = orders.load(orderId);
        var secondCopy = orders.load(orderId);
        firstCopy.confirm();
        orders.update(firstCopy);

        // When
        secondCopy.cancel("Changed my mind");
        var thrown = catchThrowable(() -> orders.update(secondCopy));

        // Then
        assertThat(thrown).isInstanceOf(OptimisticConcurrencyException.class);
        var stored = orders.load(orderId);
        assertThat(stored.state().status).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(stored.state().stateVersion()).isEqualTo(1);
        assertThat(stored.state().items).containsExactly(new OrderItem("Margherita", PizzaSize.LARGE, new BigDecimal("12.99")));
        assertThat(orders.find(DocumentFilter.where("status", OrderStatus.CONFIRMED))).hasSize(1);
    }

    @Test
    void verify_that_the_command_pipeline_dispatches_events_after_the_state_is_stored_in_postgresql() {
        // Given
        var orders            = newOrderRepository();
        var unitOfWorkFactory = UnitOfWorkFactory.threadBound();
        var handledEvents     = new ArrayList<String>();
        var subscriptions = DomainEventSubscriptions.builder()
                                                    .subscribe(OrderEvent.OrderConfirmed.class, "status-checker",
                                                               event -> handledEvents.add(event.eventType() + ":" + orders.load(event.aggregateId()).state().status.value()))
                                                    .build();
        var pipeline = CommandPipeline.builder()
                                      .addMiddleware(new LoggingCommandMiddleware())
                                      .addMiddleware(new DomainEventDispatchingMiddleware(unitOfWorkFactory, new DomainEventDispatcher(subscriptions)))
                                      .addMiddleware(new ConcurrencyConflictRetryMiddleware(unitOfWorkFactory, ConflictRetryPolicy.fixedBackoff(Duration.ofMillis(10), 3)))
                                      .addMiddleware(new ExceptionTranslatingMiddleware())
                                      .addHandler(PlaceOrder.class, new PlaceOrderHandler(orders, unitOfWorkFactory))
                                      .addHandler(ConfirmOrder.class, new ConfirmOrderHandler(orders, unitOfWorkFactory))
                                      .build();
        var orderId = OrderId.random();
        pipeline.send(new PlaceOrder(orderId, CustomerId.random(), List.of(new OrderItem("Hawaii", PizzaSize.MEDIUM, new BigDecimal("10.50")))));

        // When
        var result = pipeline.send(new ConfirmOrder(orderId));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(handledEvents).containsExactly("OrderConfirmed:confirmed");
    }

    private StateRepository<OrderId, OrderState, Order> newOrderRepository() {
        return StateRepository.from(documentStore,
                                    new JacksonJSONSerializer(),
                                    StateRepositoryConfiguration.of(ORDERS, Order.class, OrderState.class, Order::new));
    }
}
