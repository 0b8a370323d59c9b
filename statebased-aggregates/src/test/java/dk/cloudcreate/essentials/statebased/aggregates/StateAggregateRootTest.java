package dk.cloudcreate.essentials.statebased.aggregates;

import dk.cloudcreate.essentials.statebased.test_data.*;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.*;

class StateAggregateRootTest {

    @Test
    void verify_that_registered_events_are_pending_in_registration_order() {
        // Given
        var orderId = OrderId.random();
        var order   = Order.place(orderId, CustomerId.random());

        // When
        order.addItem(new OrderItem("Margherita", PizzaSize.LARGE, new BigDecimal("12.99")));
        order.confirm();

        // Then
        assertThat(order.hasPendingEvents()).isTrue();
        assertThat(order.uncommittedEvents()).hasSize(3);
        assertThat(order.uncommittedEvents().get(0)).isInstanceOf(OrderEvent.OrderPlaced.class);
        assertThat(order.uncommittedEvents().get(1)).isInstanceOf(OrderEvent.ItemAdded.class);
        assertThat(order.uncommittedEvents().get(2)).isInstanceOf(OrderEvent.OrderConfirmed.class);
        assertThat((CharSequence) order.uncommittedEvents().get(2).aggregateId()).isEqualTo(orderId);
        assertThat(order.uncommittedEvents().get(2).eventType()).isEqualTo("OrderConfirmed");
    }

    @Test
    void verify_that_uncommitted_events_is_a_snapshot() {
        // Given
        var order    = Order.place(OrderId.random(), CustomerId.random());
        var snapshot = order.uncommittedEvents();

        // When
        order.clearPendingEvents();

        // Then
        assertThat(snapshot).hasSize(1);
        assertThat(order.uncommittedEvents()).isEmpty();
        assertThat(order.hasPendingEvents()).isFalse();
        assertThatThrownBy(() -> snapshot.clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void verify_that_a_failed_validation_neither_changes_state_nor_registers_events() {
        // Given
        var order = Order.place(OrderId.random(), CustomerId.random());
        order.clearPendingEvents();

        // When
        var thrown = catchThrowableOfType(order::confirm, AggregateValidationException.class);

        // Then
        assertThat(thrown).isNotNull();
        assertThat(thrown.aggregateType).isEqualTo(Order.class);
        assertThat(thrown.aggregateId).isEqualTo(order.aggregateId());
        assertThat(thrown.getMessage()).contains("Cannot confirm an order without items");
        assertThat(order.state().status).isEqualTo(OrderStatus.PENDING);
        assertThat(order.hasPendingEvents()).isFalse();
    }

    @Test
    void verify_that_a_broken_business_rule_reports_every_violation() {
        // Given
        var order = Order.place(OrderId.random(), CustomerId.random());
        order.cancel("Customer changed their mind");
        order.clearPendingEvents();

        // When
        var thrown = catchThrowableOfType(order::confirm, AggregateValidationException.class);

        // Then
        assertThat(thrown).isNotNull();
        assertThat(thrown.violations).extracting(violation -> violation.ruleName)
                                     .containsExactly("order_is_pending", "order_has_items");
        assertThat(thrown.getMessage()).contains("Cannot confirm an order with status 'CANCELLED'")
                                       .contains("Cannot confirm an order without items");
        assertThat(order.state().status).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.hasPendingEvents()).isFalse();
    }

    @Test
    void verify_that_the_aggregate_id_is_resolved_through_the_state() {
        var orderId = OrderId.random();
        var order   = new Order(new OrderState(orderId, CustomerId.random()));
        assertThat((CharSequence) order.aggregateId()).isEqualTo(orderId);
        assertThat((CharSequence) order.state().aggregateId()).isEqualTo(orderId);
        assertThat(order.hasPendingEvents()).isFalse();
    }

    @Test
    void verify_that_created_at_can_only_be_set_once() {
        // Given
        var state = new OrderState(OrderId.random(), CustomerId.random());
        var first = OffsetDateTime.parse("2024-01-01T10:00:00Z");

        // When
        state.markCreated(first);
        state.markCreated(first.plusDays(1));

        // Then
        assertThat(state.createdAt()).isEqualTo(first);
    }
}
