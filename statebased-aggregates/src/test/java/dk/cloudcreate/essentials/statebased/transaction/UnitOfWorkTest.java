package dk.cloudcreate.essentials.statebased.transaction;

import dk.cloudcreate.essentials.statebased.aggregates.DomainEvent;
import dk.cloudcreate.essentials.statebased.test_data.*;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class UnitOfWorkTest {

    @Test
    void verify_that_registering_the_same_aggregate_twice_has_no_effect() {
        // Given
        var unitOfWork = new UnitOfWork.DefaultUnitOfWork();
        var order      = Order.place(OrderId.random(), CustomerId.random());

        // When
        unitOfWork.register(order);
        unitOfWork.register(order);
        unitOfWork.register(null);

        // Then
        assertThat(unitOfWork.registeredAggregates()).hasSize(1);
        assertThat(unitOfWork.pendingEvents()).hasSize(1);
    }

    @Test
    void verify_that_pending_events_are_ordered_by_aggregate_registration_and_event_registration() {
        // Given
        var unitOfWork = new UnitOfWork.DefaultUnitOfWork();
        var first      = Order.place(OrderId.random(), CustomerId.random());
        var second     = Order.place(OrderId.random(), CustomerId.random());
        second.addItem(new OrderItem("Margherita", PizzaSize.SMALL, new BigDecimal("7.00")));
        first.addItem(new OrderItem("Pepperoni", PizzaSize.SMALL, new BigDecimal("8.00")));

        // When
        unitOfWork.register(second);
        unitOfWork.register(first);

        // Then
        var events = unitOfWork.pendingEvents();
        assertThat(events).hasSize(4);
        assertThat(events.get(0).aggregateId()).isEqualTo(second.aggregateId());
        assertThat(events.get(0)).isInstanceOf(OrderEvent.OrderPlaced.class);
        assertThat(events.get(1).aggregateId()).isEqualTo(second.aggregateId());
        assertThat(events.get(1)).isInstanceOf(OrderEvent.ItemAdded.class);
        assertThat(events.get(2).aggregateId()).isEqualTo(first.aggregateId());
        assertThat(events.get(3).aggregateId()).isEqualTo(first.aggregateId());
    }

    @Test
    void verify_hasChanges() {
        // Given
        var unitOfWork = new UnitOfWork.DefaultUnitOfWork();
        var order      = new Order(new OrderState(OrderId.random(), CustomerId.random()));

        // When / Then
        assertThat(unitOfWork.hasChanges()).isFalse();
        unitOfWork.register(order);
        assertThat(unitOfWork.hasChanges()).isFalse();
        order.cancel("Wrong address");
        assertThat(unitOfWork.hasChanges()).isTrue();
    }

    @Test
    void verify_that_clear_drops_pending_events_and_registrations() {
        // Given
        var unitOfWork = new UnitOfWork.DefaultUnitOfWork();
        var order      = Order.place(OrderId.random(), CustomerId.random());
        unitOfWork.register(order);

        // When
        unitOfWork.clear();

        // Then
        assertThat(order.hasPendingEvents()).isFalse();
        assertThat(unitOfWork.registeredAggregates()).isEmpty();
        assertThat(unitOfWork.pendingEvents()).isEmpty();
        assertThat(unitOfWork.hasChanges()).isFalse();
    }

    @Test
    void verify_that_pending_events_is_a_snapshot() {
        // Given
        var unitOfWork = new UnitOfWork.DefaultUnitOfWork();
        var order      = Order.place(OrderId.random(), CustomerId.random());
        unitOfWork.register(order);

        // When
        var events = unitOfWork.pendingEvents();
        unitOfWork.clear();

        // Then
        assertThat(events).hasSize(1);
        DomainEvent<?> event = events.get(0);
        assertThat(event).isInstanceOf(OrderEvent.OrderPlaced.class);
    }
}
