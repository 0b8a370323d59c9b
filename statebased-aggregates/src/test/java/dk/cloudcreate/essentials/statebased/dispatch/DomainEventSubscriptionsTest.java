package dk.cloudcreate.essentials.statebased.dispatch;

import dk.cloudcreate.essentials.statebased.test_data.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DomainEventSubscriptionsTest {

    @Test
    void verify_that_subscriptions_are_resolved_by_event_type_including_base_types() {
        // Given
        DomainEventHandler<OrderEvent>                audit   = event -> { };
        DomainEventHandler<OrderEvent.OrderCancelled> refunds = event -> { };
        DomainEventHandler<OrderEvent.OrderDelivered> survey  = event -> { };
        var subscriptions = DomainEventSubscriptions.builder()
                                                    .subscribe(OrderEvent.class, "audit", audit)
                                                    .subscribe(OrderEvent.OrderCancelled.class, "refunds", refunds)
                                                    .subscribe(OrderEvent.OrderDelivered.class, "survey", survey)
                                                    .build();

        // When
        var forCancelled = subscriptions.subscriptionsFor(new OrderEvent.OrderCancelled(OrderId.random(), "Too slow"));

        // Then
        assertThat(forCancelled).hasSize(2);
        assertThat(forCancelled.get(0).handlerName).isEqualTo("audit");
        assertThat(forCancelled.get(1).handlerName).isEqualTo("refunds");
        assertThat(subscriptions.allSubscriptions()).hasSize(3);
    }

    @Test
    void verify_that_the_handler_class_name_is_used_when_no_handler_name_is_given() {
        // Given
        var handler = new KitchenNotifier();

        // When
        var subscriptions = DomainEventSubscriptions.builder()
                                                    .subscribe(OrderEvent.OrderConfirmed.class, handler)
                                                    .build();

        // Then
        assertThat(subscriptions.allSubscriptions().get(0).handlerName).isEqualTo(KitchenNotifier.class.getName());
    }

    @Test
    void verify_that_a_built_registry_is_immutable() {
        var subscriptions = DomainEventSubscriptions.builder()
                                                    .subscribe(OrderEvent.OrderConfirmed.class, new KitchenNotifier())
                                                    .build();
        assertThatThrownBy(() -> subscriptions.allSubscriptions().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    private static class KitchenNotifier implements DomainEventHandler<OrderEvent.OrderConfirmed> {
        @Override
        public void handle(OrderEvent.OrderConfirmed event) {
        }
    }
}
