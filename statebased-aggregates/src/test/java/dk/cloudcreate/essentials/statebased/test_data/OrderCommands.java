package dk.cloudcreate.essentials.statebased.test_data;

import dk.cloudcreate.essentials.statebased.command.Command;

import java.util.List;

public final class OrderCommands {
    private OrderCommands() {
    }

    public static class PlaceOrder implements Command<OrderId> {
        public final OrderId         orderId;
        public final CustomerId      customerId;
        public final List<OrderItem> items;

        public PlaceOrder(OrderId orderId, CustomerId customerId, List<OrderItem> items) {
            this.orderId = orderId;
            this.customerId = customerId;
            this.items = items;
        }

        @Override
        public String toString() {
            return "PlaceOrder{" +
                    "orderId=" + orderId +
                    ", customerId=" + customerId +
                    ", items=" + items +
                    '}';
        }
    }

    public static class ConfirmOrder implements Command<Void> {
        public final OrderId orderId;

        public ConfirmOrder(OrderId orderId) {
            this.orderId = orderId;
        }

        @Override
        public String toString() {
            return "ConfirmOrder{" +
                    "orderId=" + orderId +
                    '}';
        }
    }

    public static class CancelOrder implements Command<Void> {
        public final OrderId orderId;
        public final String  reason;

        public CancelOrder(OrderId orderId, String reason) {
            this.orderId = orderId;
            this.reason = reason;
        }

        @Override
        public String toString() {
            return "CancelOrder{" +
                    "orderId=" + orderId +
                    ", reason='" + reason + '\'' +
                    '}';
        }
    }
}
