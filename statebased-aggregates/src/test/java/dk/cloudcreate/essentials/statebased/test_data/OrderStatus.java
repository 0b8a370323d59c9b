package dk.cloudcreate.essentials.statebased.test_data;

import dk.cloudcreate.essentials.statebased.serializer.EnumValue;

public enum OrderStatus implements EnumValue {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    READY("ready"),
    DELIVERED("delivered"),
    CANCELLED("cancelled");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }
}
