package dk.cloudcreate.essentials.statebased.test_data;

import dk.cloudcreate.essentials.statebased.serializer.EnumValue;

public enum PizzaSize implements EnumValue {
    SMALL("small"),
    MEDIUM("medium"),
    LARGE("large");

    private final String value;

    PizzaSize(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }
}
