package dk.cloudcreate.essentials.statebased.serializer;

/**
 * Implemented by enums whose persisted form is a value that differs from the constant name.<br>
 * Example: <code>OrderStatus.PENDING</code> is persisted as <code>"pending"</code>.<br>
 * Enums that don't implement this interface are persisted using their constant name.
 */
public interface EnumValue {
    /**
     * The persisted value of the enum constant
     */
    String value();
}
