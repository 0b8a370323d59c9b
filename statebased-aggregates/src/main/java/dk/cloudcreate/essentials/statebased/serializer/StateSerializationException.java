package dk.cloudcreate.essentials.statebased.serializer;

/**
 * Base exception for failures to convert between aggregate state and its persisted document form.<br>
 * A serialization failure is fatal for the current operation and is never translated into an operation result.
 */
public class StateSerializationException extends RuntimeException {
    public StateSerializationException(String message) {
        super(message);
    }

    public StateSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
