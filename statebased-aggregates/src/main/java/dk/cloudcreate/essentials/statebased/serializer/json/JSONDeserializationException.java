package dk.cloudcreate.essentials.statebased.serializer.json;

import dk.cloudcreate.essentials.statebased.serializer.StateSerializationException;

public class JSONDeserializationException extends StateSerializationException {
    public JSONDeserializationException(String msg) {
        super(msg);
    }

    public JSONDeserializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
