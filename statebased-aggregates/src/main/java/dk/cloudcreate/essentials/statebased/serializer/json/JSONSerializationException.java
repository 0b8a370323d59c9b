package dk.cloudcreate.essentials.statebased.serializer.json;

import dk.cloudcreate.essentials.statebased.serializer.StateSerializationException;

public class JSONSerializationException extends StateSerializationException {
    public JSONSerializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
