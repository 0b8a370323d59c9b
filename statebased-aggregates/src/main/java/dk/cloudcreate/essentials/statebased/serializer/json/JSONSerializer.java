package dk.cloudcreate.essentials.statebased.serializer.json;

import java.util.Map;

/**
 * JSON serializer and deserializer for aggregate state and the values it contains.<br>
 * Documents are clean: snake_case field names, no type information and no wrapping envelope.
 */
public interface JSONSerializer {
    /**
     * Serialize a java object to a JSON string
     *
     * @param objectToSerialize the java object that will be serialized to JSON
     * @return the JSON string
     * @throws JSONSerializationException in case the <code>objectToSerialize</code> couldn't be serialized to JSON
     */
    String serialize(Object objectToSerialize);

    /**
     * Serialize a java object to its document form, i.e. a map of field name to JSON compatible values
     * (String, Number, Boolean, List, Map or null)
     *
     * @param objectToSerialize the java object that will be serialized
     * @return the document
     * @throws JSONSerializationException in case the <code>objectToSerialize</code> couldn't be serialized
     */
    Map<String, Object> serializeToDocument(Object objectToSerialize);

    /**
     * Convert a single value to the form it has inside a persisted document (e.g. an enum to its value,
     * a decimal to its string representation, a timestamp to a UTC ISO-8601 string).<br>
     * Used to normalize values used in queries
     *
     * @param value the value
     * @return the persisted form of the value
     * @throws JSONSerializationException in case the <code>value</code> couldn't be converted
     */
    Object serializeValue(Object value);

    /**
     * Deserialize the payload in the <code>json</code> parameter into the Java type specified by the <code>javaType</code> parameter
     *
     * @param json     the json payload
     * @param javaType the Java type that the json payload should be deserialized into
     * @param <T>      the corresponding Java type
     * @return the deserialized json payload
     * @throws JSONDeserializationException in case the json couldn't be deserialized to the specified java type
     */
    <T> T deserialize(String json, Class<T> javaType);

    /**
     * Deserialize a document into the Java type specified by the <code>javaType</code> parameter
     *
     * @param document the document
     * @param javaType the Java type that the document should be deserialized into
     * @param <T>      the corresponding Java type
     * @return the deserialized document
     * @throws JSONDeserializationException in case the document couldn't be deserialized to the specified java type
     */
    <T> T deserialize(Map<String, Object> document, Class<T> javaType);
}
