package dk.cloudcreate.essentials.statebased.serializer.json;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.core.*;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.essentials.jackson.types.EssentialTypesJacksonModule;
import dk.cloudcreate.essentials.statebased.aggregates.AggregateState;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jackson based {@link JSONSerializer}.<br>
 * Use {@link #createDefaultObjectMapper()} to get an {@link ObjectMapper} configured for clean state documents:
 * <ul>
 *     <li>all declared fields, regardless of visibility, are persisted. Getters and setters are ignored and <code>transient</code> fields are skipped</li>
 *     <li>field names are snake_case</li>
 *     <li>null values are omitted and unknown properties are ignored when reading</li>
 *     <li>the declared field type decides how a value is decoded, untyped values (<code>Object</code>/<code>Map</code>) are kept as they are,
 *     except that floating point numbers are read as {@link java.math.BigDecimal}</li>
 *     <li>enum, decimal and timestamp conventions from {@link StateSerializationModule}</li>
 *     <li>single value types, such as aggregate ids, as their plain value through the <code>EssentialTypesJacksonModule</code></li>
 * </ul>
 * Immutable value objects are reconstructed through an explicit {@link JsonCreator} factory, which allows them to keep a validating public constructor.<br>
 * <br>
 * When deserializing an {@link AggregateState}, a legacy envelope document <code>{"type": "...", "state": {...}}</code> (textual <code>type</code>,
 * object <code>state</code> and no top level <code>state_version</code>) is unwrapped before decoding. Envelopes are never written.
 */
public class JacksonJSONSerializer implements JSONSerializer {
    private static final Logger                             log                = LoggerFactory.getLogger(JacksonJSONSerializer.class);
    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE      = new TypeReference<>() {
    };
    public static final  String                             LEGACY_TYPE_FIELD  = "type";
    public static final  String                             LEGACY_STATE_FIELD = "state";

    private final ObjectMapper objectMapper;

    public JacksonJSONSerializer() {
        this(createDefaultObjectMapper());
    }

    public JacksonJSONSerializer(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper instance provided");
    }

    public static ObjectMapper createDefaultObjectMapper() {
        return JsonMapper.builder()
                         .disable(MapperFeature.AUTO_DETECT_GETTERS)
                         .disable(MapperFeature.AUTO_DETECT_IS_GETTERS)
                         .disable(MapperFeature.AUTO_DETECT_SETTERS)
                         .enable(MapperFeature.ALLOW_EXPLICIT_PROPERTY_RENAMING)
                         .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                         .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                         .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                         .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                         .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                         .visibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE)
                         .visibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE)
                         .visibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE)
                         .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                         .serializationInclusion(JsonInclude.Include.NON_NULL)
                         .addModule(new Jdk8Module())
                         .addModule(new JavaTimeModule())
                         .addModule(new EssentialTypesJacksonModule())
                         .addModule(new StateSerializationModule())
                         .build();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public String serialize(Object objectToSerialize) {
        requireNonNull(objectToSerialize, "No objectToSerialize provided");
        try {
            if (objectToSerialize instanceof AggregateState && !((AggregateState<?>) objectToSerialize).unparsedValues().isEmpty()) {
                return objectMapper.writeValueAsString(serializeToDocument(objectToSerialize));
            }
            return objectMapper.writeValueAsString(objectToSerialize);
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(msg("Failed to serialize {} to JSON", objectToSerialize.getClass().getName()), e);
        }
    }

    @Override
    public Map<String, Object> serializeToDocument(Object objectToSerialize) {
        requireNonNull(objectToSerialize, "No objectToSerialize provided");
        Map<String, Object> document;
        try {
            document = objectMapper.convertValue(objectToSerialize, DOCUMENT_TYPE);
        } catch (IllegalArgumentException e) {
            throw new JSONSerializationException(msg("Failed to serialize {} to a document", objectToSerialize.getClass().getName()), e);
        }
        if (objectToSerialize instanceof AggregateState) {
            ((AggregateState<?>) objectToSerialize).unparsedValues().forEach((jsonPointer, rawValue) -> restoreUnparsedValue(document, jsonPointer, rawValue));
        }
        return document;
    }

    /**
     * Put the raw text back where it was read from, unless the state has since been given a value at that location
     */
    @SuppressWarnings("unchecked")
    private static void restoreUnparsedValue(Map<String, Object> document, String jsonPointer, String rawValue) {
        var    pointer   = JsonPointer.compile(jsonPointer);
        Object container = document;
        while (!pointer.tail().matches()) {
            container = child(container, pointer);
            pointer = pointer.tail();
            if (container == null) {
                log.debug("Can't restore unparsed value at '{}' since its parent is no longer present", jsonPointer);
                return;
            }
        }
        if (container instanceof Map) {
            ((Map<String, Object>) container).putIfAbsent(pointer.getMatchingProperty(), rawValue);
        } else if (container instanceof List && pointer.mayMatchElement()) {
            var list  = (List<Object>) container;
            var index = pointer.getMatchingIndex();
            if (index < list.size() && list.get(index) == null) {
                list.set(index, rawValue);
            }
        }
    }

    private static Object child(Object container, JsonPointer pointer) {
        if (container instanceof Map) {
            return ((Map<?, ?>) container).get(pointer.getMatchingProperty());
        }
        if (container instanceof List && pointer.mayMatchElement()) {
            var list  = (List<?>) container;
            var index = pointer.getMatchingIndex();
            return index < list.size() ? list.get(index) : null;
        }
        return null;
    }

    @Override
    public Object serializeValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection) {
            var values = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                values.add(serializeValue(element));
            }
            return values;
        }
        try {
            return objectMapper.convertValue(value, Object.class);
        } catch (IllegalArgumentException e) {
            throw new JSONSerializationException(msg("Failed to convert value of type {} to its persisted form", value.getClass().getName()), e);
        }
    }

    @Override
    public <T> T deserialize(String json, Class<T> javaType) {
        requireNonNull(json, "No json provided");
        requireNonNull(javaType, "No javaType provided");
        try {
            return decode(objectMapper.readTree(json), javaType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("Failed to deserialize JSON to {}", javaType.getName()), e);
        }
    }

    @Override
    public <T> T deserialize(Map<String, Object> document, Class<T> javaType) {
        requireNonNull(document, "No document provided");
        requireNonNull(javaType, "No javaType provided");
        JsonNode node;
        try {
            node = objectMapper.valueToTree(document);
        } catch (IllegalArgumentException e) {
            throw new JSONDeserializationException(msg("Failed to read document for {}", javaType.getName()), e);
        }
        try {
            return decode(node, javaType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("Failed to deserialize document to {}", javaType.getName()), e);
        }
    }

    private <T> T decode(JsonNode node, Class<T> javaType) throws JsonProcessingException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new JSONDeserializationException(msg("Cannot deserialize an empty payload to {}", javaType.getName()));
        }
        if (!AggregateState.class.isAssignableFrom(javaType)) {
            return objectMapper.treeToValue(node, javaType);
        }
        node = unwrapLegacyEnvelope(node, javaType);
        var unparsedValues = new LinkedHashMap<String, String>();
        T state = objectMapper.readerFor(javaType)
                              .withAttribute(UtcTimestamps.UNPARSED_VALUES_ATTRIBUTE, unparsedValues)
                              .treeToValue(node, javaType);
        unparsedValues.forEach(((AggregateState<?>) state)::retainUnparsedValue);
        return state;
    }

    private JsonNode unwrapLegacyEnvelope(JsonNode node, Class<?> javaType) {
        if (node.isObject() &&
                node.path(LEGACY_TYPE_FIELD).isTextual() &&
                node.path(LEGACY_STATE_FIELD).isObject() &&
                !node.has(AggregateState.STATE_VERSION_FIELD)) {
            log.debug("Unwrapping legacy '{}' envelope with type '{}' for {}",
                      LEGACY_STATE_FIELD,
                      node.get(LEGACY_TYPE_FIELD).asText(),
                      javaType.getName());
            return node.get(LEGACY_STATE_FIELD);
        }
        return node;
    }
}
