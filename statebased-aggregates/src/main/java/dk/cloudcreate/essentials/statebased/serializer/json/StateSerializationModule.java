package dk.cloudcreate.essentials.statebased.serializer.json;

import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.Serializers;

import java.math.BigDecimal;
import java.time.*;

/**
 * Jackson module with the value conventions used for persisted aggregate state:
 * <ul>
 *     <li>enums as their persisted value, read leniently from value or name</li>
 *     <li>decimals as plain strings</li>
 *     <li>timestamps as UTC ISO-8601, read leniently</li>
 * </ul>
 * Must be registered after the <code>JavaTimeModule</code>. Single value types (such as aggregate ids) are handled by the
 * <code>EssentialTypesJacksonModule</code>
 */
public class StateSerializationModule extends SimpleModule {
    public StateSerializationModule() {
        super("StateSerializationModule");
        addSerializer(BigDecimal.class, new PlainBigDecimalSerializer());
        addSerializer(OffsetDateTime.class, new UtcTimestamps.OffsetDateTimeSerializer());
        addDeserializer(OffsetDateTime.class, new UtcTimestamps.OffsetDateTimeDeserializer());
        addSerializer(Instant.class, new UtcTimestamps.InstantSerializer());
        addDeserializer(Instant.class, new UtcTimestamps.InstantDeserializer());
        addSerializer(ZonedDateTime.class, new UtcTimestamps.ZonedDateTimeSerializer());
        addDeserializer(ZonedDateTime.class, new UtcTimestamps.ZonedDateTimeDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.addSerializers(new StateSerializers());
        context.addDeserializers(new StateDeserializers());
    }

    private static class StateSerializers extends Serializers.Base {
        @Override
        public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
            if (type.isEnumType()) {
                return new EnumValueSerializer();
            }
            return null;
        }
    }

    private static class StateDeserializers extends Deserializers.Base {
        @Override
        public JsonDeserializer<?> findEnumDeserializer(Class<?> type, DeserializationConfig config, BeanDescription beanDesc) {
            return new LenientEnumDeserializer(type);
        }
    }
}
