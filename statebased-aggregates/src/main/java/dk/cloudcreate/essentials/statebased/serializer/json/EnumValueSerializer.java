package dk.cloudcreate.essentials.statebased.serializer.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import dk.cloudcreate.essentials.statebased.serializer.EnumValue;

import java.io.IOException;

/**
 * Writes an enum as its persisted value, i.e. {@link EnumValue#value()} or the constant name
 */
@SuppressWarnings("rawtypes")
public class EnumValueSerializer extends StdSerializer<Enum> {
    public EnumValueSerializer() {
        super(Enum.class);
    }

    @Override
    public void serialize(Enum value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(LenientEnumDeserializer.valueOf(value));
    }
}
