package dk.cloudcreate.essentials.statebased.serializer.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.math.BigDecimal;

/**
 * Writes {@link BigDecimal}'s as plain numeric strings (<code>"12.99"</code>) so no precision is lost to binary floating point
 */
public class PlainBigDecimalSerializer extends StdSerializer<BigDecimal> {
    public PlainBigDecimalSerializer() {
        super(BigDecimal.class);
    }

    @Override
    public void serialize(BigDecimal value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(value.toPlainString());
    }
}
