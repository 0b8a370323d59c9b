package dk.cloudcreate.essentials.statebased.serializer.json;

import com.fasterxml.jackson.core.*;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import dk.cloudcreate.essentials.statebased.serializer.EnumValue;

import java.io.IOException;
import java.util.*;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Resolves an enum constant from its persisted value ({@link EnumValue#value()}) or its constant name.<br>
 * Exact matches are tried first, then case-insensitive matches. Anything else is a deserialization failure
 */
public class LenientEnumDeserializer extends StdScalarDeserializer<Object> {
    private final Class<?> enumType;

    public LenientEnumDeserializer(Class<?> enumType) {
        super(enumType);
        this.enumType = enumType;
    }

    @Override
    public Object deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.hasToken(JsonToken.VALUE_STRING)) {
            return ctxt.handleUnexpectedToken(enumType, p);
        }
        var text = p.getText();
        return resolve(enumType, text)
                .orElseThrow(() -> ctxt.weirdStringException(text,
                                                              enumType,
                                                              msg("not one of the values or names accepted for '{}': {}",
                                                                  enumType.getName(),
                                                                  acceptedValues(enumType))));
    }

    /**
     * Resolve an enum constant from a persisted value or a constant name
     *
     * @param enumType the enum type
     * @param text     the persisted text
     * @return the matching constant or {@link Optional#empty()}
     */
    public static Optional<Object> resolve(Class<?> enumType, String text) {
        if (text == null) {
            return Optional.empty();
        }
        var candidate = text.trim();
        var constants = enumType.getEnumConstants();
        for (Object constant : constants) {
            if (valueOf(constant).equals(candidate) || ((Enum<?>) constant).name().equals(candidate)) {
                return Optional.of(constant);
            }
        }
        for (Object constant : constants) {
            if (valueOf(constant).equalsIgnoreCase(candidate) || ((Enum<?>) constant).name().equalsIgnoreCase(candidate)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }

    /**
     * The persisted value of an enum constant
     *
     * @param constant the enum constant
     * @return {@link EnumValue#value()} if the enum implements {@link EnumValue} otherwise the constant name
     */
    public static String valueOf(Object constant) {
        if (constant instanceof EnumValue) {
            return ((EnumValue) constant).value();
        }
        return ((Enum<?>) constant).name();
    }

    private static List<String> acceptedValues(Class<?> enumType) {
        var accepted = new ArrayList<String>();
        for (Object constant : enumType.getEnumConstants()) {
            accepted.add(valueOf(constant));
        }
        return accepted;
    }
}
