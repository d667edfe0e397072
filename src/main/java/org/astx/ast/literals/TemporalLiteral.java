package org.astx.ast.literals;

import org.astx.api.InvalidValueException;
import org.astx.ast.types.TemporalType;
import org.astx.serialization.StructBuilder;

import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.function.Function;

/**
 * Shared parsing and rendering of the date and time literals. The value is kept in
 * its ISO-8601 text form so that export and re-import produce the same text.
 */
public abstract class TemporalLiteral<T extends TemporalAccessor> extends Literal {

    private final T value;

    protected TemporalLiteral(TemporalType type, T value) {
        super(type);
        this.value = value;
    }

    protected static <T> T parse(String text, Function<String, T> parser, String format, TemporalType type) {
        if (text == null) {
            throw new InvalidValueException("Missing text for " + type + " literal");
        }
        try {
            return parser.apply(text.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidValueException(
                    String.format("Invalid %s literal '%s', expected %s", type, text, format), e);
        }
    }

    public T value() {
        return value;
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("value", value.toString());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + value + "]";
    }
}
