package org.astx.ast.literals;

import org.astx.api.InvalidValueException;
import org.astx.ast.AstKind;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.Objects;

/**
 * A text literal. The value must be well-formed UTF-16, so that it encodes to UTF-8;
 * an unpaired surrogate fails with {@link InvalidValueException}.
 */
public final class LiteralUTF8String extends Literal {

    private final String value;

    public LiteralUTF8String(String value) {
        super(DataTypes.utf8String());
        this.value = requireWellFormed(Objects.requireNonNull(value, "value"), "string");
    }

    static String requireWellFormed(String value, String what) {
        for (int i = 0; i < value.length(); ) {
            int codePoint = value.codePointAt(i);
            if (Character.getType(codePoint) == Character.SURROGATE) {
                throw new InvalidValueException(String.format(
                        "Unpaired surrogate U+%04X at index %d in %s literal", codePoint, i, what));
            }
            i += Character.charCount(codePoint);
        }
        return value;
    }

    public String value() {
        return value;
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_STRING;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralUTF8String(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("value", value);
    }

    @Override
    public String toString() {
        return "LiteralUTF8String[" + value + "]";
    }
}
