package org.astx.ast.literals;

import org.astx.api.InvalidValueException;
import org.astx.ast.AstKind;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

/**
 * A single Unicode code point. Surrogate pairs count as one character.
 */
public final class LiteralUTF8Char extends Literal {

    private final String value;

    public LiteralUTF8Char(String value) {
        super(DataTypes.utf8Char());
        if (value == null || value.codePointCount(0, value.length()) != 1) {
            throw new InvalidValueException("A UTF-8 char literal requires exactly one code point, got: " + value);
        }
        this.value = LiteralUTF8String.requireWellFormed(value, "char");
    }

    public String value() {
        return value;
    }

    public int codePoint() {
        return value.codePointAt(0);
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_CHAR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralUTF8Char(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("value", value);
    }

    @Override
    public String toString() {
        return "LiteralUTF8Char[" + value + "]";
    }
}
