package org.astx.ast.literals;

import org.astx.api.InvalidValueException;
import org.astx.ast.AstKind;
import org.astx.ast.types.IntegerType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Base of the fixed-width integer literals. Construction fails with
 * {@link InvalidValueException} when the value does not fit the width and signedness.
 */
public abstract class LiteralInteger extends Literal {

    private final BigInteger value;

    protected LiteralInteger(IntegerType type, BigInteger value) {
        super(type);
        Objects.requireNonNull(value, "value");
        if (!type.contains(value)) {
            throw new InvalidValueException(String.format(
                    "Value %s is out of range for %s [%s, %s]", value, type, type.min(), type.max()));
        }
        this.value = value;
    }

    /**
     * Creates the literal class matching the given integer type.
     */
    public static LiteralInteger of(IntegerType type, BigInteger value) {
        if (!type.contains(value)) {
            throw new InvalidValueException(String.format(
                    "Value %s is out of range for %s [%s, %s]", value, type, type.min(), type.max()));
        }
        if (type.isSigned()) {
            return switch (type.bits()) {
                case 8 -> new LiteralInt8(value.longValueExact());
                case 16 -> new LiteralInt16(value.longValueExact());
                case 32 -> new LiteralInt32(value.longValueExact());
                case 64 -> new LiteralInt64(value.longValueExact());
                default -> new LiteralInt128(value);
            };
        }
        return switch (type.bits()) {
            case 8 -> new LiteralUInt8(value.longValueExact());
            case 16 -> new LiteralUInt16(value.longValueExact());
            case 32 -> new LiteralUInt32(value.longValueExact());
            case 64 -> new LiteralUInt64(value);
            default -> new LiteralUInt128(value);
        };
    }

    public BigInteger value() {
        return value;
    }

    @Override
    public IntegerType type() {
        return (IntegerType) super.type();
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_INTEGER;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralInteger(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("value", value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + value + "]";
    }
}
