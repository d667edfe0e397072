package org.astx.ast.literals;

import org.astx.api.InvalidValueException;
import org.astx.ast.AstKind;
import org.astx.ast.types.FloatType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

/**
 * Base of the floating point literals. Finite values beyond the largest
 * magnitude of the width fail with {@link InvalidValueException}.
 */
public abstract class LiteralFloat extends Literal {

    private final double value;

    protected LiteralFloat(FloatType type, double value) {
        super(type);
        if (!type.contains(value)) {
            throw new InvalidValueException(String.format(
                    "Value %s overflows %s (max magnitude %s)", value, type, type.maxMagnitude()));
        }
        this.value = value;
    }

    public static LiteralFloat of(FloatType type, double value) {
        return switch (type.bits()) {
            case 16 -> new LiteralFloat16(value);
            case 32 -> new LiteralFloat32(value);
            default -> new LiteralFloat64(value);
        };
    }

    public double value() {
        return value;
    }

    @Override
    public FloatType type() {
        return (FloatType) super.type();
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_FLOAT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralFloat(this);
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
