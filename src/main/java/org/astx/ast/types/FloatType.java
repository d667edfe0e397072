package org.astx.ast.types;

import org.astx.api.InvalidValueException;
import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

/**
 * An IEEE 754 binary floating point type of 16, 32 or 64 bits.
 */
public final class FloatType extends DataType {

    private static final double FLOAT16_MAX = 65504.0;

    private final int bits;

    public FloatType(int bits) {
        if (bits != 16 && bits != 32 && bits != 64) {
            throw new InvalidValueException("Unsupported float width: " + bits);
        }
        this.bits = bits;
    }

    public int bits() {
        return bits;
    }

    /**
     * @return The precision in bits, counting the implicit leading bit.
     */
    public int significandBits() {
        return switch (bits) {
            case 16 -> 11;
            case 32 -> 24;
            default -> 53;
        };
    }

    /**
     * @return The largest finite magnitude representable at this width.
     */
    public double maxMagnitude() {
        return switch (bits) {
            case 16 -> FLOAT16_MAX;
            case 32 -> Float.MAX_VALUE;
            default -> Double.MAX_VALUE;
        };
    }

    /**
     * Non-finite values are representable at every width; finite values must not overflow it.
     */
    public boolean contains(double value) {
        return !Double.isFinite(value) || Math.abs(value) <= maxMagnitude();
    }

    @Override
    public TypeFamily family() {
        return TypeFamily.FLOAT;
    }

    @Override
    public AstKind kind() {
        return AstKind.FLOAT_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFloatType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        // width is part of the key
    }

    @Override
    public String toString() {
        return "Float" + bits;
    }
}
