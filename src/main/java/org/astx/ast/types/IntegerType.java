package org.astx.ast.types;

import org.astx.api.InvalidValueException;
import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.math.BigInteger;
import java.util.Set;

/**
 * A fixed-width two's complement (signed) or unsigned integer of 8, 16, 32, 64 or 128 bits.
 */
public final class IntegerType extends DataType {

    private static final Set<Integer> WIDTHS = Set.of(8, 16, 32, 64, 128);

    private final int bits;
    private final boolean signed;
    private final BigInteger min;
    private final BigInteger max;

    public IntegerType(int bits, boolean signed) {
        if (!WIDTHS.contains(bits)) {
            throw new InvalidValueException("Unsupported integer width: " + bits);
        }
        this.bits = bits;
        this.signed = signed;
        if (signed) {
            this.min = BigInteger.ONE.shiftLeft(bits - 1).negate();
            this.max = BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
        } else {
            this.min = BigInteger.ZERO;
            this.max = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
        }
    }

    public int bits() {
        return bits;
    }

    public boolean isSigned() {
        return signed;
    }

    public BigInteger min() {
        return min;
    }

    public BigInteger max() {
        return max;
    }

    public boolean contains(BigInteger value) {
        return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
    }

    @Override
    public TypeFamily family() {
        return TypeFamily.INTEGER;
    }

    @Override
    public AstKind kind() {
        return AstKind.INTEGER_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIntegerType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        // width and signedness are part of the key
    }

    @Override
    public String toString() {
        return (signed ? "Int" : "UInt") + bits;
    }
}
