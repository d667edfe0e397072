package org.astx.ast.types;

import org.astx.api.InvalidValueException;
import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

/**
 * A complex number type. {@code Complex32} stores two {@code Float32} components,
 * {@code Complex64} stores two {@code Float64} components.
 */
public final class ComplexType extends DataType {

    private final int bits;

    public ComplexType(int bits) {
        if (bits != 32 && bits != 64) {
            throw new InvalidValueException("Unsupported complex width: " + bits);
        }
        this.bits = bits;
    }

    public int bits() {
        return bits;
    }

    public FloatType componentType() {
        return new FloatType(bits);
    }

    @Override
    public TypeFamily family() {
        return TypeFamily.COMPLEX;
    }

    @Override
    public AstKind kind() {
        return AstKind.COMPLEX_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitComplexType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        // width is part of the key
    }

    @Override
    public String toString() {
        return "Complex" + bits;
    }
}
