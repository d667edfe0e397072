package org.astx.ast.literals;

import org.astx.api.InvalidValueException;
import org.astx.ast.AstKind;
import org.astx.ast.types.ComplexType;
import org.astx.ast.types.FloatType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

/**
 * Base of the complex literals: a real and an imaginary component, each validated
 * against the component width of the complex type.
 */
public abstract class LiteralComplex extends Literal {

    private final double real;
    private final double imag;

    protected LiteralComplex(ComplexType type, double real, double imag) {
        super(type);
        FloatType component = type.componentType();
        if (!component.contains(real) || !component.contains(imag)) {
            throw new InvalidValueException(String.format(
                    "Components (%s, %s) overflow the %s components of %s", real, imag, component, type));
        }
        this.real = real;
        this.imag = imag;
    }

    public static LiteralComplex of(ComplexType type, double real, double imag) {
        return type.bits() == 32 ? new LiteralComplex32(real, imag) : new LiteralComplex64(real, imag);
    }

    public double real() {
        return real;
    }

    public double imag() {
        return imag;
    }

    @Override
    public ComplexType type() {
        return (ComplexType) super.type();
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_COMPLEX;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralComplex(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("real", real).attr("imag", imag);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + real + (imag < 0 ? "" : "+") + imag + "j]";
    }
}
