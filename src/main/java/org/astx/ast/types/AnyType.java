package org.astx.ast.types;

import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

/**
 * Dynamic type of untyped variables and identifiers. Compatible with every type.
 */
public final class AnyType extends DataType {

    @Override
    public TypeFamily family() {
        return TypeFamily.ANY;
    }

    @Override
    public AstKind kind() {
        return AstKind.ANY_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAnyType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
    }

    @Override
    public String toString() {
        return "AnyType";
    }
}
