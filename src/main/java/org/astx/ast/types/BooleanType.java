package org.astx.ast.types;

import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

/**
 * A truth value.
 */
public final class BooleanType extends DataType {

    @Override
    public TypeFamily family() {
        return TypeFamily.BOOLEAN;
    }

    @Override
    public AstKind kind() {
        return AstKind.BOOLEAN_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBooleanType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
    }

    @Override
    public String toString() {
        return "Boolean";
    }
}
