package org.astx.ast.types;

import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

/**
 * Sentinel for a slot whose type was never declared. It is only compatible with itself.
 */
public final class UndefinedType extends DataType {

    @Override
    public TypeFamily family() {
        return TypeFamily.UNDEFINED;
    }

    @Override
    public AstKind kind() {
        return AstKind.UNDEFINED_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUndefinedType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
    }

    @Override
    public String toString() {
        return "Undefined";
    }
}
