package org.astx.ast.types;

import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

/**
 * The type of the absent value.
 */
public final class NoneType extends DataType {

    @Override
    public TypeFamily family() {
        return TypeFamily.NONE;
    }

    @Override
    public AstKind kind() {
        return AstKind.NONE_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNoneType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
    }

    @Override
    public String toString() {
        return "NoneType";
    }
}
