package org.astx.ast.types;

import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

/**
 * A Unicode text value.
 */
public final class StringType extends DataType {

    @Override
    public TypeFamily family() {
        return TypeFamily.TEXT;
    }

    @Override
    public AstKind kind() {
        return AstKind.STRING_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStringType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
    }

    @Override
    public String toString() {
        return "UTF8String";
    }
}
