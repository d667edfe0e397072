package org.astx.ast.types;

import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

/**
 * A single Unicode code point.
 */
public final class CharType extends DataType {

    @Override
    public TypeFamily family() {
        return TypeFamily.TEXT;
    }

    @Override
    public AstKind kind() {
        return AstKind.CHAR_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCharType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
    }

    @Override
    public String toString() {
        return "UTF8Char";
    }
}
