package org.astx.ast.literals;

import org.astx.ast.AstKind;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

public final class LiteralNone extends Literal {

    public LiteralNone() {
        super(DataTypes.none());
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_NONE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralNone(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        // no value beyond the type
    }

    @Override
    public String toString() {
        return "LiteralNone";
    }
}
