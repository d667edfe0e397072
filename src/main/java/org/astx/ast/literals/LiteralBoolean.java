package org.astx.ast.literals;

import org.astx.ast.AstKind;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

public final class LiteralBoolean extends Literal {

    private final boolean value;

    public LiteralBoolean(boolean value) {
        super(DataTypes.bool());
        this.value = value;
    }

    public boolean value() {
        return value;
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_BOOLEAN;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralBoolean(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("value", value);
    }

    @Override
    public String toString() {
        return "LiteralBoolean[" + value + "]";
    }
}
