package org.astx.ast;

import org.astx.ast.types.DataType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;

/**
 * Explicit grouping kept from the source so generators can reproduce it.
 */
public final class ParenthesizedExpr extends Expr {

    private final Expr value;

    public ParenthesizedExpr(Expr value) {
        this.value = adopt(value);
    }

    public Expr value() {
        return value;
    }

    @Override
    public DataType type() {
        return value.type();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public AstKind kind() {
        return AstKind.PARENTHESIZED_EXPR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitParenthesizedExpr(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("value", value);
    }

    @Override
    public String toString() {
        return "ParenthesizedExpr";
    }
}
