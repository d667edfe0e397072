package org.astx.ast.callables;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * Delegates to another iterable, yielding each of its values.
 */
public final class YieldFromExpr extends Expr {

    private final Expr value;

    public YieldFromExpr(Expr value) {
        this.value = adopt(Objects.requireNonNull(value, "value"));
    }

    public Expr value() {
        return value;
    }

    @Override
    public DataType type() {
        return DataTypes.any();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public AstKind kind() {
        return AstKind.YIELD_FROM_EXPR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitYieldFromExpr(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("value", value);
    }

    @Override
    public String toString() {
        return "YieldFromExpr";
    }
}
