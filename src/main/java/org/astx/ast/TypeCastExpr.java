package org.astx.ast;

import org.astx.ast.types.DataType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * An explicit conversion of an expression to a target type. No check is made that the
 * conversion succeeds at run time.
 */
public final class TypeCastExpr extends Expr {

    private final Expr expr;
    private final DataType targetType;

    public TypeCastExpr(Expr expr, DataType targetType) {
        this.expr = adopt(expr);
        this.targetType = Objects.requireNonNull(targetType, "targetType");
    }

    public Expr expr() {
        return expr;
    }

    public DataType targetType() {
        return targetType;
    }

    @Override
    public DataType type() {
        return targetType;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expr);
    }

    @Override
    public AstKind kind() {
        return AstKind.TYPE_CAST_EXPR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitTypeCastExpr(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("expr", expr).child("target-type", targetType);
    }

    @Override
    public String toString() {
        return "TypeCastExpr[" + targetType + "]";
    }
}
