package org.astx.ast.callables;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;

/**
 * Produces a value from a generator. The value may be absent.
 */
public final class YieldExpr extends Expr {

    private final Expr value;

    public YieldExpr() {
        this(null);
    }

    public YieldExpr(Expr value) {
        this.value = adopt(value);
    }

    /**
     * @return The yielded value, or {@code null}.
     */
    public Expr value() {
        return value;
    }

    @Override
    public DataType type() {
        return DataTypes.any();
    }

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of() : List.of(value);
    }

    @Override
    public AstKind kind() {
        return AstKind.YIELD_EXPR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitYieldExpr(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.optionalChild("value", value);
    }

    @Override
    public String toString() {
        return "YieldExpr";
    }
}
