package org.astx.ast.flows;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * The expression form of a do-while loop.
 */
public final class DoWhileExpr extends Expr {

    private final Expr condition;
    private final Block body;

    public DoWhileExpr(Block body, Expr condition) {
        this.condition = adopt(Objects.requireNonNull(condition, "condition"));
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public Expr condition() {
        return condition;
    }

    public Block body() {
        return body;
    }

    /**
     * Loops used as expressions yield no statically known value.
     */
    @Override
    public DataType type() {
        return DataTypes.any();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(body, condition);
    }

    @Override
    public AstKind kind() {
        return AstKind.DO_WHILE_EXPR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDoWhileExpr(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("body", body).child("condition", condition);
    }

    @Override
    public String toString() {
        return "DoWhileExpr";
    }
}
