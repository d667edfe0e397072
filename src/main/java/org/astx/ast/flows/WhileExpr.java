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
 * The expression form of a while loop.
 */
public final class WhileExpr extends Expr {

    private final Expr condition;
    private final Block body;

    public WhileExpr(Expr condition, Block body) {
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
        return List.of(condition, body);
    }

    @Override
    public AstKind kind() {
        return AstKind.WHILE_EXPR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWhileExpr(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("condition", condition).child("body", body);
    }

    @Override
    public String toString() {
        return "WhileExpr";
    }
}
