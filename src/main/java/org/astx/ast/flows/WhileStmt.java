package org.astx.ast.flows;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.Expr;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * Repeats the body while the condition holds; the condition is tested first.
 */
public final class WhileStmt extends Statement {

    private final Expr condition;
    private final Block body;

    public WhileStmt(Expr condition, Block body) {
        this.condition = adopt(Objects.requireNonNull(condition, "condition"));
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public Expr condition() {
        return condition;
    }

    public Block body() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }

    @Override
    public AstKind kind() {
        return AstKind.WHILE_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWhileStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("condition", condition).child("body", body);
    }

    @Override
    public String toString() {
        return "WhileStmt";
    }
}
