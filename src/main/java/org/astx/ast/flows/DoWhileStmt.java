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
 * Runs the body once, then repeats it while the condition holds.
 */
public final class DoWhileStmt extends Statement {

    private final Expr condition;
    private final Block body;

    public DoWhileStmt(Block body, Expr condition) {
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
        return List.of(body, condition);
    }

    @Override
    public AstKind kind() {
        return AstKind.DO_WHILE_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDoWhileStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("body", body).child("condition", condition);
    }

    @Override
    public String toString() {
        return "DoWhileStmt";
    }
}
