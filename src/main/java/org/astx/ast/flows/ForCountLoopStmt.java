package org.astx.ast.flows;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.Expr;
import org.astx.ast.Statement;
import org.astx.ast.variables.InlineVariableDeclaration;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * A C-style counting loop: initializer, continuation condition and update.
 * An update that adds or subtracts a literal zero is rejected.
 */
public final class ForCountLoopStmt extends Statement {

    private final InlineVariableDeclaration initializer;
    private final Expr condition;
    private final Expr update;
    private final Block body;

    public ForCountLoopStmt(InlineVariableDeclaration initializer, Expr condition, Expr update, Block body) {
        LoopChecks.requireAdvancingUpdate(update);
        this.initializer = adopt(Objects.requireNonNull(initializer, "initializer"));
        this.condition = adopt(Objects.requireNonNull(condition, "condition"));
        this.update = adopt(Objects.requireNonNull(update, "update"));
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public InlineVariableDeclaration initializer() {
        return initializer;
    }

    public Expr condition() {
        return condition;
    }

    public Expr update() {
        return update;
    }

    public Block body() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(initializer, condition, update, body);
    }

    @Override
    public AstKind kind() {
        return AstKind.FOR_COUNT_LOOP_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitForCountLoopStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("initializer", initializer)
                .child("condition", condition)
                .child("update", update)
                .child("body", body);
    }

    @Override
    public String toString() {
        return "ForCountLoopStmt[" + initializer.name() + "]";
    }
}
