package org.astx.ast.flows;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;

/**
 * Raises an exception. Without an exception expression it re-raises the one being handled.
 */
public final class ThrowStmt extends Statement {

    private final Expr exception;

    public ThrowStmt() {
        this(null);
    }

    public ThrowStmt(Expr exception) {
        this.exception = adopt(exception);
    }

    public Expr exception() {
        return exception;
    }

    @Override
    public List<AstNode> getChildren() {
        return exception == null ? List.of() : List.of(exception);
    }

    @Override
    public AstKind kind() {
        return AstKind.THROW_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitThrowStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.optionalChild("exception", exception);
    }

    @Override
    public String toString() {
        return "ThrowStmt";
    }
}
