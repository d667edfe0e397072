package org.astx.ast.flows;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

public final class FinallyHandlerStmt extends Statement {

    private final Block body;

    public FinallyHandlerStmt(Block body) {
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public Block body() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(body);
    }

    @Override
    public AstKind kind() {
        return AstKind.FINALLY_HANDLER_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFinallyHandlerStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("body", body);
    }

    @Override
    public String toString() {
        return "FinallyHandlerStmt";
    }
}
