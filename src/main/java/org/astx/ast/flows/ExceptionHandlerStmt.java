package org.astx.ast.flows;

import org.astx.api.MalformedNodeException;
import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A guarded body with catch handlers and an optional finally handler.
 * At least one catch handler or a finally handler is required.
 */
public final class ExceptionHandlerStmt extends Statement {

    private final Block body;
    private final List<CatchHandlerStmt> handlers;
    private final FinallyHandlerStmt finallyHandler;

    public ExceptionHandlerStmt(Block body, List<CatchHandlerStmt> handlers, FinallyHandlerStmt finallyHandler) {
        if (handlers.isEmpty() && finallyHandler == null) {
            throw new MalformedNodeException("An exception handler needs a catch handler or a finally handler");
        }
        this.body = adopt(Objects.requireNonNull(body, "body"));
        this.handlers = adoptAll(handlers);
        this.finallyHandler = adopt(finallyHandler);
    }

    public Block body() {
        return body;
    }

    public List<CatchHandlerStmt> handlers() {
        return handlers;
    }

    /**
     * @return The finally handler, or {@code null}.
     */
    public FinallyHandlerStmt finallyHandler() {
        return finallyHandler;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(body);
        children.addAll(handlers);
        if (finallyHandler != null) {
            children.add(finallyHandler);
        }
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.EXCEPTION_HANDLER_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitExceptionHandlerStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("body", body)
                .children("handlers", handlers)
                .optionalChild("finally-handler", finallyHandler);
    }

    @Override
    public String toString() {
        return "ExceptionHandlerStmt";
    }
}
