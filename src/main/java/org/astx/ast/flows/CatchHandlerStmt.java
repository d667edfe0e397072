package org.astx.ast.flows;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.Identifier;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Handles exceptions of the listed types, optionally binding the caught exception to a name.
 * An empty type list catches everything.
 */
public final class CatchHandlerStmt extends Statement {

    private final Block body;
    private final String name;
    private final List<Identifier> types;

    public CatchHandlerStmt(Block body) {
        this(body, null, List.of());
    }

    public CatchHandlerStmt(Block body, String name, List<Identifier> types) {
        this.body = adopt(Objects.requireNonNull(body, "body"));
        this.name = name == null || name.isEmpty() ? null : name;
        this.types = adoptAll(types);
    }

    public Block body() {
        return body;
    }

    /**
     * @return The bound name, or {@code null}.
     */
    public String name() {
        return name;
    }

    public List<Identifier> types() {
        return types;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(types);
        children.add(body);
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.CATCH_HANDLER_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCatchHandlerStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.optionalAttr("name", name)
                .children("types", types)
                .child("body", body);
    }

    @Override
    public String toString() {
        return name == null ? "CatchHandlerStmt" : "CatchHandlerStmt[" + name + "]";
    }
}
