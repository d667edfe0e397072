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
 * Runs a body inside one or more context managers.
 */
public final class WithStmt extends Statement {

    private final List<WithItem> items;
    private final Block body;

    public WithStmt(List<WithItem> items, Block body) {
        if (items.isEmpty()) {
            throw new MalformedNodeException("A with statement requires at least one item");
        }
        this.items = adoptAll(items);
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public List<WithItem> items() {
        return items;
    }

    public Block body() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(items);
        children.add(body);
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.WITH_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWithStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.children("items", items).child("body", body);
    }

    @Override
    public String toString() {
        return "WithStmt[" + items.size() + "]";
    }
}
