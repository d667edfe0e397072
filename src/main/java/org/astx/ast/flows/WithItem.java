package org.astx.ast.flows;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * One context manager of a {@link WithStmt}: {@code expr} or {@code expr as name}.
 */
public final class WithItem extends AstNode {

    private final Expr contextExpr;
    private final String instanceName;

    public WithItem(Expr contextExpr) {
        this(contextExpr, null);
    }

    public WithItem(Expr contextExpr, String instanceName) {
        this.contextExpr = adopt(Objects.requireNonNull(contextExpr, "contextExpr"));
        this.instanceName = instanceName == null || instanceName.isEmpty() ? null : instanceName;
    }

    public Expr contextExpr() {
        return contextExpr;
    }

    /**
     * @return The name bound by {@code as}, or {@code null}.
     */
    public String instanceName() {
        return instanceName;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(contextExpr);
    }

    @Override
    public AstKind kind() {
        return AstKind.WITH_ITEM;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWithItem(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("context-expr", contextExpr).optionalAttr("instance-name", instanceName);
    }

    @Override
    public String toString() {
        return instanceName == null ? "WithItem" : "WithItem[" + instanceName + "]";
    }
}
