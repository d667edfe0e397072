package org.astx.ast.flows;

import org.astx.api.MalformedNodeException;
import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.Expr;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One arm of a {@link SwitchStmt}. A default arm has no condition; every other arm has one.
 */
public final class CaseStmt extends Statement {

    private final Expr condition;
    private final Block body;
    private final boolean isDefault;

    public CaseStmt(Expr condition, Block body) {
        this(condition, body, false);
    }

    public CaseStmt(Expr condition, Block body, boolean isDefault) {
        if (isDefault && condition != null) {
            throw new MalformedNodeException("A default case cannot have a condition");
        }
        if (!isDefault && condition == null) {
            throw new MalformedNodeException("A non-default case requires a condition");
        }
        this.condition = adopt(condition);
        this.body = adopt(Objects.requireNonNull(body, "body"));
        this.isDefault = isDefault;
    }

    public static CaseStmt defaultCase(Block body) {
        return new CaseStmt(null, body, true);
    }

    public Expr condition() {
        return condition;
    }

    public Block body() {
        return body;
    }

    public boolean isDefault() {
        return isDefault;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        if (condition != null) {
            children.add(condition);
        }
        children.add(body);
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.CASE_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCaseStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("default", isDefault)
                .optionalChild("condition", condition)
                .child("body", body);
    }

    @Override
    public String toString() {
        return isDefault ? "CaseStmt[default]" : "CaseStmt";
    }
}
