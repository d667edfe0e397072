package org.astx.ast.flows;

import org.astx.api.MalformedNodeException;
import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Matches a subject against its cases in declaration order. At most one case may be the default.
 */
public final class SwitchStmt extends Statement {

    private final Expr value;
    private final List<CaseStmt> cases;

    public SwitchStmt(Expr value, List<CaseStmt> cases) {
        long defaults = cases.stream().filter(CaseStmt::isDefault).count();
        if (defaults > 1) {
            throw new MalformedNodeException("A switch allows at most one default case, found " + defaults);
        }
        this.value = adopt(Objects.requireNonNull(value, "value"));
        this.cases = adoptAll(cases);
    }

    public Expr value() {
        return value;
    }

    public List<CaseStmt> cases() {
        return cases;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(value);
        children.addAll(cases);
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.SWITCH_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSwitchStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("value", value).children("cases", cases);
    }

    @Override
    public String toString() {
        return "SwitchStmt[" + cases.size() + "]";
    }
}
