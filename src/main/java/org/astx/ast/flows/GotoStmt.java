package org.astx.ast.flows;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Identifier;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * An unconditional jump to a label.
 */
public final class GotoStmt extends Statement {

    private final Identifier label;

    public GotoStmt(Identifier label) {
        this.label = adopt(Objects.requireNonNull(label, "label"));
    }

    public Identifier label() {
        return label;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(label);
    }

    @Override
    public AstKind kind() {
        return AstKind.GOTO_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitGotoStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("label", label);
    }

    @Override
    public String toString() {
        return "GotoStmt[" + label.value() + "]";
    }
}
