package org.astx.ast.operators;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.variables.Variable;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;

/**
 * An assignment expression ({@code name := value}) that yields the assigned value.
 */
public final class WalrusOp extends Expr {

    private final Variable lhs;
    private final Expr rhs;

    public WalrusOp(Expr lhs, Expr rhs) {
        this.lhs = adopt(AssignmentTargets.requireAddressable(lhs, "Assignment expression"));
        this.rhs = adopt(rhs);
    }

    public Variable lhs() {
        return lhs;
    }

    public Expr rhs() {
        return rhs;
    }

    @Override
    public DataType type() {
        return rhs.type();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(lhs, rhs);
    }

    @Override
    public AstKind kind() {
        return AstKind.WALRUS_OP;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWalrusOp(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("lhs", lhs).child("rhs", rhs);
    }

    @Override
    public String toString() {
        return "WalrusOp[:=]";
    }
}
