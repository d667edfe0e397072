package org.astx.ast.variables;

import org.astx.api.MalformedNodeException;
import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.Identifier;
import org.astx.ast.Statement;
import org.astx.ast.SubscriptExpr;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * Unbinds one or more names or removes subscripted entries ({@code del a, b[0]}).
 * Each target must be a variable, an identifier or a subscript.
 */
public final class DeleteStmt extends Statement {

    private final List<Expr> targets;

    public DeleteStmt(List<? extends Expr> targets) {
        Objects.requireNonNull(targets, "targets");
        if (targets.isEmpty()) {
            throw new MalformedNodeException("Delete statement requires at least one target");
        }
        for (Expr target : targets) {
            if (!(target instanceof Variable || target instanceof Identifier || target instanceof SubscriptExpr)) {
                throw new MalformedNodeException("Cannot delete " + target);
            }
        }
        this.targets = adoptAll(targets);
    }

    public List<Expr> targets() {
        return targets;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(targets);
    }

    @Override
    public AstKind kind() {
        return AstKind.DELETE_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDeleteStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.children("targets", targets);
    }

    @Override
    public String toString() {
        return "DeleteStmt[" + targets.size() + "]";
    }
}
