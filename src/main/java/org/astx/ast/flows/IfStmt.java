package org.astx.ast.flows;

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
 * A conditional statement with an optional else branch.
 */
public final class IfStmt extends Statement {

    private final Expr condition;
    private final Block thenBlock;
    private final Block elseBlock;

    public IfStmt(Expr condition, Block thenBlock) {
        this(condition, thenBlock, null);
    }

    public IfStmt(Expr condition, Block thenBlock, Block elseBlock) {
        this.condition = adopt(Objects.requireNonNull(condition, "condition"));
        this.thenBlock = adopt(Objects.requireNonNull(thenBlock, "thenBlock"));
        this.elseBlock = adopt(elseBlock);
    }

    public Expr condition() {
        return condition;
    }

    public Block thenBlock() {
        return thenBlock;
    }

    /**
     * @return The else branch, or {@code null}.
     */
    public Block elseBlock() {
        return elseBlock;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(List.of(condition, thenBlock));
        if (elseBlock != null) {
            children.add(elseBlock);
        }
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.IF_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIfStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("condition", condition)
                .child("then-block", thenBlock)
                .optionalChild("else-block", elseBlock);
    }

    @Override
    public String toString() {
        return "IfStmt";
    }
}
