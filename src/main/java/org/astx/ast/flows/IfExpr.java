package org.astx.ast.flows;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A conditional that yields a value. Each branch yields its last expression.
 */
public final class IfExpr extends Expr {

    private final Expr condition;
    private final Block thenBlock;
    private final Block elseBlock;

    public IfExpr(Expr condition, Block thenBlock, Block elseBlock) {
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

    public Block elseBlock() {
        return elseBlock;
    }

    /**
     * The type both branches agree on, otherwise {@code Any}.
     */
    @Override
    public DataType type() {
        DataType thenType = yieldedType(thenBlock);
        if (elseBlock != null && thenType != null && thenType.equals(yieldedType(elseBlock))) {
            return thenType;
        }
        return DataTypes.any();
    }

    private static DataType yieldedType(Block block) {
        if (block.isEmpty()) {
            return null;
        }
        AstNode last = block.get(block.size() - 1);
        return last instanceof Expr expr ? expr.type() : null;
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
        return AstKind.IF_EXPR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIfExpr(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("condition", condition)
                .child("then-block", thenBlock)
                .optionalChild("else-block", elseBlock);
    }

    @Override
    public String toString() {
        return "IfExpr";
    }
}
