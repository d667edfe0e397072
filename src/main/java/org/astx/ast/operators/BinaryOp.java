package org.astx.ast.operators;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * An infix operator over two operands. The result type is resolved through the
 * {@link PromotionTable} at construction, so an ill-typed operation is never built.
 */
public class BinaryOp extends Expr {

    private final String opCode;
    private final Expr lhs;
    private final Expr rhs;
    private final DataType type;

    public BinaryOp(String opCode, Expr lhs, Expr rhs) {
        this.opCode = Objects.requireNonNull(opCode, "opCode");
        this.type = resolve(opCode, lhs.type(), rhs.type());
        this.lhs = adopt(lhs);
        this.rhs = adopt(rhs);
    }

    /**
     * Hook for subclasses that accept a narrower set of operator codes.
     */
    protected DataType resolve(String opCode, DataType lhsType, DataType rhsType) {
        return PromotionTable.binary(opCode, lhsType, rhsType);
    }

    public String opCode() {
        return opCode;
    }

    public Expr lhs() {
        return lhs;
    }

    public Expr rhs() {
        return rhs;
    }

    @Override
    public DataType type() {
        return type;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(lhs, rhs);
    }

    @Override
    public AstKind kind() {
        return AstKind.BINARY_OP;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("op-code", opCode).child("lhs", lhs).child("rhs", rhs);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + opCode + "]";
    }
}
