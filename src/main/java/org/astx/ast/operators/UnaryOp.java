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
 * A prefix operator applied to one operand, for example {@code -x} or {@code not done}.
 */
public final class UnaryOp extends Expr {

    private final String opCode;
    private final Expr operand;
    private final DataType type;

    public UnaryOp(String opCode, Expr operand) {
        this.opCode = Objects.requireNonNull(opCode, "opCode");
        this.type = PromotionTable.unary(opCode, operand.type());
        this.operand = adopt(operand);
    }

    public String opCode() {
        return opCode;
    }

    public Expr operand() {
        return operand;
    }

    @Override
    public DataType type() {
        return type;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public AstKind kind() {
        return AstKind.UNARY_OP;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("op-code", opCode).child("operand", operand);
    }

    @Override
    public String toString() {
        return "UnaryOp[" + opCode + "]";
    }
}
