package org.astx.ast.operators;

import org.astx.api.MalformedNodeException;
import org.astx.ast.AstKind;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.visitor.AstVisitor;

/**
 * A logical connective over two boolean operands: and, or, xor, nand, nor, xnor.
 */
public final class BoolBinaryOp extends BinaryOp {

    public BoolBinaryOp(String opCode, Expr lhs, Expr rhs) {
        super(opCode, lhs, rhs);
    }

    @Override
    protected DataType resolve(String opCode, DataType lhsType, DataType rhsType) {
        if (!PromotionTable.isBoolean(opCode)) {
            throw new MalformedNodeException("'" + opCode + "' is not a boolean operator");
        }
        return PromotionTable.bool(opCode, lhsType, rhsType);
    }

    @Override
    public AstKind kind() {
        return AstKind.BOOL_BINARY_OP;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBoolBinaryOp(this);
    }
}
