package org.astx.ast.operators;

import org.astx.api.MalformedNodeException;
import org.astx.ast.AstKind;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.visitor.AstVisitor;

/**
 * A comparison. Its type is always {@code Boolean} once the operands are accepted.
 */
public final class CompareOp extends BinaryOp {

    public CompareOp(String opCode, Expr lhs, Expr rhs) {
        super(opCode, lhs, rhs);
    }

    @Override
    protected DataType resolve(String opCode, DataType lhsType, DataType rhsType) {
        if (!PromotionTable.isComparison(opCode)) {
            throw new MalformedNodeException("'" + opCode + "' is not a comparison operator");
        }
        return PromotionTable.compare(opCode, lhsType, rhsType);
    }

    @Override
    public AstKind kind() {
        return AstKind.COMPARE_OP;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCompareOp(this);
    }
}
