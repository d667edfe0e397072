package org.astx.ast.flows;

import org.astx.api.InvalidValueException;
import org.astx.api.TypeMismatchException;
import org.astx.ast.Expr;
import org.astx.ast.literals.LiteralComplex;
import org.astx.ast.literals.LiteralFloat;
import org.astx.ast.literals.LiteralInteger;
import org.astx.ast.operators.AugAssign;
import org.astx.ast.operators.UnaryOp;
import org.astx.ast.types.AnyType;

import java.math.BigInteger;

/**
 * Construction checks shared by the loop variants.
 */
final class LoopChecks {

    private LoopChecks() {}

    static void requireNumeric(Expr bound, String role) {
        if (bound != null && !(bound.type() instanceof AnyType) && !bound.type().isNumeric()) {
            throw new TypeMismatchException(String.format(
                    "Range %s must be numeric, got %s of type %s", role, bound, bound.type()));
        }
    }

    /**
     * Rejects a step that is statically known to be zero. Non-literal steps are accepted.
     */
    static void requireNonZeroStep(Expr step) {
        if (step != null && isZeroLiteral(step)) {
            throw new InvalidValueException("Loop step must not be zero: " + step);
        }
    }

    /**
     * Rejects an update such as {@code i += 0} that can never advance the loop.
     */
    static void requireAdvancingUpdate(Expr update) {
        if (update instanceof AugAssign aug && isZeroLiteral(aug.value())
                && (aug.baseOpCode().equals("+") || aug.baseOpCode().equals("-"))) {
            throw new InvalidValueException("Loop update never advances: " + aug + " with " + aug.value());
        }
    }

    private static boolean isZeroLiteral(Expr expr) {
        if (expr instanceof UnaryOp unary && (unary.opCode().equals("-") || unary.opCode().equals("+"))) {
            return isZeroLiteral(unary.operand());
        }
        if (expr instanceof LiteralInteger integer) {
            return integer.value().equals(BigInteger.ZERO);
        }
        if (expr instanceof LiteralFloat real) {
            return real.value() == 0.0;
        }
        if (expr instanceof LiteralComplex complex) {
            return complex.real() == 0.0 && complex.imag() == 0.0;
        }
        return false;
    }
}
