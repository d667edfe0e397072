package org.astx.ast.operators;

import org.astx.api.MalformedNodeException;
import org.astx.api.TypeMismatchException;
import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.variables.Variable;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;

/**
 * An in-place update such as {@code x += 1}. The target must be a {@link Variable};
 * the combined value must not widen past the target's type, so {@code Int8 x; x /= 2} is rejected.
 */
public final class AugAssign extends Expr {

    private final String opCode;
    private final Variable target;
    private final Expr value;

    public AugAssign(String opCode, Expr target, Expr value) {
        Variable variable = AssignmentTargets.requireAddressable(target, "Augmented assignment");
        if (opCode == null || !opCode.endsWith("=") || opCode.length() < 2) {
            throw new MalformedNodeException("Not an augmented assignment operator: " + opCode);
        }
        String base = opCode.substring(0, opCode.length() - 1);
        if (!PromotionTable.ARITHMETIC.contains(base) && !PromotionTable.BITWISE.contains(base)) {
            throw new MalformedNodeException("Not an augmented assignment operator: " + opCode);
        }
        DataType combined = PromotionTable.binary(base, variable.type(), value.type());
        if (!DataTypes.isAssignable(variable.type(), combined)) {
            throw new TypeMismatchException(String.format(
                    "Result %s of '%s' cannot be stored in %s", combined, opCode, variable));
        }
        this.opCode = opCode;
        this.target = adopt(variable);
        this.value = adopt(value);
    }

    public String opCode() {
        return opCode;
    }

    /**
     * @return The binary operator applied, for example {@code +} for {@code +=}.
     */
    public String baseOpCode() {
        return opCode.substring(0, opCode.length() - 1);
    }

    public Variable target() {
        return target;
    }

    public Expr value() {
        return value;
    }

    @Override
    public DataType type() {
        return target.type();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, value);
    }

    @Override
    public AstKind kind() {
        return AstKind.AUG_ASSIGN;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAugAssign(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("op-code", opCode).child("target", target).child("value", value);
    }

    @Override
    public String toString() {
        return "AugAssign[" + opCode + "]";
    }
}
