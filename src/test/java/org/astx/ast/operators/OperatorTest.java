package org.astx.ast.operators;

import org.astx.api.MalformedNodeException;
import org.astx.api.TypeMismatchException;
import org.astx.ast.literals.LiteralBoolean;
import org.astx.ast.literals.LiteralFloat32;
import org.astx.ast.literals.LiteralInt32;
import org.astx.ast.literals.LiteralInt64;
import org.astx.ast.literals.LiteralInt8;
import org.astx.ast.literals.LiteralUTF8String;
import org.astx.ast.types.DataTypes;
import org.astx.ast.variables.Variable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the operator nodes. Result types come from the promotion
 * table at construction time; invalid combinations fail before the node exists.
 */
public class OperatorTest {

    @Test
    @Tag("unit")
    void testBinaryOpTypeIsFixedAtConstruction() {
        BinaryOp op = new BinaryOp("+", new LiteralInt8(1), new LiteralFloat32(2.0));
        assertThat(op.type()).isEqualTo(DataTypes.float32());
        assertThat(op).hasToString("BinaryOp[+]");
    }

    @Test
    @Tag("unit")
    void testBinaryOpRejectsMismatchedOperands() {
        assertThatThrownBy(() -> new BinaryOp("+", new LiteralUTF8String("a"), new LiteralInt32(1)))
                .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    @Tag("unit")
    void testCompareAndBoolOpsOnlyAcceptTheirCategory() {
        assertThat(new CompareOp("<", new LiteralInt32(1), new LiteralInt8(2)).type()).isEqualTo(DataTypes.bool());
        assertThat(new BoolBinaryOp("xnor", new LiteralBoolean(true), new LiteralBoolean(false)))
                .hasToString("BoolBinaryOp[xnor]");
        assertThatThrownBy(() -> new CompareOp("+", new LiteralInt32(1), new LiteralInt32(2)))
                .isInstanceOf(MalformedNodeException.class);
        assertThatThrownBy(() -> new BoolBinaryOp("==", new LiteralBoolean(true), new LiteralBoolean(true)))
                .isInstanceOf(MalformedNodeException.class);
    }

    @Test
    @Tag("unit")
    void testUnaryOp() {
        UnaryOp neg = new UnaryOp("-", new LiteralInt32(4));
        assertThat(neg.type()).isEqualTo(DataTypes.int32());
        assertThat(neg).hasToString("UnaryOp[-]");
        assertThatThrownBy(() -> new UnaryOp("not", new LiteralInt32(4))).isInstanceOf(TypeMismatchException.class);
    }

    /**
     * Verifies that augmented assignment needs an addressable target and a storable result.
     */
    @Test
    @Tag("unit")
    void testAugAssignValidatesTargetAndResult() {
        AugAssign add = new AugAssign("+=", new Variable("x", DataTypes.int32()), new LiteralInt8(1));
        assertThat(add.baseOpCode()).isEqualTo("+");
        assertThat(add.type()).isEqualTo(DataTypes.int32());

        assertThatThrownBy(() -> new AugAssign("+=", new LiteralInt32(1), new LiteralInt32(1)))
                .isInstanceOf(MalformedNodeException.class);
        assertThatThrownBy(() -> new AugAssign("==", new Variable("x", DataTypes.int32()), new LiteralInt32(1)))
                .isInstanceOf(MalformedNodeException.class);
        assertThatThrownBy(() -> new AugAssign("+=", new Variable("s", DataTypes.utf8String()), new LiteralInt32(1)))
                .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    @Tag("unit")
    void testAugAssignRejectsResultWiderThanTarget() {
        Variable small = new Variable("x", DataTypes.int8());

        assertThatThrownBy(() -> new AugAssign("/=", small, new LiteralInt8(2)))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("Float64");
        assertThatThrownBy(() -> new AugAssign("+=", new Variable("y", DataTypes.int8()), new LiteralInt32(1)))
                .isInstanceOf(TypeMismatchException.class);
        assertThat(new AugAssign("*=", new Variable("z", DataTypes.int64()), new LiteralInt64(3)).type())
                .isEqualTo(DataTypes.int64());
    }

    @Test
    @Tag("unit")
    void testWalrusTakesTheValueType() {
        WalrusOp walrus = new WalrusOp(new Variable("n"), new LiteralFloat32(1.5));
        assertThat(walrus.type()).isEqualTo(DataTypes.float32());
        assertThat(walrus).hasToString("WalrusOp[:=]");
    }

    @Test
    @Tag("unit")
    void testStarredKeepsTheOperand() {
        Variable args = new Variable("args", DataTypes.list(DataTypes.int32()));
        Starred starred = new Starred(args);
        assertThat(starred.getChildren()).containsExactly(args);
    }
}
