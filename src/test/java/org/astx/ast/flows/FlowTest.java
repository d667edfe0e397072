package org.astx.ast.flows;

import org.astx.api.InvalidValueException;
import org.astx.api.MalformedNodeException;
import org.astx.api.TypeMismatchException;
import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.Identifier;
import org.astx.ast.literals.LiteralBoolean;
import org.astx.ast.literals.LiteralFloat64;
import org.astx.ast.literals.LiteralInt32;
import org.astx.ast.literals.LiteralUTF8String;
import org.astx.ast.operators.AugAssign;
import org.astx.ast.operators.CompareOp;
import org.astx.ast.operators.UnaryOp;
import org.astx.ast.types.DataTypes;
import org.astx.ast.variables.InlineVariableDeclaration;
import org.astx.ast.variables.Variable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the control flow nodes and their construction checks.
 */
public class FlowTest {

    private static InlineVariableDeclaration loopVar(String name) {
        return new InlineVariableDeclaration(name, DataTypes.int32(), new LiteralInt32(0));
    }

    private static Block blockOf(AstNode... nodes) {
        Block block = new Block();
        for (AstNode node : nodes) {
            block.append(node);
        }
        return block;
    }

    @Test
    @Tag("unit")
    void testRangeLoopWithZeroStepIsRejected() {
        assertThatThrownBy(() -> new ForRangeLoopExpr(loopVar("i"),
                new LiteralInt32(0), new LiteralInt32(10), new LiteralInt32(0), new Block()))
                .isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> new ForRangeLoopStmt(loopVar("i"),
                new LiteralInt32(0), new LiteralInt32(10), new UnaryOp("-", new LiteralFloat64(0.0)), new Block()))
                .isInstanceOf(InvalidValueException.class);
    }

    @Test
    @Tag("unit")
    void testRangeLoopWithUnitStepIsAccepted() {
        ForRangeLoopExpr loop = new ForRangeLoopExpr(loopVar("i"),
                new LiteralInt32(0), new LiteralInt32(10), new LiteralInt32(1), new Block());
        assertThat(loop.step()).isEqualTo(new LiteralInt32(1));
        assertThat(loop).hasToString("ForRangeLoopExpr[i]");
        assertThat(loop.type()).isEqualTo(DataTypes.any());
    }

    @Test
    @Tag("unit")
    void testAsyncRangeLoops() {
        assertThatThrownBy(() -> new AsyncForRangeLoopStmt(loopVar("i"),
                new LiteralInt32(0), new LiteralInt32(10), new LiteralInt32(0), new Block()))
                .isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> new AsyncForRangeLoopExpr(loopVar("i"), new LiteralInt32(0), new LiteralInt32(3), null,
                blockOf(new Variable("a"), new Variable("b"))))
                .isInstanceOf(MalformedNodeException.class)
                .hasMessageContaining("one body node");

        AsyncForRangeLoopStmt loop = new AsyncForRangeLoopStmt(loopVar("i"),
                new LiteralInt32(0), new LiteralInt32(3), null, blockOf(new Variable("a")));
        assertThat(loop).hasToString("AsyncForRangeLoopStmt[i]");
        assertThat(loop.getChildren()).hasSize(4).last().isSameAs(loop.body());
    }

    @Test
    @Tag("unit")
    void testRangeBoundsMustBeNumeric() {
        assertThatThrownBy(() -> new ForRangeLoopStmt(loopVar("i"),
                new LiteralUTF8String("a"), new LiteralInt32(10), null, new Block()))
                .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    @Tag("unit")
    void testCountLoopRejectsUpdateThatNeverAdvances() {
        Variable i = new Variable("i", DataTypes.int32());
        CompareOp condition = new CompareOp("<", new Variable("i", DataTypes.int32()), new LiteralInt32(3));
        assertThatThrownBy(() -> new ForCountLoopStmt(loopVar("i"), condition,
                new AugAssign("+=", i, new LiteralInt32(0)), new Block()))
                .isInstanceOf(InvalidValueException.class);
    }

    @Test
    @Tag("unit")
    void testIfExprTypeIsTheAgreedBranchType() {
        IfExpr agreed = new IfExpr(new LiteralBoolean(true), blockOf(new LiteralInt32(1)), blockOf(new LiteralInt32(2)));
        IfExpr differing = new IfExpr(new LiteralBoolean(true), blockOf(new LiteralInt32(1)), blockOf(new LiteralFloat64(2)));
        IfExpr noElse = new IfExpr(new LiteralBoolean(true), blockOf(new LiteralInt32(1)), null);

        assertThat(agreed.type()).isEqualTo(DataTypes.int32());
        assertThat(differing.type()).isEqualTo(DataTypes.any());
        assertThat(noElse.type()).isEqualTo(DataTypes.any());
    }

    @Test
    @Tag("unit")
    void testIfStmtChildrenOmitMissingElse() {
        IfStmt stmt = new IfStmt(new LiteralBoolean(true), new Block());
        assertThat(stmt.getChildren()).hasSize(2);
        assertThat(stmt.getStruct(false).get("IfStmt").has("else-block")).isFalse();
    }

    /**
     * Verifies that a switch accepts at most one default case and that cases validate themselves.
     */
    @Test
    @Tag("unit")
    void testSwitchAllowsOneDefault() {
        CaseStmt one = new CaseStmt(new LiteralInt32(1), new Block());
        SwitchStmt ok = new SwitchStmt(new Variable("n"), List.of(one, CaseStmt.defaultCase(new Block())));
        assertThat(ok).hasToString("SwitchStmt[2]");

        assertThatThrownBy(() -> new SwitchStmt(new Variable("n"),
                List.of(CaseStmt.defaultCase(new Block()), CaseStmt.defaultCase(new Block()))))
                .isInstanceOf(MalformedNodeException.class);
        assertThatThrownBy(() -> new CaseStmt(null, new Block())).isInstanceOf(MalformedNodeException.class);
        assertThatThrownBy(() -> new CaseStmt(new LiteralInt32(1), new Block(), true))
                .isInstanceOf(MalformedNodeException.class);
    }

    @Test
    @Tag("unit")
    void testExceptionHandlerNeedsAHandler() {
        assertThatThrownBy(() -> new ExceptionHandlerStmt(new Block(), List.of(), null))
                .isInstanceOf(MalformedNodeException.class);

        CatchHandlerStmt handler = new CatchHandlerStmt(new Block(), "e", List.of(new Identifier("ValueError")));
        ExceptionHandlerStmt withFinally = new ExceptionHandlerStmt(
                new Block(), List.of(handler), new FinallyHandlerStmt(new Block()));
        assertThat(withFinally.getChildren()).hasSize(3);
        assertThat(handler).hasToString("CatchHandlerStmt[e]");
    }

    @Test
    @Tag("unit")
    void testWithStatementRequiresItems() {
        assertThatThrownBy(() -> new WithStmt(List.of(), new Block())).isInstanceOf(MalformedNodeException.class);
        WithItem item = new WithItem(new Identifier("lock"), "guard");
        assertThat(new WithStmt(List.of(item), new Block())).hasToString("WithStmt[1]");
        assertThat(item).hasToString("WithItem[guard]");
    }

    @Test
    @Tag("unit")
    void testGotoCarriesItsLabel() {
        assertThat(new GotoStmt(new Identifier("retry"))).hasToString("GotoStmt[retry]");
    }
}
