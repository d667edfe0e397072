package org.astx.transpiler.python;

import com.typesafe.config.ConfigFactory;
import org.astx.SampleTrees;
import org.astx.api.UnhandledNodeException;
import org.astx.ast.Block;
import org.astx.ast.Identifier;
import org.astx.ast.flows.AsyncForRangeLoopExpr;
import org.astx.ast.flows.AsyncForRangeLoopStmt;
import org.astx.ast.flows.CaseStmt;
import org.astx.ast.flows.ContinueStmt;
import org.astx.ast.flows.DoWhileStmt;
import org.astx.ast.flows.ForCountLoopExpr;
import org.astx.ast.flows.ForCountLoopStmt;
import org.astx.ast.flows.ForRangeLoopExpr;
import org.astx.ast.flows.GotoStmt;
import org.astx.ast.flows.IfStmt;
import org.astx.ast.flows.SwitchStmt;
import org.astx.ast.flows.WhileStmt;
import org.astx.ast.SubscriptExpr;
import org.astx.ast.literals.FormattedValue;
import org.astx.ast.literals.JoinedStr;
import org.astx.ast.literals.LiteralBoolean;
import org.astx.ast.literals.LiteralInt32;
import org.astx.ast.literals.LiteralSet;
import org.astx.ast.literals.LiteralTuple;
import org.astx.ast.literals.LiteralUTF8String;
import org.astx.ast.operators.AugAssign;
import org.astx.ast.operators.BinaryOp;
import org.astx.ast.operators.BoolBinaryOp;
import org.astx.ast.operators.CompareOp;
import org.astx.ast.types.DataTypes;
import org.astx.ast.variables.DeleteStmt;
import org.astx.ast.variables.InlineVariableDeclaration;
import org.astx.ast.variables.Variable;
import org.astx.config.AstxConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for rendering trees as Python source.
 */
public class PythonTranspilerTest {

    private PythonTranspiler transpiler;

    @BeforeEach
    void setUp() {
        transpiler = new PythonTranspiler();
    }

    @Test
    @Tag("unit")
    void testFunctionWithLoop() {
        String expected = String.join("\n",
                "def total(limit: int) -> int:",
                "    acc: int = 0",
                "    for i in range(0, limit):",
                "        if (i > 2):",
                "            acc += i",
                "    return acc");

        assertThat(transpiler.transpile(SampleTrees.totalFunction())).isEqualTo(expected);
    }

    @Test
    @Tag("unit")
    void testProgramLayout() {
        String python = transpiler.transpile(SampleTrees.program());

        assertThat(python).startsWith("# target: x86_64-pc-linux-gnu (e-m:e-i64:64)\n# package: demo\n\n# module: main\n");
        assertThat(python.lines()).contains(
                "from math import floor, pi as PI",
                "GREETING: str = 'it\\'s 42'",
                "class Point:",
                "    x: float = 0.5",
                "    y: float",
                "result: int = (total(10) * 2)",
                "values: list[int] = [1, 2]");
    }

    @Test
    @Tag("unit")
    void testEmptyBlocksBecomePass() {
        WhileStmt loop = new WhileStmt(new LiteralBoolean(true), new Block());

        assertThat(transpiler.transpile(loop)).isEqualTo("while True:\n    pass");
        assertThat(transpiler.transpile(new SwitchStmt(new Variable("x"), List.of())))
                .isEqualTo("match x:\n    case _:\n        pass");
    }

    @Test
    @Tag("unit")
    void testSwitchWithDefault() {
        Block one = new Block();
        one.append(new Variable("a"));
        CaseStmt first = new CaseStmt(new LiteralInt32(1), one, false);
        CaseStmt fallback = new CaseStmt(null, new Block(), true);

        String python = transpiler.transpile(new SwitchStmt(new Variable("x", DataTypes.int32()), List.of(first, fallback)));

        assertThat(python).isEqualTo(String.join("\n",
                "match x:",
                "    case 1:",
                "        a",
                "    case _:",
                "        pass"));
    }

    @Test
    @Tag("unit")
    void testLiteralForms() {
        assertThat(transpiler.transpile(new LiteralSet(List.of()))).isEqualTo("set()");
        assertThat(transpiler.transpile(new LiteralTuple(List.of(new LiteralInt32(1))))).isEqualTo("(1,)");
        assertThat(transpiler.transpile(new LiteralUTF8String("a\nb"))).isEqualTo("'a\\nb'");
        assertThat(transpiler.transpile(new BoolBinaryOp("&&", new LiteralBoolean(true), new LiteralBoolean(false))))
                .isEqualTo("(True and False)");
    }

    @Test
    @Tag("unit")
    void testLoopForms() {
        Block squares = new Block();
        squares.append(new BinaryOp("*", new Variable("i", DataTypes.int32()), new Variable("i", DataTypes.int32())));
        ForRangeLoopExpr comprehension = new ForRangeLoopExpr(new InlineVariableDeclaration("i", DataTypes.int32(), null),
                new LiteralInt32(0), new LiteralInt32(3), new LiteralInt32(1), squares);

        Block step = new Block();
        step.append(new Variable("work"));
        ForCountLoopStmt counted = new ForCountLoopStmt(
                new InlineVariableDeclaration("n", DataTypes.int32(), new LiteralInt32(0)),
                new CompareOp("<", new Variable("n", DataTypes.int32()), new LiteralInt32(5)),
                new AugAssign("+=", new Variable("n", DataTypes.int32()), new LiteralInt32(1)), step);

        assertThat(transpiler.transpile(comprehension)).isEqualTo("[(i * i) for i in range(0, 3, 1)]");
        assertThat(transpiler.transpile(counted)).isEqualTo(String.join("\n",
                "n: int = 0",
                "while (n < 5):",
                "    work",
                "    n += 1"));
        assertThat(transpiler.transpile(new DoWhileStmt(new Block(), new LiteralBoolean(false)))).isEqualTo(String.join("\n",
                "while True:",
                "    pass",
                "    if not False:",
                "        break"));
    }

    /**
     * The update of a counted loop must also run when the body continues,
     * otherwise the generated loop would never advance past the skipped iteration.
     */
    @Test
    @Tag("unit")
    void testCountLoopUpdateRunsOnContinue() {
        Block skip = new Block();
        skip.append(new ContinueStmt());
        Block body = new Block();
        body.append(new IfStmt(new CompareOp("==", new Variable("i", DataTypes.int32()), new LiteralInt32(2)), skip));
        ForCountLoopStmt loop = new ForCountLoopStmt(
                new InlineVariableDeclaration("i", DataTypes.int32(), new LiteralInt32(0)),
                new CompareOp("<", new Variable("i", DataTypes.int32()), new LiteralInt32(5)),
                new AugAssign("+=", new Variable("i", DataTypes.int32()), new LiteralInt32(1)), body);

        assertThat(transpiler.transpile(loop)).isEqualTo(String.join("\n",
                "i: int = 0",
                "while (i < 5):",
                "    try:",
                "        if (i == 2):",
                "            continue",
                "    finally:",
                "        i += 1"));
    }

    @Test
    @Tag("unit")
    void testContinueInNestedLoopKeepsPlainCountLoop() {
        Block inner = new Block();
        inner.append(new ContinueStmt());
        Block body = new Block();
        body.append(new WhileStmt(new LiteralBoolean(false), inner));
        ForCountLoopStmt loop = new ForCountLoopStmt(
                new InlineVariableDeclaration("n", DataTypes.int32(), new LiteralInt32(0)),
                new CompareOp("<", new Variable("n", DataTypes.int32()), new LiteralInt32(2)),
                new AugAssign("+=", new Variable("n", DataTypes.int32()), new LiteralInt32(1)), body);

        assertThat(transpiler.transpile(loop)).isEqualTo(String.join("\n",
                "n: int = 0",
                "while (n < 2):",
                "    while False:",
                "        continue",
                "    n += 1"));
    }

    @Test
    @Tag("unit")
    void testDoWhileContinueReachesCondition() {
        Block body = new Block();
        body.append(new ContinueStmt());

        assertThat(transpiler.transpile(new DoWhileStmt(body, new LiteralBoolean(false)))).isEqualTo(String.join("\n",
                "_do_first = True",
                "while _do_first or False:",
                "    _do_first = False",
                "    continue"));
    }

    @Test
    @Tag("unit")
    void testNonLiteralCaseComparesWithSubject() {
        CaseStmt byName = new CaseStmt(new Variable("limit"), new Block());
        CaseStmt byValue = new CaseStmt(new LiteralInt32(3), new Block());

        String python = transpiler.transpile(new SwitchStmt(new Variable("x"), List.of(byName, byValue)));

        assertThat(python).isEqualTo(String.join("\n",
                "match x:",
                "    case _ if x == limit:",
                "        pass",
                "    case 3:",
                "        pass"));
    }

    @Test
    @Tag("unit")
    void testAsyncRangeLoops() {
        Block body = new Block();
        body.append(new Variable("i", DataTypes.int32()));
        AsyncForRangeLoopStmt statement = new AsyncForRangeLoopStmt(
                new InlineVariableDeclaration("i", DataTypes.int32(), null),
                new LiteralInt32(0), new LiteralInt32(4), null, new Block());
        AsyncForRangeLoopExpr expression = new AsyncForRangeLoopExpr(
                new InlineVariableDeclaration("i", DataTypes.int32(), null),
                new LiteralInt32(0), new LiteralInt32(4), new LiteralInt32(2), body);

        assertThat(transpiler.transpile(statement)).isEqualTo("async for i in range(0, 4):\n    pass");
        assertThat(transpiler.transpile(expression)).isEqualTo("[i async for i in range(0, 4, 2)]");
    }

    @Test
    @Tag("unit")
    void testDeleteTargets() {
        DeleteStmt delete = new DeleteStmt(List.of(
                new Variable("a"), SubscriptExpr.index(new Variable("b"), new LiteralInt32(0))));

        assertThat(transpiler.transpile(delete)).isEqualTo("del a, b[0]");
    }

    @Test
    @Tag("unit")
    void testFormattedStrings() {
        JoinedStr price = new JoinedStr(List.of(
                new LiteralUTF8String("total: "),
                new FormattedValue(new Variable("n"), 'r', new LiteralUTF8String(".2f")),
                new LiteralUTF8String(" {ok}")));
        FormattedValue padded = new FormattedValue(new Variable("v"), null, new JoinedStr(List.of(
                new LiteralUTF8String(">"), new FormattedValue(new Variable("width")))));

        assertThat(transpiler.transpile(price)).isEqualTo("f'total: {n!r:.2f} {{ok}}'");
        assertThat(transpiler.transpile(padded)).isEqualTo("f'{v:>{width}}'");
        assertThat(transpiler.transpile(new JoinedStr(List.of(new FormattedValue(new LiteralUTF8String("x"))))))
                .isEqualTo("f\"{'x'}\"");
    }

    @Test
    @Tag("unit")
    void testCountLoopExpressionHasNoPythonForm() {
        ForCountLoopExpr loop = new ForCountLoopExpr(
                new InlineVariableDeclaration("n", DataTypes.int32(), new LiteralInt32(0)),
                new CompareOp("<", new Variable("n", DataTypes.int32()), new LiteralInt32(5)),
                new AugAssign("+=", new Variable("n", DataTypes.int32()), new LiteralInt32(1)), new Block());

        assertThatThrownBy(() -> transpiler.transpile(loop)).isInstanceOf(UnhandledNodeException.class);
    }

    @Test
    @Tag("unit")
    void testConfiguredIndent() {
        AstxConfig tabs = AstxConfig.from(ConfigFactory.parseString("astx.transpiler.indent = \"\\t\"")
                .withFallback(ConfigFactory.defaultReference()));

        String python = new PythonTranspiler(tabs).transpile(new WhileStmt(new LiteralBoolean(false), new Block()));

        assertThat(python).isEqualTo("while False:\n\tpass");
    }

    @Test
    @Tag("unit")
    void testGotoHasNoPythonForm() {
        assertThatThrownBy(() -> transpiler.transpile(new GotoStmt(new Identifier("retry"))))
                .isInstanceOf(UnhandledNodeException.class)
                .hasMessageContaining("PythonTranspiler");
    }
}
