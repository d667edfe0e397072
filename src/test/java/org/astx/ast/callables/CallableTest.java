package org.astx.ast.callables;

import org.astx.api.MalformedNodeException;
import org.astx.api.TypeMismatchException;
import org.astx.ast.Block;
import org.astx.ast.literals.LiteralFloat32;
import org.astx.ast.literals.LiteralInt32;
import org.astx.ast.literals.LiteralUTF8String;
import org.astx.ast.types.DataTypes;
import org.astx.ast.variables.Variable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for function prototypes, definitions and calls.
 */
public class CallableTest {

    private static FunctionPrototype add() {
        return new FunctionPrototype("add",
                new Arguments(new Argument("a", DataTypes.int32()),
                        new Argument("b", DataTypes.int32(), new LiteralInt32(1))),
                DataTypes.int32());
    }

    @Test
    @Tag("unit")
    void testArgumentNamesAreUnique() {
        Arguments args = new Arguments(new Argument("x", DataTypes.int32()));
        assertThatThrownBy(() -> args.append(new Argument("x", DataTypes.float32())))
                .isInstanceOf(MalformedNodeException.class);
        assertThatThrownBy(() -> args.insert(0, new Argument("x", DataTypes.float32())))
                .isInstanceOf(MalformedNodeException.class);
        assertThat(args.size()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testArgumentDefaultMustMatchType() {
        assertThatThrownBy(() -> new Argument("n", DataTypes.int32(), new LiteralUTF8String("one")))
                .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    @Tag("unit")
    void testPrototypeDescribesItsFunctionType() {
        assertThat(add().functionType())
                .isEqualTo(DataTypes.function(DataTypes.int32(), DataTypes.int32(), DataTypes.int32()));
        assertThat(add().args().requiredCount()).isEqualTo(1);
    }

    /**
     * Verifies that a call checks its argument count against required and total parameters,
     * and each argument type against its parameter.
     */
    @Test
    @Tag("unit")
    void testCallChecksArity() {
        FunctionCall full = new FunctionCall(add(), List.of(new LiteralInt32(1), new LiteralInt32(2)));
        FunctionCall withDefault = new FunctionCall(add(), List.of(new LiteralInt32(1)));

        assertThat(full.type()).isEqualTo(DataTypes.int32());
        assertThat(withDefault.args()).hasSize(1);
        assertThat(full).hasToString("FunctionCall[add]");
        assertThatThrownBy(() -> new FunctionCall(add(), List.of()))
                .isInstanceOf(MalformedNodeException.class)
                .hasMessageContaining("1 to 2");
        assertThatThrownBy(() -> new FunctionCall(add(),
                List.of(new LiteralInt32(1), new LiteralInt32(2), new LiteralInt32(3))))
                .isInstanceOf(MalformedNodeException.class);
        assertThatThrownBy(() -> new FunctionCall(add(), List.of(new LiteralUTF8String("x"))))
                .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    @Tag("unit")
    void testCallDoesNotAdoptTheCallee() {
        FunctionPrototype prototype = add();
        FunctionDef def = new FunctionDef(prototype, new Block());
        FunctionCall call = new FunctionCall(prototype, List.of(new LiteralInt32(1)));

        assertThat(prototype.getParent()).containsSame(def);
        assertThat(call.getChildren()).doesNotContain(prototype);
    }

    @Test
    @Tag("unit")
    void testDefinitionsAndExpressions() {
        FunctionDef def = new FunctionAsyncDef(add(), new Block());
        assertThat(def).hasToString("FunctionAsyncDef[add]");
        assertThat(def.name()).isEqualTo("add");

        LambdaExpr lambda = new LambdaExpr(new Arguments(new Argument("x", DataTypes.float32())), new LiteralFloat32(1));
        assertThat(lambda.type()).isEqualTo(DataTypes.function(DataTypes.float32(), DataTypes.float32()));

        assertThat(new AwaitExpr(new Variable("task", DataTypes.utf8String())).type()).isEqualTo(DataTypes.utf8String());
        assertThat(new YieldExpr().type()).isEqualTo(DataTypes.any());
        assertThat(new FunctionReturn().getChildren()).isEmpty();
    }
}
