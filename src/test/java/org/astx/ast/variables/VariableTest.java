package org.astx.ast.variables;

import org.astx.api.MalformedNodeException;
import org.astx.api.TypeMismatchException;
import org.astx.ast.SubscriptExpr;
import org.astx.ast.literals.LiteralFloat64;
import org.astx.ast.literals.LiteralInt32;
import org.astx.ast.literals.LiteralInt8;
import org.astx.ast.literals.LiteralUTF8String;
import org.astx.ast.modifiers.MutabilityKind;
import org.astx.ast.modifiers.ScopeKind;
import org.astx.ast.modifiers.VisibilityKind;
import org.astx.ast.types.DataTypes;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class VariableTest {

    @Test
    @Tag("unit")
    void testConstantRequiresInitializer() {
        assertThatThrownBy(() -> new VariableDeclaration("PI", DataTypes.float64(), MutabilityKind.CONSTANT,
                ScopeKind.GLOBAL, VisibilityKind.PUBLIC, null))
                .isInstanceOf(MalformedNodeException.class)
                .hasMessageContaining("PI");
        assertThatThrownBy(() -> new InlineVariableDeclaration("k", DataTypes.int32(), MutabilityKind.CONSTANT,
                ScopeKind.LOCAL, VisibilityKind.PUBLIC, null))
                .isInstanceOf(MalformedNodeException.class);
    }

    @Test
    @Tag("unit")
    void testInitializerMustBeCompatible() {
        assertThatThrownBy(() -> new VariableDeclaration("n", DataTypes.int32(), new LiteralUTF8String("ten")))
                .isInstanceOf(TypeMismatchException.class);

        VariableDeclaration widened = new VariableDeclaration("n", DataTypes.int32(), new LiteralInt8(10));
        assertThat(widened.value()).isNotNull();
        assertThat(new VariableDeclaration("m", DataTypes.float64(), null).getChildren()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testVariableReferences() {
        assertThat(new Variable("x").type()).isEqualTo(DataTypes.any());
        assertThat(new Variable("x", DataTypes.float64())).hasToString("Variable[x]");
        assertThatThrownBy(() -> new Variable("")).isInstanceOf(MalformedNodeException.class);

        VariableAssignment assignment = new VariableAssignment("x", new LiteralFloat64(1.5));
        assertThat(assignment.getChildren()).containsExactly(assignment.value());
        assertThatThrownBy(() -> new VariableAssignment("x", null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @Tag("unit")
    void testDeleteNeedsAddressableTargets() {
        Variable items = new Variable("items");
        DeleteStmt delete = new DeleteStmt(List.of(items, SubscriptExpr.index(new Variable("table"), new LiteralInt32(1))));

        assertThat(delete.targets()).hasSize(2);
        assertThat(items.getParent()).containsSame(delete);
        assertThatThrownBy(() -> new DeleteStmt(List.of())).isInstanceOf(MalformedNodeException.class);
        assertThatThrownBy(() -> new DeleteStmt(List.of(new LiteralInt32(1))))
                .isInstanceOf(MalformedNodeException.class)
                .hasMessageContaining("Cannot delete");
    }
}
