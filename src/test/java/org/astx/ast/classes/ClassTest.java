package org.astx.ast.classes;

import org.astx.api.MalformedNodeException;
import org.astx.ast.Block;
import org.astx.ast.Identifier;
import org.astx.ast.callables.Arguments;
import org.astx.ast.callables.FunctionDef;
import org.astx.ast.callables.FunctionPrototype;
import org.astx.ast.literals.LiteralInt32;
import org.astx.ast.modifiers.MutabilityKind;
import org.astx.ast.modifiers.ScopeKind;
import org.astx.ast.modifiers.VisibilityKind;
import org.astx.ast.types.DataTypes;
import org.astx.ast.variables.VariableDeclaration;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ClassTest {

    private static VariableDeclaration field(String name, VisibilityKind visibility) {
        return new VariableDeclaration(name, DataTypes.int32(), MutabilityKind.MUTABLE,
                ScopeKind.LOCAL, visibility, null);
    }

    private static VariableDeclaration constant(String name, int value) {
        return new VariableDeclaration(name, DataTypes.int32(), MutabilityKind.CONSTANT,
                ScopeKind.GLOBAL, VisibilityKind.PUBLIC, new LiteralInt32(value));
    }

    private static FunctionDef method(String name) {
        return new FunctionDef(new FunctionPrototype(name, new Arguments(), DataTypes.none()), new Block());
    }

    @Test
    @Tag("unit")
    void testClassDefinitionCarriesItsMembers() {
        ClassDefStmt point = new ClassDefStmt("Point", List.of(new Identifier("Base")), List.of(),
                VisibilityKind.PUBLIC, true, null,
                List.of(field("x", VisibilityKind.PUBLIC)), List.of(method("norm")));

        assertThat(point.isAbstract()).isTrue();
        assertThat(point.declaredType()).isEqualTo(DataTypes.classType("Point"));
        assertThat(point.getChildren()).hasSize(3);
        assertThat(point).hasToString("ClassDefStmt[Point]");
    }

    /**
     * The same name may appear once per visibility level.
     */
    @Test
    @Tag("unit")
    void testMemberNamesAreUniquePerVisibility() {
        assertThatThrownBy(() -> new ClassDefStmt("A",
                List.of(field("x", VisibilityKind.PUBLIC), field("x", VisibilityKind.PUBLIC)), List.of()))
                .isInstanceOf(MalformedNodeException.class);
        assertThatThrownBy(() -> new StructDefStmt("S", List.of(field("run", VisibilityKind.PUBLIC)), List.of(method("run"))))
                .isInstanceOf(MalformedNodeException.class);
        assertThat(new ClassDefStmt("B",
                List.of(field("x", VisibilityKind.PUBLIC), field("x", VisibilityKind.PRIVATE)), List.of())
                .attributes()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void testEnumMembersMustBeDistinctConstants() {
        EnumDeclStmt color = new EnumDeclStmt("Color", List.of(constant("RED", 1), constant("GREEN", 2)));
        assertThat(color.declaredType()).isEqualTo(DataTypes.enumType("Color"));

        assertThatThrownBy(() -> new EnumDeclStmt("Color", List.of(field("RED", VisibilityKind.PUBLIC))))
                .isInstanceOf(MalformedNodeException.class);
        assertThatThrownBy(() -> new EnumDeclStmt("Color", List.of(constant("RED", 1), constant("RED", 2))))
                .isInstanceOf(MalformedNodeException.class);
    }

    @Test
    @Tag("unit")
    void testStructDeclaration() {
        StructDeclStmt point = new StructDeclStmt("Point", List.of(field("x", VisibilityKind.PUBLIC)));
        assertThat(point.declaredType()).isEqualTo(DataTypes.struct("Point"));
        assertThatThrownBy(() -> new StructDeclStmt(" ", List.of())).isInstanceOf(MalformedNodeException.class);
    }
}
