package org.astx.symbols;

import org.astx.api.ErrorKind;
import org.astx.api.SymbolResolutionException;
import org.astx.ast.literals.LiteralInt32;
import org.astx.ast.modifiers.VisibilityKind;
import org.astx.ast.variables.Variable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for scope nesting, definition and lookup in the {@link SymbolTable}.
 */
public class SymbolTableTest {

    private SymbolTable table;

    @BeforeEach
    void setUp() {
        table = new SymbolTable();
    }

    @Test
    @Tag("unit")
    void testLookupWalksOutward() {
        Variable outer = new Variable("x");
        table.define("x", SymbolKind.VARIABLE, outer);
        SymbolTable.Scope fn = table.enterScope("main");
        SymbolTable.Scope loop = table.enterScope("loop");

        assertThat(table.lookup(loop, "x")).isSameAs(outer);
        assertThat(loop.path()).isEqualTo("root.main.loop");
        assertThat(loop.parent()).contains(fn);
        assertThat(table.rootScope().child("main")).contains(fn);
    }

    @Test
    @Tag("unit")
    void testInnerScopeShadowsOuter() {
        table.define("x", SymbolKind.VARIABLE, new Variable("x"));
        table.enterScope("inner");
        Variable shadow = new Variable("x");
        table.define("x", SymbolKind.ARGUMENT, shadow);

        assertThat(table.lookup("x")).isSameAs(shadow);
        table.leaveScope();
        assertThat(table.resolve("x")).hasValueSatisfying(s -> assertThat(s.kind()).isEqualTo(SymbolKind.VARIABLE));
    }

    @Test
    @Tag("unit")
    void testRedefinitionFailsAtSameVisibility() {
        SymbolTable.Scope root = table.rootScope();
        table.define(root, "count", SymbolKind.VARIABLE, VisibilityKind.PUBLIC, new LiteralInt32(1));

        assertThatThrownBy(() -> table.define(root, "count", SymbolKind.CONSTANT, VisibilityKind.PUBLIC, new LiteralInt32(2)))
                .isInstanceOf(SymbolResolutionException.class)
                .satisfies(e -> assertThat(((SymbolResolutionException) e).kind()).isEqualTo(ErrorKind.KEY));

        table.define(root, "count", SymbolKind.VARIABLE, VisibilityKind.PRIVATE, new LiteralInt32(3));
        assertThat(root.symbols()).extracting(Symbol::visibility)
                .containsExactly(VisibilityKind.PUBLIC, VisibilityKind.PRIVATE);
        assertThat(table.lookup(root, "count")).isEqualTo(new LiteralInt32(1));
    }

    @Test
    @Tag("unit")
    void testUndefinedNameFails() {
        SymbolTable.Scope inner = table.enterScope("inner");
        assertThatThrownBy(() -> table.lookup(inner, "missing"))
                .isInstanceOf(SymbolResolutionException.class)
                .hasMessageContaining("missing");
        assertThatThrownBy(() -> table.update(inner, "missing", new Variable("missing")))
                .isInstanceOf(SymbolResolutionException.class);
        assertThat(table.resolve(inner, "missing")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testUpdateKeepsKindAndVisibility() {
        table.define(table.rootScope(), "n", SymbolKind.CONSTANT, VisibilityKind.PROTECTED, new LiteralInt32(1));
        SymbolTable.Scope inner = table.enterScope("inner");
        LiteralInt32 replacement = new LiteralInt32(2);

        table.update(inner, "n", replacement);

        Symbol symbol = table.resolve(inner, "n").orElseThrow();
        assertThat(symbol.node()).isSameAs(replacement);
        assertThat(symbol.kind()).isEqualTo(SymbolKind.CONSTANT);
        assertThat(symbol.visibility()).isEqualTo(VisibilityKind.PROTECTED);
        assertThat(inner.symbols()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testLeavingRootIsNoOp() {
        table.leaveScope();
        assertThat(table.currentScope()).isSameAs(table.rootScope());
        table.enterScope("a");
        table.resetScope();
        assertThat(table.currentScope().name()).isEqualTo("root");
    }
}
