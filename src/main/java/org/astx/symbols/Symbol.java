package org.astx.symbols;

import org.astx.ast.AstNode;
import org.astx.ast.modifiers.VisibilityKind;

/**
 * Represents a single declared name in the symbol table.
 *
 * @param name The declared name.
 * @param kind The kind of declaration.
 * @param visibility The visibility the declaration was made with.
 * @param node The declaring AST node. The table shares it; the tree owns it.
 */
public record Symbol(String name, SymbolKind kind, VisibilityKind visibility, AstNode node) {

    /**
     * Constructor for public symbols.
     * @param name The declared name.
     * @param kind The kind of declaration.
     * @param node The declaring AST node.
     */
    public Symbol(String name, SymbolKind kind, AstNode node) {
        this(name, kind, VisibilityKind.PUBLIC, node);
    }
}
