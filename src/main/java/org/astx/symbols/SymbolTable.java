package org.astx.symbols;

import org.astx.api.SymbolResolutionException;
import org.astx.ast.AstNode;
import org.astx.ast.modifiers.VisibilityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A symbol table for managing scopes and the declarations visible in them.
 * <p>
 * Scopes form an explicit tree: each scope knows its enclosing scope, and lookups walk
 * outward along that chain. A name can be declared once per scope and visibility level;
 * redeclaring it at the same level of the same scope fails, while a nested scope may shadow it.
 * When one scope declares a name at several levels, lookups find the earliest declaration.
 */
public class SymbolTable {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolTable.class);

    /**
     * Represents a single scope in the symbol table.
     */
    public static final class Scope {
        private final String name;
        private final Scope parent;
        private final List<Scope> children = new ArrayList<>();
        private final Map<String, List<Symbol>> symbols = new LinkedHashMap<>();

        Scope(String name, Scope parent) {
            this.name = name;
            this.parent = parent;
        }

        public String name() {
            return name;
        }

        /**
         * @return The enclosing scope, empty for the root.
         */
        public Optional<Scope> parent() {
            return Optional.ofNullable(parent);
        }

        public List<Scope> children() {
            return Collections.unmodifiableList(children);
        }

        /**
         * @return The first nested scope with the given name.
         */
        public Optional<Scope> child(String childName) {
            return children.stream().filter(c -> c.name.equals(childName)).findFirst();
        }

        /**
         * @return The symbols declared directly in this scope, grouped by name in declaration order.
         */
        public List<Symbol> symbols() {
            List<Symbol> all = new ArrayList<>();
            symbols.values().forEach(all::addAll);
            return Collections.unmodifiableList(all);
        }

        private Symbol find(String symbolName) {
            List<Symbol> declared = symbols.get(symbolName);
            return declared == null ? null : declared.get(0);
        }

        /**
         * @return The dot-separated names from the root down to this scope.
         */
        public String path() {
            return parent == null ? name : parent.path() + "." + name;
        }

        @Override
        public String toString() {
            return "Scope[" + path() + "]";
        }
    }

    private final Scope rootScope;
    private Scope currentScope;

    /**
     * Constructs a new symbol table with an empty root scope named {@code root}.
     */
    public SymbolTable() {
        this.rootScope = new Scope("root", null);
        this.currentScope = this.rootScope;
    }

    public Scope rootScope() {
        return rootScope;
    }

    public Scope currentScope() {
        return currentScope;
    }

    /**
     * Resets the current scope to the root scope.
     */
    public void resetScope() {
        this.currentScope = this.rootScope;
    }

    /**
     * Enters a new scope nested in the current one.
     * @param name A label for the scope, for example the function name.
     * @return The new scope.
     */
    public Scope enterScope(String name) {
        Scope newScope = new Scope(name, currentScope);
        currentScope.children.add(newScope);
        currentScope = newScope;
        LOG.debug("Entered scope {}", newScope.path());
        return newScope;
    }

    /**
     * Leaves the current scope and moves to the parent scope. Leaving the root is a no-op.
     */
    public void leaveScope() {
        if (currentScope.parent != null) {
            LOG.debug("Left scope {}", currentScope.path());
            currentScope = currentScope.parent;
        }
    }

    /**
     * Sets the current scope to the given scope.
     * @param scope The scope to set as current.
     */
    public void setCurrentScope(Scope scope) {
        this.currentScope = scope;
    }

    /**
     * Defines a public symbol in the current scope.
     * @see #define(Scope, String, SymbolKind, VisibilityKind, AstNode)
     */
    public Symbol define(String name, SymbolKind kind, AstNode node) {
        return define(currentScope, name, kind, VisibilityKind.PUBLIC, node);
    }

    /**
     * Defines a public variable symbol in the given scope.
     * @see #define(Scope, String, SymbolKind, VisibilityKind, AstNode)
     */
    public Symbol define(Scope scope, String name, AstNode node) {
        return define(scope, name, SymbolKind.VARIABLE, VisibilityKind.PUBLIC, node);
    }

    /**
     * Defines a new symbol in the given scope.
     * @param scope The scope that receives the declaration.
     * @param name The declared name.
     * @param kind The kind of declaration.
     * @param visibility The declared visibility.
     * @param node The declaring node.
     * @return The new symbol.
     * @throws SymbolResolutionException if {@code name} is already declared in {@code scope}
     *         with the same visibility.
     */
    public Symbol define(Scope scope, String name, SymbolKind kind, VisibilityKind visibility, AstNode node) {
        List<Symbol> declared = scope.symbols.computeIfAbsent(name, k -> new ArrayList<>());
        for (Symbol existing : declared) {
            if (existing.visibility() == visibility) {
                throw new SymbolResolutionException(name, String.format(
                        "Symbol '%s' is already defined as %s in %s by %s",
                        name, visibility.label(), scope, existing.node()));
            }
        }
        Symbol symbol = new Symbol(name, kind, visibility, node);
        declared.add(symbol);
        LOG.debug("Defined {} '{}' in {}", kind, name, scope.path());
        return symbol;
    }

    /**
     * Resolves a symbol by name, searching from the given scope upwards to the root.
     * @param scope The innermost scope to search.
     * @param name The name to resolve.
     * @return An optional containing the nearest declaration, or empty if not found.
     */
    public Optional<Symbol> resolve(Scope scope, String name) {
        for (Scope s = scope; s != null; s = s.parent) {
            Symbol symbol = s.find(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a symbol from the current scope upwards.
     */
    public Optional<Symbol> resolve(String name) {
        return resolve(currentScope, name);
    }

    /**
     * Looks up the declaring node of the nearest declaration of {@code name}.
     * @throws SymbolResolutionException if no enclosing scope declares it.
     */
    public AstNode lookup(Scope scope, String name) {
        return resolve(scope, name)
                .map(Symbol::node)
                .orElseThrow(() -> new SymbolResolutionException(name, String.format(
                        "Symbol '%s' is not defined in %s or any enclosing scope", name, scope)));
    }

    public AstNode lookup(String name) {
        return lookup(currentScope, name);
    }

    /**
     * Replaces the declaring node of the nearest existing declaration of {@code name},
     * keeping its kind and visibility.
     * @throws SymbolResolutionException if no enclosing scope declares it.
     */
    public void update(Scope scope, String name, AstNode node) {
        for (Scope s = scope; s != null; s = s.parent) {
            List<Symbol> declared = s.symbols.get(name);
            if (declared != null) {
                Symbol symbol = declared.get(0);
                declared.set(0, new Symbol(name, symbol.kind(), symbol.visibility(), node));
                LOG.debug("Updated '{}' in {}", name, s.path());
                return;
            }
        }
        throw new SymbolResolutionException(name, String.format(
                "Cannot update '%s': not defined in %s or any enclosing scope", name, scope));
    }
}
