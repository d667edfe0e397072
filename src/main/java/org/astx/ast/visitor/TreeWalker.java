package org.astx.ast.visitor;

import org.astx.ast.AstNode;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing an Abstract Syntax Tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * so that passes which only care about a few variants stay decoupled from the full
 * node taxonomy.
 * <p>
 * Handlers are looked up by the exact runtime class of a node. An enter handler runs
 * before the node's children are walked, an exit handler after them, which lets a pass
 * open and close scopes around a subtree.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> enterHandlers;
    private final Map<Class<? extends AstNode>, Consumer<AstNode>> exitHandlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this(handlers, Map.of());
    }

    /**
     * Constructs a new TreeWalker with handlers for entering and leaving nodes.
     * @param enterHandlers Handlers run before a node's children.
     * @param exitHandlers Handlers run after a node's children.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> enterHandlers,
                      Map<Class<? extends AstNode>, Consumer<AstNode>> exitHandlers) {
        this.enterHandlers = new HashMap<>(enterHandlers);
        this.exitHandlers = new HashMap<>(exitHandlers);
    }

    /**
     * Walks a list of AST nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single AST node and its children recursively, depth first in child order.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        Consumer<AstNode> enter = enterHandlers.get(node.getClass());
        if (enter != null) {
            enter.accept(node);
        }

        // Descend into all children without knowing their type.
        for (AstNode child : node.getChildren()) {
            walk(child);
        }

        Consumer<AstNode> exit = exitHandlers.get(node.getClass());
        if (exit != null) {
            exit.accept(node);
        }
    }
}
