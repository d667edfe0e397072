package org.astx.ast;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.AstExporter;
import org.astx.serialization.StructBuilder;
import org.astx.serialization.StructMode;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The base class for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * A node has an identity token that is assigned once at construction, an optional
 * source location and comment, and a non-owning link to the node that adopted it.
 * Ownership is strictly top-down: a parent holds its children, a child only remembers
 * its parent through a weak reference.
 * <p>
 * Equality is structural. Two nodes are equal when their {@link StructMode#SEMANTIC}
 * representations are equal, which ignores identity tokens, locations and comments.
 * Mutable containers therefore should not be used as hash keys while they change.
 */
public abstract class AstNode {

    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final long id = NEXT_ID.getAndIncrement();
    private SourceLocation loc = SourceLocation.NONE;
    private String comment = "";
    private WeakReference<AstNode> parent;

    /**
     * @return The identity token of this node, unique for the lifetime of the JVM.
     */
    public final long id() {
        return id;
    }

    /**
     * @return The variant tag of this node.
     */
    public abstract AstKind kind();

    public SourceLocation loc() {
        return loc;
    }

    public void setLoc(SourceLocation loc) {
        this.loc = Objects.requireNonNull(loc, "loc");
    }

    public String comment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment == null ? "" : comment;
    }

    /**
     * @return The node that adopted this one, if it is still reachable.
     */
    public Optional<AstNode> getParent() {
        return parent == null ? Optional.empty() : Optional.ofNullable(parent.get());
    }

    /**
     * Records this node as the parent of {@code child}. Null children are passed through.
     */
    protected final <T extends AstNode> T adopt(T child) {
        if (child != null) {
            ((AstNode) child).parent = new WeakReference<>(this);
        }
        return child;
    }

    protected final <T extends AstNode> List<T> adoptAll(List<? extends T> children) {
        List<T> adopted = new ArrayList<>(children.size());
        for (T child : children) {
            adopted.add(adopt(Objects.requireNonNull(child, "child")));
        }
        return Collections.unmodifiableList(adopted);
    }

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     * Type descriptors are not children; they describe a node rather than being owned by it.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Double-dispatch entry point: calls the visitor method for this node's variant.
     */
    public abstract <R> R accept(AstVisitor<R> visitor);

    /**
     * Produces the canonical structural representation.
     *
     * @param simplified {@code true} for the visualization form (identity token in every key),
     *                   {@code false} for the export form.
     * @return A single-entry mapping from this node's key to its content.
     */
    public final ObjectNode getStruct(boolean simplified) {
        return getStruct(simplified ? StructMode.SIMPLIFIED : StructMode.FULL);
    }

    public final ObjectNode getStruct(StructMode mode) {
        StructBuilder content = new StructBuilder(mode);
        buildStruct(content);
        if (mode == StructMode.FULL) {
            if (loc.isKnown()) {
                ObjectNode location = content.content().putObject("loc");
                location.put("line", loc.line());
                location.put("col", loc.col());
            }
            content.optionalAttr("comment", comment);
        }
        ObjectNode struct = JsonNodeFactory.instance.objectNode();
        struct.set(structKey(mode), content.content());
        return struct;
    }

    /**
     * @return The mapping key of this node in the given form.
     */
    public final String structKey(StructMode mode) {
        return mode == StructMode.SIMPLIFIED ? this + "#" + id : toString();
    }

    /**
     * Describes the semantic sub-nodes and scalar attributes of this node.
     * Child keys are lowercase and hyphen-separated.
     */
    protected abstract void buildStruct(StructBuilder struct);

    public String toJson() {
        return AstExporter.defaultExporter().toJson(this);
    }

    public String toYaml() {
        return AstExporter.defaultExporter().toYaml(this);
    }

    /**
     * @return The human-readable tag: class name plus bracketed non-child attributes.
     */
    @Override
    public abstract String toString();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return getStruct(StructMode.SEMANTIC).equals(((AstNode) o).getStruct(StructMode.SEMANTIC));
    }

    @Override
    public int hashCode() {
        return getStruct(StructMode.SEMANTIC).hashCode();
    }
}
