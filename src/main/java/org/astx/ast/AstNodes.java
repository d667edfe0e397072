package org.astx.ast;

import org.astx.api.NodeIndexException;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * An ordered, mutable sequence of owned nodes.
 * <p>
 * Appending keeps insertion order and does not deduplicate. Indexed access outside
 * {@code [0, size)} fails with {@link NodeIndexException}; negative indices are not
 * counted from the end.
 *
 * @param <T> The node type the container accepts.
 */
public abstract class AstNodes<T extends AstNode> extends AstNode implements Iterable<T> {

    private final String name;
    private final List<T> nodes = new ArrayList<>();

    protected AstNodes(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    /**
     * Appends a node and makes this container its parent.
     *
     * @return The length after appending.
     */
    public int append(T node) {
        nodes.add(adopt(Objects.requireNonNull(node, "node")));
        return nodes.size();
    }

    /**
     * Inserts a node before {@code index}; {@code index == size()} appends.
     */
    public void insert(int index, T node) {
        if (index < 0 || index > nodes.size()) {
            throw new NodeIndexException(index, nodes.size());
        }
        nodes.add(index, adopt(Objects.requireNonNull(node, "node")));
    }

    public T get(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new NodeIndexException(index, nodes.size());
        }
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * @return A read-only view of the contained nodes.
     */
    public List<T> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    @Override
    public Iterator<T> iterator() {
        return nodes().iterator();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(nodes);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("name", name).children("nodes", nodes);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
