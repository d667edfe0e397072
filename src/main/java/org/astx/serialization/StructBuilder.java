package org.astx.serialization;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astx.ast.AstNode;

import java.math.BigInteger;
import java.util.List;

/**
 * Collects the content mapping of one node while it describes itself.
 * Insertion order is kept, so the order of calls is the order of keys in JSON and YAML.
 */
public final class StructBuilder {

    private final StructMode mode;
    private final ObjectNode content;

    public StructBuilder(StructMode mode) {
        this.mode = mode;
        this.content = JsonNodeFactory.instance.objectNode();
    }

    public StructMode mode() {
        return mode;
    }

    public StructBuilder child(String key, AstNode node) {
        content.set(key, node.getStruct(mode));
        return this;
    }

    public StructBuilder optionalChild(String key, AstNode node) {
        if (node != null) {
            child(key, node);
        }
        return this;
    }

    public StructBuilder children(String key, List<? extends AstNode> nodes) {
        ArrayNode array = content.putArray(key);
        for (AstNode node : nodes) {
            array.add(node.getStruct(mode));
        }
        return this;
    }

    public StructBuilder attr(String key, String value) {
        content.put(key, value);
        return this;
    }

    public StructBuilder optionalAttr(String key, String value) {
        if (value != null && !value.isEmpty()) {
            content.put(key, value);
        }
        return this;
    }

    public StructBuilder attr(String key, long value) {
        content.put(key, value);
        return this;
    }

    public StructBuilder attr(String key, BigInteger value) {
        content.put(key, value);
        return this;
    }

    public StructBuilder attr(String key, boolean value) {
        content.put(key, value);
        return this;
    }

    /**
     * Non-finite values are written as their text form ("NaN", "Infinity", "-Infinity")
     * since JSON has no literal for them.
     */
    public StructBuilder attr(String key, double value) {
        if (Double.isFinite(value)) {
            content.put(key, value);
        } else {
            content.put(key, Double.toString(value));
        }
        return this;
    }

    public StructBuilder strings(String key, List<String> values) {
        ArrayNode array = content.putArray(key);
        values.forEach(array::add);
        return this;
    }

    /**
     * @return The mapping built so far. Callers must not keep mutating it after the node is done.
     */
    public ObjectNode content() {
        return content;
    }
}
