package org.astx.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astx.api.InvalidValueException;
import org.astx.api.MalformedNodeException;
import org.astx.api.TypeMismatchException;
import org.astx.ast.AstNode;
import org.astx.ast.types.DataType;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Typed read access to the content of one node during import.
 * Child entries are decoded recursively through the owning {@link AstImporter}.
 */
public final class StructReader {

    private final String key;
    private final ObjectNode content;
    private final AstImporter importer;

    StructReader(String key, ObjectNode content, AstImporter importer) {
        this.key = key;
        this.content = content;
        this.importer = importer;
    }

    /**
     * @return The variant tag of the node being decoded.
     */
    public String tag() {
        return StructKeys.tag(key);
    }

    /**
     * @return The bracketed part of the key, for example {@code "slice"} in {@code SubscriptExpr[slice]}.
     */
    public String keyArgument() {
        return StructKeys.argument(key);
    }

    public boolean has(String field) {
        JsonNode value = content.get(field);
        return value != null && !value.isNull();
    }

    public String string(String field) {
        return required(field).asText();
    }

    public String optionalString(String field) {
        return has(field) ? content.get(field).asText() : null;
    }

    public boolean bool(String field) {
        JsonNode value = required(field);
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        String text = value.asText();
        if ("true".equals(text) || "false".equals(text)) {
            return Boolean.parseBoolean(text);
        }
        throw new InvalidValueException(String.format("%s: '%s' is not a boolean: %s", key, field, text));
    }

    public BigInteger bigInteger(String field) {
        JsonNode value = required(field);
        if (value.isIntegralNumber()) {
            return value.bigIntegerValue();
        }
        try {
            return new BigInteger(value.asText());
        } catch (NumberFormatException e) {
            throw new InvalidValueException(String.format("%s: '%s' is not an integer: %s", key, field, value), e);
        }
    }

    public int intValue(String field) {
        return bigInteger(field).intValueExact();
    }

    /**
     * Accepts numbers as well as the text forms {@code NaN}, {@code Infinity} and {@code -Infinity}.
     */
    public double doubleValue(String field) {
        JsonNode value = required(field);
        if (value.isNumber()) {
            return value.doubleValue();
        }
        try {
            return Double.parseDouble(value.asText());
        } catch (NumberFormatException e) {
            throw new InvalidValueException(String.format("%s: '%s' is not a number: %s", key, field, value), e);
        }
    }

    public <E> E label(String field, Function<String, E> fromLabel) {
        return fromLabel.apply(string(field));
    }

    public <T extends AstNode> T child(String field, Class<T> expected) {
        return importer.decode(required(field), expected);
    }

    public <T extends AstNode> T optionalChild(String field, Class<T> expected) {
        return has(field) ? child(field, expected) : null;
    }

    public DataType type(String field) {
        return child(field, DataType.class);
    }

    /**
     * A missing array reads as empty.
     */
    public <T extends AstNode> List<T> children(String field, Class<T> expected) {
        JsonNode array = content.get(field);
        if (array == null || array.isNull()) {
            return new ArrayList<>();
        }
        if (!array.isArray()) {
            throw new TypeMismatchException(String.format("%s: '%s' must be a sequence", key, field));
        }
        List<T> nodes = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            nodes.add(importer.decode(element, expected));
        }
        return nodes;
    }

    private JsonNode required(String field) {
        JsonNode value = content.get(field);
        if (value == null || value.isNull()) {
            throw new MalformedNodeException(String.format("%s: missing field '%s'", key, field));
        }
        return value;
    }
}
