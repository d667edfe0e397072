package org.astx.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.astx.api.InvalidValueException;
import org.astx.api.MalformedNodeException;
import org.astx.api.TypeMismatchException;
import org.astx.ast.AstNode;
import org.astx.ast.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Rebuilds trees from the export form written by {@link AstExporter}.
 * <p>
 * Every node is rebuilt through its public constructor, so the same validation applies
 * as for hand-built trees. Keys of the visualization form are accepted as well; their
 * identity tokens are ignored and fresh tokens are assigned.
 */
public final class AstImporter {

    private static final Logger LOG = LoggerFactory.getLogger(AstImporter.class);

    private final NodeDecoderRegistry registry;
    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public AstImporter() {
        this(NodeDecoderRegistry.initializeWithDefaults());
    }

    public AstImporter(NodeDecoderRegistry registry) {
        this.registry = registry;
    }

    public AstNode fromJson(String json) {
        return fromStruct(read(jsonMapper, json, "JSON"));
    }

    public AstNode fromYaml(String yaml) {
        return fromStruct(read(yamlMapper, yaml, "YAML"));
    }

    public AstNode fromStruct(JsonNode struct) {
        AstNode node = decode(struct, AstNode.class);
        LOG.debug("Imported {}", node);
        return node;
    }

    /**
     * Decodes a single-entry mapping and checks that the result is of the expected class.
     */
    <T extends AstNode> T decode(JsonNode struct, Class<T> expected) {
        if (struct == null || !struct.isObject() || struct.size() != 1) {
            throw new MalformedNodeException("A node must be a mapping with exactly one key, got: " + struct);
        }
        Map.Entry<String, JsonNode> entry = struct.fields().next();
        String key = entry.getKey();
        ObjectNode content = contentOf(key, entry.getValue());

        AstNode node = registry.resolve(StructKeys.tag(key)).decode(new StructReader(key, content, this));
        applyMetadata(node, content);
        if (!expected.isInstance(node)) {
            throw new TypeMismatchException(String.format(
                    "Expected %s but found %s", expected.getSimpleName(), key));
        }
        return expected.cast(node);
    }

    private static ObjectNode contentOf(String key, JsonNode value) {
        if (value == null || value.isNull()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!value.isObject()) {
            throw new MalformedNodeException("Content of " + key + " must be a mapping");
        }
        return (ObjectNode) value;
    }

    private static void applyMetadata(AstNode node, ObjectNode content) {
        JsonNode loc = content.get("loc");
        if (loc != null && loc.isObject()) {
            node.setLoc(new SourceLocation(loc.path("line").asInt(-1), loc.path("col").asInt(-1)));
        }
        JsonNode comment = content.get("comment");
        if (comment != null && !comment.isNull()) {
            node.setComment(comment.asText());
        }
    }

    private static JsonNode read(ObjectMapper mapper, String text, String format) {
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new InvalidValueException("Malformed " + format + " input: " + e.getOriginalMessage(), e);
        }
    }
}
