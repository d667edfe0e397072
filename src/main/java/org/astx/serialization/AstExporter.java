package org.astx.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.astx.api.InvalidValueException;
import org.astx.ast.AstNode;
import org.astx.config.AstxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes trees as JSON or YAML. Output is always the export form of the structural
 * representation, so it carries source locations and comments and can be read back
 * with {@link AstImporter}.
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class AstExporter {

    private static final Logger LOG = LoggerFactory.getLogger(AstExporter.class);

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public AstExporter(AstxConfig config) {
        this.jsonMapper = new ObjectMapper();
        if (config.jsonPretty()) {
            jsonMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        YAMLFactory yamlFactory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .configure(YAMLGenerator.Feature.MINIMIZE_QUOTES, config.yamlMinimizeQuotes())
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .build();
        this.yamlMapper = new ObjectMapper(yamlFactory);
    }

    /**
     * @return The exporter configured from {@link AstxConfig#defaults()}.
     */
    public static AstExporter defaultExporter() {
        return Holder.INSTANCE;
    }

    public ObjectNode toStruct(AstNode node) {
        return node.getStruct(StructMode.FULL);
    }

    public String toJson(AstNode node) {
        return write(jsonMapper, node, "JSON");
    }

    public String toYaml(AstNode node) {
        return write(yamlMapper, node, "YAML");
    }

    private String write(ObjectMapper mapper, AstNode node, String format) {
        try {
            String text = mapper.writeValueAsString(toStruct(node));
            LOG.trace("Exported {} as {} ({} chars)", node, format, text.length());
            return text;
        } catch (JsonProcessingException e) {
            throw new InvalidValueException("Failed to write " + node + " as " + format, e);
        }
    }

    private static final class Holder {
        private static final AstExporter INSTANCE = new AstExporter(AstxConfig.defaults());
    }
}
