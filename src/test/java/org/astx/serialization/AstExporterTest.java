package org.astx.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.ConfigFactory;
import org.astx.ast.Block;
import org.astx.ast.SourceLocation;
import org.astx.ast.flows.IfStmt;
import org.astx.ast.literals.LiteralBoolean;
import org.astx.ast.literals.LiteralFloat64;
import org.astx.ast.literals.LiteralInt32;
import org.astx.ast.variables.VariableAssignment;
import org.astx.config.AstxConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the structural export forms.
 */
public class AstExporterTest {

    private static IfStmt sample() {
        Block then = new Block("then");
        then.append(new VariableAssignment("x", new LiteralInt32(1)));
        IfStmt stmt = new IfStmt(new LiteralBoolean(true), then);
        stmt.setLoc(new SourceLocation(3, 5));
        stmt.setComment("guard");
        return stmt;
    }

    @Test
    @Tag("unit")
    void testFullStructCarriesMetadata() {
        ObjectNode struct = AstExporter.defaultExporter().toStruct(sample());

        JsonNode content = struct.get("IfStmt");
        assertThat(struct.size()).isEqualTo(1);
        assertThat(content.path("loc").path("line").asInt()).isEqualTo(3);
        assertThat(content.path("loc").path("col").asInt()).isEqualTo(5);
        assertThat(content.path("comment").asText()).isEqualTo("guard");
        assertThat(content.path("then-block").has("Block[then]")).isTrue();
        assertThat(content.has("else-block")).isFalse();
        assertThat(content.path("then-block").path("Block[then]").has("loc")).isFalse();
    }

    @Test
    @Tag("unit")
    void testJsonPreservesKeyOrder() throws Exception {
        String json = AstExporter.defaultExporter().toJson(sample());

        assertThat(json).contains("\n").containsSubsequence("\"condition\"", "\"then-block\"", "\"loc\"", "\"comment\"");
        assertThat(new ObjectMapper().readTree(json).toString()).isEqualTo(sample().getStruct(false).toString());
    }

    @Test
    @Tag("unit")
    void testCompactJsonAndYaml() {
        AstxConfig compact = AstxConfig.from(ConfigFactory.parseString("astx.export.json.pretty = false")
                .withFallback(ConfigFactory.defaultReference()));
        AstExporter exporter = new AstExporter(compact);

        assertThat(exporter.toJson(new LiteralFloat64(Double.NaN)))
                .isEqualTo("{\"LiteralFloat64[NaN]\":{\"value\":\"NaN\"}}");
        assertThat(exporter.toYaml(new LiteralInt32(7)))
                .contains("LiteralInt32[7]")
                .contains("value: 7")
                .doesNotContain("---");
    }
}
