package org.astx.config;

import com.typesafe.config.ConfigFactory;
import org.astx.api.InvalidValueException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AstxConfigTest {

    private static AstxConfig parse(String hocon) {
        return AstxConfig.from(ConfigFactory.parseString(hocon).withFallback(ConfigFactory.defaultReference()));
    }

    @Test
    @Tag("unit")
    void testReferenceDefaults() {
        AstxConfig config = parse("");

        assertThat(config.jsonPretty()).isTrue();
        assertThat(config.yamlMinimizeQuotes()).isTrue();
        assertThat(config.transpilerIndent()).isEqualTo("    ");
    }

    @Test
    @Tag("unit")
    void testIndentMustBeWhitespace() {
        assertThatThrownBy(() -> parse("astx.transpiler.indent = \"--\""))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining(AstxConfig.TRANSPILER_INDENT);
        assertThatThrownBy(() -> parse("astx.transpiler.indent = \"\""))
                .isInstanceOf(InvalidValueException.class);
    }

    @Test
    @Tag("unit")
    void testWrongValueTypeIsReported() {
        assertThatThrownBy(() -> parse("astx.export.json.pretty = sometimes"))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("pretty");
        assertThatThrownBy(() -> AstxConfig.from(ConfigFactory.empty()))
                .isInstanceOf(InvalidValueException.class);
    }
}
