package org.astx.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.astx.api.InvalidValueException;

/**
 * Typed view of the {@code astx} configuration tree.
 * <p>
 * Values are read once at construction; a missing or mistyped key fails immediately
 * with {@link InvalidValueException}.
 */
public final class AstxConfig {

    static final String JSON_PRETTY = "astx.export.json.pretty";
    static final String YAML_MINIMIZE_QUOTES = "astx.export.yaml.minimize-quotes";
    static final String TRANSPILER_INDENT = "astx.transpiler.indent";

    private final boolean jsonPretty;
    private final boolean yamlMinimizeQuotes;
    private final String transpilerIndent;

    private AstxConfig(Config config) {
        try {
            this.jsonPretty = config.getBoolean(JSON_PRETTY);
            this.yamlMinimizeQuotes = config.getBoolean(YAML_MINIMIZE_QUOTES);
            this.transpilerIndent = config.getString(TRANSPILER_INDENT);
        } catch (ConfigException e) {
            throw new InvalidValueException("Invalid astx configuration: " + e.getMessage(), e);
        }
        if (transpilerIndent.isEmpty() || !transpilerIndent.chars().allMatch(c -> c == ' ' || c == '\t')) {
            throw new InvalidValueException(
                    TRANSPILER_INDENT + " must be a non-empty run of spaces or tabs, got '" + transpilerIndent + "'");
        }
    }

    /**
     * Reads the settings from an already loaded configuration.
     */
    public static AstxConfig from(Config config) {
        return new AstxConfig(config);
    }

    /**
     * @return The process-wide configuration, loaded through {@link ConfigLoader} on first use.
     */
    public static AstxConfig defaults() {
        return Holder.INSTANCE;
    }

    public boolean jsonPretty() {
        return jsonPretty;
    }

    public boolean yamlMinimizeQuotes() {
        return yamlMinimizeQuotes;
    }

    /**
     * @return The text emitted once per nesting level by code generators.
     */
    public String transpilerIndent() {
        return transpilerIndent;
    }

    private static final class Holder {
        private static final AstxConfig INSTANCE = new AstxConfig(ConfigLoader.load());
    }
}
