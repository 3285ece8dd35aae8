package org.tessera.compiler.frontend.lexer;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Typed view of the {@code tessera.lexer} configuration block.
 *
 * <pre>
 * tessera.lexer {
 *   default-file-name = "&lt;memory&gt;"
 *   max-source-bytes = 16777216
 *   trace-tokens = false
 * }
 * </pre>
 *
 * @param defaultFileName The logical file name used for sources that do not come from a file.
 * @param maxSourceBytes The largest source accepted by {@link SourceBuffer#read}.
 * @param traceTokens Whether every produced token is logged at TRACE level.
 */
public record LexerOptions(String defaultFileName, long maxSourceBytes, boolean traceTokens) {

    private static final String CONFIG_PATH = "tessera.lexer";

    /**
     * Reads the options from a full application configuration.
     * @param config The resolved configuration containing a {@code tessera.lexer} block.
     * @return The lexer options.
     */
    public static LexerOptions fromConfig(Config config) {
        Config lexer = config.getConfig(CONFIG_PATH);
        long maxBytes = lexer.getBytes("max-source-bytes");
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("tessera.lexer.max-source-bytes must be positive, was " + maxBytes);
        }
        return new LexerOptions(
                lexer.getString("default-file-name"),
                maxBytes,
                lexer.getBoolean("trace-tokens"));
    }

    /**
     * @return The options defined by the bundled {@code reference.conf}.
     */
    public static LexerOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }
}
