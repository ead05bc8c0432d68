package io.github.irctext.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.irctext.layout.AlignedTable;
import io.github.irctext.marker.ControlCode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Transport and layout defaults.
 *
 * <p>Values come from the built-in defaults, overlaid by the classpath resource {@value #RESOURCE} and then by the
 * JSON file named in the {@value #PATH_PROPERTY} system property. Later sources only need to name the keys they
 * change.
 *
 * @param maxLineLength longest outgoing line, in codepoints
 * @param encoding charset used to measure lines in bytes
 * @param tableColor border color index for grid tables
 * @param justifyMinSeparator minimum gap between justified items
 * @param alignSeparator divider between aligned columns
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FormatterConfig(
        int maxLineLength, String encoding, int tableColor, int justifyMinSeparator, String alignSeparator) {
    private static final Logger logger = LogManager.getLogger(FormatterConfig.class);

    public static final String RESOURCE = "irctext.json";
    public static final String PATH_PROPERTY = "irctext.config";

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final FormatterConfig DEFAULTS =
            new FormatterConfig(512, "UTF-8", 12, 3, AlignedTable.DEFAULT_SEPARATOR);

    public FormatterConfig {
        Objects.requireNonNull(encoding, "encoding");
        Objects.requireNonNull(alignSeparator, "alignSeparator");
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
        if (tableColor < 0 || tableColor > ControlCode.MAX_COLOR) {
            throw new IllegalArgumentException(
                    "tableColor must be within 0.." + ControlCode.MAX_COLOR + ": " + tableColor);
        }
        if (justifyMinSeparator < 0) {
            throw new IllegalArgumentException("justifyMinSeparator must not be negative: " + justifyMinSeparator);
        }
        try {
            Charset.forName(encoding);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new IllegalArgumentException("Unknown encoding: " + encoding, e);
        }
    }

    public static FormatterConfig defaults() {
        return DEFAULTS;
    }

    @JsonIgnore
    public Charset charset() {
        return Charset.forName(encoding);
    }

    /** Defaults, then the classpath resource, then the file named by the system property. */
    public static FormatterConfig load() {
        ObjectNode merged = objectMapper.valueToTree(DEFAULTS);
        try (InputStream in = FormatterConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                overlay(merged, objectMapper.readTree(in));
            }
        } catch (IOException e) {
            logger.warn("Could not read {} from classpath: {}. Using built-in defaults.", RESOURCE, e.getMessage());
        }

        String override = System.getProperty(PATH_PROPERTY);
        if (override != null && !override.isBlank()) {
            readOverride(Path.of(override), merged);
        }
        return fromTree(merged);
    }

    /** Built-in defaults overlaid by {@code file}; an unreadable file leaves the defaults in place. */
    public static FormatterConfig load(Path file) {
        ObjectNode merged = objectMapper.valueToTree(DEFAULTS);
        readOverride(file, merged);
        return fromTree(merged);
    }

    private static void readOverride(Path file, ObjectNode merged) {
        try {
            overlay(merged, objectMapper.readTree(Files.readString(file)));
            logger.debug("Loaded formatter configuration overrides from {}", file);
        } catch (IOException e) {
            logger.warn("Could not read formatter configuration {}: {}. Ignoring it.", file, e.getMessage());
        }
    }

    private static void overlay(ObjectNode target, @Nullable JsonNode source) {
        if (source == null || !source.isObject()) {
            logger.warn("Ignoring formatter configuration that is not a JSON object");
            return;
        }
        target.setAll((ObjectNode) source);
    }

    private static FormatterConfig fromTree(ObjectNode tree) {
        try {
            return objectMapper.treeToValue(tree, FormatterConfig.class);
        } catch (ValueInstantiationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalArgumentException("Invalid formatter configuration: " + cause.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid formatter configuration: " + e.getOriginalMessage(), e);
        }
    }
}
