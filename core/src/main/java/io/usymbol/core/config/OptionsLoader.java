package io.usymbol.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link ContextOptions} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Expected layout (every key optional, missing keys keep the defaults of
 * {@link ContextOptions#DEFAULT}):
 *
 * <pre>
 * context:
 *   initial-capacity: 4096
 *   max-folded-exponent: 512
 * </pre>
 *
 * <p>
 * {@code USYMBOL_INITIAL_CAPACITY} and {@code USYMBOL_MAX_FOLDED_EXPONENT}
 * override the file. An env var counts as set only if it is defined and
 * non-blank after trimming.
 */
public final class OptionsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(OptionsLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_INITIAL_CAPACITY = "USYMBOL_INITIAL_CAPACITY";
    static final String ENV_MAX_FOLDED_EXPONENT = "USYMBOL_MAX_FOLDED_EXPONENT";

    private OptionsLoader() {
        // utility class
    }

    /**
     * Loads options from {@code path}, applying overrides from {@link System#getenv}.
     *
     * @throws OptionsLoadException if the file is missing, malformed or invalid
     */
    public static ContextOptions load(Path path) {
        return load(path, System::getenv);
    }

    /**
     * Loads options from {@code path}, applying overrides from {@code envLookup}.
     * The lookup returns {@code null} for undefined variables.
     *
     * @throws OptionsLoadException if the file is missing, malformed or invalid
     */
    public static ContextOptions load(Path path, Function<String, String> envLookup) {
        if (!Files.exists(path)) {
            throw new OptionsLoadException("Options file not found: " + path);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(path)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new OptionsLoadException("Failed to parse YAML options: " + path, e);
        }
        ContextOptions options = fromTree(root, envLookup, path.toString());
        LOG.info("Loaded context options from {}: {}", path, options);
        return options;
    }

    /**
     * Builds options from defaults plus environment overrides only.
     *
     * @throws OptionsLoadException if an override is invalid
     */
    public static ContextOptions fromEnvironment(Function<String, String> envLookup) {
        return fromTree(null, envLookup, "environment");
    }

    private static ContextOptions fromTree(JsonNode root, Function<String, String> envLookup, String source) {
        ContextOptions.Builder builder = ContextOptions.builder();
        if (root != null && !root.isMissingNode() && !root.isNull()) {
            JsonNode context = root.path("context");
            yamlInt(context, "initial-capacity", source, builder::initialCapacity);
            yamlInt(context, "max-folded-exponent", source, builder::maxFoldedExponent);
        }

        List<String> overridden = new ArrayList<>();
        envInt(envLookup, ENV_INITIAL_CAPACITY, overridden, builder::initialCapacity);
        envInt(envLookup, ENV_MAX_FOLDED_EXPONENT, overridden, builder::maxFoldedExponent);
        if (!overridden.isEmpty()) {
            LOG.info("Context options overridden from environment: {}", overridden);
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new OptionsLoadException("Invalid context options from " + source + ": " + e.getMessage(), e);
        }
    }

    // --- YAML helpers ---

    private static void yamlInt(JsonNode node, String field, String source, IntConsumer setter) {
        if (!node.has(field)) {
            return;
        }
        JsonNode value = node.get(field);
        if (!value.canConvertToInt()) {
            throw new OptionsLoadException(
                    "Option 'context." + field + "' in " + source + " must be an integer, got: " + value);
        }
        setter.accept(value.asInt());
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envInt(
            Function<String, String> envLookup, String envVar, List<String> overridden, IntConsumer setter) {
        if (!isSet(envLookup, envVar)) {
            return;
        }
        String raw = envLookup.apply(envVar).trim();
        try {
            setter.accept(Integer.parseInt(raw));
        } catch (NumberFormatException e) {
            throw new OptionsLoadException("Environment variable " + envVar + " must be an integer, got: " + raw, e);
        }
        overridden.add(envVar);
    }
}
