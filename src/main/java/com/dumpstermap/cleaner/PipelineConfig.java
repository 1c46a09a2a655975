package com.dumpstermap.cleaner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Pipeline configuration: classifier keyword lists, platform domains excluded from domain matching, and
 * website validator settings.
 * <p>
 * Resolution order, later wins:
 * <ol>
 *   <li>bundled {@code pipeline-defaults.json}</li>
 *   <li>JSON file named by {@code LISTING_PIPELINE_CONFIG}; top-level keys replace the defaults, {@code validator} is merged key by key</li>
 *   <li>{@code LISTING_VALIDATOR_CONCURRENCY}, {@code LISTING_PROBE_TIMEOUT_MS}, {@code LISTING_VALIDATE_WEBSITES}</li>
 * </ol>
 * Settings are read from the environment first, then JVM system properties. A scalar override that is not a
 * positive integer is logged and ignored; a non-positive concurrency or timeout coming from a file is rejected.
 * Empty keyword lists are valid and simply disable their rule.
 *
 * @author DumpsterMap Data Team
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineConfig(
    @JsonProperty("big_box_retailers") List<String> bigBoxRetailers,
    @JsonProperty("national_chains") List<String> nationalChains,
    @JsonProperty("junk_removal_brands") List<String> junkRemovalBrands,
    @JsonProperty("non_dumpster_keywords") List<String> nonDumpsterKeywords,
    @JsonProperty("platform_domains") List<String> platformDomains,
    @JsonProperty("validator") ValidatorSettings validator
) {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String DEFAULTS_RESOURCE = "/pipeline-defaults.json";
    public static final String CONFIG_FILE_KEY = "LISTING_PIPELINE_CONFIG";
    public static final String CONCURRENCY_KEY = "LISTING_VALIDATOR_CONCURRENCY";
    public static final String TIMEOUT_KEY = "LISTING_PROBE_TIMEOUT_MS";
    public static final String ENABLED_KEY = "LISTING_VALIDATE_WEBSITES";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Website validator settings.
     *
     * @param enabled     whether the pipeline probes websites at all
     * @param concurrency maximum simultaneous probes
     * @param timeoutMs   per-probe timeout in milliseconds
     * @param userAgent   User-Agent header sent with each probe
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidatorSettings(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("concurrency") int concurrency,
        @JsonProperty("timeout_ms") long timeoutMs,
        @JsonProperty("user_agent") String userAgent
    ) {
        public Duration timeout() {
            return Duration.ofMillis(timeoutMs);
        }
    }

    public PipelineConfig {
        bigBoxRetailers = ClassifierPolicy.clean(bigBoxRetailers);
        nationalChains = ClassifierPolicy.clean(nationalChains);
        junkRemovalBrands = ClassifierPolicy.clean(junkRemovalBrands);
        nonDumpsterKeywords = ClassifierPolicy.clean(nonDumpsterKeywords);
        platformDomains = ClassifierPolicy.clean(platformDomains);
        if (validator == null) validator = new ValidatorSettings(true, 50, 10_000, null);
    }

    public PipelineConfig withValidationEnabled(boolean enabled) {
        ValidatorSettings v = new ValidatorSettings(enabled, validator.concurrency(), validator.timeoutMs(), validator.userAgent());
        return new PipelineConfig(bigBoxRetailers, nationalChains, junkRemovalBrands, nonDumpsterKeywords, platformDomains, v);
    }

    public ClassifierPolicy classifierPolicy() {
        return new ClassifierPolicy(bigBoxRetailers, nationalChains, junkRemovalBrands, nonDumpsterKeywords);
    }

    /**
     * Loads configuration from the process environment and system properties.
     */
    public static PipelineConfig load() {
        return load(Utils::envOrProp);
    }

    /**
     * Loads configuration using the given setting lookup.
     * @param lookup maps a setting name to its value, or null when unset
     * @return resolved configuration
     * @throws UncheckedIOException if the bundled defaults or a named override file cannot be read
     * @throws IllegalArgumentException if the resolved validator concurrency or timeout is not positive
     */
    public static PipelineConfig load(UnaryOperator<String> lookup) {
        ObjectNode tree = readDefaults();

        String overridePath = lookup.apply(CONFIG_FILE_KEY);
        if (!Utils.isBlank(overridePath)) {
            merge(tree, readOverride(Path.of(overridePath.trim())));
        }

        ObjectNode validator = tree.withObject("/validator");
        Long concurrency = positive(lookup, CONCURRENCY_KEY);
        if (concurrency != null) {
            if (concurrency > Integer.MAX_VALUE) {
                logger.warn("Ignoring {}={}: too large", CONCURRENCY_KEY, concurrency);
            } else {
                validator.put("concurrency", concurrency.intValue());
            }
        }
        Long timeout = positive(lookup, TIMEOUT_KEY);
        if (timeout != null) {
            validator.put("timeout_ms", timeout);
        }
        String enabled = lookup.apply(ENABLED_KEY);
        if (!Utils.isBlank(enabled)) {
            validator.put("enabled", Boolean.parseBoolean(enabled.trim()));
        }

        PipelineConfig config;
        try {
            config = MAPPER.treeToValue(tree, PipelineConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid pipeline configuration", e);
        }
        ValidatorSettings v = config.validator();
        if (v.concurrency() <= 0) {
            throw new IllegalArgumentException("Invalid pipeline configuration: validator.concurrency must be positive, got " + v.concurrency());
        }
        if (v.timeoutMs() <= 0) {
            throw new IllegalArgumentException("Invalid pipeline configuration: validator.timeout_ms must be positive, got " + v.timeoutMs());
        }
        logger.info("Loaded pipeline config: {} big-box, {} chain, {} junk, {} non-dumpster keywords; validator enabled={} concurrency={} timeout={}ms",
            config.bigBoxRetailers().size(), config.nationalChains().size(), config.junkRemovalBrands().size(),
            config.nonDumpsterKeywords().size(), v.enabled(), v.concurrency(), v.timeoutMs());
        return config;
    }

    // Scalar override that must be a positive integer; anything else is logged and ignored.
    private static Long positive(UnaryOperator<String> lookup, String key) {
        String raw = lookup.apply(key);
        if (Utils.isBlank(raw)) return null;
        try {
            long value = Long.parseLong(raw.trim());
            if (value > 0) return value;
            logger.warn("Ignoring {}='{}': must be positive", key, raw);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}='{}': not an integer", key, raw);
        }
        return null;
    }

    private static ObjectNode readDefaults() {
        try (InputStream in = PipelineConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) throw new IOException("Missing classpath resource " + DEFAULTS_RESOURCE);
            return (ObjectNode) MAPPER.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read bundled pipeline defaults", e);
        }
    }

    private static JsonNode readOverride(Path path) {
        try {
            logger.info("Applying pipeline config overrides from {}", path);
            return MAPPER.readTree(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read pipeline config override " + path, e);
        }
    }

    private static void merge(ObjectNode target, JsonNode override) {
        if (override == null || !override.isObject()) {
            logger.warn("Pipeline config override is not a JSON object; ignoring it");
            return;
        }
        override.fields().forEachRemaining(entry -> {
            JsonNode current = target.get(entry.getKey());
            if ("validator".equals(entry.getKey()) && current instanceof ObjectNode node && entry.getValue().isObject()) {
                node.setAll((ObjectNode) entry.getValue());
            } else {
                target.set(entry.getKey(), entry.getValue());
            }
        });
    }
}
