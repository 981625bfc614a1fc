package com.fuzzy.reconciliation.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fuzzy.reconciliation.api.ReconciliationEngine;
import com.fuzzy.reconciliation.api.ReconciliationOptions;
import com.fuzzy.reconciliation.blocking.BlockingKeyExtractor;
import com.fuzzy.reconciliation.blocking.DateBucketKey;
import com.fuzzy.reconciliation.blocking.FieldValueKey;
import com.fuzzy.reconciliation.blocking.NumericBucketKey;
import com.fuzzy.reconciliation.blocking.PrefixKey;
import com.fuzzy.reconciliation.blocking.SuffixKey;
import com.fuzzy.reconciliation.cache.CacheConfig;
import com.fuzzy.reconciliation.core.model.FieldKind;
import com.fuzzy.reconciliation.rules.ExtractionRule;
import com.fuzzy.reconciliation.rules.FieldSchema;
import com.fuzzy.reconciliation.rules.FieldSpec;
import com.fuzzy.reconciliation.similarity.AggregationMode;
import com.fuzzy.reconciliation.similarity.Comparators;
import com.fuzzy.reconciliation.similarity.FieldRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Reads a JSON reconciliation configuration into a ready {@link ReconciliationEngine.Builder}.
 *
 * <p>Document layout:</p>
 * <pre>
 * {
 *   "options":     { "threshold": 0.5, "maxCandidatesPerRecord": 50, ..., "cache": { ... } },
 *   "aggregation": "WEIGHTED_AVERAGE" | "MIN_OVER_REQUIRED",
 *   "left":        { "fields": [ {name, kind, required} ], "extract": [ {name, sourceField, pattern, group, targetField, priority} ] },
 *   "right":       { ... },
 *   "blocking":    [ {type: value|prefix|suffix|numeric|date, field | leftField + rightField, name, width, days, length} ],
 *   "scoring":     [ {field | leftField + rightField, comparator, parameter, weight, required, missingScore} ]
 * }
 * </pre>
 * Sinks, metrics and custom scorers are not part of the document; add them to the returned builder.
 */
public class ReconciliationConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationConfigLoader.class);

    /** Classpath resource holding the bank-transaction configuration. */
    public static final String TRANSACTION_DEFAULTS_RESOURCE = "/transaction-reconciliation.json";

    private final ObjectMapper objectMapper;

    public ReconciliationConfigLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Builder for reconciling structured bank-feed rows (left: {@code amount}, {@code date},
     * {@code recipient}, {@code recipient_acc_no}) against free-text transaction descriptions
     * (right: {@code description}).
     */
    public static ReconciliationEngine.Builder transactionDefaults() {
        try {
            return new ReconciliationConfigLoader().loadResource(TRANSACTION_DEFAULTS_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + TRANSACTION_DEFAULTS_RESOURCE, e);
        }
    }

    public ReconciliationEngine.Builder load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public ReconciliationEngine.Builder loadResource(String resource) throws IOException {
        try (InputStream in = ReconciliationConfigLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Configuration resource not found: " + resource);
            }
            return load(in);
        }
    }

    public ReconciliationEngine.Builder load(InputStream in) throws IOException {
        return toBuilder(objectMapper.readValue(in, ConfigDocument.class));
    }

    public ReconciliationEngine.Builder fromJson(String json) {
        try {
            return toBuilder(objectMapper.readValue(json, ConfigDocument.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid reconciliation configuration: " + e.getOriginalMessage(), e);
        }
    }

    private ReconciliationEngine.Builder toBuilder(ConfigDocument doc) {
        if (doc.blocking() == null || doc.blocking().isEmpty()) {
            throw new IllegalArgumentException("Configuration must declare at least one blocking extractor");
        }
        if (doc.scoring() == null || doc.scoring().isEmpty()) {
            throw new IllegalArgumentException("Configuration must declare at least one scoring rule");
        }

        ReconciliationEngine.Builder builder = ReconciliationEngine.builder()
                .options(toOptions(doc.options()))
                .leftSchema(toSchema(doc.left()))
                .rightSchema(toSchema(doc.right()));
        if (doc.aggregation() != null) {
            builder.aggregationMode(AggregationMode.valueOf(doc.aggregation().toUpperCase(Locale.ROOT)));
        }
        for (BlockingConfig blocking : doc.blocking()) {
            builder.blocking(toExtractor(blocking));
        }
        for (ScoringConfig scoring : doc.scoring()) {
            builder.fieldRule(toRule(scoring));
        }
        log.info("Loaded reconciliation configuration: {} blocking extractors, {} scoring rules",
                doc.blocking().size(), doc.scoring().size());
        return builder;
    }

    private static ReconciliationOptions toOptions(OptionsConfig config) {
        ReconciliationOptions.Builder options = ReconciliationOptions.builder();
        if (config == null) {
            return options.build();
        }
        if (config.threshold() != null) {
            options.threshold(config.threshold());
        }
        if (config.maxCandidatesPerRecord() != null) {
            options.maxCandidatesPerRecord(config.maxCandidatesPerRecord());
        }
        if (config.scoringThreads() != null) {
            options.scoringThreads(config.scoringThreads());
        }
        if (config.verifyFullStateEachBatch() != null) {
            options.verifyFullStateEachBatch(config.verifyFullStateEachBatch());
        }
        if (config.maxBatchSize() != null) {
            options.maxBatchSize(config.maxBatchSize());
        }
        if (config.asyncTimeoutMs() != null) {
            options.asyncTimeoutMs(config.asyncTimeoutMs());
        }
        if (config.cache() != null) {
            CacheConfig defaults = CacheConfig.defaults();
            CacheSettings cache = config.cache();
            options.cacheConfig(new CacheConfig(
                    cache.maxSize() != null ? cache.maxSize() : defaults.maxSize(),
                    cache.ttlSeconds() != null ? cache.ttlSeconds() : defaults.ttlSeconds(),
                    cache.enabled() == null || cache.enabled()));
        }
        return options.build();
    }

    private static FieldSchema toSchema(SchemaConfig config) {
        FieldSchema.Builder schema = FieldSchema.builder();
        if (config == null) {
            return schema.build();
        }
        if (config.fields() != null) {
            for (FieldConfig field : config.fields()) {
                FieldKind kind = field.kind() != null
                        ? FieldKind.valueOf(field.kind().toUpperCase(Locale.ROOT)) : FieldKind.TEXT;
                schema.field(new FieldSpec(field.name(), kind, Boolean.TRUE.equals(field.required())));
            }
        }
        if (config.extract() != null) {
            for (ExtractConfig extract : config.extract()) {
                ExtractionRule.Builder rule = ExtractionRule.builder()
                        .name(extract.name())
                        .sourceField(extract.sourceField())
                        .pattern(extract.pattern())
                        .targetField(extract.targetField());
                if (extract.group() != null) {
                    rule.group(extract.group());
                }
                if (extract.priority() != null) {
                    rule.priority(extract.priority());
                }
                schema.extract(rule.build());
            }
        }
        return schema.build();
    }

    private static BlockingKeyExtractor toExtractor(BlockingConfig config) {
        if (config.type() == null) {
            throw new IllegalArgumentException("Blocking extractor type is required");
        }
        String leftField = firstNonNull(config.leftField(), config.field(), "leftField");
        String rightField = firstNonNull(config.rightField(), config.field(), "rightField");
        String type = config.type().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "value" -> new FieldValueKey(
                    config.name() != null ? config.name() : leftField, leftField, rightField);
            case "prefix" -> new PrefixKey(
                    config.name() != null ? config.name() : "pfx", leftField, rightField,
                    required(config.length(), type, "length"));
            case "suffix" -> new SuffixKey(
                    config.name() != null ? config.name() : "sfx", leftField, rightField,
                    required(config.length(), type, "length"));
            case "numeric" -> new NumericBucketKey(
                    config.name() != null ? config.name() : "num", leftField, rightField,
                    required(config.width(), type, "width"));
            case "date" -> new DateBucketKey(
                    config.name() != null ? config.name() : "date", leftField, rightField,
                    required(config.days(), type, "days"));
            default -> throw new IllegalArgumentException("Unknown blocking extractor type: " + config.type());
        };
    }

    private static FieldRule toRule(ScoringConfig config) {
        if (config.comparator() == null) {
            throw new IllegalArgumentException("Scoring rule comparator is required");
        }
        String leftField = firstNonNull(config.leftField(), config.field(), "leftField");
        String rightField = firstNonNull(config.rightField(), config.field(), "rightField");
        return new FieldRule(
                leftField,
                rightField,
                Comparators.byName(config.comparator(), config.parameter() != null ? config.parameter() : 0.0),
                config.weight() != null ? config.weight() : 1.0,
                Boolean.TRUE.equals(config.required()),
                config.missingScore() != null ? config.missingScore() : 0.0);
    }

    private static String firstNonNull(String specific, String shared, String what) {
        if (specific != null) {
            return specific;
        }
        if (shared != null) {
            return shared;
        }
        throw new IllegalArgumentException("Either '" + what + "' or 'field' is required");
    }

    private static <T> T required(T value, String type, String property) {
        if (value == null) {
            throw new IllegalArgumentException("'" + property + "' is required for " + type + " blocking");
        }
        return value;
    }

    // Configuration DTOs

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConfigDocument(
            OptionsConfig options,
            String aggregation,
            SchemaConfig left,
            SchemaConfig right,
            List<BlockingConfig> blocking,
            List<ScoringConfig> scoring
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OptionsConfig(
            Double threshold,
            Integer maxCandidatesPerRecord,
            Integer scoringThreads,
            Boolean verifyFullStateEachBatch,
            Integer maxBatchSize,
            Long asyncTimeoutMs,
            CacheSettings cache
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CacheSettings(Integer maxSize, Integer ttlSeconds, Boolean enabled) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SchemaConfig(List<FieldConfig> fields, List<ExtractConfig> extract) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FieldConfig(String name, String kind, Boolean required) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExtractConfig(
            String name,
            String sourceField,
            String pattern,
            Integer group,
            String targetField,
            Integer priority
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BlockingConfig(
            String type,
            String name,
            String field,
            String leftField,
            String rightField,
            Double width,
            Integer days,
            Integer length
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ScoringConfig(
            String field,
            String leftField,
            String rightField,
            String comparator,
            Double parameter,
            Double weight,
            Boolean required,
            Double missingScore
    ) {}
}
