package com.fuzzy.reconciliation.rules;

import com.fuzzy.reconciliation.core.model.DeltaEvent;
import com.fuzzy.reconciliation.core.model.FieldBag;
import com.fuzzy.reconciliation.core.model.FieldValue;
import com.fuzzy.reconciliation.core.model.RecordId;
import com.fuzzy.reconciliation.core.model.Side;
import com.fuzzy.reconciliation.core.model.SourceRecord;
import com.fuzzy.reconciliation.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ingestion boundary: turns raw string fields into a typed {@link FieldBag}.
 *
 * <p>Order of work for each record:</p>
 * <ol>
 *   <li>explicit raw fields are parsed according to their declared kind;</li>
 *   <li>extraction rules fill declared fields that are still absent from free text;</li>
 *   <li>required fields that are still absent are recorded as malformed.</li>
 * </ol>
 * Malformed values never fail ingestion; the record stays active and its pairs score 0.
 */
public class FieldNormalizer {
    private static final Logger log = LoggerFactory.getLogger(FieldNormalizer.class);

    private final Map<Side, FieldSchema> schemas;

    public FieldNormalizer() {
        this(FieldSchema.untyped(), FieldSchema.untyped());
    }

    public FieldNormalizer(FieldSchema leftSchema, FieldSchema rightSchema) {
        this.schemas = new EnumMap<>(Side.class);
        this.schemas.put(Side.LEFT, Objects.requireNonNull(leftSchema, "leftSchema is required"));
        this.schemas.put(Side.RIGHT, Objects.requireNonNull(rightSchema, "rightSchema is required"));
    }

    public FieldSchema schemaFor(Side side) {
        return schemas.get(side);
    }

    public SourceRecord normalize(DeltaEvent event) {
        try (LogContext ctx = LogContext.forRecord(event.side().name(), event.id())) {
            return new SourceRecord(event.side(), RecordId.of(event.id()),
                    normalize(event.side(), event.id(), event.fields()));
        }
    }

    FieldBag normalize(Side side, String id, Map<String, String> rawFields) {
        FieldSchema schema = schemas.get(side);
        FieldBag.Builder bag = FieldBag.builder();

        rawFields.forEach((name, raw) -> {
            if (!raw.isBlank()) {
                bag.put(name, ValueParsers.parse(raw, schema.kindOf(name)));
            }
        });

        for (ExtractionRule rule : schema.extractionRules()) {
            if (bag.has(rule.getTargetField())) {
                continue;
            }
            String source = rawFields.get(rule.getSourceField());
            Optional<String> extracted = rule.extract(source);
            if (extracted.isPresent()) {
                FieldValue value = ValueParsers.parse(extracted.get(), schema.kindOf(rule.getTargetField()));
                bag.put(rule.getTargetField(), value);
                log.debug("Rule '{}' extracted {}={} for {}:{}", rule.getName(),
                        rule.getTargetField(), value, side, id);
            }
        }

        for (FieldSpec spec : schema.fields()) {
            if (spec.required() && !bag.has(spec.name())) {
                log.warn("record.malformed side={} id={} missingField={}", side, id, spec.name());
                bag.put(spec.name(), FieldValue.malformed(""));
            }
        }

        FieldBag result = bag.build();
        if (result.hasMalformed()) {
            log.debug("Record {}:{} carries malformed fields: {}", side, id, result);
        }
        return result;
    }
}
