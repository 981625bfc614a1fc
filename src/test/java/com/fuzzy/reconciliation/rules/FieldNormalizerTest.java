package com.fuzzy.reconciliation.rules;

import com.fuzzy.reconciliation.core.model.DeltaEvent;
import com.fuzzy.reconciliation.core.model.FieldBag;
import com.fuzzy.reconciliation.core.model.FieldKind;
import com.fuzzy.reconciliation.core.model.FieldValue;
import com.fuzzy.reconciliation.core.model.RecordId;
import com.fuzzy.reconciliation.core.model.Side;
import com.fuzzy.reconciliation.core.model.SourceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldNormalizerTest {

    private FieldNormalizer normalizer;

    @BeforeEach
    void setUp() {
        FieldSchema left = FieldSchema.builder()
                .requiredField("amount", FieldKind.NUMBER)
                .field("date", FieldKind.DATE)
                .build();
        FieldSchema right = FieldSchema.builder()
                .requiredField("amount", FieldKind.NUMBER)
                .field("date", FieldKind.DATE)
                .extract(ExtractionRule.builder()
                        .name("labelled-amount")
                        .sourceField("description")
                        .pattern("amount\\s*(?:eur)?\\s*(\\d[\\d_.,]*)")
                        .targetField("amount")
                        .build())
                .extract(ExtractionRule.builder()
                        .name("any-amount")
                        .sourceField("description")
                        .pattern("(\\d[\\d_.,]*)\\s*eur")
                        .targetField("amount")
                        .priority(200)
                        .build())
                .extract(ExtractionRule.builder()
                        .name("iso-date")
                        .sourceField("description")
                        .pattern("(\\d{4}-\\d{2}-\\d{2})")
                        .targetField("date")
                        .build())
                .extract(ExtractionRule.builder()
                        .name("bracketed-recipient")
                        .sourceField("description")
                        .pattern("\\(([^)]+)\\)")
                        .targetField("recipient")
                        .build())
                .build();
        normalizer = new FieldNormalizer(left, right);
    }

    @Test
    @DisplayName("Declared fields are parsed to their kind; undeclared fields stay text")
    void parsesDeclaredKinds() {
        SourceRecord record = normalizer.normalize(DeltaEvent.insert(Side.LEFT, "0",
                Map.of("amount", "8,946.00", "date", "2020-06-04", "recipient", "M. Perez")));

        FieldBag fields = record.fields();
        assertEquals(RecordId.of(0), record.id());
        assertEquals(FieldValue.number(new BigDecimal("8946")), fields.get("amount").orElseThrow());
        assertEquals(FieldValue.date(LocalDate.of(2020, 6, 4)), fields.get("date").orElseThrow());
        assertEquals(FieldValue.text("m. perez"), fields.get("recipient").orElseThrow());
        assertFalse(fields.hasMalformed());
    }

    @Test
    @DisplayName("Extraction rules pull typed fields out of free text")
    void extractsFromFreeText() {
        SourceRecord record = normalizer.normalize(DeltaEvent.insert(Side.RIGHT, "1", Map.of("description",
                "EUR 8944 on 2020-06-06 by INTERNATIONAL transfer credited to 00000000008280573 (M. Perez) "
                        + "by BNP Paribas Securities Services, fee EUR 2, amount EUR 8946.")));

        FieldBag fields = record.fields();
        assertEquals(FieldValue.number(new BigDecimal("8946")), fields.get("amount").orElseThrow());
        assertEquals(FieldValue.date(LocalDate.of(2020, 6, 6)), fields.get("date").orElseThrow());
        assertEquals(FieldValue.text("m. perez"), fields.get("recipient").orElseThrow());
    }

    @Test
    @DisplayName("Lower-priority rule is used when the preferred one does not match")
    void fallsBackToLowerPriorityRule() {
        SourceRecord record = normalizer.normalize(DeltaEvent.insert(Side.RIGHT, "0",
                Map.of("description", "Received 8521 EUR on 2014-08-07, amount EUR unknown")));

        assertEquals(FieldValue.number(new BigDecimal("8521")), record.fields().get("amount").orElseThrow());
    }

    @Test
    @DisplayName("Explicit fields take precedence over extracted ones")
    void explicitFieldWins() {
        SourceRecord record = normalizer.normalize(DeltaEvent.insert(Side.RIGHT, "2",
                Map.of("amount", "100", "description", "amount EUR 999")));

        assertEquals(FieldValue.number(new BigDecimal("100")), record.fields().get("amount").orElseThrow());
    }

    @Test
    @DisplayName("Missing required field becomes malformed, record still normalizes")
    void missingRequiredFieldIsMalformed() {
        SourceRecord record = normalizer.normalize(DeltaEvent.insert(Side.LEFT, "3", Map.of("date", "2020-01-01")));

        assertTrue(record.fields().hasMalformed());
        assertTrue(record.fields().get("amount").orElseThrow().isMalformed());
    }

    @Test
    void unparseableValueIsMalformed() {
        SourceRecord record = normalizer.normalize(DeltaEvent.insert(Side.LEFT, "4",
                Map.of("amount", "lots", "date", "yesterday")));

        assertTrue(record.fields().get("amount").orElseThrow().isMalformed());
        assertTrue(record.fields().get("date").orElseThrow().isMalformed());
    }

    @Test
    void blankValuesAreTreatedAsAbsent() {
        SourceRecord record = normalizer.normalize(DeltaEvent.insert(Side.LEFT, "5",
                Map.of("amount", "10", "recipient", "   ")));

        assertFalse(record.fields().has("recipient"));
    }

    @Test
    void untypedNormalizerKeepsEverythingAsText() {
        SourceRecord record = new FieldNormalizer().normalize(DeltaEvent.insert(Side.LEFT, "6",
                Map.of("amount", "8946")));

        assertEquals(FieldKind.TEXT, record.fields().get("amount").orElseThrow().kind());
    }
}
