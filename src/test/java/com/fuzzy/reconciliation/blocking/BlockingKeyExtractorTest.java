package com.fuzzy.reconciliation.blocking;

import com.fuzzy.reconciliation.core.model.FieldBag;
import com.fuzzy.reconciliation.core.model.FieldValue;
import com.fuzzy.reconciliation.core.model.Side;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BlockingKeyExtractor Tests")
class BlockingKeyExtractorTest {

    private static FieldBag amount(String value) {
        return FieldBag.builder().put("amount", FieldValue.number(new BigDecimal(value))).build();
    }

    private static FieldBag date(String value) {
        return FieldBag.builder().put("date", FieldValue.date(LocalDate.parse(value))).build();
    }

    private static boolean meet(BlockingKeyExtractor extractor, FieldBag left, FieldBag right) {
        Set<String> probe = new HashSet<>(extractor.probeKeys(Side.LEFT, left));
        probe.retainAll(extractor.indexKeys(Side.RIGHT, right));
        return !probe.isEmpty();
    }

    @Nested
    @DisplayName("Exact value keys")
    class ValueKeys {

        @Test
        void namespacedByExtractor() {
            FieldValueKey extractor = new FieldValueKey("recipient");
            FieldBag fields = FieldBag.builder().text("recipient", "m. perez").build();
            assertEquals(Set.of("recipient:m. perez"), extractor.indexKeys(Side.LEFT, fields));
        }

        @Test
        @DisplayName("Reads a differently named field on each side")
        void sideSpecificFields() {
            FieldValueKey extractor = new FieldValueKey("who", "recipient", "beneficiary");
            FieldBag left = FieldBag.builder().text("recipient", "l. prouse").build();
            FieldBag right = FieldBag.builder().text("beneficiary", "l. prouse").build();

            assertEquals(extractor.indexKeys(Side.LEFT, left), extractor.indexKeys(Side.RIGHT, right));
            assertTrue(extractor.indexKeys(Side.RIGHT, left).isEmpty());
        }

        @Test
        @DisplayName("Missing and malformed values yield no keys")
        void missingAndMalformed() {
            FieldValueKey extractor = new FieldValueKey("recipient");
            assertTrue(extractor.indexKeys(Side.LEFT, FieldBag.empty()).isEmpty());
            FieldBag malformed = FieldBag.builder().put("recipient", FieldValue.malformed("???")).build();
            assertTrue(extractor.probeKeys(Side.LEFT, malformed).isEmpty());
        }
    }

    @Nested
    @DisplayName("Prefix and suffix keys")
    class PrefixSuffix {

        @Test
        void prefixTruncates() {
            PrefixKey extractor = new PrefixKey("recipient", 3);
            assertEquals(Set.of("pfx:c. "), extractor.indexKeys(Side.LEFT,
                    FieldBag.builder().text("recipient", "c. baxter").build()));
            assertEquals(Set.of("pfx:ab"), extractor.indexKeys(Side.LEFT,
                    FieldBag.builder().text("recipient", "ab").build()));
        }

        @Test
        @DisplayName("Account suffix joins IBAN and domestic account numbers")
        void suffixJoinsAccounts() {
            SuffixKey extractor = new SuffixKey("acc", 7);
            FieldBag iban = FieldBag.builder().text("acc", "hu30186000000000000008280573").build();
            FieldBag domestic = FieldBag.builder().text("acc", "00000000008280573").build();

            assertEquals(Set.of("sfx:8280573"), extractor.indexKeys(Side.LEFT, iban));
            assertTrue(meet(extractor, iban, domestic));
        }

        @Test
        void suffixNeedsEnoughDigits() {
            SuffixKey extractor = new SuffixKey("acc", 7);
            assertTrue(extractor.indexKeys(Side.LEFT, FieldBag.builder().text("acc", "12345").build()).isEmpty());
        }

        @Test
        void lengthMustBePositive() {
            assertThrows(IllegalArgumentException.class, () -> new PrefixKey("recipient", 0));
            assertThrows(IllegalArgumentException.class, () -> new SuffixKey("acc", -1));
        }
    }

    @Nested
    @DisplayName("Bucketed keys")
    class Buckets {

        @Test
        void numericIndexesOneBucket() {
            NumericBucketKey extractor = new NumericBucketKey("amount", 10);
            assertEquals(Set.of("num:894"), extractor.indexKeys(Side.LEFT, amount("8946")));
            assertEquals(Set.of("num:893", "num:894", "num:895"), extractor.probeKeys(Side.LEFT, amount("8946")));
        }

        @ParameterizedTest(name = "{0} and {1} meet: {2}")
        @CsvSource({
                "8946, 8941, true",
                "8949, 8950, true",
                "8940, 8959, true",
                "8940, 8960, false",
                "-3, 4, true"
        })
        @DisplayName("Values closer than the bucket width always meet")
        void numericNeighbourBuckets(String left, String right, boolean expected) {
            NumericBucketKey extractor = new NumericBucketKey("amount", 10);
            assertEquals(expected, meet(extractor, amount(left), amount(right)));
        }

        @Test
        void numericIgnoresOtherKinds() {
            NumericBucketKey extractor = new NumericBucketKey("amount", 10);
            assertTrue(extractor.indexKeys(Side.LEFT, FieldBag.builder().text("amount", "8946").build()).isEmpty());
        }

        @Test
        void dateWindows() {
            DateBucketKey extractor = new DateBucketKey("date", 7);
            assertTrue(meet(extractor, date("2015-01-26"), date("2015-01-29")));
            assertTrue(meet(extractor, date("2015-01-26"), date("2015-02-02")));
            assertFalse(meet(extractor, date("2015-01-01"), date("2015-02-01")));
        }

        @Test
        void widthMustBePositive() {
            assertThrows(IllegalArgumentException.class, () -> new NumericBucketKey("amount", 0));
            assertThrows(IllegalArgumentException.class, () -> new DateBucketKey("date", 0));
        }
    }
}
