package com.fuzzy.reconciliation.similarity;

import com.fuzzy.reconciliation.core.model.FieldValue;

/**
 * Jaro-Winkler similarity, boosting values that share a prefix of up to four characters.
 * Suited to short names such as {@code "m. perez"} vs {@code "m perez"}.
 */
public class JaroWinklerComparator implements FieldComparator {

    private static final int PREFIX_CAP = 4;

    private final double prefixScale;

    public JaroWinklerComparator() {
        this(0.1);
    }

    public JaroWinklerComparator(double prefixScale) {
        if (prefixScale < 0 || prefixScale > 0.25) {
            throw new IllegalArgumentException("prefixScale must be between 0 and 0.25");
        }
        this.prefixScale = prefixScale;
    }

    @Override
    public double compare(FieldValue left, FieldValue right) {
        String a = left.asText();
        String b = right.asText();
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        double jaro = jaro(a, b);
        int prefix = 0;
        int limit = Math.min(PREFIX_CAP, Math.min(a.length(), b.length()));
        while (prefix < limit && a.charAt(prefix) == b.charAt(prefix)) {
            prefix++;
        }
        return Math.min(1.0, jaro + prefix * prefixScale * (1.0 - jaro));
    }

    @Override
    public String getName() {
        return "jaro-winkler";
    }

    private static double jaro(String a, String b) {
        int window = Math.max(0, Math.max(a.length(), b.length()) / 2 - 1);
        boolean[] takenA = new boolean[a.length()];
        boolean[] takenB = new boolean[b.length()];

        int common = 0;
        for (int i = 0; i < a.length(); i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(b.length(), i + window + 1);
            for (int j = from; j < to; j++) {
                if (!takenB[j] && a.charAt(i) == b.charAt(j)) {
                    takenA[i] = true;
                    takenB[j] = true;
                    common++;
                    break;
                }
            }
        }
        if (common == 0) {
            return 0.0;
        }

        int halfTranspositions = 0;
        int j = 0;
        for (int i = 0; i < a.length(); i++) {
            if (takenA[i]) {
                while (!takenB[j]) {
                    j++;
                }
                if (a.charAt(i) != b.charAt(j)) {
                    halfTranspositions++;
                }
                j++;
            }
        }
        double m = common;
        return (m / a.length() + m / b.length() + (m - halfTranspositions / 2.0) / m) / 3.0;
    }
}
