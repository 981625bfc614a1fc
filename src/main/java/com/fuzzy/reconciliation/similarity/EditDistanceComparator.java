package com.fuzzy.reconciliation.similarity;

import com.fuzzy.reconciliation.core.model.FieldValue;

/**
 * Levenshtein similarity: {@code 1 - distance / max(len(a), len(b))}.
 * Values are compared in their canonical text form.
 */
public class EditDistanceComparator implements FieldComparator {

    @Override
    public double compare(FieldValue left, FieldValue right) {
        return similarity(left.asText(), right.asText());
    }

    @Override
    public String getName() {
        return "edit-distance";
    }

    static double similarity(String a, String b) {
        if (a.equals(b)) {
            return 1.0;
        }
        int longest = Math.max(a.length(), b.length());
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        return 1.0 - (double) distance(a, b) / longest;
    }

    /**
     * Wagner-Fischer with two rolling rows sized to the shorter input.
     */
    static int distance(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;

        int[] above = new int[shorter.length() + 1];
        int[] row = new int[shorter.length() + 1];
        for (int i = 0; i < above.length; i++) {
            above[i] = i;
        }
        for (int j = 1; j <= longer.length(); j++) {
            row[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= shorter.length(); i++) {
                int substitution = above[i - 1] + (shorter.charAt(i - 1) == c ? 0 : 1);
                row[i] = Math.min(substitution, Math.min(row[i - 1], above[i]) + 1);
            }
            int[] swap = above;
            above = row;
            row = swap;
        }
        return above[shorter.length()];
    }
}
