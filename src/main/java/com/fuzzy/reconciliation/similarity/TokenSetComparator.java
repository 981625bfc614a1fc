package com.fuzzy.reconciliation.similarity;

import com.fuzzy.reconciliation.core.model.FieldValue;

import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Jaccard overlap of word tokens: {@code |A ∩ B| / |A ∪ B|}.
 * Punctuation splits tokens, so {@code "m. perez"} and {@code "perez m"} score 1.0.
 */
public class TokenSetComparator implements FieldComparator {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\p{Punct}]+");

    @Override
    public double compare(FieldValue left, FieldValue right) {
        Set<String> a = tokens(left.asText());
        Set<String> b = tokens(right.asText());
        if (a.isEmpty() || b.isEmpty()) {
            return a.isEmpty() && b.isEmpty() ? 1.0 : 0.0;
        }
        int shared = 0;
        for (String token : a) {
            if (b.contains(token)) {
                shared++;
            }
        }
        return (double) shared / (a.size() + b.size() - shared);
    }

    @Override
    public String getName() {
        return "token-set";
    }

    static Set<String> tokens(String text) {
        Set<String> tokens = new TreeSet<>();
        for (String token : SEPARATORS.split(text)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
