package com.property.distress.similarity;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Word-order-independent similarity: both strings are split into tokens, sorted and re-joined
 * before the delegate compares them. "SMITH JOHN" and "JOHN SMITH" score 1.0.
 */
public class TokenSortSimilarity implements SimilarityAlgorithm {

    private final SimilarityAlgorithm delegate;

    public TokenSortSimilarity() {
        this(new LevenshteinSimilarity());
    }

    public TokenSortSimilarity(SimilarityAlgorithm delegate) {
        this.delegate = delegate;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return delegate.compute(sortedTokens(s1), sortedTokens(s2));
    }

    @Override
    public String getName() {
        return "TokenSort(" + delegate.getName() + ")";
    }

    static String sortedTokens(String text) {
        return Arrays.stream(text.trim().toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(token -> !token.isEmpty())
                .sorted()
                .collect(Collectors.joining(" "));
    }
}
