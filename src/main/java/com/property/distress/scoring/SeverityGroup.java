package com.property.distress.scoring;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Violation-type keywords that share a severity.
 *
 * @param name     label used in logs
 * @param points   severity awarded when any keyword matches
 * @param keywords lower-case substrings searched in the violation type
 */
public record SeverityGroup(String name, int points, List<String> keywords) {

    public SeverityGroup {
        Objects.requireNonNull(name, "name is required");
        keywords = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        if (points < 0 || points > ScoringPolicy.MAX_SEVERITY) {
            throw new IllegalArgumentException("points must be between 0 and " + ScoringPolicy.MAX_SEVERITY);
        }
    }

    public static SeverityGroup of(String name, int points, String... keywords) {
        return new SeverityGroup(name, points, List.of(keywords));
    }

    public boolean matches(String lowerCaseType) {
        return keywords.stream().anyMatch(lowerCaseType::contains);
    }
}
