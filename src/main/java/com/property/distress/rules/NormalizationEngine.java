package com.property.distress.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies normalization rules in priority order (lower number runs first).
 * Reject rules short-circuit to the empty key. Case folding is left to the caller.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Runs every rule scoped to {@code target} over the text.
     *
     * @return the normalized key, or "" when a reject rule fired or nothing is left
     */
    public String normalize(String text, NormalizationTarget target) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = text;
        for (NormalizationRule rule : rules) {
            if (!rule.appliesTo(target)) {
                continue;
            }
            if (rule.isReject()) {
                if (rule.matches(result)) {
                    log.debug("Rule '{}' rejected '{}'", rule.getName(), result);
                    return "";
                }
                continue;
            }
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                log.debug("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
            if (result.isBlank()) {
                return "";
            }
        }

        return result.trim().replaceAll("\\s+", " ");
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
