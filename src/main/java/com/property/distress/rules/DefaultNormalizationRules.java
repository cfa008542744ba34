package com.property.distress.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Built-in rule chains for postal addresses and owner names.
 * Address rules expect lower-cased input, owner rules upper-cased input.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates an engine holding both rule chains.
     */
    public static NormalizationEngine createDefaultEngine(NormalizerConfig config) {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getAddressRules(config));
        engine.addRules(getOwnerNameRules(config));
        return engine;
    }

    public static List<NormalizationRule> getAddressRules(NormalizerConfig config) {
        List<NormalizationRule> rules = new ArrayList<>();

        if (!config.addressBlocklist().isEmpty()) {
            rules.add(NormalizationRule.builder()
                    .name("address-blocklist")
                    .pattern(alternation(config.addressBlocklist()))
                    .targets(NormalizationTarget.ADDRESS)
                    .priority(10)
                    .rejectOnMatch()
                    .build());
        }

        // Intersections are not postal addresses
        rules.add(NormalizationRule.builder()
                .name("address-intersection")
                .pattern("\\s(?:&|and)\\s")
                .targets(NormalizationTarget.ADDRESS)
                .priority(11)
                .rejectOnMatch()
                .build());

        rules.add(NormalizationRule.builder()
                .name("address-semicolon-annotation")
                .pattern(";.*$")
                .targets(NormalizationTarget.ADDRESS)
                .priority(20)
                .build());

        rules.add(NormalizationRule.builder()
                .name("address-periods")
                .pattern("\\.")
                .targets(NormalizationTarget.ADDRESS)
                .priority(30)
                .build());

        for (Map.Entry<String, String> abbreviation : config.abbreviations().entrySet()) {
            rules.add(NormalizationRule.builder()
                    .name("address-abbrev-" + abbreviation.getKey())
                    .pattern("\\b" + Pattern.quote(abbreviation.getKey()) + "\\b")
                    .replacement(abbreviation.getValue())
                    .targets(NormalizationTarget.ADDRESS)
                    .priority(40)
                    .build());
        }

        rules.add(NormalizationRule.builder()
                .name("address-collapse-whitespace")
                .pattern("\\s+")
                .replacement(" ")
                .targets(NormalizationTarget.ADDRESS)
                .priority(50)
                .build());

        rules.add(NormalizationRule.builder()
                .name("address-trim")
                .pattern("^\\s+|\\s+$")
                .targets(NormalizationTarget.ADDRESS)
                .priority(51)
                .build());

        // House number must lead: "main st" or "vacant lot" cannot be matched
        rules.add(NormalizationRule.builder()
                .name("address-leading-number")
                .pattern("^[^\\s\\d]+(?:\\s|$)")
                .targets(NormalizationTarget.ADDRESS)
                .priority(60)
                .rejectOnMatch()
                .build());

        rules.add(NormalizationRule.builder()
                .name("address-comma-tail")
                .pattern(",.*$")
                .targets(NormalizationTarget.ADDRESS)
                .priority(70)
                .build());

        if (!config.cityNames().isEmpty()) {
            rules.add(NormalizationRule.builder()
                    .name("address-trailing-city")
                    .pattern("\\s+" + alternation(abbreviatedCities(config)) + "$")
                    .targets(NormalizationTarget.ADDRESS)
                    .priority(80)
                    .build());
        }

        // A bare "fl" counts as the state only at the end or before a ZIP: "100 n fl ave" is Florida Avenue
        rules.add(NormalizationRule.builder()
                .name("address-state-tail")
                .pattern("\\s+fl(?:\\s+\\d{5}(?:-\\d{4})?\\b.*)?$")
                .targets(NormalizationTarget.ADDRESS)
                .priority(81)
                .build());

        rules.add(NormalizationRule.builder()
                .name("address-trailing-zip")
                .pattern("\\s+\\d{5}(?:-\\d{4})?$")
                .targets(NormalizationTarget.ADDRESS)
                .priority(82)
                .build());

        rules.add(NormalizationRule.builder()
                .name("address-unit")
                .pattern("\\s+(?:apt|unit|ste|suite|lot|bldg)\\b\\s*#?\\s*[\\w-]+|\\s*#\\s*[\\w-]+")
                .targets(NormalizationTarget.ADDRESS)
                .priority(90)
                .build());

        return rules;
    }

    public static List<NormalizationRule> getOwnerNameRules(NormalizerConfig config) {
        List<NormalizationRule> rules = new ArrayList<>();

        // L.L.C. -> LLC before punctuation turns it into separate letters
        rules.add(NormalizationRule.builder()
                .name("owner-periods")
                .pattern("\\.")
                .targets(NormalizationTarget.OWNER_NAME)
                .priority(10)
                .build());

        rules.add(NormalizationRule.builder()
                .name("owner-punctuation")
                .pattern("[^\\w\\s&]")
                .replacement(" ")
                .targets(NormalizationTarget.OWNER_NAME)
                .priority(20)
                .build());

        if (!config.ownerSuffixes().isEmpty()) {
            rules.add(NormalizationRule.builder()
                    .name("owner-suffixes")
                    .pattern("\\b" + alternation(config.ownerSuffixes()) + "\\b")
                    .replacement(" ")
                    .targets(NormalizationTarget.OWNER_NAME)
                    .priority(30)
                    .build());
        }

        rules.add(NormalizationRule.builder()
                .name("owner-ampersand")
                .pattern("&")
                .replacement(" ")
                .targets(NormalizationTarget.OWNER_NAME)
                .priority(31)
                .build());

        return rules;
    }

    /**
     * City names go through the abbreviation table first ("temple terrace" is matched as "temple ter").
     */
    private static List<String> abbreviatedCities(NormalizerConfig config) {
        List<String> cities = new ArrayList<>();
        for (String city : config.cityNames()) {
            String abbreviated = city.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, String> abbreviation : config.abbreviations().entrySet()) {
                abbreviated = abbreviated.replaceAll("\\b" + Pattern.quote(abbreviation.getKey()) + "\\b",
                        abbreviation.getValue());
            }
            cities.add(abbreviated);
        }
        return cities;
    }

    private static String alternation(Collection<String> terms) {
        return terms.stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .map(Pattern::quote)
                .collect(Collectors.joining("|", "(?:", ")"));
    }
}
