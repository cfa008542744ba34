package com.property.distress.rules;

import java.util.Locale;

/**
 * Canonicalizes addresses and owner names into comparable keys.
 * Both operations are pure; an empty key means the value cannot be used for matching.
 *
 * <p>Address keys are a fixpoint of the address rule chain, so
 * {@code normalizeAddress(normalizeAddress(x)).equals(normalizeAddress(x))} always holds.</p>
 */
public class Normalizer {
    private static final int MAX_ADDRESS_PASSES = 5;

    private final NormalizationEngine engine;

    public Normalizer() {
        this(NormalizerConfig.defaults());
    }

    public Normalizer(NormalizerConfig config) {
        this(DefaultNormalizationRules.createDefaultEngine(config));
    }

    public Normalizer(NormalizationEngine engine) {
        this.engine = engine;
    }

    public String normalizeAddress(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String key = engine.normalize(text.toLowerCase(Locale.ROOT), NormalizationTarget.ADDRESS);
        // Tail rules can expose another strippable tail ("... tampa apt 4" -> "... tampa")
        for (int pass = 1; pass < MAX_ADDRESS_PASSES && !key.isEmpty(); pass++) {
            String again = engine.normalize(key, NormalizationTarget.ADDRESS);
            if (again.equals(key)) {
                break;
            }
            key = again;
        }
        return key;
    }

    public String normalizeOwnerName(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return engine.normalize(text.toUpperCase(Locale.ROOT), NormalizationTarget.OWNER_NAME);
    }

    /**
     * True when both addresses normalize to the same non-empty key.
     */
    public boolean areEquivalentAddresses(String address1, String address2) {
        String key1 = normalizeAddress(address1);
        return !key1.isEmpty() && key1.equals(normalizeAddress(address2));
    }
}
