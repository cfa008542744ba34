package com.property.distress.rules;

import com.property.distress.core.model.AbsenteeStatus;
import com.property.distress.core.model.Property;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives where an owner lives relative to the property from the mailing address.
 * Returns null when the mailing data is too thin to decide.
 */
public class AbsenteeClassifier {
    private static final Pattern ZIP5 = Pattern.compile("\\b(\\d{5})(?:-\\d{4})?\\b");

    private final Normalizer normalizer;
    private final String homeState;

    public AbsenteeClassifier(Normalizer normalizer, String homeState) {
        this.normalizer = normalizer;
        this.homeState = homeState.trim().toUpperCase(Locale.ROOT);
    }

    public AbsenteeStatus classify(Property property, String mailingAddress, String mailingState,
                                   String mailingZip) {
        boolean hasAddress = mailingAddress != null && !mailingAddress.isBlank();
        boolean hasState = mailingState != null && !mailingState.isBlank();
        boolean hasZip = mailingZip != null && !mailingZip.isBlank();
        if (!hasAddress && !hasState && !hasZip) {
            return null;
        }

        if (hasAddress && property.hasNormalizedAddress()
                && normalizer.normalizeAddress(mailingAddress).equals(property.getNormalizedAddress())) {
            return AbsenteeStatus.IN_COUNTY;
        }

        if (hasState) {
            String propertyState = property.getState() != null && !property.getState().isBlank()
                    ? property.getState().trim().toUpperCase(Locale.ROOT)
                    : homeState;
            if (!mailingState.trim().toUpperCase(Locale.ROOT).equals(propertyState)) {
                return AbsenteeStatus.OUT_OF_STATE;
            }
        }

        String ownerZip = zip5(hasZip ? mailingZip : mailingAddress);
        String propertyZip = zip5(property.getZip());
        if (ownerZip == null || propertyZip == null) {
            return null;
        }
        return ownerZip.equals(propertyZip) ? AbsenteeStatus.IN_COUNTY : AbsenteeStatus.OUT_OF_COUNTY;
    }

    static String zip5(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = ZIP5.matcher(text);
        String last = null;
        while (matcher.find()) {
            last = matcher.group(1);
        }
        return last;
    }
}
