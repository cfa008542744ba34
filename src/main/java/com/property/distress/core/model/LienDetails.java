package com.property.distress.core.model;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * A recorded lien or judgment against a property owner.
 */
public record LienDetails(
        Kind kind,
        String documentType,
        String grantor,
        String grantee,
        BigDecimal amount,
        String bookPage
) implements SignalDetails {

    public enum Kind {
        LIEN,
        JUDGMENT
    }

    /**
     * Judgment and certified-judgment documents are judgments; everything else recorded is a lien.
     */
    public static Kind kindOf(String documentType) {
        if (documentType == null) {
            return Kind.LIEN;
        }
        String upper = documentType.toUpperCase(Locale.ROOT);
        return upper.contains("JUDGMENT") || upper.contains("CERTIFIED") ? Kind.JUDGMENT : Kind.LIEN;
    }
}
