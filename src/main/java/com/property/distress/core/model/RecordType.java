package com.property.distress.core.model;

import java.util.Locale;

/**
 * Kinds of public-record extracts. Each type names the column whose value identifies
 * a record uniquely across all ingestion runs, and the details variant its records carry.
 */
public enum RecordType {
    VIOLATIONS("violations", "Record Number", ViolationDetails.class),
    LIENS("liens", "Instrument", LienDetails.class),
    JUDGMENTS("judgments", "Instrument", LienDetails.class),
    DEEDS("deeds", "Instrument", DeedDetails.class),
    FORECLOSURES("foreclosures", "Case Number", ForeclosureDetails.class),
    TAX("tax", "Account Number", TaxDelinquencyDetails.class),
    PERMITS("permits", "Record Number", PermitDetails.class),
    PROBATE("probate", "CaseNumber", LegalProceedingDetails.class),
    EVICTIONS("evictions", "CaseNumber", LegalProceedingDetails.class),
    BANKRUPTCY("bankruptcy", "Docket Number", LegalProceedingDetails.class),
    INCIDENTS("incidents", "Incident Number", IncidentDetails.class);

    private final String key;
    private final String identityColumn;
    private final Class<? extends SignalDetails> detailsType;

    RecordType(String key, String identityColumn, Class<? extends SignalDetails> detailsType) {
        this.key = key;
        this.identityColumn = identityColumn;
        this.detailsType = detailsType;
    }

    public String getKey() {
        return key;
    }

    public String getIdentityColumn() {
        return identityColumn;
    }

    /**
     * The typed details variant that records of this type carry.
     */
    public Class<? extends SignalDetails> getDetailsType() {
        return detailsType;
    }

    /**
     * Looks up a record type by its key or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static RecordType fromKey(String value) {
        if (value != null) {
            String lookup = value.trim().toLowerCase(Locale.ROOT);
            for (RecordType type : values()) {
                if (type.key.equals(lookup) || type.name().equalsIgnoreCase(lookup)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown record type: " + value);
    }
}
