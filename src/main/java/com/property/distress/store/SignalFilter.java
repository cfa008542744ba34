package com.property.distress.store;

/**
 * Optional narrowing of an identity lookup.
 *
 * @param taxYear       only records for this tax year, or null for all
 * @param recordSubtype only records with this subtype, or null for all
 */
public record SignalFilter(Integer taxYear, String recordSubtype) {

    private static final SignalFilter NONE = new SignalFilter(null, null);

    public static SignalFilter none() {
        return NONE;
    }

    public boolean isEmpty() {
        return taxYear == null && recordSubtype == null;
    }
}
