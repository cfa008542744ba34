package com.property.distress.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tables that drive address and owner-name normalization.
 *
 * @param addressBlocklist placeholder fragments that mark an address as unusable
 * @param abbreviations    whole-word rewrites, applied in iteration order
 * @param cityNames        city names stripped from the end of an address
 * @param ownerSuffixes    legal-entity and fiduciary tokens dropped from owner names
 * @param homeState        state assumed for properties whose record carries none
 */
public record NormalizerConfig(
        List<String> addressBlocklist,
        Map<String, String> abbreviations,
        List<String> cityNames,
        Set<String> ownerSuffixes,
        String homeState
) {
    public NormalizerConfig {
        addressBlocklist = List.copyOf(addressBlocklist);
        abbreviations = Collections.unmodifiableMap(new LinkedHashMap<>(abbreviations));
        cityNames = List.copyOf(cityNames);
        ownerSuffixes = Set.copyOf(ownerSuffixes);
        if (homeState == null || homeState.isBlank()) {
            throw new IllegalArgumentException("homeState is required");
        }
    }

    /**
     * Defaults tuned for the Hillsborough County, FL public-record extracts.
     */
    public static NormalizerConfig defaults() {
        Map<String, String> abbreviations = new LinkedHashMap<>();
        abbreviations.put("street", "st");
        abbreviations.put("avenue", "ave");
        abbreviations.put("drive", "dr");
        abbreviations.put("road", "rd");
        abbreviations.put("lane", "ln");
        abbreviations.put("circle", "cir");
        abbreviations.put("boulevard", "blvd");
        abbreviations.put("court", "ct");
        abbreviations.put("place", "pl");
        abbreviations.put("terrace", "ter");
        abbreviations.put("parkway", "pkwy");
        abbreviations.put("highway", "hwy");
        abbreviations.put("way", "wy");
        abbreviations.put("florida", "fl");

        return new NormalizerConfig(
                List.of("not provided", "right of way", "intersection", "unknown", "no address"),
                abbreviations,
                List.of("tampa", "plant city", "temple terrace", "brandon", "riverview", "valrico",
                        "seffner", "lutz", "odessa", "ruskin", "apollo beach", "sun city center",
                        "wimauma", "dover", "thonotosassa", "gibsonton", "lithia"),
                Set.of("LLC", "INC", "CORP", "CO", "LTD", "LP", "LLP", "PLLC", "TRUSTEE", "TRUST",
                        "ESTATE", "REVOCABLE", "IRREVOCABLE", "THE", "AND"),
                "FL"
        );
    }
}
