package com.property.distress.resolve;

/**
 * Raw identifiers a record offers for resolution. Any field may be null; the resolver
 * tries whichever are present.
 */
public record ResolutionRequest(String parcelId, String address, String ownerName) {

    public static ResolutionRequest byParcelId(String parcelId) {
        return new ResolutionRequest(parcelId, null, null);
    }

    public static ResolutionRequest byAddress(String address) {
        return new ResolutionRequest(null, address, null);
    }

    public static ResolutionRequest byOwnerName(String ownerName) {
        return new ResolutionRequest(null, null, ownerName);
    }

    public boolean isEmpty() {
        return isBlank(parcelId) && isBlank(address) && isBlank(ownerName);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
