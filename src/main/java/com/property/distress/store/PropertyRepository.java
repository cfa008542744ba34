package com.property.distress.store;

import com.property.distress.core.model.Owner;
import com.property.distress.core.model.Property;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage for properties and their owners.
 * Every list-returning lookup is ordered by ascending property id so that callers
 * picking "the first" candidate get the same answer on every call.
 */
public interface PropertyRepository {

    Optional<Property> findById(long id);

    Optional<Property> findByParcelId(String parcelId);

    /**
     * Lowest-id property whose stored normalized address equals {@code normalizedAddress}.
     */
    Optional<Property> findFirstByNormalizedAddress(String normalizedAddress);

    /**
     * The first {@code limit} properties carrying a non-empty normalized address.
     */
    List<Property> findAddressCandidates(int limit);

    Optional<Owner> findOwnerByPropertyId(long propertyId);

    /**
     * Lowest-property-id owner whose normalized name equals {@code normalizedName}.
     */
    Optional<Owner> findFirstOwnerByNormalizedName(String normalizedName);

    /**
     * Owners whose normalized name matches a SQL LIKE pattern. {@code \} escapes a literal
     * {@code %}, {@code _} or {@code \}.
     */
    List<Owner> findOwnersByNamePattern(String likePattern, int limit);

    List<Owner> findOwners(int limit);

    Set<String> findAllParcelIds();

    /**
     * Persists the batch atomically: either every property (and owner) is stored or none is.
     *
     * @return the saved properties with their assigned ids, in input order
     */
    List<Property> saveAll(List<PropertyWithOwner> batch);

    long count();
}
