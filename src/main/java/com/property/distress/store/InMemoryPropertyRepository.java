package com.property.distress.store;

import com.property.distress.core.model.Owner;
import com.property.distress.core.model.Property;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory property store for tests and single-process runs.
 * Ids are assigned from a sequence, so map ordering equals insertion ordering.
 */
public class InMemoryPropertyRepository implements PropertyRepository {

    private final AtomicLong propertySequence = new AtomicLong();
    private final AtomicLong ownerSequence = new AtomicLong();
    private final ConcurrentSkipListMap<Long, Property> properties = new ConcurrentSkipListMap<>();
    private final ConcurrentSkipListMap<Long, Owner> ownersByProperty = new ConcurrentSkipListMap<>();
    private final ConcurrentHashMap<String, Long> parcelIndex = new ConcurrentHashMap<>();

    @Override
    public Optional<Property> findById(long id) {
        return Optional.ofNullable(properties.get(id));
    }

    @Override
    public Optional<Property> findByParcelId(String parcelId) {
        if (parcelId == null) {
            return Optional.empty();
        }
        Long id = parcelIndex.get(parcelId.trim());
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public Optional<Property> findFirstByNormalizedAddress(String normalizedAddress) {
        if (normalizedAddress == null || normalizedAddress.isEmpty()) {
            return Optional.empty();
        }
        return properties.values().stream()
                .filter(p -> p.getNormalizedAddress().equals(normalizedAddress))
                .findFirst();
    }

    @Override
    public List<Property> findAddressCandidates(int limit) {
        return properties.values().stream()
                .filter(Property::hasNormalizedAddress)
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Owner> findOwnerByPropertyId(long propertyId) {
        return Optional.ofNullable(ownersByProperty.get(propertyId));
    }

    @Override
    public Optional<Owner> findFirstOwnerByNormalizedName(String normalizedName) {
        if (normalizedName == null || normalizedName.isEmpty()) {
            return Optional.empty();
        }
        return ownersByProperty.values().stream()
                .filter(o -> o.getNormalizedName().equalsIgnoreCase(normalizedName))
                .findFirst();
    }

    @Override
    public List<Owner> findOwnersByNamePattern(String likePattern, int limit) {
        Pattern regex = likeToRegex(likePattern);
        return ownersByProperty.values().stream()
                .filter(o -> regex.matcher(o.getNormalizedName()).matches())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public List<Owner> findOwners(int limit) {
        return ownersByProperty.values().stream()
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public Set<String> findAllParcelIds() {
        return Set.copyOf(parcelIndex.keySet());
    }

    @Override
    public synchronized List<Property> saveAll(List<PropertyWithOwner> batch) {
        Set<String> incoming = new HashSet<>();
        for (PropertyWithOwner item : batch) {
            String parcelId = item.property().getParcelId();
            if (parcelIndex.containsKey(parcelId) || !incoming.add(parcelId)) {
                throw new IllegalStateException("Duplicate parcel id: " + parcelId);
            }
        }

        List<Property> saved = new ArrayList<>(batch.size());
        for (PropertyWithOwner item : batch) {
            long id = propertySequence.incrementAndGet();
            Property property = Property.builder(item.property()).id(id).build();
            properties.put(id, property);
            parcelIndex.put(property.getParcelId(), id);
            if (item.owner() != null) {
                ownersByProperty.put(id, Owner.builder(item.owner())
                        .id(ownerSequence.incrementAndGet())
                        .propertyId(id)
                        .build());
            }
            saved.add(property);
        }
        return saved;
    }

    @Override
    public long count() {
        return properties.size();
    }

    static Pattern likeToRegex(String likePattern) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < likePattern.length(); i++) {
            char c = likePattern.charAt(i);
            if (c == '\\' && i + 1 < likePattern.length()) {
                regex.append(Pattern.quote(String.valueOf(likePattern.charAt(++i))));
            } else if (c == '%') {
                regex.append(".*");
            } else if (c == '_') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }
}
