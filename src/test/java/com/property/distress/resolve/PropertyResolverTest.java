package com.property.distress.resolve;

import com.property.distress.cache.CacheConfig;
import com.property.distress.cache.CaffeineResolutionCache;
import com.property.distress.core.model.MatchResult;
import com.property.distress.core.model.MatchTier;
import com.property.distress.core.model.Owner;
import com.property.distress.core.model.Property;
import com.property.distress.metrics.NoOpMetricsService;
import com.property.distress.rules.Normalizer;
import com.property.distress.store.InMemoryPropertyRepository;
import com.property.distress.store.PropertyWithOwner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PropertyResolver Tests")
class PropertyResolverTest {

    private Normalizer normalizer;
    private InMemoryPropertyRepository repository;
    private PropertyResolver resolver;

    @BeforeEach
    void setUp() {
        normalizer = new Normalizer();
        repository = new InMemoryPropertyRepository();
        resolver = new PropertyResolver(repository, normalizer);
    }

    private Property add(String parcelId, String address, String ownerName) {
        Property property = Property.builder()
                .parcelId(parcelId)
                .address(address)
                .normalizedAddress(normalizer.normalizeAddress(address))
                .zip("33602")
                .build();
        Owner owner = ownerName == null ? null : Owner.builder()
                .ownerName(ownerName)
                .normalizedName(normalizer.normalizeOwnerName(ownerName))
                .build();
        return repository.saveAll(List.of(new PropertyWithOwner(property, owner))).get(0);
    }

    @Nested
    @DisplayName("Exact tiers")
    class ExactTiers {

        @Test
        @DisplayName("Should match on parcel id first")
        void parcelIdWins() {
            Property first = add("A-100", "1 Alpha St", null);
            Property second = add("B-200", "2 Beta St", null);

            Optional<MatchResult> result = resolver.resolve(new ResolutionRequest("B-200", "1 Alpha St", null));

            assertTrue(result.isPresent());
            assertEquals(second.getId(), result.get().property().getId());
            assertEquals(MatchTier.PARCEL_ID, result.get().tier());
            assertEquals(100.0, result.get().confidence());
            assertNotEquals(first.getId(), second.getId());
        }

        @Test
        @DisplayName("Should match formatted address variants to the lowest id")
        void exactAddressLowestId() {
            Property first = add("A-1", "123 Main Street", null);
            add("A-2", "123 MAIN ST, Tampa FL 33601", null);

            MatchResult result = resolver.resolve(ResolutionRequest.byAddress("123 Main St.")).orElseThrow();

            assertEquals(first.getId(), result.property().getId());
            assertEquals(MatchTier.EXACT_ADDRESS, result.tier());
            assertTrue(result.tier().isExact());
        }

        @Test
        @DisplayName("Should match normalized owner name exactly")
        void exactOwner() {
            add("A-1", "9 Pine Rd", "DOE JANE");
            Property smith = add("A-2", "10 Oak Ave", "SMITH JOHN");

            MatchResult result = resolver.resolve(ResolutionRequest.byOwnerName("Smith, John")).orElseThrow();

            assertEquals(smith.getId(), result.property().getId());
            assertEquals(MatchTier.EXACT_OWNER, result.tier());
        }
    }

    @Nested
    @DisplayName("Fuzzy tiers")
    class FuzzyTiers {

        @Test
        @DisplayName("Should accept a close address above the threshold")
        void fuzzyAddress() {
            Property columbus = add("A-1", "1234 Columbus Dr", null);

            MatchResult result = resolver.resolve(ResolutionRequest.byAddress("1234 Columbus Drv")).orElseThrow();

            assertEquals(columbus.getId(), result.property().getId());
            assertEquals(MatchTier.FUZZY_ADDRESS, result.tier());
            assertTrue(result.confidence() >= 85.0 && result.confidence() < 100.0);
        }

        @Test
        @DisplayName("Should reject a distant address")
        void distantAddress() {
            add("A-1", "1234 Columbus Dr", null);

            assertTrue(resolver.resolve(ResolutionRequest.byAddress("9999 Unrelated Blvd")).isEmpty());
        }

        @Test
        @DisplayName("Equal fuzzy scores resolve to the lowest id")
        void fuzzyTieLowestId() {
            Property first = add("A-1", "100 Oak Sx", null);
            add("A-2", "100 Oak Sz", null);

            MatchResult result = resolver.resolve(ResolutionRequest.byAddress("100 Oak Sy")).orElseThrow();

            assertEquals(first.getId(), result.property().getId());
            assertEquals(90.0, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Should find owners sharing first and last tokens")
        void partialOwner() {
            Property smith = add("A-1", "5 Elm St", "SMITH JOHN A");

            MatchResult result = resolver.resolve(ResolutionRequest.byOwnerName("Smith John")).orElseThrow();

            assertEquals(smith.getId(), result.property().getId());
            assertEquals(MatchTier.PARTIAL_OWNER, result.tier());
            assertFalse(result.tier().isExact());
        }

        @Test
        @DisplayName("Should fall back to token-sort over the owner window")
        void fallbackOwner() {
            Property smith = add("A-1", "5 Elm St", "SMITH JOHN");

            MatchResult result = resolver.resolve(ResolutionRequest.byOwnerName("John Smith")).orElseThrow();

            assertEquals(smith.getId(), result.property().getId());
            assertEquals(MatchTier.FALLBACK_OWNER, result.tier());
            assertEquals(100.0, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Should not match unrelated owners")
        void unrelatedOwner() {
            add("A-1", "5 Elm St", "SMITH JOHN");

            assertTrue(resolver.resolve(ResolutionRequest.byOwnerName("Gonzalez Maria")).isEmpty());
        }
    }

    @Nested
    @DisplayName("Unusable requests")
    class UnusableRequests {

        @Test
        @DisplayName("Empty and placeholder requests do not resolve")
        void emptyRequests() {
            add("A-1", "1 Alpha St", "DOE JANE");

            assertTrue(resolver.resolve(null).isEmpty());
            assertTrue(resolver.resolve(new ResolutionRequest(null, null, null)).isEmpty());
            assertTrue(resolver.resolve(ResolutionRequest.byAddress("Not Provided")).isEmpty());
            assertTrue(resolver.resolve(ResolutionRequest.byAddress("Main St & 5th Ave")).isEmpty());
        }

        @Test
        @DisplayName("resolveFirst tries requests in order")
        void resolveFirst() {
            Property property = add("A-1", "1 Alpha St", null);

            Optional<MatchResult> result = resolver.resolveFirst(List.of(
                    ResolutionRequest.byOwnerName("Nobody Here"),
                    ResolutionRequest.byAddress("1 Alpha Street")));

            assertEquals(property.getId(), result.orElseThrow().property().getId());
            assertTrue(resolver.resolveFirst(List.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        private PropertyResolver cached;

        @BeforeEach
        void setUp() {
            cached = new PropertyResolver(repository, normalizer, ResolverOptions.defaults(),
                    new CaffeineResolutionCache(new CacheConfig(100, Duration.ofMinutes(5), true)),
                    new NoOpMetricsService());
        }

        @Test
        @DisplayName("Positive results are served from the cache")
        void positiveCached() {
            add("A-1", "1 Alpha St", null);

            cached.resolve(ResolutionRequest.byAddress("1 Alpha St"));
            cached.resolve(ResolutionRequest.byAddress("1 ALPHA STREET"));

            assertEquals(1, cached.getCache().getStats().hitCount());
        }

        @Test
        @DisplayName("Misses are not cached")
        void negativeNotCached() {
            assertTrue(cached.resolve(ResolutionRequest.byAddress("1 Alpha St")).isEmpty());

            add("A-1", "1 Alpha St", null);

            assertTrue(cached.resolve(ResolutionRequest.byAddress("1 Alpha St")).isPresent());
        }

        @Test
        @DisplayName("Invalidation lets a better match replace a cached one")
        void invalidation() {
            add("A-1", "100 Oak Sx", null);
            assertEquals(MatchTier.FUZZY_ADDRESS,
                    cached.resolve(ResolutionRequest.byAddress("100 Oak Sy")).orElseThrow().tier());

            Property exact = add("A-2", "100 Oak Sy", null);
            cached.invalidateCache();

            MatchResult result = cached.resolve(ResolutionRequest.byAddress("100 Oak Sy")).orElseThrow();
            assertEquals(exact.getId(), result.property().getId());
            assertEquals(MatchTier.EXACT_ADDRESS, result.tier());
        }
    }

    @Test
    @DisplayName("likePattern uses first and last tokens")
    void likePattern() {
        assertEquals("%SMITH%JR%", PropertyResolver.likePattern("SMITH JOHN JR"));
        assertEquals("%SMITH%", PropertyResolver.likePattern("SMITH"));
        assertEquals("%ABC\\_HOLDINGS%LLC%", PropertyResolver.likePattern("ABC_HOLDINGS LLC"));
    }

    @Test
    @DisplayName("Options reject out-of-range thresholds")
    void optionsValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> ResolverOptions.builder().fuzzyAddressThreshold(101).build());
        assertThrows(IllegalArgumentException.class,
                () -> ResolverOptions.builder().partialOwnerLimit(-1).build());
        assertEquals(85.0, ResolverOptions.defaults().getFuzzyAddressThreshold());
    }
}
