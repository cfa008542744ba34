package com.property.distress.resolve;

import com.property.distress.cache.NoOpResolutionCache;
import com.property.distress.cache.ResolutionCache;
import com.property.distress.core.model.MatchResult;
import com.property.distress.core.model.MatchTier;
import com.property.distress.core.model.Owner;
import com.property.distress.core.model.Property;
import com.property.distress.metrics.MetricsService;
import com.property.distress.metrics.NoOpMetricsService;
import com.property.distress.rules.Normalizer;
import com.property.distress.similarity.LevenshteinSimilarity;
import com.property.distress.similarity.SimilarityAlgorithm;
import com.property.distress.similarity.TokenSortSimilarity;
import com.property.distress.store.PropertyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Maps a record's identifiers onto an existing property.
 *
 * <p>Tiers are tried in a fixed order and the first hit wins:</p>
 * <ol>
 *   <li>parcel id equality</li>
 *   <li>normalized address equality</li>
 *   <li>Levenshtein similarity over a bounded window of addresses</li>
 *   <li>normalized owner name equality</li>
 *   <li>token-sort similarity over owners found by a first/last token LIKE pattern</li>
 *   <li>token-sort similarity over a bounded window of owners</li>
 * </ol>
 *
 * <p>Candidate lists come back ordered by property id and a candidate only replaces the
 * current best on a strictly higher score, so ties always resolve to the lowest id.</p>
 */
public class PropertyResolver {
    private static final Logger log = LoggerFactory.getLogger(PropertyResolver.class);

    private final PropertyRepository repository;
    private final Normalizer normalizer;
    private final ResolverOptions options;
    private final SimilarityAlgorithm addressSimilarity;
    private final SimilarityAlgorithm ownerSimilarity;
    private final ResolutionCache cache;
    private final MetricsService metrics;

    public PropertyResolver(PropertyRepository repository, Normalizer normalizer) {
        this(repository, normalizer, ResolverOptions.defaults(), new NoOpResolutionCache(),
                new NoOpMetricsService());
    }

    public PropertyResolver(PropertyRepository repository, Normalizer normalizer, ResolverOptions options,
                            ResolutionCache cache, MetricsService metrics) {
        this.repository = repository;
        this.normalizer = normalizer;
        this.options = options;
        this.addressSimilarity = new LevenshteinSimilarity();
        this.ownerSimilarity = new TokenSortSimilarity();
        this.cache = cache;
        this.metrics = metrics;
    }

    public Optional<MatchResult> resolve(ResolutionRequest request) {
        if (request == null || request.isEmpty()) {
            return Optional.empty();
        }
        String parcelId = request.parcelId() != null ? request.parcelId().trim() : "";
        String addressKey = normalizer.normalizeAddress(request.address());
        String ownerKey = normalizer.normalizeOwnerName(request.ownerName());
        if (parcelId.isEmpty() && addressKey.isEmpty() && ownerKey.isEmpty()) {
            log.debug("resolve.unusable request={}", request);
            metrics.recordResolution(null);
            return Optional.empty();
        }

        String lookupKey = "P=" + parcelId + "|A=" + addressKey + "|O=" + ownerKey;
        Optional<MatchResult> cached = cache.get(lookupKey);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached;
        }
        metrics.recordCacheMiss();

        Optional<MatchResult> result = resolveUncached(parcelId, addressKey, ownerKey);
        if (result.isPresent()) {
            cache.put(lookupKey, result.get());
            log.debug("resolve.matched tier={} propertyId={} confidence={}",
                    result.get().tier(), result.get().propertyId(), result.get().confidence());
        } else {
            log.debug("resolve.no_match parcel='{}' address='{}' owner='{}'", parcelId, addressKey, ownerKey);
        }
        metrics.recordResolution(result.map(MatchResult::tier).orElse(null));
        return result;
    }

    /**
     * Tries each request in order and returns the first that resolves.
     */
    public Optional<MatchResult> resolveFirst(List<ResolutionRequest> requests) {
        for (ResolutionRequest request : requests) {
            Optional<MatchResult> result = resolve(request);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    /**
     * Drops cached matches. Must be called after properties or owners are added.
     */
    public void invalidateCache() {
        cache.invalidateAll();
    }

    public ResolutionCache getCache() {
        return cache;
    }

    private Optional<MatchResult> resolveUncached(String parcelId, String addressKey, String ownerKey) {
        if (!parcelId.isEmpty()) {
            Optional<Property> byParcel = repository.findByParcelId(parcelId);
            if (byParcel.isPresent()) {
                return Optional.of(MatchResult.exact(byParcel.get(), MatchTier.PARCEL_ID));
            }
        }

        if (!addressKey.isEmpty()) {
            Optional<Property> byAddress = repository.findFirstByNormalizedAddress(addressKey);
            if (byAddress.isPresent()) {
                return Optional.of(MatchResult.exact(byAddress.get(), MatchTier.EXACT_ADDRESS));
            }
            Optional<MatchResult> fuzzy = fuzzyAddress(addressKey);
            if (fuzzy.isPresent()) {
                return fuzzy;
            }
        }

        if (!ownerKey.isEmpty()) {
            Optional<Property> byOwner = repository.findFirstOwnerByNormalizedName(ownerKey)
                    .flatMap(this::propertyOf);
            if (byOwner.isPresent()) {
                return Optional.of(MatchResult.exact(byOwner.get(), MatchTier.EXACT_OWNER));
            }
            List<Owner> partial = repository.findOwnersByNamePattern(likePattern(ownerKey),
                    options.getPartialOwnerLimit());
            Optional<MatchResult> partialMatch = bestOwner(ownerKey, partial, MatchTier.PARTIAL_OWNER);
            if (partialMatch.isPresent()) {
                return partialMatch;
            }
            List<Owner> window = repository.findOwners(options.getFallbackOwnerWindow());
            return bestOwner(ownerKey, window, MatchTier.FALLBACK_OWNER);
        }

        return Optional.empty();
    }

    private Optional<MatchResult> fuzzyAddress(String addressKey) {
        Property best = null;
        double bestScore = -1.0;
        for (Property candidate : repository.findAddressCandidates(options.getFuzzyAddressWindow())) {
            double score = addressSimilarity.score(addressKey, candidate.getNormalizedAddress());
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best == null || bestScore < options.getFuzzyAddressThreshold()) {
            return Optional.empty();
        }
        return Optional.of(new MatchResult(best, clamp(bestScore), MatchTier.FUZZY_ADDRESS));
    }

    private Optional<MatchResult> bestOwner(String ownerKey, List<Owner> candidates, MatchTier tier) {
        Owner best = null;
        double bestScore = -1.0;
        for (Owner candidate : candidates) {
            double score = ownerSimilarity.score(ownerKey, candidate.getNormalizedName());
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best == null || bestScore < options.getOwnerThreshold()) {
            return Optional.empty();
        }
        double confidence = clamp(bestScore);
        return propertyOf(best).map(property -> new MatchResult(property, confidence, tier));
    }

    private Optional<Property> propertyOf(Owner owner) {
        return owner.getPropertyId() != null ? repository.findById(owner.getPropertyId()) : Optional.empty();
    }

    /**
     * {@code %FIRST%LAST%} for multi-token names, {@code %TOKEN%} otherwise. Tokens are escaped
     * with {@code \} so an underscore in a name matches only itself.
     */
    static String likePattern(String ownerKey) {
        String[] tokens = ownerKey.split(" ");
        if (tokens.length == 1) {
            return "%" + escapeLike(tokens[0]) + "%";
        }
        return "%" + escapeLike(tokens[0]) + "%" + escapeLike(tokens[tokens.length - 1]) + "%";
    }

    static String escapeLike(String token) {
        return token.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(100.0, score));
    }
}
