package com.property.distress.store;

import com.property.distress.core.model.DistressScore;
import com.property.distress.core.model.LeadTier;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory score history: one day-keyed timeline per property.
 * All access is synchronized, which makes the per-day upsert atomic.
 */
public class InMemoryDistressScoreRepository implements DistressScoreRepository {

    private final AtomicLong sequence = new AtomicLong();
    private final Map<Long, TreeMap<LocalDate, DistressScore>> timelines = new HashMap<>();

    @Override
    public synchronized Optional<DistressScore> findForDay(long propertyId, LocalDate day) {
        TreeMap<LocalDate, DistressScore> timeline = timelines.get(propertyId);
        return timeline == null ? Optional.empty() : Optional.ofNullable(timeline.get(day));
    }

    @Override
    public synchronized Optional<DistressScore> findLatest(long propertyId) {
        TreeMap<LocalDate, DistressScore> timeline = timelines.get(propertyId);
        if (timeline == null || timeline.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(timeline.lastEntry().getValue());
    }

    @Override
    public synchronized DistressScore upsertForDay(DistressScore score, LocalDate day) {
        TreeMap<LocalDate, DistressScore> timeline =
                timelines.computeIfAbsent(score.propertyId(), id -> new TreeMap<>());
        DistressScore existing = timeline.get(day);
        long id = existing != null ? existing.id() : sequence.incrementAndGet();
        DistressScore stored = score.withId(id);
        timeline.put(day, stored);
        return stored;
    }

    @Override
    public synchronized List<DistressScore> findLatestQualified(int minScore) {
        return latestMatching(s -> s.qualified() && s.finalScore() >= minScore);
    }

    @Override
    public synchronized List<DistressScore> findLatestByLeadTier(LeadTier tier) {
        return latestMatching(s -> s.leadTier() == tier);
    }

    @Override
    public synchronized List<DistressScore> findHistory(long propertyId) {
        TreeMap<LocalDate, DistressScore> timeline = timelines.get(propertyId);
        return timeline == null ? List.of() : new ArrayList<>(timeline.values());
    }

    private List<DistressScore> latestMatching(Predicate<DistressScore> predicate) {
        return timelines.values().stream()
                .filter(timeline -> !timeline.isEmpty())
                .map(timeline -> timeline.lastEntry().getValue())
                .filter(predicate)
                .sorted(Comparator.comparingInt(DistressScore::finalScore).reversed()
                        .thenComparingLong(DistressScore::propertyId))
                .collect(Collectors.toList());
    }
}
