package com.property.distress.store;

import com.property.distress.core.model.DistressScore;
import com.property.distress.core.model.LeadTier;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Historical distress scores, at most one per property per calendar day.
 */
public interface DistressScoreRepository {

    Optional<DistressScore> findForDay(long propertyId, LocalDate day);

    /**
     * Most recent row for the property on any day.
     */
    Optional<DistressScore> findLatest(long propertyId);

    /**
     * Inserts the score for {@code day}, or overwrites the row already stored for that day.
     * Atomic with respect to concurrent callers for the same property and day.
     *
     * @return the stored row
     */
    DistressScore upsertForDay(DistressScore score, LocalDate day);

    /**
     * Latest row per property where the property qualified with at least {@code minScore},
     * highest score first.
     */
    List<DistressScore> findLatestQualified(int minScore);

    /**
     * Latest row per property whose tier is {@code tier}, highest score first.
     */
    List<DistressScore> findLatestByLeadTier(LeadTier tier);

    /**
     * Every row for the property, oldest first.
     */
    List<DistressScore> findHistory(long propertyId);
}
