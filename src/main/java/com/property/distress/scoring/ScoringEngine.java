package com.property.distress.scoring;

import com.property.distress.core.model.AbsenteeStatus;
import com.property.distress.core.model.FactorScores;
import com.property.distress.core.model.Owner;
import com.property.distress.core.model.Property;
import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;
import com.property.distress.core.model.ViolationDetails;
import com.property.distress.metrics.MetricsService;
import com.property.distress.rules.AbsenteeClassifier;
import com.property.distress.store.PropertyRepository;
import com.property.distress.store.SignalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;

/**
 * Computes the six-factor distress score of a property.
 *
 * <table>
 *   <caption>Factors</caption>
 *   <tr><th>Factor</th><th>Cap</th><th>Input</th></tr>
 *   <tr><td>Violation severity</td><td>25</td><td>open violations, by type keyword</td></tr>
 *   <tr><td>Days open</td><td>20</td><td>open violations, by status then age</td></tr>
 *   <tr><td>Persistence</td><td>20</td><td>open violations: age + status + violation count</td></tr>
 *   <tr><td>Absentee ownership</td><td>15</td><td>owner mailing address</td></tr>
 *   <tr><td>Prior violations</td><td>10</td><td>count of all violations</td></tr>
 *   <tr><td>Equity</td><td>10</td><td>assessed market value</td></tr>
 * </table>
 *
 * <p>Per-violation factors take the maximum over the open violations. "Today" comes from the
 * injected clock, so a score is a pure function of the snapshot and the clock.</p>
 */
public class ScoringEngine {
    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    private static final BigDecimal EQUITY_HIGH = new BigDecimal("300000");
    private static final BigDecimal EQUITY_MID = new BigDecimal("150000");
    private static final BigDecimal EQUITY_LOW = new BigDecimal("75000");

    private final PropertyRepository properties;
    private final SignalRepository signals;
    private final ScoringPolicy policy;
    private final AbsenteeClassifier classifier;
    private final MetricsService metrics;
    private final Clock clock;

    public ScoringEngine(PropertyRepository properties, SignalRepository signals, ScoringPolicy policy,
                         AbsenteeClassifier classifier, MetricsService metrics, Clock clock) {
        this.properties = properties;
        this.signals = signals;
        this.policy = policy;
        this.classifier = classifier;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Loads the property, its owner and its violations and scores them.
     *
     * @throws IllegalArgumentException if no property has the id
     */
    public ScoreBreakdown scoreProperty(long propertyId) {
        Property property = properties.findById(propertyId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown property id: " + propertyId));
        Owner owner = properties.findOwnerByPropertyId(propertyId).orElse(null);
        List<ViolationDetails> violations = signals.findByProperty(propertyId, RecordType.VIOLATIONS).stream()
                .map(SignalRecord::details)
                .map(ViolationDetails.class::cast)
                .toList();
        return score(new PropertySnapshot(property, owner, violations));
    }

    public ScoreBreakdown score(PropertySnapshot snapshot) {
        LocalDate today = LocalDate.now(clock);
        List<ViolationDetails> open = snapshot.openViolations();
        int violationCount = snapshot.violations().size();

        int severity = 0;
        int daysOpen = 0;
        int persistence = 0;
        for (ViolationDetails violation : open) {
            severity = Math.max(severity, severityPoints(violation.violationType()));
            daysOpen = Math.max(daysOpen, daysOpenPoints(violation, today));
            persistence = Math.max(persistence, persistencePoints(violation, today, violationCount));
        }

        FactorScores factors = new FactorScores(
                severity,
                daysOpen,
                persistence,
                absenteePoints(snapshot.property(), snapshot.owner()),
                priorViolationPoints(violationCount),
                equityPoints(snapshot.property().getAssessedMarketValue()));
        int total = factors.total();
        boolean qualified = policy.isQualified(total);
        metrics.recordScore(total, qualified);

        ScoreBreakdown breakdown = new ScoreBreakdown(snapshot.property().getId(), factors, total, qualified,
                policy.leadTierFor(total), policy.urgencyFor(total));
        log.debug("score.computed propertyId={} total={} tier={} factors={}",
                breakdown.propertyId(), total, breakdown.tier(), factors.asMap());
        return breakdown;
    }

    int severityPoints(String violationType) {
        if (violationType == null || violationType.isBlank()) {
            return 0;
        }
        String lower = violationType.toLowerCase(Locale.ROOT);
        for (SeverityGroup group : policy.getSeverityGroups()) {
            if (group.matches(lower)) {
                return group.points();
            }
        }
        log.warn("score.unmapped_violation_type type='{}'", violationType);
        metrics.incrementUnmappedViolationType();
        return 0;
    }

    /**
     * Escalated statuses outrank age; otherwise the age bucket decides.
     */
    static int daysOpenPoints(ViolationDetails violation, LocalDate today) {
        String status = lower(violation.status());
        if (containsAny(status, "judgment", "court", "legal")) {
            return 20;
        }
        if (status.contains("hearing")) {
            return 18;
        }
        if (status.contains("lien") || violation.lien()) {
            return 16;
        }
        if (violation.openedDate() == null) {
            return 0;
        }
        long days = daysBetween(violation.openedDate(), today);
        if (days > 365) return 14;
        if (days >= 181) return 10;
        if (days >= 91) return 7;
        if (days >= 31) return 4;
        return 2;
    }

    static int persistencePoints(ViolationDetails violation, LocalDate today, int violationCount) {
        int points = 0;

        if (violation.openedDate() != null) {
            long days = daysBetween(violation.openedDate(), today);
            if (days >= 365) points += 8;
            else if (days >= 180) points += 6;
            else if (days >= 90) points += 4;
            else if (days >= 30) points += 2;
            else points += 1;
        }

        String status = lower(violation.status());
        if (containsAny(status, "judgment", "court", "legal action")) points += 8;
        else if (containsAny(status, "hearing", "scheduled")) points += 6;
        else if (status.contains("lien") || violation.lien()) points += 5;
        else if (containsAny(status, "notice", "warning")) points += 2;

        if (violationCount >= 5) points += 4;
        else if (violationCount >= 3) points += 3;
        else if (violationCount >= 2) points += 2;

        return Math.min(points, 20);
    }

    int absenteePoints(Property property, Owner owner) {
        if (owner == null) {
            return 0;
        }
        AbsenteeStatus status = owner.getAbsenteeStatus();
        if (status == null) {
            status = classifier.classify(property, owner.getMailingAddress(), owner.getMailingState(),
                    owner.getMailingZip());
        }
        if (status == null) {
            return 5;
        }
        return switch (status) {
            case OUT_OF_STATE -> 15;
            case OUT_OF_COUNTY -> 8;
            case IN_COUNTY -> 0;
        };
    }

    static int priorViolationPoints(int violationCount) {
        if (violationCount >= 5) return 10;
        if (violationCount >= 3) return 7;
        if (violationCount >= 2) return 4;
        return 0;
    }

    static int equityPoints(BigDecimal assessedValue) {
        if (assessedValue == null || assessedValue.signum() <= 0) {
            return 3;
        }
        if (assessedValue.compareTo(EQUITY_HIGH) >= 0) return 10;
        if (assessedValue.compareTo(EQUITY_MID) >= 0) return 7;
        if (assessedValue.compareTo(EQUITY_LOW) >= 0) return 5;
        return 3;
    }

    // Future-dated cases count as opened today
    private static long daysBetween(LocalDate opened, LocalDate today) {
        return Math.max(0, ChronoUnit.DAYS.between(opened, today));
    }

    private static String lower(String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : "";
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
