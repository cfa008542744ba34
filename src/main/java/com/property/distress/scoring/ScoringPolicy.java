package com.property.distress.scoring;

import com.property.distress.core.model.LeadTier;
import com.property.distress.core.model.UrgencyLevel;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunable parts of the scoring model: severity keyword groups, the qualification threshold,
 * and the lead-tier and urgency breakpoints. Factor caps are fixed.
 */
public class ScoringPolicy {

    public static final int MAX_SEVERITY = 25;

    private static final int DEFAULT_QUALIFICATION_THRESHOLD = 70;

    private final List<SeverityGroup> severityGroups;
    private final int qualificationThreshold;
    private final int ultraPlatinumFloor;
    private final int platinumFloor;
    private final int goldFloor;
    private final int silverFloor;
    private final int immediateFloor;
    private final int highFloor;
    private final int mediumFloor;

    private ScoringPolicy(Builder builder) {
        this.severityGroups = List.copyOf(builder.severityGroups);
        this.qualificationThreshold = builder.qualificationThreshold;
        this.ultraPlatinumFloor = builder.ultraPlatinumFloor;
        this.platinumFloor = builder.platinumFloor;
        this.goldFloor = builder.goldFloor;
        this.silverFloor = builder.silverFloor;
        this.immediateFloor = builder.immediateFloor;
        this.highFloor = builder.highFloor;
        this.mediumFloor = builder.mediumFloor;
    }

    /**
     * Groups in the order they are checked; the first match decides the severity.
     */
    public List<SeverityGroup> getSeverityGroups() {
        return severityGroups;
    }

    public int getQualificationThreshold() {
        return qualificationThreshold;
    }

    public boolean isQualified(int total) {
        return total >= qualificationThreshold;
    }

    public LeadTier leadTierFor(int total) {
        if (total >= ultraPlatinumFloor) return LeadTier.ULTRA_PLATINUM;
        if (total >= platinumFloor) return LeadTier.PLATINUM;
        if (total >= goldFloor) return LeadTier.GOLD;
        if (total >= silverFloor) return LeadTier.SILVER;
        return LeadTier.BRONZE;
    }

    public UrgencyLevel urgencyFor(int total) {
        if (total >= immediateFloor) return UrgencyLevel.IMMEDIATE;
        if (total >= highFloor) return UrgencyLevel.HIGH;
        if (total >= mediumFloor) return UrgencyLevel.MEDIUM;
        return UrgencyLevel.LOW;
    }

    public static ScoringPolicy defaults() {
        return builder().build();
    }

    /**
     * Keyword groups for Hillsborough County code-enforcement case types. The environmental
     * group is checked before the proactive one, so "proactive water enforcement" scores 8.
     */
    public static List<SeverityGroup> defaultSeverityGroups() {
        return List.of(
                SeverityGroup.of("critical", 25, "structural condemnation", "unsafe", "condemned"),
                SeverityGroup.of("major", 20, "fire marshal", "enforcement complaint", "generalized housing"),
                SeverityGroup.of("environmental", 8, "water enforcement", "fertilizer", "right of way"),
                SeverityGroup.of("proactive", 15, "citizen board support code", "proactive", "community outreach"),
                SeverityGroup.of("minor", 3, "consumer protection", "locksmith", "vehicle for hire",
                        "trespass tow", "false alarm", "ada gas pumping"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<SeverityGroup> severityGroups = new ArrayList<>(defaultSeverityGroups());
        private int qualificationThreshold = DEFAULT_QUALIFICATION_THRESHOLD;
        private int ultraPlatinumFloor = 85;
        private int platinumFloor = 75;
        private int goldFloor = 65;
        private int silverFloor = 55;
        private int immediateFloor = 85;
        private int highFloor = 75;
        private int mediumFloor = 60;

        public Builder severityGroups(List<SeverityGroup> severityGroups) {
            this.severityGroups = new ArrayList<>(severityGroups);
            return this;
        }

        public Builder qualificationThreshold(int qualificationThreshold) {
            this.qualificationThreshold = qualificationThreshold;
            return this;
        }

        public Builder tierFloors(int ultraPlatinum, int platinum, int gold, int silver) {
            this.ultraPlatinumFloor = ultraPlatinum;
            this.platinumFloor = platinum;
            this.goldFloor = gold;
            this.silverFloor = silver;
            return this;
        }

        public Builder urgencyFloors(int immediate, int high, int medium) {
            this.immediateFloor = immediate;
            this.highFloor = high;
            this.mediumFloor = medium;
            return this;
        }

        public ScoringPolicy build() {
            if (qualificationThreshold < 0 || qualificationThreshold > 100) {
                throw new IllegalArgumentException("qualificationThreshold must be between 0 and 100");
            }
            if (!(ultraPlatinumFloor >= platinumFloor && platinumFloor >= goldFloor && goldFloor >= silverFloor)) {
                throw new IllegalArgumentException("Tier floors must be non-increasing");
            }
            if (!(immediateFloor >= highFloor && highFloor >= mediumFloor)) {
                throw new IllegalArgumentException("Urgency floors must be non-increasing");
            }
            return new ScoringPolicy(this);
        }
    }
}
