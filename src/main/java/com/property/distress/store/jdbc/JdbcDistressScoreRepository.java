package com.property.distress.store.jdbc;

import com.property.distress.core.model.DistressScore;
import com.property.distress.core.model.FactorScores;
import com.property.distress.core.model.LeadTier;
import com.property.distress.core.model.UrgencyLevel;
import com.property.distress.store.DistressScoreRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Score history on a relational database.
 *
 * <p>{@code UNIQUE (property_id, score_day)} plus a single MERGE statement makes the
 * per-day upsert race-free: two concurrent saves for one property on one day end up
 * as one row holding the last writer's values.</p>
 */
public class JdbcDistressScoreRepository implements DistressScoreRepository {

    private static final String COLUMNS = """
            id, property_id, score_date, final_score, lead_tier, urgency_level, violation_severity,
            days_open, violation_persistence, absentee_ownership, prior_violations, equity, qualified""";

    private static final String LATEST_PER_PROPERTY = """
            SELECT %s FROM distress_scores d
            WHERE d.score_day = (SELECT MAX(d2.score_day) FROM distress_scores d2
                                 WHERE d2.property_id = d.property_id)
            """.formatted(COLUMNS);

    private static final String UPSERT = """
            MERGE INTO distress_scores t
            USING (SELECT CAST(? AS BIGINT) AS property_id, CAST(? AS DATE) AS score_day) s
            ON (t.property_id = s.property_id AND t.score_day = s.score_day)
            WHEN MATCHED THEN UPDATE SET
                score_date = ?, final_score = ?, lead_tier = ?, urgency_level = ?,
                violation_severity = ?, days_open = ?, violation_persistence = ?,
                absentee_ownership = ?, prior_violations = ?, equity = ?, qualified = ?
            WHEN NOT MATCHED THEN INSERT (property_id, score_day, score_date, final_score, lead_tier,
                urgency_level, violation_severity, days_open, violation_persistence,
                absentee_ownership, prior_violations, equity, qualified)
            VALUES (s.property_id, s.score_day, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    private static final RowMapper<DistressScore> MAPPER = (rs, rowNum) -> new DistressScore(
            rs.getLong("id"),
            rs.getLong("property_id"),
            rs.getTimestamp("score_date").toInstant(),
            rs.getInt("final_score"),
            LeadTier.valueOf(rs.getString("lead_tier")),
            UrgencyLevel.valueOf(rs.getString("urgency_level")),
            new FactorScores(
                    rs.getInt("violation_severity"),
                    rs.getInt("days_open"),
                    rs.getInt("violation_persistence"),
                    rs.getInt("absentee_ownership"),
                    rs.getInt("prior_violations"),
                    rs.getInt("equity")),
            rs.getBoolean("qualified"));

    private final JdbcTemplate jdbcTemplate;

    public JdbcDistressScoreRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<DistressScore> findForDay(long propertyId, LocalDate day) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM distress_scores WHERE property_id = ? AND score_day = ?",
                MAPPER, propertyId, Date.valueOf(day)).stream().findFirst();
    }

    @Override
    public Optional<DistressScore> findLatest(long propertyId) {
        return jdbcTemplate.query("""
                        SELECT %s FROM distress_scores
                        WHERE property_id = ?
                        ORDER BY score_day DESC, score_date DESC
                        LIMIT 1""".formatted(COLUMNS),
                MAPPER, propertyId).stream().findFirst();
    }

    @Override
    public DistressScore upsertForDay(DistressScore score, LocalDate day) {
        Timestamp scoreDate = Timestamp.from(score.scoreDate());
        FactorScores factors = score.factorScores();
        Object[] values = {
                scoreDate,
                score.finalScore(),
                score.leadTier().name(),
                score.urgencyLevel().name(),
                factors.violationSeverity(),
                factors.daysOpen(),
                factors.violationPersistence(),
                factors.absenteeOwnership(),
                factors.priorViolations(),
                factors.equity(),
                score.qualified()
        };
        Object[] args = new Object[2 + values.length * 2];
        args[0] = score.propertyId();
        args[1] = Date.valueOf(day);
        System.arraycopy(values, 0, args, 2, values.length);
        System.arraycopy(values, 0, args, 2 + values.length, values.length);
        jdbcTemplate.update(UPSERT, args);

        return findForDay(score.propertyId(), day)
                .orElseThrow(() -> new IllegalStateException(
                        "Score for property " + score.propertyId() + " on " + day + " vanished after upsert"));
    }

    @Override
    public List<DistressScore> findLatestQualified(int minScore) {
        return jdbcTemplate.query(LATEST_PER_PROPERTY + """
                        AND d.qualified = TRUE AND d.final_score >= ?
                        ORDER BY d.final_score DESC, d.property_id""",
                MAPPER, minScore);
    }

    @Override
    public List<DistressScore> findLatestByLeadTier(LeadTier tier) {
        return jdbcTemplate.query(LATEST_PER_PROPERTY + """
                        AND d.lead_tier = ?
                        ORDER BY d.final_score DESC, d.property_id""",
                MAPPER, tier.name());
    }

    @Override
    public List<DistressScore> findHistory(long propertyId) {
        return jdbcTemplate.query("""
                        SELECT %s FROM distress_scores
                        WHERE property_id = ?
                        ORDER BY score_day""".formatted(COLUMNS),
                MAPPER, propertyId);
    }
}
