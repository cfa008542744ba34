package com.property.distress.store.jdbc;

import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;
import com.property.distress.store.SignalFilter;
import com.property.distress.store.SignalRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Date;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Signal storage on a relational database. The {@code uq_signal_identity} constraint
 * rejects duplicates; a rejected row rolls back its whole batch.
 */
public class JdbcSignalRepository implements SignalRepository {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SignalDetailsCodec codec;
    private final RowMapper<SignalRecord> mapper;

    public JdbcSignalRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this(jdbcTemplate, transactionTemplate, new SignalDetailsCodec());
    }

    public JdbcSignalRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                SignalDetailsCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.codec = codec;
        this.mapper = (rs, rowNum) -> {
            RecordType type = RecordType.valueOf(rs.getString("record_type"));
            Date eventDate = rs.getDate("event_date");
            return new SignalRecord(
                    rs.getLong("id"),
                    rs.getLong("property_id"),
                    type,
                    rs.getString("external_key"),
                    rs.getInt("tax_year"),
                    rs.getString("record_subtype"),
                    eventDate != null ? eventDate.toLocalDate() : null,
                    this.codec.decode(type, rs.getString("details")),
                    rs.getTimestamp("created_at").toInstant());
        };
    }

    @Override
    public Set<String> findExternalKeys(RecordType recordType, SignalFilter filter) {
        SignalFilter effective = filter != null ? filter : SignalFilter.none();
        StringBuilder sql = new StringBuilder("SELECT external_key FROM signal_records WHERE record_type = ?");
        List<Object> args = new ArrayList<>();
        args.add(recordType.name());
        if (effective.taxYear() != null) {
            sql.append(" AND tax_year = ?");
            args.add(effective.taxYear());
        }
        if (effective.recordSubtype() != null) {
            sql.append(" AND UPPER(record_subtype) = UPPER(?)");
            args.add(effective.recordSubtype());
        }
        return new HashSet<>(jdbcTemplate.queryForList(sql.toString(), String.class, args.toArray()));
    }

    @Override
    public boolean exists(RecordType recordType, String externalKey, int taxYear) {
        Integer count = jdbcTemplate.queryForObject("""
                        SELECT COUNT(*) FROM signal_records
                        WHERE record_type = ? AND external_key = ? AND tax_year = ?""",
                Integer.class, recordType.name(), externalKey.trim(), taxYear);
        return count != null && count > 0;
    }

    @Override
    public void saveAll(List<SignalRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(records.size());
        for (SignalRecord record : records) {
            rows.add(new Object[]{
                    record.propertyId(),
                    record.recordType().name(),
                    record.externalKey(),
                    record.taxYear(),
                    record.recordSubtype(),
                    record.eventDate() != null ? Date.valueOf(record.eventDate()) : null,
                    codec.encode(record.details()),
                    Timestamp.from(record.createdAt())
            });
        }
        transactionTemplate.executeWithoutResult(status -> jdbcTemplate.batchUpdate("""
                INSERT INTO signal_records (property_id, record_type, external_key, tax_year,
                    record_subtype, event_date, details, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)""", rows));
    }

    @Override
    public List<SignalRecord> findByProperty(long propertyId, RecordType recordType) {
        if (recordType == null) {
            return jdbcTemplate.query("SELECT * FROM signal_records WHERE property_id = ? ORDER BY id",
                    mapper, propertyId);
        }
        return jdbcTemplate.query("""
                        SELECT * FROM signal_records
                        WHERE property_id = ? AND record_type = ?
                        ORDER BY id""",
                mapper, propertyId, recordType.name());
    }

    @Override
    public List<Long> findPropertyIdsWithSignals() {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT property_id FROM signal_records ORDER BY property_id", Long.class);
    }

    @Override
    public long count(RecordType recordType) {
        Long count = recordType == null
                ? jdbcTemplate.queryForObject("SELECT COUNT(*) FROM signal_records", Long.class)
                : jdbcTemplate.queryForObject("SELECT COUNT(*) FROM signal_records WHERE record_type = ?",
                        Long.class, recordType.name());
        return count != null ? count : 0L;
    }
}
