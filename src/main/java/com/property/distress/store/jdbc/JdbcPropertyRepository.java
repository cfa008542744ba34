package com.property.distress.store.jdbc;

import com.property.distress.core.model.AbsenteeStatus;
import com.property.distress.core.model.Owner;
import com.property.distress.core.model.Property;
import com.property.distress.store.PropertyRepository;
import com.property.distress.store.PropertyWithOwner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Property and owner storage on a relational database through Spring's JdbcTemplate.
 */
public class JdbcPropertyRepository implements PropertyRepository {

    private static final String PROPERTY_COLUMNS = """
            id, parcel_id, address, normalized_address, city, state, zip, property_type,
            assessed_market_value, taxable_value, created_at""";

    private static final String OWNER_COLUMNS = """
            id, property_id, owner_name, normalized_name, mailing_address, mailing_city,
            mailing_state, mailing_zip, absentee_status""";

    private static final RowMapper<Property> PROPERTY_MAPPER = (rs, rowNum) -> Property.builder()
            .id(rs.getLong("id"))
            .parcelId(rs.getString("parcel_id"))
            .address(rs.getString("address"))
            .normalizedAddress(rs.getString("normalized_address"))
            .city(rs.getString("city"))
            .state(rs.getString("state"))
            .zip(rs.getString("zip"))
            .propertyType(rs.getString("property_type"))
            .assessedMarketValue(rs.getBigDecimal("assessed_market_value"))
            .taxableValue(rs.getBigDecimal("taxable_value"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .build();

    private static final RowMapper<Owner> OWNER_MAPPER = (rs, rowNum) -> Owner.builder()
            .id(rs.getLong("id"))
            .propertyId(rs.getLong("property_id"))
            .ownerName(rs.getString("owner_name"))
            .normalizedName(rs.getString("normalized_name"))
            .mailingAddress(rs.getString("mailing_address"))
            .mailingCity(rs.getString("mailing_city"))
            .mailingState(rs.getString("mailing_state"))
            .mailingZip(rs.getString("mailing_zip"))
            .absenteeStatus(rs.getString("absentee_status") != null
                    ? AbsenteeStatus.valueOf(rs.getString("absentee_status")) : null)
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcPropertyRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public Optional<Property> findById(long id) {
        return jdbcTemplate.query("SELECT " + PROPERTY_COLUMNS + " FROM properties WHERE id = ?",
                PROPERTY_MAPPER, id).stream().findFirst();
    }

    @Override
    public Optional<Property> findByParcelId(String parcelId) {
        if (parcelId == null) {
            return Optional.empty();
        }
        return jdbcTemplate.query("SELECT " + PROPERTY_COLUMNS + " FROM properties WHERE parcel_id = ?",
                PROPERTY_MAPPER, parcelId.trim()).stream().findFirst();
    }

    @Override
    public Optional<Property> findFirstByNormalizedAddress(String normalizedAddress) {
        if (normalizedAddress == null || normalizedAddress.isEmpty()) {
            return Optional.empty();
        }
        return jdbcTemplate.query("""
                        SELECT %s FROM properties
                        WHERE normalized_address = ?
                        ORDER BY id
                        LIMIT 1""".formatted(PROPERTY_COLUMNS),
                PROPERTY_MAPPER, normalizedAddress).stream().findFirst();
    }

    @Override
    public List<Property> findAddressCandidates(int limit) {
        return jdbcTemplate.query("""
                        SELECT %s FROM properties
                        WHERE normalized_address <> ''
                        ORDER BY id
                        LIMIT ?""".formatted(PROPERTY_COLUMNS),
                PROPERTY_MAPPER, limit);
    }

    @Override
    public Optional<Owner> findOwnerByPropertyId(long propertyId) {
        return jdbcTemplate.query("SELECT " + OWNER_COLUMNS + " FROM owners WHERE property_id = ?",
                OWNER_MAPPER, propertyId).stream().findFirst();
    }

    @Override
    public Optional<Owner> findFirstOwnerByNormalizedName(String normalizedName) {
        if (normalizedName == null || normalizedName.isEmpty()) {
            return Optional.empty();
        }
        return jdbcTemplate.query("""
                        SELECT %s FROM owners
                        WHERE UPPER(normalized_name) = UPPER(?)
                        ORDER BY property_id
                        LIMIT 1""".formatted(OWNER_COLUMNS),
                OWNER_MAPPER, normalizedName).stream().findFirst();
    }

    @Override
    public List<Owner> findOwnersByNamePattern(String likePattern, int limit) {
        return jdbcTemplate.query("""
                        SELECT %s FROM owners
                        WHERE UPPER(normalized_name) LIKE UPPER(?) ESCAPE '\\'
                        ORDER BY property_id
                        LIMIT ?""".formatted(OWNER_COLUMNS),
                OWNER_MAPPER, likePattern, limit);
    }

    @Override
    public List<Owner> findOwners(int limit) {
        return jdbcTemplate.query("SELECT " + OWNER_COLUMNS + " FROM owners ORDER BY property_id LIMIT ?",
                OWNER_MAPPER, limit);
    }

    @Override
    public Set<String> findAllParcelIds() {
        return new HashSet<>(jdbcTemplate.queryForList("SELECT parcel_id FROM properties", String.class));
    }

    @Override
    public List<Property> saveAll(List<PropertyWithOwner> batch) {
        List<Property> saved = transactionTemplate.execute(status -> {
            List<Property> result = new ArrayList<>(batch.size());
            for (PropertyWithOwner item : batch) {
                Property property = insertProperty(item.property());
                if (item.owner() != null) {
                    insertOwner(item.owner(), property.getId());
                }
                result.add(property);
            }
            return result;
        });
        return saved != null ? saved : List.of();
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM properties", Long.class);
        return count != null ? count : 0L;
    }

    private Property insertProperty(Property property) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement("""
                    INSERT INTO properties (parcel_id, address, normalized_address, city, state, zip,
                        property_type, assessed_market_value, taxable_value, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""", Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, property.getParcelId());
            ps.setString(2, property.getAddress());
            ps.setString(3, property.getNormalizedAddress());
            ps.setString(4, property.getCity());
            ps.setString(5, property.getState());
            ps.setString(6, property.getZip());
            ps.setString(7, property.getPropertyType());
            ps.setBigDecimal(8, property.getAssessedMarketValue());
            ps.setBigDecimal(9, property.getTaxableValue());
            ps.setTimestamp(10, Timestamp.from(property.getCreatedAt()));
            return ps;
        }, keyHolder);
        return Property.builder(property).id(JdbcKeys.generatedId(keyHolder)).build();
    }

    private void insertOwner(Owner owner, long propertyId) {
        jdbcTemplate.update("""
                        INSERT INTO owners (property_id, owner_name, normalized_name, mailing_address,
                            mailing_city, mailing_state, mailing_zip, absentee_status)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?)""",
                propertyId,
                owner.getOwnerName(),
                owner.getNormalizedName(),
                owner.getMailingAddress(),
                owner.getMailingCity(),
                owner.getMailingState(),
                owner.getMailingZip(),
                owner.getAbsenteeStatus() != null ? owner.getAbsenteeStatus().name() : null);
    }
}
