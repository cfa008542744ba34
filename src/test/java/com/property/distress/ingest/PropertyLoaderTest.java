package com.property.distress.ingest;

import com.property.distress.cache.CacheConfig;
import com.property.distress.core.model.AbsenteeStatus;
import com.property.distress.core.model.Owner;
import com.property.distress.core.model.Property;
import com.property.distress.metrics.NoOpMetricsService;
import com.property.distress.resolve.PropertyResolver;
import com.property.distress.resolve.ResolutionRequest;
import com.property.distress.resolve.ResolverOptions;
import com.property.distress.rules.AbsenteeClassifier;
import com.property.distress.rules.Normalizer;
import com.property.distress.store.InMemoryPropertyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PropertyLoader Tests")
class PropertyLoaderTest {

    private InMemoryPropertyRepository repository;
    private PropertyResolver resolver;
    private PropertyLoader loader;

    @BeforeEach
    void setUp() {
        Normalizer normalizer = new Normalizer();
        repository = new InMemoryPropertyRepository();
        resolver = new PropertyResolver(repository, normalizer, ResolverOptions.defaults(),
                CacheConfig.defaults().createCache(), new NoOpMetricsService());
        loader = new PropertyLoader(repository, normalizer, new AbsenteeClassifier(normalizer, "FL"), resolver,
                IngestionOptions.builder().batchSize(2).build(), new NoOpMetricsService());
    }

    private static SourceRow master(long line, String folio, String siteAddress, String owner, String mailing,
                                    String state, String zip) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("FOLIO", folio);
        values.put("SITE_ADDR", siteAddress);
        values.put("SITE_CITY", "Tampa");
        values.put("SITE_ZIP", "33602");
        values.put("OWNER", owner);
        values.put("ADDR_1", mailing);
        values.put("STATE", state);
        values.put("ZIP", zip);
        values.put("ASD_VAL", "$320,000");
        values.put("TYPE", "SINGLE FAMILY");
        return SourceRow.of(line, values);
    }

    @Test
    @DisplayName("Should store normalized keys and absentee status")
    void loadsProperties() {
        IngestionResult result = loader.loadFromRecords(List.of(
                master(2, "A-100", "123 Main Street", "Smith, John", "9 Broadway", "NY", "10001"),
                master(3, "A-200", "200 Oak Avenue", "Doe Jane", "200 Oak Ave", "FL", "33602")), true);

        assertEquals(2, result.matched());
        assertEquals(2, result.committed());
        assertEquals("master", result.source());

        Property property = repository.findByParcelId("A-100").orElseThrow();
        assertEquals("123 main st", property.getNormalizedAddress());
        assertEquals(new BigDecimal("320000"), property.getAssessedMarketValue());
        Owner owner = repository.findOwnerByPropertyId(property.getId()).orElseThrow();
        assertEquals("SMITH JOHN", owner.getNormalizedName());
        assertEquals(AbsenteeStatus.OUT_OF_STATE, owner.getAbsenteeStatus());

        Property occupied = repository.findByParcelId("A-200").orElseThrow();
        assertEquals(AbsenteeStatus.IN_COUNTY,
                repository.findOwnerByPropertyId(occupied.getId()).orElseThrow().getAbsenteeStatus());
    }

    @Test
    @DisplayName("Parcels already stored or repeated are skipped")
    void skipsDuplicates() {
        loader.loadFromRecords(List.of(master(2, "A-100", "1 Main St", "Doe Jane", null, null, null)), true);

        IngestionResult result = loader.loadFromRecords(List.of(
                master(2, "A-100", "1 Main St", "Doe Jane", null, null, null),
                master(3, "A-300", "3 Main St", "Roe Rick", null, null, null),
                master(4, "A-300", "3 Main St", "Roe Rick", null, null, null)), true);

        assertEquals(1, result.matched());
        assertEquals(2, result.skipped());
        assertEquals(2, repository.count());
        assertEquals(0.0, loader.loadFromRecords(List.of(), true).matchRate());
    }

    @Test
    @DisplayName("A row without an owner stores only the property")
    void withoutOwner() {
        loader.loadFromRecords(List.of(master(2, "A-100", "1 Main St", null, null, null, null)), true);

        Property property = repository.findByParcelId("A-100").orElseThrow();
        assertTrue(repository.findOwnerByPropertyId(property.getId()).isEmpty());
    }

    @Test
    @DisplayName("Rows with a blank parcel or a bad amount fail individually")
    void rowFailures() {
        IngestionResult result = loader.loadFromRecords(List.of(
                master(2, " ", "1 Main St", "Doe Jane", null, null, null),
                master(3, "A-200", "2 Main St", "Doe Jane", null, null, null).with("ASD_VAL", "n/a"),
                master(4, "A-300", "3 Main St", "Doe Jane", null, null, null)), true);

        assertEquals(2, result.failed());
        assertEquals(1, result.matched());
        assertEquals(2, result.errors().get(0).rowNumber());
        assertEquals("A-200", result.errors().get(1).externalKey());
    }

    @Test
    @DisplayName("A roll without FOLIO is a configuration error")
    void missingFolio() {
        List<SourceRow> rows = List.of(SourceRow.of(2, Map.of("PARCEL", "A-1")));

        assertThrows(IngestionConfigurationException.class, () -> loader.loadFromRecords(rows, true));
    }

    @Test
    @DisplayName("Committing properties empties the resolution cache")
    void invalidatesCache() {
        loader.loadFromRecords(List.of(master(2, "A-100", "1 Main St", "Doe Jane", null, null, null)), true);
        assertTrue(resolver.resolve(ResolutionRequest.byParcelId("A-100")).isPresent());
        assertEquals(1, resolver.getCache().getStats().estimatedSize());

        loader.loadFromRecords(List.of(master(2, "A-200", "2 Main St", "Roe Rick", null, null, null)), true);

        assertEquals(0, resolver.getCache().getStats().estimatedSize());
    }
}
