package com.property.distress.rest;

import com.property.distress.core.model.DistressScore;
import com.property.distress.core.model.FactorScores;
import com.property.distress.core.model.LeadTier;
import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.UrgencyLevel;
import com.property.distress.ingest.BatchCommitException;
import com.property.distress.ingest.IngestionConfigurationException;
import com.property.distress.ingest.IngestionLoader;
import com.property.distress.ingest.IngestionResult;
import com.property.distress.ingest.SourceRow;
import com.property.distress.rest.dto.ErrorResponse;
import com.property.distress.rest.dto.IngestionResponse;
import com.property.distress.rest.dto.ScoreResponse;
import com.property.distress.scoring.ScoreBreakdown;
import com.property.distress.scoring.ScoreStore;
import com.property.distress.scoring.ScoringEngine;
import com.property.distress.scoring.ScoringRunResult;
import com.property.distress.scoring.ScoringService;
import com.property.distress.store.SaveOutcome;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("LeadResource Tests")
@ExtendWith(MockitoExtension.class)
class LeadResourceTest {

    private static final FactorScores FACTORS = new FactorScores(25, 20, 17, 15, 7, 3);

    @Mock
    private IngestionLoader loader;

    @Mock
    private ScoringEngine engine;

    @Mock
    private ScoringService scoringService;

    @Mock
    private ScoreStore scoreStore;

    private LeadResource resource;

    @BeforeEach
    void setUp() {
        resource = new LeadResource(loader, engine, scoringService, scoreStore);
    }

    private static DistressScore saved(long propertyId) {
        return new DistressScore(11L, propertyId, Instant.parse("2026-10-19T10:00:00Z"), 87,
                LeadTier.ULTRA_PLATINUM, UrgencyLevel.IMMEDIATE, FACTORS, true);
    }

    @Nested
    @DisplayName("Ingest")
    class Ingest {

        @Test
        @DisplayName("Should load rows numbered from 2 and return the counts")
        @SuppressWarnings("unchecked")
        void ingest() {
            IngestionResult result = new IngestionResult("violations", 2, 1, 1, 0, 0, 1, List.of());
            when(loader.loadFromRecords(eq(RecordType.VIOLATIONS), anyList(), eq(false))).thenReturn(result);

            Response response = resource.ingest("violations", false,
                    List.of(Map.of("Record Number", "CE-1"), Map.of("Record Number", "CE-2")));

            assertEquals(200, response.getStatus());
            IngestionResponse body = (IngestionResponse) response.getEntity();
            assertEquals(1, body.committed());
            assertEquals(50.0, body.matchRate(), 1e-9);

            ArgumentCaptor<List<SourceRow>> rows = ArgumentCaptor.forClass(List.class);
            verify(loader).loadFromRecords(eq(RecordType.VIOLATIONS), rows.capture(), eq(false));
            assertEquals(List.of(2L, 3L), rows.getValue().stream().map(SourceRow::rowNumber).toList());
        }

        @Test
        @DisplayName("Unknown record types are rejected")
        void unknownType() {
            Response response = resource.ingest("parking", true, List.of());

            assertEquals(400, response.getStatus());
            assertEquals("Unknown record type: parking", ((ErrorResponse) response.getEntity()).message());
            verifyNoInteractions(loader);
        }

        @Test
        @DisplayName("Extracts missing required columns are rejected")
        void configurationError() {
            when(loader.loadFromRecords(any(), anyList(), anyBoolean()))
                    .thenThrow(new IngestionConfigurationException("Missing required column 'Record Number'"));

            Response response = resource.ingest("violations", true, List.of(Map.of("x", "y")));

            assertEquals(400, response.getStatus());
        }

        @Test
        @DisplayName("Commit failures are reported without internals")
        void commitFailure() {
            when(loader.loadFromRecords(any(), anyList(), anyBoolean()))
                    .thenThrow(new BatchCommitException("batch 2 failed",
                            IngestionResult.empty("violations"), new IllegalStateException("duplicate key")));

            Response response = resource.ingest("violations", true, null);

            assertEquals(500, response.getStatus());
            ErrorResponse error = (ErrorResponse) response.getEntity();
            assertFalse(error.message().contains("duplicate key"));
        }
    }

    @Nested
    @DisplayName("Scoring")
    class Scoring {

        @Test
        @DisplayName("Should pass the save flag through")
        void run() {
            ScoringRunResult result = new ScoringRunResult(3, 0, 1, 61.0, Map.of(SaveOutcome.INSERTED, 3L));
            when(scoringService.scoreAll(true)).thenReturn(result);

            Response response = resource.runScoring(true);

            assertEquals(200, response.getStatus());
            assertSame(result, response.getEntity());
        }

        @Test
        @DisplayName("Run failures map to 500")
        void runFailure() {
            when(scoringService.scoreAll(anyBoolean())).thenThrow(new IllegalStateException("database unavailable"));

            assertEquals(500, resource.runScoring(false).getStatus());
        }

        @Test
        @DisplayName("Live scores are computed without a save date")
        void live() {
            when(engine.scoreProperty(5L)).thenReturn(new ScoreBreakdown(5L, FACTORS, 87, true,
                    LeadTier.ULTRA_PLATINUM, UrgencyLevel.IMMEDIATE));

            Response response = resource.liveScore(5L);

            assertEquals(200, response.getStatus());
            ScoreResponse body = (ScoreResponse) response.getEntity();
            assertEquals(87, body.finalScore());
            assertEquals("Ultra Platinum", body.leadTier());
            assertNull(body.scoreDate());
            assertEquals(Integer.valueOf(17), body.factors().get("violation_persistence"));
            verifyNoInteractions(scoreStore);
        }

        @Test
        @DisplayName("Live scores of unknown properties map to 404")
        void liveUnknown() {
            when(engine.scoreProperty(9L)).thenThrow(new IllegalArgumentException("Unknown property id: 9"));

            assertEquals(404, resource.liveScore(9L).getStatus());
        }
    }

    @Nested
    @DisplayName("Lead queries")
    class LeadQueries {

        @Test
        @DisplayName("Should return the latest saved score")
        void latest() {
            when(scoreStore.findLatest(5L)).thenReturn(Optional.of(saved(5L)));

            Response response = resource.latestScore(5L);

            assertEquals(200, response.getStatus());
            ScoreResponse body = (ScoreResponse) response.getEntity();
            assertEquals(Instant.parse("2026-10-19T10:00:00Z"), body.scoreDate());
            assertTrue(body.qualified());
        }

        @Test
        @DisplayName("Properties without a saved score map to 404")
        void latestMissing() {
            when(scoreStore.findLatest(6L)).thenReturn(Optional.empty());

            Response response = resource.latestScore(6L);

            assertEquals(404, response.getStatus());
            assertEquals("/api/v1/leads/properties/6/score", ((ErrorResponse) response.getEntity()).path());
        }

        @Test
        @DisplayName("Should list qualified leads")
        @SuppressWarnings("unchecked")
        void qualified() {
            when(scoreStore.findQualified(80)).thenReturn(List.of(saved(1L), saved(2L)));

            Response response = resource.qualified(80);

            assertEquals(200, response.getStatus());
            assertEquals(2, ((List<ScoreResponse>) response.getEntity()).size());
        }

        @Test
        @DisplayName("Out-of-range thresholds are rejected")
        void qualifiedOutOfRange() {
            assertEquals(400, resource.qualified(101).getStatus());
            assertEquals(400, resource.qualified(-1).getStatus());
            verifyNoInteractions(scoreStore);
        }

        @Test
        @DisplayName("Tier labels are accepted in any spelling")
        void tier() {
            when(scoreStore.findByLeadTier(LeadTier.ULTRA_PLATINUM)).thenReturn(List.of(saved(1L)));

            assertEquals(200, resource.byTier("ultra-platinum").getStatus());
            assertEquals(200, resource.byTier("ULTRA_PLATINUM").getStatus());
            assertEquals(400, resource.byTier("diamond").getStatus());
        }
    }
}
