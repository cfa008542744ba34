package com.property.distress.rest;

import com.property.distress.core.model.DistressScore;
import com.property.distress.core.model.LeadTier;
import com.property.distress.core.model.RecordType;
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
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST resource for ingestion, scoring runs and lead queries.
 */
@Path("/api/v1/leads")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Leads", description = "Ingest public records and query distress-scored leads")
public class LeadResource {
    private static final Logger log = LoggerFactory.getLogger(LeadResource.class);
    private static final String BASE = "/api/v1/leads";
    private static final String INTERNAL_ERROR = "An internal error occurred. Check server logs for details.";

    private final IngestionLoader loader;
    private final ScoringEngine engine;
    private final ScoringService scoringService;
    private final ScoreStore scoreStore;

    @Inject
    public LeadResource(IngestionLoader loader, ScoringEngine engine, ScoringService scoringService,
                        ScoreStore scoreStore) {
        this.loader = loader;
        this.engine = engine;
        this.scoringService = scoringService;
        this.scoreStore = scoreStore;
    }

    /**
     * POST /api/v1/leads/ingest/{recordType}
     */
    @POST
    @Path("/ingest/{recordType}")
    @Operation(summary = "Ingest an extract",
            description = "Loads a JSON array of extract rows (column name to value) as signal records.")
    @APIResponse(responseCode = "200", description = "Rows processed; per-row failures are listed in the body")
    @APIResponse(responseCode = "400", description = "Unknown record type or unusable extract")
    public Response ingest(@PathParam("recordType") String recordType,
                           @QueryParam("skipDuplicates") @DefaultValue("true") boolean skipDuplicates,
                           List<Map<String, Object>> body) {
        String path = BASE + "/ingest/" + recordType;
        try {
            RecordType type = RecordType.fromKey(recordType);
            List<SourceRow> rows = new ArrayList<>();
            if (body != null) {
                // Row 1 is the header in file extracts; keep the numbering consistent
                for (int i = 0; i < body.size(); i++) {
                    rows.add(SourceRow.of(i + 2L, body.get(i)));
                }
            }
            IngestionResult result = loader.loadFromRecords(type, rows, skipDuplicates);
            return Response.ok(IngestionResponse.from(result)).build();
        } catch (IllegalArgumentException | IngestionConfigurationException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (BatchCommitException e) {
            log.error("ingest.failed type={} partial={} error={}", recordType, e.getPartialResult(), e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR, path))
                    .build();
        } catch (Exception e) {
            log.error("ingest.failed type={} error={}", recordType, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR, path))
                    .build();
        }
    }

    /**
     * POST /api/v1/leads/scoring/run
     */
    @POST
    @Path("/scoring/run")
    @Operation(summary = "Score all properties with signals")
    @APIResponse(responseCode = "200", description = "Run summary")
    public Response runScoring(@QueryParam("save") @DefaultValue("true") boolean save) {
        try {
            ScoringRunResult result = scoringService.scoreAll(save);
            return Response.ok(result).build();
        } catch (Exception e) {
            log.error("score.run_failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR, BASE + "/scoring/run"))
                    .build();
        }
    }

    /**
     * GET /api/v1/leads/qualified
     */
    @GET
    @Path("/qualified")
    @Operation(summary = "Qualified leads", description = "Latest qualified score per property, highest first.")
    public Response qualified(@QueryParam("minScore") @DefaultValue("70") int minScore) {
        String path = BASE + "/qualified";
        if (minScore < 0 || minScore > 100) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest("minScore must be between 0 and 100", path))
                    .build();
        }
        try {
            return Response.ok(toResponses(scoreStore.findQualified(minScore))).build();
        } catch (Exception e) {
            log.error("leads.qualified_failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR, path))
                    .build();
        }
    }

    /**
     * GET /api/v1/leads/tier/{tier}
     */
    @GET
    @Path("/tier/{tier}")
    @Operation(summary = "Leads in a tier", description = "Accepts labels such as 'platinum' or 'ultra-platinum'.")
    @APIResponse(responseCode = "400", description = "Unknown tier")
    public Response byTier(@PathParam("tier") String tier) {
        String path = BASE + "/tier/" + tier;
        try {
            LeadTier leadTier = LeadTier.fromLabel(tier);
            return Response.ok(toResponses(scoreStore.findByLeadTier(leadTier))).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("leads.tier_failed tier={} error={}", tier, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR, path))
                    .build();
        }
    }

    /**
     * GET /api/v1/leads/properties/{id}/score
     */
    @GET
    @Path("/properties/{id}/score")
    @Operation(summary = "Latest saved score of a property")
    @APIResponse(responseCode = "404", description = "No score has been saved for the property")
    public Response latestScore(@PathParam("id") long propertyId) {
        String path = BASE + "/properties/" + propertyId + "/score";
        try {
            Optional<DistressScore> score = scoreStore.findLatest(propertyId);
            if (score.isEmpty()) {
                return Response.status(Response.Status.NOT_FOUND)
                        .entity(ErrorResponse.notFound("No score for property " + propertyId, path))
                        .build();
            }
            return Response.ok(ScoreResponse.from(score.get())).build();
        } catch (Exception e) {
            log.error("leads.score_failed propertyId={} error={}", propertyId, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR, path))
                    .build();
        }
    }

    /**
     * GET /api/v1/leads/properties/{id}/score/live
     */
    @GET
    @Path("/properties/{id}/score/live")
    @Operation(summary = "Compute a property's score now without saving it")
    @APIResponse(responseCode = "404", description = "Unknown property")
    public Response liveScore(@PathParam("id") long propertyId) {
        String path = BASE + "/properties/" + propertyId + "/score/live";
        try {
            ScoreBreakdown breakdown = engine.scoreProperty(propertyId);
            return Response.ok(ScoreResponse.from(breakdown)).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(ErrorResponse.notFound(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("leads.live_score_failed propertyId={} error={}", propertyId, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR, path))
                    .build();
        }
    }

    private static List<ScoreResponse> toResponses(List<DistressScore> scores) {
        return scores.stream().map(ScoreResponse::from).toList();
    }
}
