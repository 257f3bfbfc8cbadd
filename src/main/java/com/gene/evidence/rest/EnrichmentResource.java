package com.gene.evidence.rest;

import com.gene.evidence.api.CandidatePage;
import com.gene.evidence.api.GeneQueryService;
import com.gene.evidence.api.InvalidQueryException;
import com.gene.evidence.logging.LogContext;
import com.gene.evidence.rest.dto.CandidateListResponse;
import com.gene.evidence.rest.dto.ErrorResponse;
import com.gene.evidence.rest.dto.ProvenanceAuditResponse;
import com.gene.evidence.tier.TierUnavailableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST resource for derived artifacts: gap candidates, provenance and the coverage matrix.
 */
@Path("/api/enrichment")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Enrichment", description = "Derived gap candidates and artifact provenance")
public class EnrichmentResource {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentResource.class);

    private final GeneQueryService queries;

    @Inject
    public EnrichmentResource(GeneQueryService queries) {
        this.queries = queries;
    }

    /**
     * GET /api/enrichment/gap-candidates?min_score=&amp;limit=
     */
    @GET
    @Path("/gap-candidates")
    @Operation(summary = "List gap candidates",
            description = "Candidates from the last derivation run, filtered by minimum score and limited in count. "
                    + "Scores are returned as stored.")
    @APIResponse(responseCode = "200", description = "Candidates")
    @APIResponse(responseCode = "400", description = "Malformed min_score or limit")
    @APIResponse(responseCode = "503", description = "Candidate snapshot absent")
    public Response gapCandidates(
            @Parameter(description = "Minimum confidence score, integer >= 0") @QueryParam("min_score") String minScore,
            @Parameter(description = "Maximum number of candidates, > 0") @QueryParam("limit") String limit) {
        String path = "/api/enrichment/gap-candidates";
        try (LogContext ctx = LogContext.forQuery(LogContext.generateCorrelationId(), "gapCandidates")) {
            CandidatePage page = queries.candidates(minScore, limit);
            log.debug("gapCandidates.served returned={} matching={}", page.candidates().size(), page.matchingCount());
            return Response.ok(CandidateListResponse.from(page)).build();
        } catch (InvalidQueryException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (TierUnavailableException e) {
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(ErrorResponse.serviceUnavailable(e.getMessage(), path, e.getHint()))
                    .build();
        } catch (Exception e) {
            log.error("gapCandidates.failed error={}", e.getMessage(), e);
            return GeneResource.internalError(path);
        }
    }

    /**
     * GET /api/enrichment/provenance
     */
    @GET
    @Path("/provenance")
    @Operation(summary = "Provenance audit",
            description = "Provenance blocks found across derived artifacts; empty when there are none.")
    @APIResponse(responseCode = "200", description = "Provenance blocks")
    public Response provenance() {
        try {
            return Response.ok(ProvenanceAuditResponse.from(queries.provenanceAudit())).build();
        } catch (Exception e) {
            log.error("provenance.failed error={}", e.getMessage(), e);
            return GeneResource.internalError("/api/enrichment/provenance");
        }
    }

    /**
     * GET /api/enrichment/coverage-matrix
     */
    @GET
    @Path("/coverage-matrix")
    @Operation(summary = "Coverage matrix", description = "Source flags per curated gene.")
    @APIResponse(responseCode = "200", description = "Matrix")
    @APIResponse(responseCode = "503", description = "No curated data")
    public Response coverageMatrix() {
        String path = "/api/enrichment/coverage-matrix";
        try {
            return Response.ok(queries.coverageMatrix()).build();
        } catch (TierUnavailableException e) {
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(ErrorResponse.serviceUnavailable(e.getMessage(), path, e.getHint()))
                    .build();
        } catch (Exception e) {
            log.error("coverageMatrix.failed error={}", e.getMessage(), e);
            return GeneResource.internalError(path);
        }
    }
}
