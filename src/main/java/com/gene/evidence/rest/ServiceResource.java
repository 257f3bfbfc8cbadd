package com.gene.evidence.rest;

import com.gene.evidence.api.GeneQueryService;
import com.gene.evidence.api.InvalidQueryException;
import com.gene.evidence.api.ServiceStatus;
import com.gene.evidence.logging.LogContext;
import com.gene.evidence.rest.dto.DigestResponse;
import com.gene.evidence.rest.dto.ErrorResponse;
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
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Service-level endpoints: status, curated coverage, the gap report and the digest.
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Service", description = "Status, coverage, gap report and digest")
public class ServiceResource {
    private static final Logger log = LoggerFactory.getLogger(ServiceResource.class);
    private static final List<String> DIGEST_FORMATS = List.of("json", "md");

    private final GeneQueryService queries;

    @Inject
    public ServiceResource(GeneQueryService queries) {
        this.queries = queries;
    }

    /**
     * GET /api
     */
    @GET
    @Operation(summary = "List endpoints")
    public Response index() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("/api/status", "Tier availability and health");
        endpoints.put("/api/genes", "List genes (tier=curated|expanded|genome)");
        endpoints.put("/api/genes/{symbol}", "Single gene detail");
        endpoints.put("/api/coverage", "Source coverage over curated genes");
        endpoints.put("/api/gaps", "Curated research gap report");
        endpoints.put("/api/digest", "Digest (format=json|md)");
        endpoints.put("/api/enrichment/gap-candidates", "Derived gap candidates (min_score, limit)");
        endpoints.put("/api/enrichment/provenance", "Provenance of derived artifacts");
        endpoints.put("/api/enrichment/coverage-matrix", "Per-gene source flags");
        return Response.ok(Map.of(
                "service", GeneQueryService.SERVICE_NAME,
                "endpoints", endpoints)).build();
    }

    /**
     * GET /api/status
     */
    @GET
    @Path("/status")
    @Operation(summary = "Tier availability and health",
            description = "Always 200; availability of each tier is reported in the body.")
    @APIResponse(responseCode = "200", description = "Status report")
    public Response status() {
        try {
            ServiceStatus status = queries.status();
            return Response.ok(status).build();
        } catch (Exception e) {
            log.error("status.failed error={}", e.getMessage(), e);
            return GeneResource.internalError("/api/status");
        }
    }

    /**
     * GET /api/coverage
     */
    @GET
    @Path("/coverage")
    @Operation(summary = "Source coverage summary",
            description = "Per-source gene count and percent over the curated population.")
    @APIResponse(responseCode = "200", description = "Coverage summary")
    @APIResponse(responseCode = "503", description = "No curated data")
    public Response coverage() {
        try (LogContext ctx = LogContext.forQuery(LogContext.generateCorrelationId(), "coverage")) {
            return Response.ok(queries.coverage()).build();
        } catch (TierUnavailableException e) {
            return unavailable(e, "/api/coverage");
        } catch (Exception e) {
            log.error("coverage.failed error={}", e.getMessage(), e);
            return GeneResource.internalError("/api/coverage");
        }
    }

    /**
     * GET /api/gaps
     */
    @GET
    @Path("/gaps")
    @Operation(summary = "Research gap report", description = "The curated pipeline's gap report, unchanged.")
    @APIResponse(responseCode = "200", description = "Gap report")
    @APIResponse(responseCode = "503", description = "Gap report not available")
    public Response gaps() {
        try {
            return Response.ok(queries.gaps()).build();
        } catch (TierUnavailableException e) {
            return unavailable(e, "/api/gaps");
        } catch (Exception e) {
            log.error("gaps.failed error={}", e.getMessage(), e);
            return GeneResource.internalError("/api/gaps");
        }
    }

    /**
     * GET /api/digest?format=json|md
     */
    @GET
    @Path("/digest")
    @Produces({MediaType.APPLICATION_JSON, "text/markdown"})
    @Operation(summary = "Digest", description = "Markdown digest of tiers, coverage and top candidates.")
    @APIResponse(responseCode = "200", description = "Digest")
    @APIResponse(responseCode = "400", description = "Unknown format")
    public Response digest(@QueryParam("format") String format) {
        String resolved = format == null || format.isBlank() ? "json" : format.trim().toLowerCase(Locale.ROOT);
        try {
            if (!DIGEST_FORMATS.contains(resolved)) {
                throw new InvalidQueryException("Unknown format: " + format, DIGEST_FORMATS);
            }
            String markdown = queries.digest();
            if ("md".equals(resolved)) {
                return Response.ok(markdown, "text/markdown").build();
            }
            return Response.ok(DigestResponse.of(queries.today(), markdown), MediaType.APPLICATION_JSON).build();
        } catch (InvalidQueryException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .type(MediaType.APPLICATION_JSON)
                    .entity(ErrorResponse.badRequest(e.getMessage(), "/api/digest", e.getValidValues()))
                    .build();
        } catch (Exception e) {
            log.error("digest.failed error={}", e.getMessage(), e);
            return GeneResource.internalError("/api/digest");
        }
    }

    private Response unavailable(TierUnavailableException e, String path) {
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(ErrorResponse.serviceUnavailable(e.getMessage(), path, e.getHint()))
                .build();
    }
}
