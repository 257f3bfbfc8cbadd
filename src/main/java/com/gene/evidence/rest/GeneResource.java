package com.gene.evidence.rest;

import com.gene.evidence.api.GeneDetail;
import com.gene.evidence.api.GeneListResult;
import com.gene.evidence.api.GeneNotFoundException;
import com.gene.evidence.api.GeneQueryService;
import com.gene.evidence.api.InvalidQueryException;
import com.gene.evidence.logging.LogContext;
import com.gene.evidence.rest.dto.ErrorResponse;
import com.gene.evidence.rest.dto.GeneDetailResponse;
import com.gene.evidence.rest.dto.GeneListResponse;
import com.gene.evidence.tier.TierUnavailableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
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
 * REST resource for gene listing and lookup across tiers.
 */
@Path("/api/genes")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Genes", description = "List genes by tier and look up single genes")
public class GeneResource {
    private static final Logger log = LoggerFactory.getLogger(GeneResource.class);
    private static final String PATH = "/api/genes";

    private final GeneQueryService queries;

    @Inject
    public GeneResource(GeneQueryService queries) {
        this.queries = queries;
    }

    /**
     * Lists genes of a tier.
     *
     * GET /api/genes?tier=curated|expanded|genome
     */
    @GET
    @Operation(summary = "List genes by tier",
            description = "Returns the symbols of the requested tier. An empty expanded tier falls back to curated "
                    + "and the response carries _fallback and _reason.")
    @APIResponse(responseCode = "200", description = "Tier served (possibly as a fallback)")
    @APIResponse(responseCode = "400", description = "Unknown tier; response lists the valid tier names")
    @APIResponse(responseCode = "503", description = "Tier unavailable; response carries a remediation hint")
    public Response listGenes(
            @Parameter(description = "curated, expanded or genome") @QueryParam("tier") String tier) {
        try (LogContext ctx = LogContext.forQuery(LogContext.generateCorrelationId(), "listGenes")) {
            GeneListResult result = queries.listGenes(tier);
            return Response.ok(GeneListResponse.from(result)).build();
        } catch (InvalidQueryException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), PATH, e.getValidValues()))
                    .build();
        } catch (TierUnavailableException e) {
            log.warn("listGenes.unavailable tier={} message={}", e.getTier(), e.getMessage());
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(ErrorResponse.serviceUnavailable(e.getMessage(), PATH, e.getHint()))
                    .build();
        } catch (Exception e) {
            log.error("listGenes.failed tier={} error={}", tier, e.getMessage(), e);
            return internalError(PATH);
        }
    }

    /**
     * Looks up one gene, case-insensitively.
     *
     * GET /api/genes/{symbol}
     */
    @GET
    @Path("/{symbol}")
    @Operation(summary = "Get gene detail",
            description = "Curated source flags for a curated gene, or a reduced record for a gene that is only "
                    + "in the expanded set.")
    @APIResponse(responseCode = "200", description = "Gene found")
    @APIResponse(responseCode = "404", description = "Gene not found in any tier")
    @APIResponse(responseCode = "503", description = "Curated data not loaded")
    public Response getGene(@PathParam("symbol") String symbol) {
        String path = PATH + "/" + symbol;
        try (LogContext ctx = LogContext.forQuery(LogContext.generateCorrelationId(), "geneDetail")) {
            GeneDetail detail = queries.geneDetail(symbol);
            return Response.ok(GeneDetailResponse.from(detail)).build();
        } catch (GeneNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(ErrorResponse.notFound(e.getMessage(), path))
                    .build();
        } catch (InvalidQueryException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (TierUnavailableException e) {
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(ErrorResponse.serviceUnavailable(e.getMessage(), path, e.getHint()))
                    .build();
        } catch (Exception e) {
            log.error("geneDetail.failed symbol={} error={}", symbol, e.getMessage(), e);
            return internalError(path);
        }
    }

    static Response internalError(String path) {
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                .build();
    }
}
