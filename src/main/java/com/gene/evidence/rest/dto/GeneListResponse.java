package com.gene.evidence.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gene.evidence.api.GeneListResult;
import com.gene.evidence.core.model.Tier;

import java.util.List;
import java.util.Map;

/**
 * Gene list of one tier. {@code tier} is the tier actually served; a fallback is marked by
 * {@code _fallback} and {@code _reason} so it is never mistaken for a genuine match.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeneListResponse(
        @JsonProperty("tier") String tier,
        @JsonProperty("count") Integer count,
        @JsonProperty("genes") List<String> genes,
        @JsonProperty("summary") Map<String, Object> summary,
        @JsonProperty("_fallback") Boolean fallback,
        @JsonProperty("_reason") String reason
) {
    public static GeneListResponse from(GeneListResult result) {
        Tier served = result.resolution().served();
        if (served == Tier.GENOME) {
            return new GeneListResponse(served.getParamName(), null, null, result.summary(), null, null);
        }
        boolean fallback = result.resolution().isFallback();
        return new GeneListResponse(
                served.getParamName(),
                result.count(),
                result.genes(),
                null,
                fallback ? Boolean.TRUE : null,
                fallback ? result.resolution().reason() : null);
    }
}
