package com.gene.evidence.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gene.evidence.api.GeneDetail;
import com.gene.evidence.core.model.GeneRecord;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeneDetailResponse(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("tier") String tier,
        @JsonProperty("sources") Map<String, Object> sources,
        @JsonProperty("hgnc") GeneRecord hgnc,
        @JsonProperty("_note") String note
) {
    public static GeneDetailResponse from(GeneDetail detail) {
        return new GeneDetailResponse(
                detail.symbol(),
                detail.tier().getParamName(),
                detail.sources(),
                detail.hgnc(),
                detail.note());
    }
}
