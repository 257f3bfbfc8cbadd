package com.gene.evidence.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Metadata tagging a derived artifact with its generator, generation time and which
 * inputs are authoritative ({@code canonSources}) versus heuristic ({@code nonCanonElements}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Provenance(
        @JsonProperty("worker") String worker,
        @JsonProperty("generated") Instant generated,
        @JsonProperty("canon_purity") String canonPurity,
        @JsonProperty("canon_sources") List<String> canonSources,
        @JsonProperty("non_canon_elements") List<String> nonCanonElements,
        @JsonProperty("description") String description
) {
    public static final String DERIVED = "derived";

    public Provenance {
        Objects.requireNonNull(worker, "worker is required");
        Objects.requireNonNull(generated, "generated is required");
        canonPurity = canonPurity != null ? canonPurity : DERIVED;
        canonSources = canonSources != null ? List.copyOf(canonSources) : List.of();
        nonCanonElements = nonCanonElements != null ? List.copyOf(nonCanonElements) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String worker;
        private Instant generated = Instant.now();
        private String canonPurity = DERIVED;
        private final List<String> canonSources = new ArrayList<>();
        private final List<String> nonCanonElements = new ArrayList<>();
        private String description;

        public Builder worker(String worker) {
            this.worker = worker;
            return this;
        }

        public Builder generated(Instant generated) {
            this.generated = generated;
            return this;
        }

        public Builder canonPurity(String canonPurity) {
            this.canonPurity = canonPurity;
            return this;
        }

        public Builder canonSource(String source) {
            this.canonSources.add(source);
            return this;
        }

        public Builder canonSources(List<String> sources) {
            this.canonSources.addAll(sources);
            return this;
        }

        public Builder nonCanonElement(String element) {
            this.nonCanonElements.add(element);
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Provenance build() {
            return new Provenance(worker, generated, canonPurity, canonSources, nonCanonElements, description);
        }
    }
}
