package com.gene.evidence.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Gene Evidence API",
                version = "1.0.0",
                description = "Read-only access to curated, expanded and genome-wide gene tiers and to " +
                        "derived gap candidates. Tiers are served from precomputed snapshots and degrade " +
                        "to a lower tier, with an explicit fallback marker, when an artifact is missing.",
                license = @License(
                        name = "Apache 2.0",
                        url = "https://www.apache.org/licenses/LICENSE-2.0.html"
                )
        )
)
public class GeneEvidenceApplication extends Application {
}
