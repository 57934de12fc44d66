package com.zero.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.zero.core.engine.ScanService;
import com.zero.core.model.AnalyzerDescriptor;
import com.zero.core.profile.ScanProfile;

import java.util.List;

/**
 * JSON responses for the analyzer catalog, profile and plan endpoints.
 */
public final class CatalogResponses {

    private CatalogResponses() {}

    public record AnalyzerResponse(
        String id,
        String description,
        List<String> dependencies,
        @JsonProperty("ttl_seconds") long ttlSeconds,
        @JsonProperty("timeout_seconds") Long timeoutSeconds
    ) {
        static AnalyzerResponse from(AnalyzerDescriptor d) {
            return new AnalyzerResponse(d.id(), d.description(), d.dependencies(), d.defaultTtl().toSeconds(),
                    d.timeout() != null ? d.timeout().toSeconds() : null);
        }
    }

    public record ProfileResponse(String name, String description, List<String> analyzers) {
        static ProfileResponse from(ScanProfile profile) {
            return new ProfileResponse(profile.name(), profile.description(), profile.analyzers());
        }
    }

    public record PlanResponse(
        String profile,
        List<String> requested,
        List<List<String>> waves,
        @JsonProperty("analyzer_count") int analyzerCount
    ) {
        static PlanResponse from(ScanService.PlannedScan planned) {
            var plan = planned.plan();
            return new PlanResponse(planned.profile(), plan.requested(), plan.waves(), plan.analyzers().size());
        }
    }
}
