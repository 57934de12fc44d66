package com.zero.dispatch.api;

import com.zero.core.cache.CacheLookup;
import com.zero.core.engine.ScanService;
import com.zero.core.model.Artifact;
import com.zero.core.model.FreshnessLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ArtifactController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ArtifactControllerTest {

    private static final Instant PRODUCED = Instant.parse("2026-02-01T08:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ScanService scanService;

    private static CacheLookup sbomLookup() {
        var artifact = Artifact.ok("acme/api", "sbom", "{\"components\":[]}".getBytes(StandardCharsets.UTF_8),
                PRODUCED);
        return new CacheLookup("acme/api", "sbom", artifact, FreshnessLevel.STALE,
                Duration.ofHours(30), Duration.ofHours(24));
    }

    @Test
    @DisplayName("GET /artifacts/{analyzer} returns payload and freshness")
    void getArtifact() throws Exception {
        when(scanService.getArtifact("acme/api", "sbom", null, null)).thenReturn(sbomLookup());

        mockMvc.perform(get("/api/v1/artifacts/sbom").param("target", "acme/api"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.analyzer_id").value("sbom"))
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.freshness").value("STALE"))
                .andExpect(jsonPath("$.age_seconds").value(108000))
                .andExpect(jsonPath("$.ttl_seconds").value(86400))
                .andExpect(jsonPath("$.age").value("1 day ago"))
                .andExpect(jsonPath("$.commit_changed").value(false))
                .andExpect(jsonPath("$.payload").value("{\"components\":[]}"));
    }

    @Test
    @DisplayName("GET /artifacts/{analyzer} reports an artifact from another commit")
    void commitChanged() throws Exception {
        var artifact = Artifact.ok("acme/api", "sbom", new byte[0], PRODUCED, "abc123");
        when(scanService.getArtifact("acme/api", "sbom", null, "def456")).thenReturn(
                new CacheLookup("acme/api", "sbom", artifact, FreshnessLevel.FRESH,
                        Duration.ofMinutes(5), Duration.ofHours(24), true));

        mockMvc.perform(get("/api/v1/artifacts/sbom").param("target", "acme/api").param("commit", "def456"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source_commit").value("abc123"))
                .andExpect(jsonPath("$.commit_changed").value(true))
                .andExpect(jsonPath("$.age").value("less than an hour ago"));
    }

    @Test
    @DisplayName("GET /artifacts/{analyzer} forwards a TTL override")
    void ttlOverride() throws Exception {
        when(scanService.getArtifact("acme/api", "sbom", Duration.ofHours(1), null)).thenReturn(sbomLookup());

        mockMvc.perform(get("/api/v1/artifacts/sbom").param("target", "acme/api").param("ttl", "PT1H"))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("GET /artifacts/{analyzer} returns 404 when nothing is stored")
    void missingArtifact() throws Exception {
        when(scanService.getArtifact("acme/api", "sbom", null, null))
                .thenReturn(CacheLookup.absent("acme/api", "sbom", Duration.ofHours(24)));

        mockMvc.perform(get("/api/v1/artifacts/sbom").param("target", "acme/api"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /artifacts lists freshness without payloads")
    void listFreshness() throws Exception {
        when(scanService.freshness("acme/api")).thenReturn(List.of(sbomLookup()));

        mockMvc.perform(get("/api/v1/artifacts").param("target", "acme/api"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].freshness").value("STALE"))
                .andExpect(jsonPath("$[0].payload").doesNotExist());
    }

    @Test
    @DisplayName("GET /artifacts without a target returns 400")
    void missingTarget() throws Exception {
        mockMvc.perform(get("/api/v1/artifacts"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    @DisplayName("GET /artifacts with an escaping target returns 400")
    void invalidTarget() throws Exception {
        when(scanService.freshness("../etc"))
                .thenThrow(new IllegalArgumentException("Invalid target path segment in: ../etc"));

        mockMvc.perform(get("/api/v1/artifacts").param("target", "../etc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("DELETE /artifacts invalidates and reports the count")
    void invalidate() throws Exception {
        when(scanService.invalidate("acme/api", "sbom")).thenReturn(1);

        mockMvc.perform(delete("/api/v1/artifacts").param("target", "acme/api").param("analyzer", "sbom"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.target").value("acme/api"))
                .andExpect(jsonPath("$.removed").value(1));
    }
}
