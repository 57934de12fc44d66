package com.zero.dispatch.api;

import com.zero.core.engine.ScanService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * REST controller for cached artifacts. Targets contain slashes, so they travel as a
 * query parameter.
 */
@RestController
@RequestMapping("/api/v1/artifacts")
public class ArtifactController {

    private final ScanService scanService;

    public ArtifactController(ScanService scanService) {
        this.scanService = scanService;
    }

    /**
     * GET /api/v1/artifacts?target=owner/repo: freshness of every stored artifact.
     */
    @GetMapping
    public List<ArtifactResponse> list(@RequestParam String target) {
        return scanService.freshness(target).stream()
                .map(lookup -> ArtifactResponse.from(lookup, false))
                .toList();
    }

    /**
     * GET /api/v1/artifacts/{analyzer}?target=owner/repo[&amp;ttl=PT1H][&amp;commit=sha]: 404 when
     * nothing is stored. With {@code commit}, the response tells whether the artifact is from another commit.
     */
    @GetMapping("/{analyzerId}")
    public ResponseEntity<ArtifactResponse> get(@PathVariable String analyzerId,
                                                @RequestParam String target,
                                                @RequestParam(required = false) Duration ttl,
                                                @RequestParam(required = false) String commit) {
        var lookup = scanService.getArtifact(target, analyzerId, ttl, commit);
        if (!lookup.found()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(ArtifactResponse.from(lookup, true));
    }

    /**
     * DELETE /api/v1/artifacts?target=owner/repo[&amp;analyzer=id]: invalidate one or all artifacts.
     */
    @DeleteMapping
    public Map<String, Object> invalidate(@RequestParam String target,
                                          @RequestParam(required = false) String analyzer) {
        int removed = scanService.invalidate(target, analyzer);
        return Map.of("target", target, "removed", removed);
    }
}
