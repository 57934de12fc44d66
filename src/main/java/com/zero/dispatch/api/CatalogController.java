package com.zero.dispatch.api;

import com.zero.core.engine.ScanService;
import com.zero.core.profile.ProfileResolver;
import com.zero.core.registry.AnalyzerRegistry;
import com.zero.dispatch.api.CatalogResponses.AnalyzerResponse;
import com.zero.dispatch.api.CatalogResponses.PlanResponse;
import com.zero.dispatch.api.CatalogResponses.ProfileResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only endpoints for the analyzer catalog, the profiles and plan previews.
 */
@RestController
@RequestMapping("/api/v1")
public class CatalogController {

    private final AnalyzerRegistry registry;
    private final ProfileResolver profileResolver;
    private final ScanService scanService;

    public CatalogController(AnalyzerRegistry registry, ProfileResolver profileResolver, ScanService scanService) {
        this.registry = registry;
        this.profileResolver = profileResolver;
        this.scanService = scanService;
    }

    @GetMapping("/analyzers")
    public List<AnalyzerResponse> analyzers() {
        return registry.descriptors().stream().map(AnalyzerResponse::from).toList();
    }

    @GetMapping("/profiles")
    public List<ProfileResponse> profiles() {
        return profileResolver.profiles().stream().map(ProfileResponse::from).toList();
    }

    /**
     * GET /api/v1/plan?profile=standard: the waves a scan would run, without running it.
     */
    @GetMapping("/plan")
    public PlanResponse plan(@RequestParam(required = false) String profile) {
        return PlanResponse.from(scanService.plan(profile));
    }
}
