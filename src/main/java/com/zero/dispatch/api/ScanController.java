package com.zero.dispatch.api;

import com.zero.core.engine.ScanService;
import com.zero.core.model.JobSnapshot;
import com.zero.core.model.ScanOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.List;

/**
 * REST controller for scan job lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/scans")
public class ScanController {

    private static final Logger log = LoggerFactory.getLogger(ScanController.class);

    private final ScanService scanService;
    private final SseStreamingService sseStreamingService;

    public ScanController(ScanService scanService, SseStreamingService sseStreamingService) {
        this.scanService = scanService;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/scans: plan and enqueue a scan. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<JobResponse> submitScan(@RequestBody ScanRequest request) {
        if (request.target() == null || request.target().isBlank()) {
            throw new IllegalArgumentException("target is required");
        }
        ScanOptions options = toOptions(request);
        JobSnapshot snapshot = request.analyzers() != null && !request.analyzers().isEmpty()
                ? scanService.submitJob(request.target(), request.analyzers(), options)
                : scanService.submitJob(request.target(), request.profile(), options);
        log.info("Accepted scan {} for {}", snapshot.id(), snapshot.target());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobResponse.from(snapshot));
    }

    /**
     * GET /api/v1/scans: queued and running jobs.
     */
    @GetMapping
    public List<JobResponse> listActive() {
        return scanService.listActiveJobs().stream().map(JobResponse::from).toList();
    }

    /**
     * GET /api/v1/scans/recent?window=PT1H: jobs created within the window, newest first.
     */
    @GetMapping("/recent")
    public List<JobResponse> listRecent(@RequestParam(defaultValue = "PT1H") Duration window) {
        return scanService.listRecentJobs(window).stream().map(JobResponse::from).toList();
    }

    @GetMapping("/{jobId}")
    public JobResponse getScan(@PathVariable String jobId) {
        return JobResponse.from(scanService.getJob(jobId));
    }

    /**
     * POST /api/v1/scans/{jobId}/cancel: 409 if the job has already finished.
     */
    @PostMapping("/{jobId}/cancel")
    public JobResponse cancelScan(@PathVariable String jobId) {
        return JobResponse.from(scanService.cancelJob(jobId));
    }

    /**
     * GET /api/v1/scans/{jobId}/events: server-sent progress events until the job ends.
     */
    @GetMapping(value = "/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String jobId) {
        JobSnapshot snapshot = scanService.getJob(jobId);
        return sseStreamingService.createEmitter(snapshot);
    }

    private ScanOptions toOptions(ScanRequest request) {
        ScanOptions defaults = scanService.defaultOptions();
        return new ScanOptions(
                Boolean.TRUE.equals(request.force()),
                request.bestEffort() != null ? request.bestEffort() : defaults.bestEffort(),
                request.ttlOverride(),
                request.skip(),
                request.commit());
    }
}
