package com.agentflow.api.rest;

import com.agentflow.advisory.AdvisoryService;
import com.agentflow.advisory.AdvisoryService.FailureAnalysisReport;
import com.agentflow.advisory.AdvisoryService.RetryPolicySuggestion;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Read-only analysis of archived pipelines. Nothing here changes pipeline state.
 */
@RestController
@RequestMapping("/api/v1/advisory")
public class AdvisoryController {

    private static final Duration DEFAULT_LOOKBACK = Duration.ofDays(7);

    private final AdvisoryService advisoryService;
    private final Clock clock;

    public AdvisoryController(AdvisoryService advisoryService, Clock clock) {
        this.advisoryService = advisoryService;
        this.clock = clock;
    }

    /**
     * Recurring failure patterns since the given instant, the last seven days by default.
     */
    @GetMapping("/patterns")
    public ResponseEntity<FailureAnalysisReport> getPatterns(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since) {
        return ResponseEntity.ok(advisoryService.analyzeFailurePatterns(sinceOrDefault(since)));
    }

    @GetMapping("/retry-policy")
    public ResponseEntity<RetryPolicySuggestion> getRetryPolicySuggestion(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since) {
        return ResponseEntity.ok(advisoryService.suggestRetryPolicy(sinceOrDefault(since)));
    }

    @GetMapping(value = "/pipelines/{taskId}/explain", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> explainPipeline(@PathVariable String taskId) {
        return ResponseEntity.ok(advisoryService.explainPipeline(taskId));
    }

    private Instant sinceOrDefault(Instant since) {
        return since != null ? since : clock.instant().minus(DEFAULT_LOOKBACK);
    }
}
