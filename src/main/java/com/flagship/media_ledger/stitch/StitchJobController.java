package com.flagship.media_ledger.stitch;

import com.flagship.media_ledger.stitch.dto.EnqueueStitchRequest;
import com.flagship.media_ledger.stitch.dto.RunnerCallbackRequest;
import com.flagship.media_ledger.stitch.dto.StitchJobResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/stitch")
@RequiredArgsConstructor
public class StitchJobController {

    private static final String USER_HEADER = "X-User-Id";

    private final JobOrchestrator orchestrator;

    /**
     * 409 while the target already has a job in progress.
     */
    @PostMapping("/targets/{targetId}/jobs")
    public ResponseEntity<StitchJobResponse> enqueue(@RequestHeader(USER_HEADER) String userId,
                                                     @PathVariable("targetId") String targetId,
                                                     @Valid @RequestBody EnqueueStitchRequest request) {
        StitchJob job = orchestrator.enqueueStitch(targetId, userId, request.getInputPaths());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(toResponse(job));
    }

    @GetMapping("/targets/{targetId}/active")
    public ResponseEntity<StitchJobResponse> active(@PathVariable("targetId") String targetId) {
        return orchestrator.getActiveJob(targetId)
            .map(job -> ResponseEntity.ok(toResponse(job)))
            .orElse(ResponseEntity.noContent().build());
    }

    @GetMapping("/targets/{targetId}/jobs")
    public ResponseEntity<List<StitchJobResponse>> list(@PathVariable("targetId") String targetId) {
        return ResponseEntity.ok(orchestrator.listJobs(targetId).stream()
            .map(this::toResponse)
            .toList());
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<StitchJobResponse> get(@PathVariable("jobId") UUID jobId) {
        return ResponseEntity.ok(toResponse(orchestrator.getJob(jobId)));
    }

    @PostMapping("/jobs/{jobId}/callback")
    public ResponseEntity<StitchJobResponse> callback(@PathVariable("jobId") UUID jobId,
                                                      @Valid @RequestBody RunnerCallbackRequest request) {
        StitchJob job = orchestrator.onRunnerCallback(jobId, request.getStatus(), request.getMessage());
        return ResponseEntity.ok(toResponse(job));
    }

    private StitchJobResponse toResponse(StitchJob job) {
        return StitchJobResponse.from(job, orchestrator.outputUrl(job).orElse(null));
    }
}
