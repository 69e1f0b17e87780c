package com.shlawgathon.sentientloop.backend.controller;

import com.shlawgathon.sentientloop.backend.dto.CheckpointResponse;
import com.shlawgathon.sentientloop.backend.dto.FailureResponse;
import com.shlawgathon.sentientloop.backend.dto.ProposalResponse;
import com.shlawgathon.sentientloop.backend.dto.ProposeActionRequest;
import com.shlawgathon.sentientloop.backend.dto.ReportFailureRequest;
import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.ProposalResult;
import com.shlawgathon.sentientloop.backend.service.SentientLoopService;
import com.shlawgathon.sentientloop.backend.service.SweepSummary;
import io.swagger.v3.oas.annotations.Hidden;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Agent-facing endpoints. Protected by the agent API key filter rather than
 * OAuth2.
 */
@RestController
@RequestMapping("/internal")
@Hidden
public class InternalGovernanceController {

    private static final Logger log = LoggerFactory.getLogger(InternalGovernanceController.class);

    static final long MAX_AWAIT_SECONDS = 300;

    private final SentientLoopService sentientLoopService;

    public InternalGovernanceController(SentientLoopService sentientLoopService) {
        this.sentientLoopService = sentientLoopService;
    }

    /**
     * Runs the checkpoint gate. 200 when the agent may proceed, 202 with the
     * checkpoint when the action is suspended.
     */
    @PostMapping("/actions")
    public ResponseEntity<ProposalResponse> proposeAction(@Valid @RequestBody ProposeActionRequest request) {
        ProposalResult result = sentientLoopService.proposeAction(request.toProposedAction());
        HttpStatus status = result.mayProceed() ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(ProposalResponse.from(result));
    }

    @GetMapping("/checkpoints/{checkpointId}")
    public ResponseEntity<CheckpointResponse> getCheckpoint(@PathVariable String checkpointId) {
        return ResponseEntity.ok(CheckpointResponse.from(sentientLoopService.getCheckpoint(checkpointId)));
    }

    /**
     * Long-polls until the checkpoint leaves PENDING or the timeout passes, then
     * returns the checkpoint as it is.
     */
    @GetMapping("/checkpoints/{checkpointId}/await")
    public CompletableFuture<ResponseEntity<CheckpointResponse>> awaitResolution(
            @PathVariable String checkpointId,
            @RequestParam(defaultValue = "30") long timeoutSeconds) {

        long bounded = Math.max(0, Math.min(timeoutSeconds, MAX_AWAIT_SECONDS));
        return sentientLoopService.awaitResolution(checkpointId, Duration.ofSeconds(bounded))
                .thenApply(checkpoint -> ResponseEntity.ok(CheckpointResponse.from(checkpoint)));
    }

    @PostMapping("/failures")
    public ResponseEntity<FailureResponse> reportFailure(@Valid @RequestBody ReportFailureRequest request) {
        FailureRecord record = sentientLoopService.reportFailure(request.getOperationName(),
                request.getModuleId(), request.getType(), request.getMetadata(), request.getErrorMessage());
        return ResponseEntity.ok(FailureResponse.from(record));
    }

    @PostMapping("/escalations/sweep")
    public ResponseEntity<SweepSummary> runEscalationSweep() {
        SweepSummary summary = sentientLoopService.runEscalationSweep();
        log.info("[API] Manual escalation sweep: {}", summary);
        return ResponseEntity.ok(summary);
    }
}
