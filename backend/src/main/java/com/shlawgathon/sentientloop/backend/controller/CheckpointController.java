package com.shlawgathon.sentientloop.backend.controller;

import com.shlawgathon.sentientloop.backend.dto.CheckpointResponse;
import com.shlawgathon.sentientloop.backend.dto.EscalationResponse;
import com.shlawgathon.sentientloop.backend.dto.ResolveCheckpointRequest;
import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointFilter;
import com.shlawgathon.sentientloop.backend.model.CheckpointType;
import com.shlawgathon.sentientloop.backend.service.SentientLoopService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/checkpoints")
@Tag(name = "Checkpoints", description = "Human review of suspended agent actions")
public class CheckpointController {

    private final SentientLoopService sentientLoopService;

    public CheckpointController(SentientLoopService sentientLoopService) {
        this.sentientLoopService = sentientLoopService;
    }

    @GetMapping
    @Operation(summary = "List pending checkpoints", description = "Pending checkpoints, newest first")
    public ResponseEntity<List<CheckpointResponse>> listPending(
            @Parameter(description = "Organization filter") @RequestParam(required = false) String organizationId,
            @Parameter(description = "Module filter") @RequestParam(required = false) String moduleId,
            @Parameter(description = "Agent filter") @RequestParam(required = false) String agentId,
            @Parameter(description = "Checkpoint type filter") @RequestParam(required = false) CheckpointType type) {

        CheckpointFilter filter = new CheckpointFilter(organizationId, moduleId, agentId, type);
        List<CheckpointResponse> pending = sentientLoopService.getPendingCheckpoints(filter).stream()
                .map(CheckpointResponse::from)
                .toList();
        return ResponseEntity.ok(pending);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get checkpoint", description = "Get a checkpoint in any status")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Checkpoint found"),
            @ApiResponse(responseCode = "404", description = "Checkpoint not found")
    })
    public ResponseEntity<CheckpointResponse> getCheckpoint(
            @Parameter(description = "Checkpoint ID") @PathVariable String id) {

        return ResponseEntity.ok(CheckpointResponse.from(sentientLoopService.getCheckpoint(id)));
    }

    @PostMapping("/{id}/resolve")
    @Operation(summary = "Resolve checkpoint",
            description = "Approve, reject, modify or escalate a pending checkpoint")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Checkpoint resolved"),
            @ApiResponse(responseCode = "400", description = "Missing reason or payload"),
            @ApiResponse(responseCode = "404", description = "Checkpoint not found"),
            @ApiResponse(responseCode = "409", description = "Checkpoint already resolved")
    })
    public ResponseEntity<CheckpointResponse> resolveCheckpoint(
            @AuthenticationPrincipal OAuth2User principal,
            @Parameter(description = "Checkpoint ID") @PathVariable String id,
            @Valid @RequestBody ResolveCheckpointRequest request) {

        Checkpoint checkpoint = sentientLoopService.resolveCheckpoint(id, request.getAction(),
                request.getReason(), request.getModifiedPayload(), request.getLevel(), principal.getName());
        return ResponseEntity.ok(CheckpointResponse.from(checkpoint));
    }

    @GetMapping("/{id}/escalations")
    @Operation(summary = "Escalation chain", description = "Escalation records of the checkpoint's whole chain")
    public ResponseEntity<List<EscalationResponse>> getEscalationChain(
            @Parameter(description = "Checkpoint ID") @PathVariable String id) {

        List<EscalationResponse> chain = sentientLoopService.getEscalationChain(id).stream()
                .map(EscalationResponse::from)
                .toList();
        return ResponseEntity.ok(chain);
    }
}
