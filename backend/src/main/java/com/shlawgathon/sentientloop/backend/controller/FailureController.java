package com.shlawgathon.sentientloop.backend.controller;

import com.shlawgathon.sentientloop.backend.dto.ExecuteRecoveryRequest;
import com.shlawgathon.sentientloop.backend.dto.FailureResponse;
import com.shlawgathon.sentientloop.backend.model.FailureStats;
import com.shlawgathon.sentientloop.backend.model.RecoveryOption;
import com.shlawgathon.sentientloop.backend.model.RecoveryResult;
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
@RequestMapping("/api/failures")
@Tag(name = "Failures", description = "Failure monitoring and guided recovery")
public class FailureController {

    private final SentientLoopService sentientLoopService;

    public FailureController(SentientLoopService sentientLoopService) {
        this.sentientLoopService = sentientLoopService;
    }

    @GetMapping
    @Operation(summary = "List open failures", description = "Active and acknowledged failures, most recent first")
    public ResponseEntity<List<FailureResponse>> listActive(
            @Parameter(description = "Module filter") @RequestParam(required = false) String moduleId) {

        return ResponseEntity.ok(sentientLoopService.listActiveFailures(moduleId).stream()
                .map(FailureResponse::from)
                .toList());
    }

    @GetMapping("/stats")
    @Operation(summary = "Failure statistics")
    public ResponseEntity<FailureStats> getStats() {
        return ResponseEntity.ok(sentientLoopService.getFailureStats());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get failure")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Failure found"),
            @ApiResponse(responseCode = "404", description = "Failure not found")
    })
    public ResponseEntity<FailureResponse> getFailure(
            @Parameter(description = "Failure ID") @PathVariable String id) {

        return ResponseEntity.ok(FailureResponse.from(sentientLoopService.getFailure(id)));
    }

    @PostMapping("/{id}/acknowledge")
    @Operation(summary = "Acknowledge failure", description = "Mark an active failure as seen by an operator")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Failure acknowledged"),
            @ApiResponse(responseCode = "404", description = "No active failure with this ID")
    })
    public ResponseEntity<FailureResponse> acknowledge(
            @AuthenticationPrincipal OAuth2User principal,
            @Parameter(description = "Failure ID") @PathVariable String id) {

        return ResponseEntity.ok(FailureResponse.from(
                sentientLoopService.acknowledgeFailure(id, principal.getName())));
    }

    @GetMapping("/{id}/recovery-options")
    @Operation(summary = "Recovery options", description = "Ranked recovery options; the first is recommended")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Options listed"),
            @ApiResponse(responseCode = "404", description = "Failure not found"),
            @ApiResponse(responseCode = "409", description = "Failure already recovered")
    })
    public ResponseEntity<List<RecoveryOption>> getRecoveryOptions(
            @Parameter(description = "Failure ID") @PathVariable String id) {

        return ResponseEntity.ok(sentientLoopService.getRecoveryOptions(id));
    }

    @PostMapping("/{id}/recovery")
    @Operation(summary = "Execute recovery", description = "Run the chosen recovery option")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recovery executed; see success flag"),
            @ApiResponse(responseCode = "404", description = "Failure or option not found"),
            @ApiResponse(responseCode = "409", description = "Recovered already or recovery in progress")
    })
    public ResponseEntity<RecoveryResult> executeRecovery(
            @AuthenticationPrincipal OAuth2User principal,
            @Parameter(description = "Failure ID") @PathVariable String id,
            @Valid @RequestBody ExecuteRecoveryRequest request) {

        return ResponseEntity.ok(sentientLoopService.executeRecovery(id, request.getOptionId(),
                principal.getName()));
    }
}
