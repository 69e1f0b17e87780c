package com.shlawgathon.sentientloop.backend.controller;

import com.shlawgathon.sentientloop.backend.dto.PolicyRequest;
import com.shlawgathon.sentientloop.backend.model.PolicyConfig;
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

@RestController
@RequestMapping("/api/policy")
@Tag(name = "Policy", description = "Per-organization governance policy")
public class PolicyController {

    private final SentientLoopService sentientLoopService;

    public PolicyController(SentientLoopService sentientLoopService) {
        this.sentientLoopService = sentientLoopService;
    }

    @GetMapping
    @Operation(summary = "Get policy", description = "Current policy; defaults are created on first read")
    public ResponseEntity<PolicyConfig> getPolicy(
            @Parameter(description = "Organization ID") @RequestParam(required = false) String organizationId) {

        return ResponseEntity.ok(sentientLoopService.getPolicy(organizationId));
    }

    @PutMapping
    @Operation(summary = "Replace policy", description = "Replace the policy if expectedVersion is current")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Policy replaced"),
            @ApiResponse(responseCode = "400", description = "Invalid policy"),
            @ApiResponse(responseCode = "409", description = "Policy was changed concurrently")
    })
    public ResponseEntity<PolicyConfig> updatePolicy(
            @AuthenticationPrincipal OAuth2User principal,
            @Parameter(description = "Organization ID") @RequestParam(required = false) String organizationId,
            @Valid @RequestBody PolicyRequest request) {

        PolicyConfig updated = sentientLoopService.updatePolicy(organizationId, request.toPolicyConfig(),
                request.getExpectedVersion(), principal.getName());
        return ResponseEntity.ok(updated);
    }
}
