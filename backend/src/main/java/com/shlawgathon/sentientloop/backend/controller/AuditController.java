package com.shlawgathon.sentientloop.backend.controller;

import com.shlawgathon.sentientloop.backend.model.AuditRecord;
import com.shlawgathon.sentientloop.backend.service.SentientLoopService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/audit")
@Tag(name = "Audit", description = "State transition history")
public class AuditController {

    private final SentientLoopService sentientLoopService;

    public AuditController(SentientLoopService sentientLoopService) {
        this.sentientLoopService = sentientLoopService;
    }

    @GetMapping
    @Operation(summary = "Audit trail", description = "Audit records of one entity, oldest first")
    public ResponseEntity<List<AuditRecord>> getAuditTrail(
            @Parameter(description = "Checkpoint, failure, policy or action ID") @RequestParam String entityId) {

        return ResponseEntity.ok(sentientLoopService.getAuditTrail(entityId));
    }
}
