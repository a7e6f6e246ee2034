package com.tripdispatch.dispatch.controller;

import com.tripdispatch.dispatch.location.LocationRegistry;
import com.tripdispatch.dispatch.location.entity.WorkerLocation;
import com.tripdispatch.dispatch.location.model.LocationReport;
import com.tripdispatch.shared.context.IdentityHeaders;
import com.tripdispatch.shared.dto.ApiResponse;
import com.tripdispatch.shared.enums.UserRole;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/workers")
@RequiredArgsConstructor
public class WorkerLocationController {

    private final LocationRegistry locationRegistry;

    /**
     * Called every few seconds per online worker. Last write wins, so no
     * idempotency key is needed.
     */
    @PostMapping("/me/location")
    public ResponseEntity<ApiResponse<Map<String, Instant>>> report(
            @RequestHeader(IdentityHeaders.USER_ID) String userId,
            @RequestHeader(IdentityHeaders.USER_ROLE) UserRole role,
            @Valid @RequestBody LocationReport report) {

        Callers.requireRole(role, UserRole.WORKER);
        WorkerLocation saved = locationRegistry.report(userId, report);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("capturedAt", saved.getCapturedAt())));
    }
}
