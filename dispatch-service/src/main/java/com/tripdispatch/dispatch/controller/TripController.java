package com.tripdispatch.dispatch.controller;

import com.tripdispatch.dispatch.booking.TripOrchestrator;
import com.tripdispatch.dispatch.dispatch.model.DispatchStats;
import com.tripdispatch.dispatch.tracking.ShareLink;
import com.tripdispatch.dispatch.trip.model.CancelRequest;
import com.tripdispatch.dispatch.trip.model.CreateTripRequest;
import com.tripdispatch.dispatch.trip.model.HoldResult;
import com.tripdispatch.dispatch.trip.model.RespondRequest;
import com.tripdispatch.dispatch.trip.model.TipRequest;
import com.tripdispatch.dispatch.trip.model.TripHistoryEntry;
import com.tripdispatch.dispatch.trip.model.TripResponse;
import com.tripdispatch.dispatch.trip.model.WorkerStepRequest;
import com.tripdispatch.shared.context.IdentityHeaders;
import com.tripdispatch.shared.dto.ApiResponse;
import com.tripdispatch.shared.enums.UserRole;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/trips")
@RequiredArgsConstructor
public class TripController {

    private final TripOrchestrator orchestrator;

    /**
     * Creates a trip with its wallet hold and dispatches the first batch.
     * Replaying an Idempotency-Key returns the original trip with 200 instead of 201.
     */
    @PostMapping
    public ResponseEntity<ApiResponse<TripResponse>> createTrip(
            @RequestHeader(IdentityHeaders.USER_ID) String userId,
            @RequestHeader(IdentityHeaders.USER_ROLE) UserRole role,
            @RequestHeader(value = IdentityHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody CreateTripRequest request) {

        Callers.requireRole(role, UserRole.REQUESTER);
        HoldResult result = orchestrator.createTrip(userId, request, idempotencyKey);
        HttpStatus status = result.replayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(ApiResponse.ok(TripResponse.from(result.trip(), result.replayed())));
    }

    @GetMapping("/{tripId}")
    public ResponseEntity<ApiResponse<TripResponse>> getTrip(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(IdentityHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(ApiResponse.ok(TripResponse.from(orchestrator.getTrip(tripId, userId))));
    }

    @GetMapping("/{tripId}/history")
    public ResponseEntity<ApiResponse<List<TripHistoryEntry>>> history(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(IdentityHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.history(tripId, userId)));
    }

    @GetMapping("/{tripId}/dispatch-stats")
    public ResponseEntity<ApiResponse<DispatchStats>> dispatchStats(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(IdentityHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.stats(tripId, userId)));
    }

    @PostMapping("/{tripId}/responses")
    public ResponseEntity<ApiResponse<TripResponse>> respond(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(IdentityHeaders.USER_ID) String userId,
            @RequestHeader(IdentityHeaders.USER_ROLE) UserRole role,
            @Valid @RequestBody RespondRequest request) {

        Callers.requireRole(role, UserRole.WORKER);
        return ResponseEntity.ok(ApiResponse.ok(TripResponse.from(
                orchestrator.respond(tripId, userId, request.getDecision(), request.getReason()))));
    }

    @PostMapping("/{tripId}/cancel")
    public ResponseEntity<ApiResponse<TripResponse>> cancel(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(IdentityHeaders.USER_ID) String userId,
            @RequestHeader(IdentityHeaders.USER_ROLE) UserRole role,
            @Valid @RequestBody(required = false) CancelRequest request) {

        String reason = request == null ? null : request.getReason();
        return ResponseEntity.ok(ApiResponse.ok(TripResponse.from(orchestrator.cancel(tripId, userId, role, reason))));
    }

    @PostMapping("/{tripId}/arrived-pickup")
    public ResponseEntity<ApiResponse<TripResponse>> arrivedPickup(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(IdentityHeaders.USER_ID) String userId,
            @RequestHeader(IdentityHeaders.USER_ROLE) UserRole role,
            @Valid @RequestBody(required = false) WorkerStepRequest step) {

        Callers.requireRole(role, UserRole.WORKER);
        return ResponseEntity.ok(ApiResponse.ok(TripResponse.from(orchestrator.arrivedAtPickup(tripId, userId, step))));
    }

    @PostMapping("/{tripId}/start")
    public ResponseEntity<ApiResponse<TripResponse>> start(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(IdentityHeaders.USER_ID) String userId,
            @RequestHeader(IdentityHeaders.USER_ROLE) UserRole role,
            @Valid @RequestBody(required = false) WorkerStepRequest step) {

        Callers.requireRole(role, UserRole.WORKER);
        return ResponseEntity.ok(ApiResponse.ok(TripResponse.from(orchestrator.startTrip(tripId, userId, step))));
    }

    @PostMapping("/{tripId}/arrived-dropoff")
    public ResponseEntity<ApiResponse<TripResponse>> arrivedDropoff(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(IdentityHeaders.USER_ID) String userId,
            @RequestHeader(IdentityHeaders.USER_ROLE) UserRole role,
            @Valid @RequestBody(required = false) WorkerStepRequest step) {

        Callers.requireRole(role, UserRole.WORKER);
        return ResponseEntity.ok(ApiResponse.ok(TripResponse.from(orchestrator.arrivedAtDropoff(tripId, userId, step))));
    }

    @PostMapping("/{tripId}/complete")
    public ResponseEntity<ApiResponse<TripResponse>> complete(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(IdentityHeaders.USER_ID) String userId,
            @RequestHeader(IdentityHeaders.USER_ROLE) UserRole role,
            @Valid @RequestBody(required = false) WorkerStepRequest step) {

        Callers.requireRole(role, UserRole.WORKER);
        return ResponseEntity.ok(ApiResponse.ok(TripResponse.from(orchestrator.complete(tripId, userId, step))));
    }

    @PostMapping("/{tripId}/tip")
    public ResponseEntity<ApiResponse<TripResponse>> tip(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(IdentityHeaders.USER_ID) String userId,
            @Valid @RequestBody TipRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(TripResponse.from(orchestrator.addTip(tripId, userId, request.getAmount()))));
    }

    @PostMapping("/{tripId}/share")
    public ResponseEntity<ApiResponse<ShareLink>> share(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(IdentityHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.share(tripId, userId)));
    }

    @DeleteMapping("/{tripId}/share")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> revokeShare(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(IdentityHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(ApiResponse.ok(Map.of("revoked", orchestrator.revokeShare(tripId, userId))));
    }
}
