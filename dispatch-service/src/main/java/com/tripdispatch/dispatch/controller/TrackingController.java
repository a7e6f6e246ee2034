package com.tripdispatch.dispatch.controller;

import com.tripdispatch.dispatch.booking.TripOrchestrator;
import com.tripdispatch.dispatch.tracking.TrackingView;
import com.tripdispatch.shared.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Public, unauthenticated view of a shared trip. */
@RestController
@RequestMapping("/api/v1/track")
@RequiredArgsConstructor
public class TrackingController {

    private final TripOrchestrator orchestrator;

    @GetMapping("/{token}")
    public ResponseEntity<ApiResponse<TrackingView>> track(@PathVariable("token") String token) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.track(token)));
    }
}
