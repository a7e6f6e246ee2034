package com.tripdispatch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.enums.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripStatusChangedEvent {

    private String tripId;
    private String requesterId;
    private String workerId;
    private TripStatus previousStatus;
    private TripStatus status;
    private UserRole actorRole;
    private String reason;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant changedAt;
}
