package com.tripdispatch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope pushed to live client connections. {@code data} carries one of the
 * trip event payloads from this package.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeEvent {

    private RealtimeEventType type;
    private String tripId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant occurredAt;

    private Object data;
}
