package com.tripdispatch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerLocationReportedEvent {

    public static final String TOPIC = "worker.location.reported";

    private String workerId;
    private double latitude;
    private double longitude;
    private String geoCell;
    private boolean online;
    private boolean available;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant capturedAt;
}
