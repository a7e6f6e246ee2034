package com.tripdispatch.dispatch.location.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/** One position report. Rows are never updated; the newest row per worker is current. */
@Entity
@Table(name = "worker_locations",
        indexes = {
                @Index(name = "idx_location_worker_time", columnList = "worker_id, captured_at"),
                @Index(name = "idx_location_time", columnList = "captured_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class WorkerLocation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "worker_id", nullable = false)
    private String workerId;

    @Column(nullable = false)
    private double lat;

    @Column(nullable = false)
    private double lng;

    private Double heading;

    @Column(name = "speed_kmh")
    private Double speedKmh;

    @Column(name = "accuracy_m")
    private Double accuracyM;

    @Column(nullable = false)
    private boolean online;

    @Column(nullable = false)
    private boolean available;

    @Column(name = "captured_at", nullable = false)
    private Instant capturedAt;
}
