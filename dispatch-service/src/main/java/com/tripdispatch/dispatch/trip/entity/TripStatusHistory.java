package com.tripdispatch.dispatch.trip.entity;

import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.enums.UserRole;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

@Entity
@Immutable
@Table(name = "trip_status_history",
        indexes = @Index(name = "idx_history_trip", columnList = "trip_id, id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class TripStatusHistory {

    /** Insertion order; several rows of one trip can share a timestamp. */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trip_id", nullable = false)
    private UUID tripId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", length = 20)
    private TripStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, length = 20)
    private TripStatus toStatus;

    @Column(name = "actor_id")
    private String actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_role", nullable = false, length = 20)
    private UserRole actorRole;

    private Double lat;

    private Double lng;

    private String note;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;
}
