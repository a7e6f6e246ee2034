package com.tripdispatch.dispatch.dispatch.entity;

import com.tripdispatch.dispatch.dispatch.model.OfferStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "dispatch_offers",
        indexes = {
                @Index(name = "idx_offer_trip_status", columnList = "trip_id, status"),
                @Index(name = "idx_offer_worker_status", columnList = "worker_id, status"),
                @Index(name = "idx_offer_status_expiry", columnList = "status, expires_at")
        },
        uniqueConstraints = @UniqueConstraint(name = "uk_offer_trip_worker", columnNames = {"trip_id", "worker_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class DispatchOffer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "trip_id", nullable = false)
    private UUID tripId;

    @Column(name = "worker_id", nullable = false)
    private String workerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OfferStatus status;

    @Column(name = "batch_number", nullable = false)
    private int batchNumber;

    @Column(name = "escalation_level", nullable = false)
    private int escalationLevel;

    @Column(name = "distance_km", precision = 10, scale = 3)
    private BigDecimal distanceKm;

    @Column(name = "estimated_arrival_min")
    private int estimatedArrivalMin;

    @Column(name = "sent_at", nullable = false)
    private Instant sentAt;

    @Column(name = "responded_at")
    private Instant respondedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "decline_reason")
    private String declineReason;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public boolean isOpenAt(Instant now) {
        return status == OfferStatus.PENDING && expiresAt.isAfter(now);
    }
}
