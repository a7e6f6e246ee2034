package com.tripdispatch.dispatch.trip.entity;

import com.tripdispatch.shared.enums.PaymentMethod;
import com.tripdispatch.shared.enums.ServiceType;
import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.enums.UserRole;
import com.tripdispatch.shared.enums.VehicleType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "trips",
        indexes = {
                @Index(name = "idx_trip_requester_status", columnList = "requester_id, status"),
                @Index(name = "idx_trip_worker_status", columnList = "worker_id, status"),
                @Index(name = "idx_trip_status_scheduled", columnList = "status, scheduled_at")
        },
        uniqueConstraints = @UniqueConstraint(name = "uk_trip_requester_idempotency",
                columnNames = {"requester_id", "idempotency_key"}))
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Trip {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    private long version;

    @Column(name = "requester_id", nullable = false)
    private String requesterId;

    @Column(name = "worker_id")
    private String workerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TripStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "service_type", nullable = false, length = 20)
    private ServiceType serviceType;

    @Enumerated(EnumType.STRING)
    @Column(name = "vehicle_type", nullable = false, length = 20)
    private VehicleType vehicleType;

    @Column(name = "pickup_lat", nullable = false)
    private double pickupLat;

    @Column(name = "pickup_lng", nullable = false)
    private double pickupLng;

    @Column(name = "pickup_address")
    private String pickupAddress;

    @Column(name = "dropoff_lat", nullable = false)
    private double dropoffLat;

    @Column(name = "dropoff_lng", nullable = false)
    private double dropoffLng;

    @Column(name = "dropoff_address")
    private String dropoffAddress;

    @Column(name = "estimated_distance_km", precision = 10, scale = 3)
    private BigDecimal estimatedDistanceKm;

    @Column(name = "estimated_duration_min")
    private int estimatedDurationMin;

    @Column(name = "estimated_fare", precision = 12, scale = 2, nullable = false)
    private BigDecimal estimatedFare;

    /** True when the estimate came from straight-line distance instead of the routing provider. */
    @Column(name = "route_fallback_used")
    private boolean routeFallbackUsed;

    @Column(name = "final_fare", precision = 12, scale = 2)
    private BigDecimal finalFare;

    @Column(name = "tip_amount", precision = 12, scale = 2)
    private BigDecimal tipAmount;

    @Column(name = "currency", length = 3, nullable = false)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 10)
    private PaymentMethod paymentMethod;

    @Column(name = "hold_entry_id")
    private UUID holdEntryId;

    @Column(name = "scheduled_at")
    private Instant scheduledAt;

    @Column(name = "idempotency_key", length = 128)
    private String idempotencyKey;

    @Column(name = "current_batch", nullable = false)
    private int currentBatch;

    @Column(name = "escalation_level", nullable = false)
    private int escalationLevel;

    @Column(name = "search_started_at")
    private Instant searchStartedAt;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "arrived_pickup_at")
    private Instant arrivedPickupAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "arrived_dropoff_at")
    private Instant arrivedDropoffAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "cancellation_reason", length = 64)
    private String cancellationReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancelled_by", length = 20)
    private UserRole cancelledBy;

    @Column(name = "cancellation_fee", precision = 12, scale = 2)
    private BigDecimal cancellationFee;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isCash() {
        return paymentMethod == PaymentMethod.CASH;
    }

    public boolean isParticipant(String userId) {
        return userId != null && (userId.equals(requesterId) || userId.equals(workerId));
    }
}
