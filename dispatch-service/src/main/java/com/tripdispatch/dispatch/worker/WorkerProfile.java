package com.tripdispatch.dispatch.worker;

import com.tripdispatch.shared.enums.ServiceType;
import com.tripdispatch.shared.enums.VehicleType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Dispatch-relevant view of a worker. Registration and verification workflows
 * own this table; dispatch only reads it.
 */
@Entity
@Table(name = "worker_profiles")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "workerId")
public class WorkerProfile {

    @Id
    @Column(name = "worker_id", length = 64)
    private String workerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "vehicle_type", nullable = false, length = 20)
    private VehicleType vehicleType;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "worker_service_types", joinColumns = @JoinColumn(name = "worker_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "service_type", length = 20)
    private Set<ServiceType> serviceTypes = EnumSet.noneOf(ServiceType.class);

    @Column(nullable = false)
    private boolean eligible;

    @Column(precision = 3, scale = 2)
    private BigDecimal rating;

    @Column(name = "completed_trips")
    private int completedTrips;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean canTake(ServiceType serviceType) {
        return eligible && serviceTypes != null && serviceTypes.contains(serviceType);
    }
}
