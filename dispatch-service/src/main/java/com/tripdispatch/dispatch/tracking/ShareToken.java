package com.tripdispatch.dispatch.tracking;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "trip_share_tokens",
        indexes = @Index(name = "idx_share_trip", columnList = "trip_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "token")
public class ShareToken {

    @Id
    @Column(length = 64)
    private String token;

    @Column(name = "trip_id", nullable = false)
    private UUID tripId;

    @Column(name = "created_by", nullable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(nullable = false)
    private boolean revoked;

    public boolean isValidAt(Instant now) {
        return !revoked && expiresAt.isAfter(now);
    }
}
