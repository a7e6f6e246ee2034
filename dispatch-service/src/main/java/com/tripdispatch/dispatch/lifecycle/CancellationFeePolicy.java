package com.tripdispatch.dispatch.lifecycle;

import com.tripdispatch.dispatch.config.TripPolicyProperties;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.shared.enums.UserRole;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Requester cancellation fee as a share of the estimated fare.
 * Nothing is charged before a worker is bound, or when the worker or the
 * system cancels.
 */
@Component
@RequiredArgsConstructor
public class CancellationFeePolicy {

    private final TripPolicyProperties tripPolicyProperties;

    public BigDecimal feeFor(Trip trip, UserRole cancelledBy) {
        if (cancelledBy != UserRole.REQUESTER || trip.getEstimatedFare() == null) {
            return BigDecimal.ZERO;
        }
        int percent = switch (trip.getStatus()) {
            case ASSIGNED -> tripPolicyProperties.getCancellation().getAssignedFeePercent();
            case ARRIVED_PICKUP, IN_PROGRESS, ARRIVED_DROPOFF ->
                    tripPolicyProperties.getCancellation().getAfterArrivalFeePercent();
            default -> 0;
        };
        if (percent == 0) {
            return BigDecimal.ZERO;
        }
        return trip.getEstimatedFare()
                .multiply(BigDecimal.valueOf(percent))
                .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
    }
}
