package com.tripdispatch.dispatch.lifecycle;

import com.tripdispatch.dispatch.exception.DispatchException;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.shared.enums.TripStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.tripdispatch.shared.enums.TripStatus.*;

/**
 * Closed transition table for trips. Anything not listed is rejected.
 *
 * <pre>
 *   PENDING         -> SEARCHING | SCHEDULED | CANCELLED
 *   SCHEDULED       -> SEARCHING | CANCELLED
 *   SEARCHING       -> ASSIGNED | CANCELLED
 *   ASSIGNED        -> ARRIVED_PICKUP | CANCELLED | SEARCHING*
 *   ARRIVED_PICKUP  -> IN_PROGRESS | CANCELLED | SEARCHING*
 *   IN_PROGRESS     -> ARRIVED_DROPOFF | CANCELLED
 *   ARRIVED_DROPOFF -> COMPLETED | CANCELLED
 * </pre>
 *
 * (*) only when the bound worker is released before pickup.
 */
public final class TripStateMachine {

    private static final Map<TripStatus, Set<TripStatus>> EDGES = new EnumMap<>(TripStatus.class);
    private static final Map<TripStatus, Set<TripStatus>> REASSIGNMENT_EDGES = new EnumMap<>(TripStatus.class);

    static {
        EDGES.put(PENDING, EnumSet.of(SEARCHING, SCHEDULED, CANCELLED));
        EDGES.put(SCHEDULED, EnumSet.of(SEARCHING, CANCELLED));
        EDGES.put(SEARCHING, EnumSet.of(ASSIGNED, CANCELLED));
        EDGES.put(ASSIGNED, EnumSet.of(ARRIVED_PICKUP, CANCELLED));
        EDGES.put(ARRIVED_PICKUP, EnumSet.of(IN_PROGRESS, CANCELLED));
        EDGES.put(IN_PROGRESS, EnumSet.of(ARRIVED_DROPOFF, CANCELLED));
        EDGES.put(ARRIVED_DROPOFF, EnumSet.of(COMPLETED, CANCELLED));
        EDGES.put(COMPLETED, EnumSet.noneOf(TripStatus.class));
        EDGES.put(CANCELLED, EnumSet.noneOf(TripStatus.class));

        REASSIGNMENT_EDGES.put(ASSIGNED, EnumSet.of(SEARCHING));
        REASSIGNMENT_EDGES.put(ARRIVED_PICKUP, EnumSet.of(SEARCHING));
    }

    private TripStateMachine() {}

    public static boolean canTransition(TripStatus from, TripStatus to) {
        return EDGES.getOrDefault(from, Set.of()).contains(to);
    }

    public static boolean canReassign(TripStatus from) {
        return REASSIGNMENT_EDGES.getOrDefault(from, Set.of()).contains(SEARCHING);
    }

    public static Set<TripStatus> allowedFrom(TripStatus from) {
        return Collections.unmodifiableSet(EDGES.getOrDefault(from, Set.of()));
    }

    public static void require(TripStatus from, TripStatus to) {
        if (!canTransition(from, to)) {
            throw new DispatchException(ErrorCode.INVALID_TRANSITION,
                    "Trip cannot move from " + from + " to " + to);
        }
    }

    public static void requireReassignment(TripStatus from) {
        if (!canReassign(from)) {
            throw new DispatchException(ErrorCode.INVALID_TRANSITION,
                    "Trip in " + from + " cannot be returned to search");
        }
    }
}
