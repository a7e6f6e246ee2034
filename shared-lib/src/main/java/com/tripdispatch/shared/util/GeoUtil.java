package com.tripdispatch.shared.util;

import com.uber.h3core.H3Core;
import com.uber.h3core.LengthUnit;

import java.io.IOException;
import java.util.List;

/**
 * H3 hexagonal geo-cell and great-circle distance helpers.
 * Resolution 7 (~1.4 km edge) buckets worker positions for proximity lookups.
 */
public final class GeoUtil {

    public static final int LOCATION_RESOLUTION = 7;

    private static final double EARTH_RADIUS_KM = 6371.0;

    private static final H3Core h3;
    private static final double LOCATION_EDGE_KM;

    static {
        try {
            h3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialise H3Core", e);
        }
        LOCATION_EDGE_KM = h3.getHexagonEdgeLengthAvg(LOCATION_RESOLUTION, LengthUnit.km);
    }

    private GeoUtil() {}

    public static String latLngToCell(double lat, double lng, int resolution) {
        return h3.latLngToCellAddress(lat, lng, resolution);
    }

    public static String locationCell(double lat, double lng) {
        return latLngToCell(lat, lng, LOCATION_RESOLUTION);
    }

    public static List<String> kRingCells(String cellId, int ringSize) {
        return h3.gridDisk(cellId, ringSize);
    }

    /**
     * Number of rings around a location cell that fully contains a circle of
     * the given radius. Over-covers; callers filter by exact distance.
     */
    public static int ringsCovering(double radiusKm) {
        return (int) Math.ceil(Math.max(radiusKm, 0.0) / LOCATION_EDGE_KM) + 1;
    }

    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }
}
