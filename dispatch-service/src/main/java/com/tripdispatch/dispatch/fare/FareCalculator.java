package com.tripdispatch.dispatch.fare;

import com.tripdispatch.shared.enums.VehicleType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fare calculation per vehicle class.
 *
 * Formula:
 *   fare = max(BASE + distanceKm * PER_KM + durationMin * PER_MIN, MINIMUM)
 */
@Slf4j
@Service
public class FareCalculator {

    record Rate(BigDecimal base, BigDecimal perKm, BigDecimal perMinute, BigDecimal minimum) {
        static Rate of(String base, String perKm, String perMinute, String minimum) {
            return new Rate(new BigDecimal(base), new BigDecimal(perKm),
                    new BigDecimal(perMinute), new BigDecimal(minimum));
        }
    }

    private static final Map<VehicleType, Rate> RATES = new EnumMap<>(VehicleType.class);

    static {
        RATES.put(VehicleType.BIKE,    Rate.of("100.00",  "60.00",  "5.00",  "300.00"));
        RATES.put(VehicleType.ECONOMY, Rate.of("200.00", "100.00", "10.00",  "500.00"));
        RATES.put(VehicleType.COMFORT, Rate.of("200.00", "150.00", "15.00",  "800.00"));
        RATES.put(VehicleType.PREMIUM, Rate.of("300.00", "200.00", "20.00", "1200.00"));
    }

    public BigDecimal calculate(VehicleType vehicleType, double distanceKm, int durationMin) {
        Rate rate = RATES.get(vehicleType);
        BigDecimal fare = rate.base()
                .add(BigDecimal.valueOf(distanceKm).multiply(rate.perKm()))
                .add(BigDecimal.valueOf(durationMin).multiply(rate.perMinute()))
                .max(rate.minimum())
                .setScale(2, RoundingMode.HALF_UP);

        log.debug("Fare calc: vehicle={} dist={}km duration={}min -> {}", vehicleType, distanceKm, durationMin, fare);
        return fare;
    }

    public BigDecimal calculate(VehicleType vehicleType, RouteEstimate route) {
        return calculate(vehicleType, route.distanceKm(), route.durationMin());
    }

    public BigDecimal minimumFare(VehicleType vehicleType) {
        return RATES.get(vehicleType).minimum();
    }
}
