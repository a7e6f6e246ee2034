package com.tripdispatch.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "trips")
public class TripPolicyProperties {

    private String defaultCurrency = "NGN";

    private Scheduling scheduling = new Scheduling();
    private Tip tip = new Tip();
    private Sharing sharing = new Sharing();
    private Cancellation cancellation = new Cancellation();

    @Data
    public static class Scheduling {
        private Duration minLead = Duration.ofMinutes(30);
        private Duration maxHorizon = Duration.ofDays(7);
        /** How long a due trip may wait on a conflicting active trip before it is cancelled. */
        private Duration promotionGrace = Duration.ofMinutes(30);
    }

    @Data
    public static class Tip {
        private BigDecimal min = new BigDecimal("50");
        private BigDecimal max = new BigDecimal("50000");
    }

    @Data
    public static class Sharing {
        private Duration tokenTtl = Duration.ofHours(24);
        private Duration postCompletionTtl = Duration.ofHours(2);
    }

    @Data
    public static class Cancellation {
        private int assignedFeePercent = 10;
        private int afterArrivalFeePercent = 50;
    }
}
