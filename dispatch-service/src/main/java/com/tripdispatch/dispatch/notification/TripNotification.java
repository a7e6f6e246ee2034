package com.tripdispatch.dispatch.notification;

import com.tripdispatch.shared.events.RealtimeEvent;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Application event raised inside a business transaction. It is delivered to
 * live connections and Kafka only after that transaction commits.
 */
@Value
@Builder
public class TripNotification {

    @Singular
    List<String> recipients;

    RealtimeEvent event;

    String topic;
    String key;
    Object payload;
}
