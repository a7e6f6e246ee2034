package com.tripdispatch.dispatch.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Delivers trip notifications once the producing transaction has committed:
 * first to live connections, then to Kafka. Failures are logged and never
 * propagate back into the business flow.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TripEventRelay {

    private final ConnectionRegistry connectionRegistry;
    private final KafkaTemplate<String, Object> kafkaTemplate;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTripNotification(TripNotification notification) {
        if (notification.getEvent() != null) {
            for (String userId : notification.getRecipients()) {
                try {
                    connectionRegistry.publish(userId, notification.getEvent());
                } catch (RuntimeException e) {
                    log.warn("Live delivery of {} to user {} failed: {}",
                            notification.getEvent().getType(), userId, e.getMessage());
                }
            }
        }

        if (notification.getTopic() == null) {
            return;
        }
        try {
            kafkaTemplate.send(notification.getTopic(), notification.getKey(), notification.getPayload())
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Kafka publish to {} failed for key {}: {}",
                                    notification.getTopic(), notification.getKey(), ex.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("Kafka publish to {} failed for key {}: {}",
                    notification.getTopic(), notification.getKey(), e.getMessage());
        }
    }
}
