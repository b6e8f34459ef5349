package com.alertrelay.pipeline.dispatch;

import java.util.Optional;

public interface NotificationGateway {
    String channel();

    Optional<String> resolveTarget(String recipientId);

    /**
     * @throws DeliveryException when the provider rejects or cannot be reached
     */
    void send(String target, NotificationContent content);
}
