package com.alertrelay.service.gateway;

import com.alertrelay.pipeline.dispatch.NotificationContent;
import com.alertrelay.pipeline.dispatch.NotificationGateway;
import com.alertrelay.pipeline.dispatch.RecipientDirectory;

import java.util.Optional;
import java.util.logging.Logger;

public final class LoggingPushGateway implements NotificationGateway {
    private static final Logger LOGGER = Logger.getLogger(LoggingPushGateway.class.getName());

    private final RecipientDirectory directory;

    public LoggingPushGateway(RecipientDirectory directory) {
        this.directory = directory;
    }

    @Override
    public String channel() {
        return HttpPushGateway.CHANNEL;
    }

    @Override
    public Optional<String> resolveTarget(String recipientId) {
        return directory.pushToken(recipientId);
    }

    @Override
    public void send(String target, NotificationContent content) {
        LOGGER.info("Push to " + abbreviate(target) + ": " + content.title() + " " + content.data());
    }

    // Tokens are credentials; only the prefix is logged.
    private static String abbreviate(String token) {
        return token.length() <= 8 ? token : token.substring(0, 8) + "...";
    }
}
