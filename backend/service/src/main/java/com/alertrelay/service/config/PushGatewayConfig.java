package com.alertrelay.service.config;

import java.util.Locale;

public record PushGatewayConfig(String mode, String endpoint, String apiKey) {
    public static final String MODE_LOG = "log";
    public static final String MODE_HTTP = "http";

    public PushGatewayConfig {
        mode = mode == null || mode.isBlank() ? MODE_LOG : mode.trim().toLowerCase(Locale.ROOT);
        if (!MODE_LOG.equals(mode) && !MODE_HTTP.equals(mode)) {
            throw new IllegalArgumentException("Unknown push mode: " + mode);
        }
        if (MODE_HTTP.equals(mode) && (endpoint == null || endpoint.isBlank())) {
            throw new IllegalArgumentException("push.endpoint is required when push.mode is http");
        }
    }

    public static PushGatewayConfig logging() {
        return new PushGatewayConfig(MODE_LOG, null, null);
    }

    public boolean http() {
        return MODE_HTTP.equals(mode);
    }
}
