package com.alertrelay.service.config;

public record EmailOutboxConfig(boolean enabled, String outboxFile, String from) {
    public EmailOutboxConfig {
        outboxFile = outboxFile == null || outboxFile.isBlank() ? "outbox.jsonl" : outboxFile;
        from = from == null || from.isBlank() ? "alerts@alertrelay.local" : from;
    }

    public static EmailOutboxConfig disabled() {
        return new EmailOutboxConfig(false, null, null);
    }
}
