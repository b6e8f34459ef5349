package com.alertrelay.service.gateway;

import com.alertrelay.core.util.JsonUtils;
import com.alertrelay.pipeline.dispatch.DeliveryException;
import com.alertrelay.pipeline.dispatch.NotificationContent;
import com.alertrelay.pipeline.dispatch.NotificationGateway;
import com.alertrelay.pipeline.dispatch.RecipientDirectory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

public final class OutboxEmailGateway implements NotificationGateway {
    public static final String CHANNEL = "email";

    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path outboxFile;
    private final String from;
    private final Clock clock;
    private final RecipientDirectory directory;
    private final ReentrantLock lock = new ReentrantLock();

    public OutboxEmailGateway(Path outboxFile, String from, Clock clock, RecipientDirectory directory) {
        this.outboxFile = outboxFile;
        this.from = from;
        this.clock = clock;
        this.directory = directory;
    }

    @Override
    public String channel() {
        return CHANNEL;
    }

    @Override
    public Optional<String> resolveTarget(String recipientId) {
        return directory.email(recipientId);
    }

    @Override
    public void send(String target, NotificationContent content) {
        OutboxMessage message = new OutboxMessage(from, target, content.title(), content.body(), content.data(), clock.instant());
        String line;
        try {
            line = MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new DeliveryException("Unable to encode email for " + target, e);
        }
        lock.lock();
        try {
            Path parent = outboxFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    outboxFile,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new DeliveryException("Failed appending to email outbox " + outboxFile, e);
        } finally {
            lock.unlock();
        }
    }

    public List<OutboxMessage> messages() {
        lock.lock();
        try {
            if (!Files.exists(outboxFile)) {
                return List.of();
            }
            List<OutboxMessage> messages = new ArrayList<>();
            for (String line : Files.readAllLines(outboxFile, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    messages.add(MAPPER.readValue(line, OutboxMessage.class));
                }
            }
            return messages;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading email outbox " + outboxFile, e);
        } finally {
            lock.unlock();
        }
    }

    public record OutboxMessage(
            String from,
            String to,
            String subject,
            String body,
            Map<String, String> data,
            Instant queuedAt
    ) {
    }
}
