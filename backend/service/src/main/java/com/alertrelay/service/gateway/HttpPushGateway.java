package com.alertrelay.service.gateway;

import com.alertrelay.core.util.JsonUtils;
import com.alertrelay.pipeline.dispatch.DeliveryException;
import com.alertrelay.pipeline.dispatch.NotificationContent;
import com.alertrelay.pipeline.dispatch.NotificationGateway;
import com.alertrelay.pipeline.dispatch.RecipientDirectory;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class HttpPushGateway implements NotificationGateway {
    public static final String CHANNEL = "push";

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final Duration timeout;
    private final RecipientDirectory directory;

    public HttpPushGateway(HttpClient httpClient, URI endpoint, String apiKey, Duration timeout, RecipientDirectory directory) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.directory = directory;
    }

    @Override
    public String channel() {
        return CHANNEL;
    }

    @Override
    public Optional<String> resolveTarget(String recipientId) {
        return directory.pushToken(recipientId);
    }

    @Override
    public void send(String target, NotificationContent content) {
        HttpResponse<String> response = post(payload(target, content));
        int status = response.statusCode();
        if (status / 100 != 2) {
            throw new DeliveryException("Push provider answered " + status + " for " + endpoint);
        }
    }

    private HttpResponse<String> post(String body) {
        HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .timeout(timeout)
                .header("Content-Type", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }
        try {
            return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeliveryException("Push request to " + endpoint + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Push request to " + endpoint + " was interrupted", e);
        }
    }

    private static String payload(String token, NotificationContent content) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("token", token);
        message.put("title", content.title());
        message.put("body", content.body());
        message.put("data", content.data());
        try {
            return JsonUtils.objectMapper().writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new DeliveryException("Unable to encode push payload", e);
        }
    }
}
