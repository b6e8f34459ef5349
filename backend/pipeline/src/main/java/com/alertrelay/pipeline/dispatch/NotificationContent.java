package com.alertrelay.pipeline.dispatch;

import com.alertrelay.core.model.LiveAlert;

import java.util.LinkedHashMap;
import java.util.Map;

public record NotificationContent(String title, String body, Map<String, String> data) {
    public NotificationContent {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static NotificationContent forAlert(LiveAlert alert) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("alertId", alert.id());
        data.put("organizationId", alert.organizationId());
        data.put("organizationName", alert.organizationName());
        data.put("groupName", alert.groupName() == null ? "" : alert.groupName());
        data.put("type", alert.category().type().wireValue());
        data.put("severity", alert.category().severity().wireValue());
        return new NotificationContent("New Alert: " + alert.title(), alert.description(), data);
    }
}
