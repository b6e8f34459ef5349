package com.alertrelay.pipeline.api;

import java.util.Set;

@FunctionalInterface
public interface GroupPreferenceFilter {
    Set<String> filter(String organizationId, Set<String> recipientIds, String groupId);
}
