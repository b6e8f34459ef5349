package com.alertrelay.pipeline.followers;

import com.alertrelay.pipeline.api.GroupPreferenceFilter;
import com.alertrelay.pipeline.store.CollectionPaths;
import com.alertrelay.pipeline.store.DocumentStore;
import com.alertrelay.pipeline.store.StoredDocument;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class StoredGroupPreferenceFilter implements GroupPreferenceFilter {
    private final DocumentStore store;

    public StoredGroupPreferenceFilter(DocumentStore store) {
        this.store = store;
    }

    @Override
    public Set<String> filter(String organizationId, Set<String> recipientIds, String groupId) {
        Set<String> enabled = new LinkedHashSet<>();
        for (String recipientId : recipientIds) {
            Optional<StoredDocument> followed = store.get(CollectionPaths.followedOrganizations(recipientId), organizationId);
            if (followed.isPresent() && groupEnabled(followed.get(), groupId)) {
                enabled.add(recipientId);
            }
        }
        return enabled;
    }

    private static boolean groupEnabled(StoredDocument followed, String groupId) {
        Object preferences = followed.get("groupPreferences");
        if (!(preferences instanceof Map<?, ?> byGroup)) {
            return false;
        }
        return Boolean.TRUE.equals(byGroup.get(groupId));
    }
}
