package com.alertrelay.pipeline.followers;

import com.alertrelay.pipeline.api.GroupPreferenceFilter;
import com.alertrelay.pipeline.api.NotFoundException;
import com.alertrelay.pipeline.store.CollectionPaths;
import com.alertrelay.pipeline.store.DocumentStore;
import com.alertrelay.pipeline.store.Query;
import com.alertrelay.pipeline.store.StoredDocument;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

public class FollowerResolver {
    private static final Logger LOGGER = Logger.getLogger(FollowerResolver.class.getName());

    private final DocumentStore store;
    private final GroupPreferenceFilter groupPreferenceFilter;

    public FollowerResolver(DocumentStore store, GroupPreferenceFilter groupPreferenceFilter) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.groupPreferenceFilter = Objects.requireNonNull(groupPreferenceFilter, "groupPreferenceFilter is required");
    }

    public Set<String> eligibleRecipients(String organizationId, String posterId, String groupId) {
        return eligibleRecipients(organizationId, null, posterId, groupId);
    }

    public Set<String> eligibleRecipients(String organizationId, String organizationName, String posterId, String groupId) {
        StoredDocument organization = findOrganization(organizationId, organizationName);

        Set<String> recipients = activeFollowers(organization);
        if (posterId != null) {
            recipients.remove(posterId);
        }
        if (recipients.isEmpty() || groupId == null || groupId.isBlank()) {
            return recipients;
        }

        Set<String> opted = groupPreferenceFilter.filter(organization.id(), Set.copyOf(recipients), groupId);
        // Keep only ids we offered so a filter can never add people back.
        recipients.retainAll(opted == null ? Set.of() : opted);
        return recipients;
    }

    private StoredDocument findOrganization(String organizationId, String organizationName) {
        Optional<StoredDocument> byId = store.get(CollectionPaths.ORGANIZATIONS, organizationId);
        if (byId.isPresent()) {
            return byId.get();
        }
        if (organizationName != null && !organizationName.isBlank()) {
            List<StoredDocument> byName = store.query(
                    CollectionPaths.ORGANIZATIONS,
                    Query.where("name", Query.Operator.EQ, organizationName).limit(1)
            );
            if (!byName.isEmpty()) {
                LOGGER.info("Organization " + organizationId + " resolved by name to " + byName.get(0).id());
                return byName.get(0);
            }
        }
        throw new NotFoundException("Organization " + organizationId + " does not exist");
    }

    private Set<String> activeFollowers(StoredDocument organization) {
        Set<String> followers = new LinkedHashSet<>();
        Object inline = organization.get("followers");
        if (inline instanceof Map<?, ?> membership) {
            for (Map.Entry<?, ?> entry : membership.entrySet()) {
                if (Boolean.TRUE.equals(entry.getValue())) {
                    followers.add(String.valueOf(entry.getKey()));
                }
            }
            return followers;
        }

        List<StoredDocument> members = store.query(
                CollectionPaths.organizationFollowers(organization.id()),
                Query.where("isActive", Query.Operator.EQ, true)
        );
        for (StoredDocument member : members) {
            followers.add(member.id());
        }
        return followers;
    }
}
