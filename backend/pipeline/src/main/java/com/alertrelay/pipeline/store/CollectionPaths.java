package com.alertrelay.pipeline.store;

public final class CollectionPaths {
    public static final String SCHEDULED_ALERTS = "scheduledAlerts";
    public static final String ORGANIZATIONS = "organizations";
    public static final String USERS = "users";

    private CollectionPaths() {
    }

    public static String organizationAlerts(String organizationId) {
        return ORGANIZATIONS + "/" + organizationId + "/alerts";
    }

    public static String organizationFollowers(String organizationId) {
        return ORGANIZATIONS + "/" + organizationId + "/followers";
    }

    public static String followedOrganizations(String userId) {
        return USERS + "/" + userId + "/followedOrganizations";
    }
}
