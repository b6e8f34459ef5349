package com.alertrelay.pipeline.dispatch;

import com.alertrelay.pipeline.store.CollectionPaths;
import com.alertrelay.pipeline.store.DocumentStore;

import java.util.Optional;

public class RecipientDirectory {
    public static final String PUSH_TOKEN_FIELD = "fcmToken";
    public static final String EMAIL_FIELD = "email";

    private final DocumentStore store;

    public RecipientDirectory(DocumentStore store) {
        this.store = store;
    }

    public Optional<String> pushToken(String recipientId) {
        return field(recipientId, PUSH_TOKEN_FIELD);
    }

    public Optional<String> email(String recipientId) {
        return field(recipientId, EMAIL_FIELD);
    }

    private Optional<String> field(String recipientId, String field) {
        return store.get(CollectionPaths.USERS, recipientId)
                .map(user -> user.get(field))
                .filter(String.class::isInstance)
                .map(String.class::cast)
                .filter(value -> !value.isBlank());
    }
}
