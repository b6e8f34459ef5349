package com.alertrelay.pipeline.store;

import java.util.Map;
import java.util.Objects;

public record StoredDocument(String id, Map<String, Object> fields) {
    public StoredDocument {
        Objects.requireNonNull(id, "id is required");
        fields = fields == null ? Map.of() : fields;
    }

    public Object get(String field) {
        return fields.get(field);
    }
}
