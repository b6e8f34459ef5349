package com.alertrelay.pipeline.codec;

import com.alertrelay.core.model.GeoLocation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

final class LocationFields {
    private LocationFields() {
    }

    static Map<String, Object> toFields(GeoLocation location) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("latitude", location.latitude());
        fields.put("longitude", location.longitude());
        putIfPresent(fields, "address", location.address());
        putIfPresent(fields, "city", location.city());
        putIfPresent(fields, "state", location.state());
        putIfPresent(fields, "zipCode", location.zipCode());
        return fields;
    }

    static GeoLocation fromFields(DocumentReader reader) {
        Optional<DocumentReader> nested = reader.nested("location");
        if (nested.isEmpty()) {
            return null;
        }
        DocumentReader location = nested.get();
        Optional<Double> latitude = location.optionalDouble("latitude");
        Optional<Double> longitude = location.optionalDouble("longitude");
        if (latitude.isEmpty() || longitude.isEmpty()) {
            return null;
        }
        return new GeoLocation(
                latitude.get(),
                longitude.get(),
                location.optionalString("address"),
                location.optionalString("city"),
                location.optionalString("state"),
                location.optionalString("zipCode")
        );
    }

    static void putIfPresent(Map<String, Object> fields, String name, Object value) {
        if (value != null) {
            fields.put(name, value);
        }
    }
}
