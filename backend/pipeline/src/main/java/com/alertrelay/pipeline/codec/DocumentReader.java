package com.alertrelay.pipeline.codec;

import com.alertrelay.pipeline.store.StoredDocument;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

final class DocumentReader {
    private final String documentRef;
    private final Map<String, Object> fields;

    DocumentReader(String collection, StoredDocument document) {
        this(collection + "/" + document.id(), document.fields());
    }

    private DocumentReader(String documentRef, Map<String, Object> fields) {
        this.documentRef = documentRef;
        this.fields = fields;
    }

    String requiredString(String field) {
        Object value = fields.get(field);
        if (!(value instanceof String text)) {
            throw missing(field);
        }
        return text;
    }

    String optionalString(String field) {
        Object value = fields.get(field);
        if (value instanceof String text && !text.isBlank()) {
            return text;
        }
        return null;
    }

    boolean requiredBoolean(String field) {
        Object value = fields.get(field);
        if (!(value instanceof Boolean flag)) {
            throw missing(field);
        }
        return flag;
    }

    boolean optionalBoolean(String field, boolean fallback) {
        Object value = fields.get(field);
        return value instanceof Boolean flag ? flag : fallback;
    }

    int requiredInt(String field) {
        Object value = fields.get(field);
        if (!(value instanceof Number number)) {
            throw missing(field);
        }
        try {
            return new BigDecimal(number.toString()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new DocumentDecodingException("Field '" + field + "' of " + documentRef + " is not an int: " + number, e);
        }
    }

    Optional<Double> optionalDouble(String field) {
        Object value = fields.get(field);
        return value instanceof Number number ? Optional.of(number.doubleValue()) : Optional.empty();
    }

    Instant requiredInstant(String field) {
        Instant instant = optionalInstant(field);
        if (instant == null) {
            throw missing(field);
        }
        return instant;
    }

    Instant optionalInstant(String field) {
        Object value = fields.get(field);
        if (value instanceof Number millis) {
            return Instant.ofEpochMilli(millis.longValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                throw new DocumentDecodingException("Field '" + field + "' of " + documentRef + " is not a timestamp", e);
            }
        }
        return null;
    }

    List<String> stringList(String field) {
        Object value = fields.get(field);
        if (!(value instanceof List<?> items)) {
            return List.of();
        }
        List<String> strings = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof String text && !text.isBlank()) {
                strings.add(text);
            }
        }
        return strings;
    }

    @SuppressWarnings("unchecked")
    Optional<DocumentReader> nested(String field) {
        Object value = fields.get(field);
        if (value instanceof Map<?, ?> map && !map.isEmpty()) {
            return Optional.of(new DocumentReader(documentRef + "#" + field, (Map<String, Object>) map));
        }
        return Optional.empty();
    }

    <T> T decode(String field, Function<String, T> parser) {
        String raw = requiredString(field);
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            throw new DocumentDecodingException("Field '" + field + "' of " + documentRef + " has unknown value '" + raw + "'", e);
        }
    }

    private DocumentDecodingException missing(String field) {
        return new DocumentDecodingException("Missing or invalid field '" + field + "' in " + documentRef);
    }
}
