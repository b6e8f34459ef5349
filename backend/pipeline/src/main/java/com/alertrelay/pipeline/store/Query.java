package com.alertrelay.pipeline.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

// Documents lacking a predicate's field never match; documents lacking the ordering field are excluded.
public final class Query {
    public enum Operator {
        EQ,
        LT,
        LTE,
        GT,
        GTE
    }

    public record Predicate(String field, Operator operator, Object value) {
        public Predicate {
            Objects.requireNonNull(field, "field is required");
            Objects.requireNonNull(operator, "operator is required");
            Objects.requireNonNull(value, "value is required");
        }

        boolean test(Map<String, Object> fields) {
            Object stored = fields.get(field);
            if (stored == null) {
                return false;
            }
            if (operator == Operator.EQ) {
                return DocumentValues.valuesEqual(stored, value);
            }
            int cmp;
            try {
                cmp = DocumentValues.compare(stored, value);
            } catch (IllegalArgumentException mismatch) {
                return false;
            }
            return switch (operator) {
                case LT -> cmp < 0;
                case LTE -> cmp <= 0;
                case GT -> cmp > 0;
                case GTE -> cmp >= 0;
                case EQ -> cmp == 0;
            };
        }
    }

    private static final Query ALL = new Query(List.of(), null, false, 0);

    private final List<Predicate> predicates;
    private final String orderBy;
    private final boolean descending;
    private final int limit;

    private Query(List<Predicate> predicates, String orderBy, boolean descending, int limit) {
        this.predicates = List.copyOf(predicates);
        this.orderBy = orderBy;
        this.descending = descending;
        this.limit = limit;
    }

    public static Query all() {
        return ALL;
    }

    public static Query where(String field, Operator operator, Object value) {
        return ALL.and(field, operator, value);
    }

    public Query and(String field, Operator operator, Object value) {
        List<Predicate> next = new ArrayList<>(predicates);
        next.add(new Predicate(field, operator, value));
        return new Query(next, orderBy, descending, limit);
    }

    public Query orderBy(String field) {
        return new Query(predicates, Objects.requireNonNull(field, "field is required"), false, limit);
    }

    public Query orderByDescending(String field) {
        return new Query(predicates, Objects.requireNonNull(field, "field is required"), true, limit);
    }

    // Zero means no limit.
    public Query limit(int max) {
        if (max < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        return new Query(predicates, orderBy, descending, max);
    }

    public List<Predicate> predicates() {
        return predicates;
    }

    public boolean matches(Map<String, Object> fields) {
        for (Predicate predicate : predicates) {
            if (!predicate.test(fields)) {
                return false;
            }
        }
        return orderBy == null || fields.get(orderBy) != null;
    }

    public List<StoredDocument> apply(Collection<StoredDocument> documents) {
        List<StoredDocument> matched = new ArrayList<>();
        for (StoredDocument document : documents) {
            if (matches(document.fields())) {
                matched.add(document);
            }
        }
        if (orderBy != null) {
            Comparator<StoredDocument> comparator = (a, b) -> DocumentValues.compare(a.get(orderBy), b.get(orderBy));
            matched.sort(descending ? comparator.reversed() : comparator);
        }
        if (limit > 0 && matched.size() > limit) {
            return new ArrayList<>(matched.subList(0, limit));
        }
        return matched;
    }

    @Override
    public String toString() {
        return "Query{predicates=" + predicates + ", orderBy=" + orderBy + ", descending=" + descending
                + ", limit=" + limit + "}";
    }
}
