package com.example.storelab.support;

import com.example.storelab.models.StatusValue;
import com.example.storelab.query.Criterion;
import com.example.storelab.query.RecordQuery;
import com.example.storelab.query.SortOrder;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Interprets a {@link RecordQuery} against plain Java objects with the same semantics as the
 * MongoDB and PostgreSQL translators, so services can be exercised without a database.
 */
public final class InMemoryQueryEvaluator<T> {

    private final Map<String, Function<T, Object>> fields;

    public InMemoryQueryEvaluator(Map<String, Function<T, Object>> fields) {
        this.fields = Map.copyOf(fields);
    }

    public List<T> find(Stream<T> records, RecordQuery query) {
        Stream<T> matching = records.filter(record -> matches(record, query));
        if (!query.sort().isEmpty()) {
            matching = matching.sorted(comparator(query.sort()));
        }
        if (query.offset().isPresent()) {
            matching = matching.skip(query.offset().get());
        }
        if (query.limit().isPresent()) {
            matching = matching.limit(query.limit().get());
        }
        return matching.toList();
    }

    public long count(Stream<T> records, RecordQuery query) {
        return records.filter(record -> matches(record, query)).count();
    }

    public boolean matches(T record, RecordQuery query) {
        boolean all = query.allOf().stream().allMatch(c -> test(record, c));
        boolean any = query.anyOf().isEmpty() || query.anyOf().stream().anyMatch(c -> test(record, c));
        return all && any;
    }

    private boolean test(T record, Criterion criterion) {
        Object actual = normalize(read(record, criterion.field()));
        Object expected = normalize(criterion.value());
        return switch (criterion.operator()) {
            case EQ -> actual == null ? expected == null : equalValues(actual, expected);
            case GTE -> actual != null && compare(actual, expected) >= 0;
            case LTE -> actual != null && compare(actual, expected) <= 0;
            case CONTAINS_IGNORE_CASE -> actual != null && actual.toString().toLowerCase(Locale.ROOT)
                    .contains(((String) expected).toLowerCase(Locale.ROOT));
        };
    }

    private Object read(T record, String field) {
        Function<T, Object> accessor = fields.get(field);
        if (accessor == null) {
            throw new IllegalArgumentException("Field " + field + " is not queryable");
        }
        return accessor.apply(record);
    }

    private Comparator<T> comparator(List<SortOrder> sorts) {
        Comparator<T> combined = null;
        for (SortOrder sort : sorts) {
            Comparator<T> key = Comparator.<T, Object>comparing(
                    record -> normalize(read(record, sort.field())),
                    Comparator.nullsLast(InMemoryQueryEvaluator::compare));
            if (!sort.ascending()) {
                key = key.reversed();
            }
            combined = combined == null ? key : combined.thenComparing(key);
        }
        return combined;
    }

    private static Object normalize(Object value) {
        return value instanceof StatusValue status ? status.value() : value;
    }

    private static boolean equalValues(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            return compare(actual, expected) == 0;
        }
        return actual.equals(expected);
    }

    private static int compare(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        if (left instanceof Instant a && right instanceof Instant b) {
            return a.compareTo(b);
        }
        throw new IllegalArgumentException("Cannot compare " + left.getClass().getSimpleName()
                + " with " + right.getClass().getSimpleName());
    }
}
