package com.example.storelab.query;

import com.example.storelab.models.StatusValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

/**
 * Translates a {@link RecordQuery} into a Spring Data MongoDB {@link Query}. Field names are the
 * mapped entity's property names; anything outside {@code allowedFields} is rejected.
 */
public final class MongoQueryTranslator {

    private final Set<String> allowedFields;

    public MongoQueryTranslator(Set<String> allowedFields) {
        this.allowedFields = Set.copyOf(allowedFields);
    }

    public Query translate(RecordQuery recordQuery) {
        Query query = new Query();

        List<Criteria> parts = new ArrayList<>();
        for (Criterion criterion : recordQuery.allOf()) {
            parts.add(toCriteria(criterion));
        }
        if (!recordQuery.anyOf().isEmpty()) {
            List<Criteria> alternatives = recordQuery.anyOf().stream()
                    .map(this::toCriteria)
                    .toList();
            parts.add(alternatives.size() == 1
                    ? alternatives.get(0)
                    : new Criteria().orOperator(alternatives));
        }
        if (parts.size() == 1) {
            query.addCriteria(parts.get(0));
        } else if (parts.size() > 1) {
            // andOperator lets the same field appear twice (e.g. a price range)
            query.addCriteria(new Criteria().andOperator(parts));
        }

        if (!recordQuery.sort().isEmpty()) {
            query.with(Sort.by(recordQuery.sort().stream()
                    .map(sort -> new Sort.Order(
                            sort.ascending() ? Sort.Direction.ASC : Sort.Direction.DESC,
                            checkField(sort.field())))
                    .toList()));
        }
        recordQuery.offset().ifPresent(query::skip);
        recordQuery.limit().ifPresent(query::limit);
        return query;
    }

    private Criteria toCriteria(Criterion criterion) {
        Criteria where = Criteria.where(checkField(criterion.field()));
        Object value = storageValue(criterion.value());
        return switch (criterion.operator()) {
            case EQ -> where.is(value);
            case GTE -> where.gte(value);
            case LTE -> where.lte(value);
            case CONTAINS_IGNORE_CASE -> where.regex(Pattern.quote((String) value), "i");
        };
    }

    private String checkField(String field) {
        if (!allowedFields.contains(field)) {
            throw new IllegalArgumentException("Field " + field + " is not queryable");
        }
        return field;
    }

    static Object storageValue(Object value) {
        return value instanceof StatusValue status ? status.value() : value;
    }
}
