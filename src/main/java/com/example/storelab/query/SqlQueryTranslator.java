package com.example.storelab.query;

import com.example.storelab.models.StatusValue;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * Translates a {@link RecordQuery} into a parameterised SQL fragment for PostgreSQL. Only fields
 * present in the column map can be referenced, so no request text ever reaches the SQL string.
 */
public final class SqlQueryTranslator {

    private final Map<String, String> columns;

    public SqlQueryTranslator(Map<String, String> columns) {
        this.columns = Map.copyOf(columns);
    }

    public SqlFragment translate(RecordQuery recordQuery) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> conditions = new ArrayList<>();

        for (Criterion criterion : recordQuery.allOf()) {
            conditions.add(condition(criterion, params));
        }
        if (!recordQuery.anyOf().isEmpty()) {
            List<String> alternatives = new ArrayList<>();
            for (Criterion criterion : recordQuery.anyOf()) {
                alternatives.add(condition(criterion, params));
            }
            conditions.add("(" + String.join(" OR ", alternatives) + ")");
        }

        String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);

        String orderBy = recordQuery.sort().isEmpty() ? "" : recordQuery.sort().stream()
                .map(sort -> column(sort.field()) + (sort.ascending() ? " ASC" : " DESC"))
                .collect(Collectors.joining(", ", " ORDER BY ", ""));

        StringBuilder window = new StringBuilder();
        recordQuery.limit().ifPresent(limit -> {
            window.append(" LIMIT :limit");
            params.addValue("limit", limit);
        });
        recordQuery.offset().ifPresent(offset -> {
            window.append(" OFFSET :offset");
            params.addValue("offset", offset);
        });

        return new SqlFragment(where, orderBy, window.toString(), params);
    }

    private String condition(Criterion criterion, MapSqlParameterSource params) {
        String column = column(criterion.field());
        String name = "p" + params.getValues().size();
        Object value = sqlValue(criterion.value());
        switch (criterion.operator()) {
            case EQ -> {
                params.addValue(name, value);
                return column + " = :" + name;
            }
            case GTE -> {
                params.addValue(name, value);
                return column + " >= :" + name;
            }
            case LTE -> {
                params.addValue(name, value);
                return column + " <= :" + name;
            }
            case CONTAINS_IGNORE_CASE -> {
                params.addValue(name, "%" + escapeLike((String) value) + "%");
                return column + " ILIKE :" + name + " ESCAPE '\\'";
            }
            default -> throw new IllegalStateException("Unhandled operator " + criterion.operator());
        }
    }

    private String column(String field) {
        String column = columns.get(field);
        if (column == null) {
            throw new IllegalArgumentException("Field " + field + " is not queryable");
        }
        return column;
    }

    static String escapeLike(String text) {
        return text.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    private static Object sqlValue(Object value) {
        if (value instanceof StatusValue status) {
            return status.value();
        }
        if (value instanceof Instant instant) {
            return Timestamp.from(instant);
        }
        return value;
    }

    /**
     * Pieces of a SELECT statement; callers supply the projection and table.
     */
    public record SqlFragment(String where, String orderBy, String window, MapSqlParameterSource params) {

        public String select(String selectFrom) {
            return selectFrom + where + orderBy + window;
        }

        public String count(String table) {
            return "SELECT COUNT(*) FROM " + table + where;
        }
    }
}
