package com.example.storelab.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Backend-neutral description of a read: every {@code allOf} criterion must hold and, when
 * {@code anyOf} is non-empty, at least one of those must hold as well. Sort keys apply in
 * order, later keys breaking ties of earlier ones. The offset/limit window is optional.
 */
public final class RecordQuery {

    private final List<Criterion> allOf;
    private final List<Criterion> anyOf;
    private final List<SortOrder> sort;
    private final Long offset;
    private final Integer limit;

    private RecordQuery(Builder builder) {
        this.allOf = List.copyOf(builder.allOf);
        this.anyOf = List.copyOf(builder.anyOf);
        this.sort = List.copyOf(builder.sort);
        this.offset = builder.offset;
        this.limit = builder.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Criterion> allOf() {
        return allOf;
    }

    public List<Criterion> anyOf() {
        return anyOf;
    }

    public List<SortOrder> sort() {
        return sort;
    }

    public Optional<Long> offset() {
        return Optional.ofNullable(offset);
    }

    public Optional<Integer> limit() {
        return Optional.ofNullable(limit);
    }

    /**
     * Same predicates without sorting or windowing, for counting.
     */
    public RecordQuery withoutWindow() {
        Builder builder = new Builder();
        builder.allOf.addAll(allOf);
        builder.anyOf.addAll(anyOf);
        return builder.build();
    }

    @Override
    public String toString() {
        return "RecordQuery{allOf=" + allOf + ", anyOf=" + anyOf + ", sort=" + sort
                + ", offset=" + offset + ", limit=" + limit + '}';
    }

    public static final class Builder {
        private final List<Criterion> allOf = new ArrayList<>();
        private final List<Criterion> anyOf = new ArrayList<>();
        private final List<SortOrder> sort = new ArrayList<>();
        private Long offset;
        private Integer limit;

        private Builder() {
        }

        public Builder where(Criterion criterion) {
            allOf.add(criterion);
            return this;
        }

        public Builder whereAll(List<Criterion> criteria) {
            allOf.addAll(criteria);
            return this;
        }

        public Builder whereAny(List<Criterion> criteria) {
            anyOf.addAll(criteria);
            return this;
        }

        /**
         * Replaces the sort keys; {@code thenBy} keys break ties left by {@code first}.
         */
        public Builder sort(SortOrder first, SortOrder... thenBy) {
            sort.clear();
            sort.add(Objects.requireNonNull(first, "first"));
            sort.addAll(Arrays.asList(thenBy));
            return this;
        }

        public Builder page(PageSpec pageSpec) {
            this.offset = pageSpec.offset();
            this.limit = pageSpec.limit();
            return this;
        }

        public Builder limit(int maxResults) {
            if (maxResults < 1) {
                throw new IllegalArgumentException("limit must be >= 1");
            }
            this.limit = maxResults;
            return this;
        }

        public RecordQuery build() {
            return new RecordQuery(this);
        }
    }
}
