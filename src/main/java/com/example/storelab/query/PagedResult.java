package com.example.storelab.query;

import java.util.List;
import java.util.function.Function;

/**
 * One page of matching records plus the total number of matches for the same filter.
 * The total and the page are read separately, so a concurrent write can make them disagree by one.
 */
public record PagedResult<T>(List<T> items, long total, int page, int limit) {

    public PagedResult {
        items = List.copyOf(items);
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0");
        }
    }

    public static <T> PagedResult<T> of(List<T> items, long total, PageSpec pageSpec) {
        return new PagedResult<>(items, total, pageSpec.page(), pageSpec.limit());
    }

    public long pages() {
        return (total + limit - 1) / limit;
    }

    public <R> PagedResult<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new PagedResult<>(mapped, total, page, limit);
    }
}
