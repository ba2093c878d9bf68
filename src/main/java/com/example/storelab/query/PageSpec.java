package com.example.storelab.query;

/**
 * 1-based page number plus page size. Both must be at least 1.
 */
public record PageSpec(int page, int limit) {

    public PageSpec {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
    }

    public static PageSpec of(int page, int limit) {
        return new PageSpec(page, limit);
    }

    public long offset() {
        return (long) (page - 1) * limit;
    }

    /**
     * Same page number with the size capped at {@code maxLimit}.
     */
    public PageSpec clampLimit(int maxLimit) {
        return limit <= maxLimit ? this : new PageSpec(page, maxLimit);
    }
}
