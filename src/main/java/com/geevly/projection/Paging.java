package com.geevly.projection;

/**
 * One page of a projection listing. Pages are 1-based.
 */
public record Paging(int limit, int page) {

    public static final int DEFAULT_LIMIT = 20;

    public Paging {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (page < 1) {
            throw new IllegalArgumentException("page must be positive: " + page);
        }
    }

    public static Paging of(Integer limit, Integer page, int maxPageSize) {
        int l = limit == null || limit < 1 ? DEFAULT_LIMIT : Math.min(limit, maxPageSize);
        int p = page == null || page < 1 ? 1 : page;
        return new Paging(l, p);
    }

    public long offset() {
        return (long) limit * (page - 1);
    }
}
