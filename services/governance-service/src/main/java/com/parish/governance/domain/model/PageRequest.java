package com.parish.governance.domain.model;

/**
 * One-based page request. Missing or invalid values fall back to page 1 and 25 items;
 * the limit is capped at 100.
 */
public record PageRequest(int page, int limit) {

    public static final int DEFAULT_LIMIT = 25;
    public static final int MAX_LIMIT = 100;

    public PageRequest {
        if (page < 1) {
            page = 1;
        }
        if (limit < 1) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
    }

    public static PageRequest of(Integer page, Integer limit) {
        return new PageRequest(page == null ? 1 : page, limit == null ? DEFAULT_LIMIT : limit);
    }

    public long offset() {
        return (long) (page - 1) * limit;
    }
}
