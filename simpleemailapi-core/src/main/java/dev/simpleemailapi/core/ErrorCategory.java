package dev.simpleemailapi.core;

/**
 * Coarse-grained buckets of {@link ErrorCodes}, each a contiguous half-open range.
 *
 * <p>Codes in 410-499 (already exists) and 700-899 (attachments, tokens) belong to no category
 * and are only addressable by exact code.
 */
public enum ErrorCategory {
    AUTH("auth", 100, 200),
    AUTHZ("authz", 200, 300),
    VALIDATION("validation", 300, 400),
    NOT_FOUND("notfound", 400, 410),
    DOMAIN("domain", 500, 600),
    RATE_LIMIT("ratelimit", 600, 700),
    INTERNAL("internal", 900, Integer.MAX_VALUE);

    private final String categoryName;
    private final int fromInclusive;
    private final int toExclusive;

    ErrorCategory(String categoryName, int fromInclusive, int toExclusive) {
        this.categoryName = categoryName;
        this.fromInclusive = fromInclusive;
        this.toExclusive = toExclusive;
    }

    public String categoryName() {
        return categoryName;
    }

    /**
     * Checks range membership.
     *
     * @param code the error code
     * @return {@code true} if the code falls inside this category's range
     */
    public boolean contains(int code) {
        if (this == INTERNAL) {
            return code >= fromInclusive;
        }
        return code >= fromInclusive && code < toExclusive;
    }

    /**
     * Resolves a category by its short name ({@code "auth"}, {@code "notfound"}, ...).
     *
     * @param name the category name
     * @return the category, or {@code null} if the name is unknown
     */
    public static ErrorCategory fromName(String name) {
        if (name == null) return null;
        for (ErrorCategory c : values()) {
            if (c.categoryName.equals(name)) return c;
        }
        return null;
    }
}
