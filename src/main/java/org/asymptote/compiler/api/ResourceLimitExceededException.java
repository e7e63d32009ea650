package org.asymptote.compiler.api;

/**
 * Thrown when a request exceeds its resource budget (token count, nesting depth,
 * fan-out or deadline). Fatal for the request.
 */
public class ResourceLimitExceededException extends AnalysisException {

    /**
     * The budget dimension that was exceeded.
     */
    public enum Limit {
        TOKENS,
        DEPTH,
        FAN_OUT,
        DEADLINE
    }

    private final Limit limit;
    private final long allowed;

    /**
     * @param limit   The exceeded dimension.
     * @param allowed The configured maximum.
     * @param where   Where the limit was hit, for the message.
     */
    public ResourceLimitExceededException(Limit limit, long allowed, String where) {
        super("Resource limit " + limit + " exceeded (allowed: " + allowed + ") " + where);
        this.limit = limit;
        this.allowed = allowed;
    }

    public Limit getLimit() {
        return limit;
    }

    public long getAllowed() {
        return allowed;
    }
}
