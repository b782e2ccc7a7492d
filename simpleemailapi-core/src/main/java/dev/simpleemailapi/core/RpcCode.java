package dev.simpleemailapi.core;

/**
 * Transport-level status codes (Connect/gRPC code space).
 */
public enum RpcCode {
    CANCELED("canceled"),
    UNKNOWN("unknown"),
    INVALID_ARGUMENT("invalid_argument"),
    DEADLINE_EXCEEDED("deadline_exceeded"),
    NOT_FOUND("not_found"),
    ALREADY_EXISTS("already_exists"),
    PERMISSION_DENIED("permission_denied"),
    RESOURCE_EXHAUSTED("resource_exhausted"),
    FAILED_PRECONDITION("failed_precondition"),
    ABORTED("aborted"),
    OUT_OF_RANGE("out_of_range"),
    UNIMPLEMENTED("unimplemented"),
    INTERNAL("internal"),
    UNAVAILABLE("unavailable"),
    DATA_LOSS("data_loss"),
    UNAUTHENTICATED("unauthenticated");

    private final String wireName;

    RpcCode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name, falling back to {@link #UNKNOWN}.
     *
     * @param wireName the wire name (may be null)
     * @return the code
     */
    public static RpcCode fromWireName(String wireName) {
        if (wireName == null) return UNKNOWN;
        for (RpcCode c : values()) {
            if (c.wireName.equals(wireName)) return c;
        }
        return UNKNOWN;
    }

    /**
     * Maps an HTTP status to a code when the response carried no usable error body.
     *
     * @param status HTTP status code
     * @return the inferred code
     */
    public static RpcCode fromHttpStatus(int status) {
        switch (status) {
            case 400:
                return INTERNAL;
            case 401:
                return UNAUTHENTICATED;
            case 403:
                return PERMISSION_DENIED;
            case 404:
                return UNIMPLEMENTED;
            case 429:
            case 502:
            case 503:
            case 504:
                return UNAVAILABLE;
            default:
                return UNKNOWN;
        }
    }
}
