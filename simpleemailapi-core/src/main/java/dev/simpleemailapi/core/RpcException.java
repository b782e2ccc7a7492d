package dev.simpleemailapi.core;

import java.util.List;
import java.util.Objects;

/**
 * Failure reported by the remote service through the transport.
 *
 * <p>Carries the transport status code and any structured details. Use
 * {@link EmailApiErrors#parse(Throwable)} to classify it.
 */
public class RpcException extends RuntimeException {
    private final RpcCode code;
    private final List<ErrorDetail> details;

    public RpcException(RpcCode code, String message) {
        this(code, message, List.of(), null);
    }

    public RpcException(RpcCode code, String message, Throwable cause) {
        this(code, message, List.of(), cause);
    }

    public RpcException(RpcCode code, String message, List<ErrorDetail> details) {
        this(code, message, details, null);
    }

    public RpcException(RpcCode code, String message, List<ErrorDetail> details, Throwable cause) {
        super(message == null ? "" : message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public RpcCode code() {
        return code;
    }

    public List<ErrorDetail> details() {
        return details;
    }
}
