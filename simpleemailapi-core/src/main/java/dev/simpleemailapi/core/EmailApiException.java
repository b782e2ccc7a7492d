package dev.simpleemailapi.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured error from SimpleEmailAPI.
 *
 * <pre>{@code
 * try {
 *     client.send(request);
 * } catch (RuntimeException e) {
 *     EmailApiException err = EmailApiErrors.parse(e);
 *     if (err != null && err.is(ErrorCodes.DOMAIN_NOT_VERIFIED)) {
 *         // ask the user to verify the domain first
 *     }
 *     if (err != null && err.isCategory(ErrorCategory.VALIDATION)) {
 *         log.warn("invalid field {}", err.field());
 *     }
 * }
 * }</pre>
 */
public class EmailApiException extends RuntimeException {
    private final int code;
    private final String field;
    private final Map<String, String> metadata;
    private final RpcCode rpcCode;

    public EmailApiException(int code, String message, String field, Map<String, String> metadata, RpcCode rpcCode) {
        this(code, message, field, metadata, rpcCode, null);
    }

    public EmailApiException(int code, String message, String field, Map<String, String> metadata,
                             RpcCode rpcCode, Throwable cause) {
        super(message == null ? "" : message, cause);
        this.code = code;
        this.field = field == null ? "" : field;
        this.metadata = copyMetadata(metadata);
        this.rpcCode = Objects.requireNonNull(rpcCode, "rpcCode");
    }

    /**
     * Service error code, {@link ErrorCodes#UNSPECIFIED} when the failure was not classified.
     *
     * @return the numeric code
     */
    public int code() {
        return code;
    }

    /**
     * Request field that caused the error; empty unless validation related.
     *
     * @return the field name
     */
    public String field() {
        return field;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    /**
     * Underlying transport status code.
     *
     * @return the transport code
     */
    public RpcCode rpcCode() {
        return rpcCode;
    }

    public boolean is(int code) {
        return this.code == code;
    }

    public boolean isCategory(ErrorCategory category) {
        return category != null && category.contains(code);
    }

    /**
     * Checks category membership by short name, see {@link ErrorCategory#categoryName()}.
     *
     * @param category the category name
     * @return {@code false} for unknown names
     */
    public boolean isCategory(String category) {
        return isCategory(ErrorCategory.fromName(category));
    }

    private static Map<String, String> copyMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        metadata.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
