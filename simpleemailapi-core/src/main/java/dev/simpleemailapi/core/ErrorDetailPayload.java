package dev.simpleemailapi.core;

import java.util.Map;

/**
 * Decoded body of a {@value Protocol#ERROR_DETAIL_TYPE} error detail.
 *
 * @param code service error code, see {@link ErrorCodes}
 * @param message human-readable message (may be empty)
 * @param field offending request field, empty unless validation related
 * @param metadata additional context such as limits or upgrade URLs (may be null)
 */
public record ErrorDetailPayload(int code, String message, String field, Map<String, String> metadata) {}
