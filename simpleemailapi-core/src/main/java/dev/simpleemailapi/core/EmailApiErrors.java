package dev.simpleemailapi.core;

import java.util.Map;

/**
 * Classification of arbitrary failures into {@link EmailApiException}.
 */
public final class EmailApiErrors {
    private EmailApiErrors() {}

    /**
     * Extracts a structured error from any failure.
     *
     * <p>Failures that did not come from the service are wrapped with
     * {@link ErrorCodes#UNSPECIFIED} and {@link RpcCode#UNKNOWN}, keeping the raw message.
     *
     * @param error the failure (may be null)
     * @return the structured error, or {@code null} if {@code error} is null
     */
    public static EmailApiException parse(Throwable error) {
        if (error == null) {
            return null;
        }

        EmailApiException structured = find(error, EmailApiException.class);
        if (structured != null) {
            return structured;
        }

        RpcException rpc = find(error, RpcException.class);
        if (rpc == null) {
            return new EmailApiException(ErrorCodes.UNSPECIFIED, messageOf(error), "", Map.of(), RpcCode.UNKNOWN, error);
        }

        int code = ErrorCodes.UNSPECIFIED;
        String message = rpc.getMessage();
        String field = "";
        Map<String, String> metadata = Map.of();

        for (ErrorDetail detail : rpc.details()) {
            if (!Protocol.ERROR_DETAIL_TYPE.equals(detail.type()) || detail.payload().isEmpty()) {
                continue;
            }
            ErrorDetailPayload payload = detail.payload().get();
            code = payload.code();
            if (payload.message() != null && !payload.message().isEmpty()) {
                message = payload.message();
            }
            field = payload.field();
            if (payload.metadata() != null) {
                metadata = payload.metadata();
            }
            break;
        }

        return new EmailApiException(code, message, field, metadata, rpc.code(), rpc);
    }

    /**
     * Checks whether a structured error is present in the cause chain.
     *
     * @param error the failure (may be null)
     * @return {@code true} if an {@link EmailApiException} was found
     */
    public static boolean isError(Throwable error) {
        return find(error, EmailApiException.class) != null;
    }

    private static <T extends Throwable> T find(Throwable error, Class<T> type) {
        Throwable cur = error;
        int depth = 0;
        while (cur != null && depth++ < 32) {
            if (type.isInstance(cur)) {
                return type.cast(cur);
            }
            cur = cur.getCause();
        }
        return null;
    }

    private static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message == null ? error.toString() : message;
    }
}
