package dev.simpleemailapi.client;

/**
 * How processed events are acknowledged.
 */
public enum AckMode {
    /** Events are acknowledged in batches after their handler returns. */
    AUTO,
    /** The caller acknowledges events via {@link EmailApiClient#ackEvents(java.util.List)}. */
    MANUAL
}
