package dev.simpleemailapi.core;

/**
 * Discriminant of an {@link Event}.
 *
 * <p>{@link #HEARTBEAT} is not a business event; it only keeps the connection alive.
 */
public enum EventType {
    UNSPECIFIED("EVENT_TYPE_UNSPECIFIED"),
    SENT("EVENT_TYPE_SENT"),
    DELIVERED("EVENT_TYPE_DELIVERED"),
    BOUNCED("EVENT_TYPE_BOUNCED"),
    COMPLAINED("EVENT_TYPE_COMPLAINED"),
    REJECTED("EVENT_TYPE_REJECTED"),
    DELAYED("EVENT_TYPE_DELAYED"),
    REPLIED("EVENT_TYPE_REPLIED"),
    FAILED("EVENT_TYPE_FAILED"),
    HEARTBEAT("EVENT_TYPE_HEARTBEAT");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used on the wire, e.g. {@code EVENT_TYPE_DELIVERED}.
     *
     * @return the wire name
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name. Unknown or missing names map to {@link #UNSPECIFIED}.
     *
     * @param wireName the wire name (may be null)
     * @return the matching type
     */
    public static EventType fromWireName(String wireName) {
        if (wireName == null) return UNSPECIFIED;
        for (EventType t : values()) {
            if (t.wireName.equals(wireName)) return t;
        }
        return UNSPECIFIED;
    }
}
