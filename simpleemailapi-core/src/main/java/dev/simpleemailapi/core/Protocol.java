package dev.simpleemailapi.core;

/**
 * SimpleEmailAPI wire-protocol constants (service paths, header names, and well-known values).
 *
 * <p>This module intentionally contains no HTTP client bindings and no JSON library dependencies.
 * It only models protocol-level concerns shared by every transport.
 */
public final class Protocol {
    private Protocol() {}

    /** Default API endpoint. */
    public static final String DEFAULT_BASE_URL = "https://api.simpleemailapi.dev";

    // Services
    public static final String EMAIL_SERVICE = "v1.EmailService";
    public static final String DOMAIN_SERVICE = "v1.DomainService";

    // EmailService procedures
    public static final String SEND_EMAIL = EMAIL_SERVICE + "/SendEmail";
    public static final String STREAM_EVENTS = EMAIL_SERVICE + "/StreamEvents";
    public static final String ACK_EVENTS = EMAIL_SERVICE + "/AckEvents";

    // DomainService procedures
    public static final String CREATE_DOMAIN = DOMAIN_SERVICE + "/CreateDomain";
    public static final String GET_DOMAIN = DOMAIN_SERVICE + "/GetDomain";
    public static final String LIST_DOMAINS = DOMAIN_SERVICE + "/ListDomains";
    public static final String VERIFY_DOMAIN = DOMAIN_SERVICE + "/VerifyDomain";
    public static final String DELETE_DOMAIN = DOMAIN_SERVICE + "/DeleteDomain";

    // HTTP headers
    public static final String H_AUTHORIZATION = "Authorization";
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CONNECT_PROTOCOL_VERSION = "Connect-Protocol-Version";

    public static final String BEARER_PREFIX = "Bearer ";
    public static final String CONNECT_PROTOCOL_VERSION = "1";

    // Content types
    public static final String CT_JSON = "application/json";
    public static final String CT_CONNECT_JSON = "application/connect+json";

    /** Type name of the structured error detail attached to service failures. */
    public static final String ERROR_DETAIL_TYPE = "v1.ErrorDetail";
}
