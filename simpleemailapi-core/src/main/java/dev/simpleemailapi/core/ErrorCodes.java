package dev.simpleemailapi.core;

/**
 * Numeric error codes returned by the service.
 *
 * <p>Ranges: 1xx auth, 2xx authz, 3xx validation, 4xx resources, 5xx domain,
 * 6xx rate/usage, 7xx attachments, 8xx tokens, 9xx internal. See {@link ErrorCategory}.
 */
public final class ErrorCodes {
    private ErrorCodes() {}

    public static final int UNSPECIFIED = 0;

    // Authentication (1xx)
    public static final int UNAUTHENTICATED = 100;
    public static final int INVALID_API_KEY = 101;
    public static final int EXPIRED_API_KEY = 102;
    public static final int CLERK_TOKEN_INVALID = 104;

    // Authorization (2xx)
    public static final int PERMISSION_DENIED = 200;
    public static final int ADMIN_REQUIRED = 201;
    public static final int ACCOUNT_SUSPENDED = 202;
    public static final int INSUFFICIENT_SCOPE = 203;

    // Validation (3xx)
    public static final int INVALID_ARGUMENT = 300;
    public static final int MISSING_REQUIRED_FIELD = 301;
    public static final int INVALID_EMAIL_SYNTAX = 302;
    public static final int NO_MX_RECORDS = 303;
    public static final int EMAIL_TYPO_DETECTED = 304;
    public static final int UNSAFE_URL = 305;
    public static final int EMAIL_SUPPRESSED = 306;
    public static final int SANDBOX_RESTRICTION = 307;

    // Resources (4xx)
    public static final int NOT_FOUND = 400;
    public static final int DOMAIN_NOT_FOUND = 401;
    public static final int API_KEY_NOT_FOUND = 402;
    public static final int USER_NOT_FOUND = 403;
    public static final int ALREADY_EXISTS = 410;
    public static final int DOMAIN_ALREADY_EXISTS = 411;

    // Domain verification (5xx)
    public static final int DOMAIN_NOT_OWNED = 500;
    public static final int DOMAIN_NOT_VERIFIED = 501;
    public static final int DOMAIN_DNS_MISMATCH = 502;
    public static final int DOMAIN_VERIFY_COOLDOWN = 503;

    // Rate limiting and usage (6xx)
    public static final int RATE_LIMITED = 600;
    public static final int DAILY_LIMIT_EXCEEDED = 601;
    public static final int MONTHLY_CREDITS_EXHAUSTED = 602;
    public static final int MAX_CONCURRENT_STREAMS = 603;

    // Attachments (7xx)
    public static final int ATTACHMENT_TOO_LARGE = 700;
    public static final int TOTAL_SIZE_EXCEEDED = 701;
    public static final int ATTACHMENT_THREAT_FOUND = 702;
    public static final int UNSUPPORTED_CONTENT_TYPE = 703;

    // Tokens (8xx)
    public static final int INVALID_TOKEN = 800;
    public static final int EXPIRED_TOKEN = 801;
    public static final int WEBHOOK_SECRET_INVALID = 810;

    // Internal (9xx)
    public static final int INTERNAL = 900;
    public static final int UPSTREAM_PROVIDER_ERROR = 901;
    public static final int SERVICE_UNAVAILABLE = 902;
}
