package dev.simpleemailapi.client;

/**
 * Result of a send operation.
 *
 * @param id the id assigned to the email; events for this email carry it as {@code emailId}
 */
public record SendEmailResponse(String id) {}
