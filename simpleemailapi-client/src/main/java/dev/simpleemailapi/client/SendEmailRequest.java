package dev.simpleemailapi.client;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Request to send an email.
 *
 * @param from sender address on a verified domain
 * @param to recipients
 * @param cc carbon-copy recipients (optional)
 * @param bcc blind carbon-copy recipients (optional)
 * @param replyTo reply-to address (optional)
 * @param subject the subject line
 * @param body plain-text body
 * @param html HTML body (optional)
 * @param headers additional MIME headers (optional)
 */
public record SendEmailRequest(
        String from,
        List<String> to,
        List<String> cc,
        List<String> bcc,
        String replyTo,
        String subject,
        String body,
        String html,
        Map<String, String> headers
) {
    public SendEmailRequest {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(subject, "subject");
        if (to.isEmpty()) {
            throw new IllegalArgumentException("to must not be empty");
        }
        to = List.copyOf(to);
        cc = cc == null ? null : List.copyOf(cc);
        bcc = bcc == null ? null : List.copyOf(bcc);
        headers = headers == null ? null : Map.copyOf(headers);
    }

    /**
     * Creates a plain-text email.
     *
     * @param from sender address
     * @param to recipients
     * @param subject the subject line
     * @param body plain-text body
     * @return the request
     */
    public static SendEmailRequest of(String from, List<String> to, String subject, String body) {
        return new SendEmailRequest(from, to, null, null, null, subject, body, null, null);
    }
}
