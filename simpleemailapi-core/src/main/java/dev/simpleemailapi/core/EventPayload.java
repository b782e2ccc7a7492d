package dev.simpleemailapi.core;

import java.util.List;

/**
 * Business payload of an {@link Event}, one record per email lifecycle step.
 *
 * <p>Timestamps are kept in their RFC 3339 wire form.
 */
public sealed interface EventPayload permits
        EventPayload.EmailSent,
        EventPayload.EmailDelivered,
        EventPayload.EmailBounced,
        EventPayload.EmailComplained,
        EventPayload.EmailRejected,
        EventPayload.EmailDelayed,
        EventPayload.EmailReplied,
        EventPayload.EmailFailed {

    /**
     * Identifier of the email this payload refers to.
     *
     * @return the email id
     */
    String emailId();

    /**
     * The email was accepted for delivery.
     *
     * @param emailId the email id
     * @param recipients recipients the email was sent to
     * @param timestamp when the email was accepted
     */
    record EmailSent(String emailId, List<String> recipients, String timestamp) implements EventPayload {
        public EmailSent {
            recipients = copy(recipients);
        }
    }

    /**
     * The email reached the recipient's mail server.
     *
     * @param emailId the email id
     * @param recipients recipients that received the email
     * @param timestamp when delivery was confirmed
     */
    record EmailDelivered(String emailId, List<String> recipients, String timestamp) implements EventPayload {
        public EmailDelivered {
            recipients = copy(recipients);
        }
    }

    /**
     * The email bounced.
     *
     * @param emailId the email id
     * @param recipients bounced recipients
     * @param bounceType bounce classification ({@code Permanent}, {@code Transient}, ...)
     * @param bounceSubType bounce sub-classification
     * @param timestamp when the bounce was reported
     */
    record EmailBounced(String emailId, List<String> recipients, String bounceType, String bounceSubType,
                        String timestamp) implements EventPayload {
        public EmailBounced {
            recipients = copy(recipients);
        }
    }

    /**
     * A recipient marked the email as spam.
     *
     * @param emailId the email id
     * @param recipients complaining recipients
     * @param feedbackType complaint feedback type reported by the mailbox provider
     * @param timestamp when the complaint was received
     */
    record EmailComplained(String emailId, List<String> recipients, String feedbackType,
                           String timestamp) implements EventPayload {
        public EmailComplained {
            recipients = copy(recipients);
        }
    }

    /**
     * The sending provider rejected the email.
     *
     * @param emailId the email id
     * @param reason rejection reason
     * @param timestamp when the email was rejected
     */
    record EmailRejected(String emailId, String reason, String timestamp) implements EventPayload {}

    /**
     * Delivery is delayed.
     *
     * @param emailId the email id
     * @param recipients delayed recipients
     * @param delayType delay classification
     * @param timestamp when the delay was reported
     */
    record EmailDelayed(String emailId, List<String> recipients, String delayType,
                        String timestamp) implements EventPayload {
        public EmailDelayed {
            recipients = copy(recipients);
        }
    }

    /**
     * A reply to the email was received.
     *
     * @param emailId the email id
     * @param from reply sender
     * @param subject reply subject
     * @param body reply text body
     * @param timestamp when the reply was received
     */
    record EmailReplied(String emailId, String from, String subject, String body,
                        String timestamp) implements EventPayload {}

    /**
     * Sending failed permanently.
     *
     * @param emailId the email id
     * @param reason failure reason
     * @param timestamp when the failure happened
     */
    record EmailFailed(String emailId, String reason, String timestamp) implements EventPayload {}

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
