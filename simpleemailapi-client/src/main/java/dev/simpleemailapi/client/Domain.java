package dev.simpleemailapi.client;

import java.util.List;

/**
 * A sending domain.
 *
 * @param id domain id
 * @param name domain name, e.g. {@code example.com}
 * @param status verification status as reported by the service
 * @param verified whether the domain may be used as sender
 * @param dnsRecords records to publish for verification
 * @param createdAt creation time (RFC 3339)
 */
public record Domain(String id, String name, String status, boolean verified, List<DnsRecord> dnsRecords,
                     String createdAt) {
    public Domain {
        dnsRecords = dnsRecords == null ? List.of() : List.copyOf(dnsRecords);
    }

    /**
     * A DNS record required by domain verification.
     *
     * @param type record type ({@code TXT}, {@code CNAME}, {@code MX})
     * @param name record name
     * @param value record value
     */
    public record DnsRecord(String type, String name, String value) {}
}
