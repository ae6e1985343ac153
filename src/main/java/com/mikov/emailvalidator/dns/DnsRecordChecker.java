package com.mikov.emailvalidator.dns;

/**
 * Answers whether a domain publishes records of a given type.
 * Implementations never throw; any failure is reported as {@link DnsLookupStatus#LOOKUP_FAILED}.
 *
 * @author zahari.mikov
 */
public interface DnsRecordChecker {

    /**
     * Looks up records of the given type for a domain.
     *
     * @param domain The domain to query
     * @param type The record type
     * @return The lookup outcome
     */
    DnsLookupStatus lookup(final String domain, final DnsRecordType type);

    /**
     * Collapses {@link #lookup} to a boolean: only a successful answer counts.
     */
    default boolean hasRecords(final String domain, final DnsRecordType type) {
        return lookup(domain, type).isFound();
    }
}
