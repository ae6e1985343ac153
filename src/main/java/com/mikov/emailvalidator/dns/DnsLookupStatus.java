package com.mikov.emailvalidator.dns;

/**
 * Outcome of a single DNS lookup.
 *
 * @author zahari.mikov
 */
public enum DnsLookupStatus {
    FOUND,
    NOT_FOUND,
    LOOKUP_FAILED;

    public boolean isFound() {
        return this == FOUND;
    }
}
