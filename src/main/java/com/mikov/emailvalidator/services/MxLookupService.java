package com.mikov.emailvalidator.services;

import com.mikov.emailvalidator.cache.MxRecordCache;
import com.mikov.emailvalidator.classifier.DomainSet;
import com.mikov.emailvalidator.dns.DnsLookupStatus;
import com.mikov.emailvalidator.dns.DnsRecordChecker;
import com.mikov.emailvalidator.dns.DnsRecordType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Mail exchanger checks for domains. MX answers go through the {@link MxRecordCache};
 * A/AAAA checks always hit the resolver.
 *
 * @author zahari.mikov
 */
@Slf4j
@RequiredArgsConstructor
public class MxLookupService {
    private final DnsRecordChecker dnsRecordChecker;
    private final MxRecordCache mxRecordCache;

    public boolean hasValidMX(final String domain) {
        final var key = DomainSet.normalize(domain);
        if (key == null || key.isEmpty()) {
            return false;
        }

        final var cached = mxRecordCache.get(key);
        if (cached != null) {
            log.debug("MX cache hit for {}: {}", key, cached);
            return cached;
        }

        final var hasMx = dnsRecordChecker.hasRecords(key, DnsRecordType.MX);
        mxRecordCache.put(key, hasMx);
        log.debug("MX lookup for {}: {}", key, hasMx);
        return hasMx;
    }

    /**
     * Fallback check for domains without MX records. Not cached.
     */
    public boolean hasValidDNS(final String domain) {
        final var key = DomainSet.normalize(domain);
        if (key == null || key.isEmpty()) {
            return false;
        }
        return dnsRecordChecker.hasRecords(key, DnsRecordType.A)
                || dnsRecordChecker.hasRecords(key, DnsRecordType.AAAA);
    }

    /**
     * Uncached MX lookup that keeps "no record" apart from "lookup failed".
     */
    public DnsLookupStatus lookupMx(final String domain) {
        final var key = DomainSet.normalize(domain);
        if (key == null || key.isEmpty()) {
            return DnsLookupStatus.NOT_FOUND;
        }
        return dnsRecordChecker.lookup(key, DnsRecordType.MX);
    }

    public MxLookupService setCachingEnabled(final boolean enabled) {
        mxRecordCache.setEnabled(enabled);
        log.info("MX caching {}", enabled ? "enabled" : "disabled");
        return this;
    }

    public boolean isCachingEnabled() {
        return mxRecordCache.isEnabled();
    }

    public MxLookupService clearCache() {
        final var size = mxRecordCache.size();
        mxRecordCache.clear();
        log.info("Cleared {} MX cache entries", size);
        return this;
    }

    public int getCacheSize() {
        return mxRecordCache.size();
    }
}
