package com.mikov.emailvalidator.dns;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.Name;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.TextParseException;

/**
 * {@link DnsRecordChecker} backed by dnsjava. Every call goes to the resolver.
 *
 * @author zahari.mikov
 */
public class XBillDnsRecordChecker implements DnsRecordChecker {
    private static final Logger logger = LoggerFactory.getLogger(XBillDnsRecordChecker.class);

    private final Resolver resolver;

    public XBillDnsRecordChecker(final Resolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public DnsLookupStatus lookup(final String domain, final DnsRecordType type) {
        if (domain == null || domain.isBlank()) {
            return DnsLookupStatus.NOT_FOUND;
        }

        try {
            final var lookup = new Lookup(Name.fromString(domain, Name.root), type.getType());
            lookup.setResolver(resolver);
            // answers are cached only by MxRecordCache, never by dnsjava's shared cache
            lookup.setCache(null);
            final var records = lookup.run();

            switch (lookup.getResult()) {
                case Lookup.SUCCESSFUL:
                    return records != null && records.length > 0 ? DnsLookupStatus.FOUND : DnsLookupStatus.NOT_FOUND;
                case Lookup.HOST_NOT_FOUND:
                case Lookup.TYPE_NOT_FOUND:
                    logger.debug("No {} records for {}: {}", type, domain, lookup.getErrorString());
                    return DnsLookupStatus.NOT_FOUND;
                default:
                    logger.warn("{} lookup failed for {}: {}", type, domain, lookup.getErrorString());
                    return DnsLookupStatus.LOOKUP_FAILED;
            }
        } catch (final TextParseException e) {
            logger.debug("Invalid domain name {}: {}", domain, e.getMessage());
            return DnsLookupStatus.LOOKUP_FAILED;
        } catch (final RuntimeException e) {
            logger.warn("Unexpected error during {} lookup for {}: {}", type, domain, e.getMessage());
            return DnsLookupStatus.LOOKUP_FAILED;
        }
    }
}
