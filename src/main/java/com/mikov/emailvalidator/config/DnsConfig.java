package com.mikov.emailvalidator.config;

import com.mikov.emailvalidator.dns.DnsRecordChecker;
import com.mikov.emailvalidator.dns.XBillDnsRecordChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Resolver;

import java.net.UnknownHostException;

@Configuration
public class DnsConfig {
    private static final Logger logger = LoggerFactory.getLogger(DnsConfig.class);

    @Bean
    public Resolver dnsResolver(final EmailValidatorProperties properties) throws UnknownHostException {
        final var dns = properties.getDns();
        final ExtendedResolver resolver;
        if (dns.getServers().isEmpty()) {
            resolver = new ExtendedResolver();
        } else {
            resolver = new ExtendedResolver(dns.getServers().toArray(new String[0]));
        }
        resolver.setTimeout(dns.getTimeout());
        logger.info("DNS resolver configured: servers={}, timeout={}",
                dns.getServers().isEmpty() ? "system" : dns.getServers(), dns.getTimeout());
        return resolver;
    }

    @Bean
    public DnsRecordChecker dnsRecordChecker(final Resolver dnsResolver) {
        return new XBillDnsRecordChecker(dnsResolver);
    }
}
