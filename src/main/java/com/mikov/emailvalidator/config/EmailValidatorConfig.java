package com.mikov.emailvalidator.config;

import com.mikov.emailvalidator.cache.MxRecordCache;
import com.mikov.emailvalidator.classifier.DomainClassifier;
import com.mikov.emailvalidator.dns.DnsRecordChecker;
import com.mikov.emailvalidator.lists.DomainListCache;
import com.mikov.emailvalidator.lists.DomainListFetcher;
import com.mikov.emailvalidator.services.MxLookupService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Slf4j
@Configuration
@EnableConfigurationProperties(EmailValidatorProperties.class)
public class EmailValidatorConfig {

    @Bean
    public DomainListCache domainListCache() {
        return new DomainListCache();
    }

    @Bean
    public DomainListFetcher domainListFetcher(final ResourceLoader resourceLoader,
                                               final EmailValidatorProperties properties,
                                               final DomainListCache domainListCache) {
        final var lists = properties.getLists();
        return new DomainListFetcher(resourceLoader, lists.getBlocklistLocation(), lists.getAllowlistLocation(), domainListCache);
    }

    @Bean
    public DomainClassifier domainClassifier(final DomainListFetcher fetcher, final EmailValidatorProperties properties) {
        final var lists = properties.getLists();
        final var classifier = new DomainClassifier();
        if (lists.isLoadDefaults()) {
            classifier.addMultipleToBlocklist(fetcher.loadBlocklist())
                    .addMultipleToAllowlist(fetcher.loadAllowlist());
        }
        classifier.addMultipleToBlocklist(lists.getExtraBlocked())
                .addMultipleToAllowlist(lists.getExtraAllowed());
        log.info("Domain classifier ready: {} blocked, {} allowed",
                classifier.getBlocklistCount(), classifier.getAllowlistCount());
        return classifier;
    }

    @Bean
    public MxRecordCache mxRecordCache(final EmailValidatorProperties properties) {
        return new MxRecordCache(properties.getMx().isCacheEnabled());
    }

    @Bean
    public MxLookupService mxLookupService(final DnsRecordChecker dnsRecordChecker, final MxRecordCache mxRecordCache) {
        return new MxLookupService(dnsRecordChecker, mxRecordCache);
    }
}
