package com.mikov.emailvalidator.classifier;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;

/**
 * Decides whether a domain belongs to a disposable email provider.
 * Holds a blocklist and an allowlist; an allowlisted domain is never disposable,
 * whatever the blocklist says.
 *
 * <p>Mutators return this instance so calls can be chained.
 *
 * @author zahari.mikov
 */
@Slf4j
public class DomainClassifier {
    private final DomainSet blocklist;
    private final DomainSet allowlist;

    public DomainClassifier() {
        this(List.of(), List.of());
    }

    public DomainClassifier(final Collection<String> blocklist, final Collection<String> allowlist) {
        this.blocklist = new DomainSet(blocklist);
        this.allowlist = new DomainSet(allowlist);
        log.debug("Classifier created with {} blocked and {} allowed domains",
                this.blocklist.size(), this.allowlist.size());
    }

    public boolean isDisposable(final String domain) {
        if (allowlist.contains(domain)) {
            return false;
        }
        return blocklist.contains(domain);
    }

    public boolean isAllowlisted(final String domain) {
        return allowlist.contains(domain);
    }

    public boolean isBlocklisted(final String domain) {
        return blocklist.contains(domain);
    }

    public DomainClassifier addToBlocklist(final String domain) {
        blocklist.add(domain);
        return this;
    }

    public DomainClassifier addMultipleToBlocklist(final Collection<String> domains) {
        blocklist.addAll(domains);
        return this;
    }

    public DomainClassifier addToAllowlist(final String domain) {
        allowlist.add(domain);
        return this;
    }

    public DomainClassifier addMultipleToAllowlist(final Collection<String> domains) {
        allowlist.addAll(domains);
        return this;
    }

    public DomainClassifier removeFromBlocklist(final String domain) {
        blocklist.remove(domain);
        return this;
    }

    public DomainClassifier removeFromAllowlist(final String domain) {
        allowlist.remove(domain);
        return this;
    }

    public DomainClassifier clearBlocklist() {
        blocklist.clear();
        return this;
    }

    public DomainClassifier clearAllowlist() {
        allowlist.clear();
        return this;
    }

    public List<String> getBlocklist() {
        return blocklist.toList();
    }

    public List<String> getAllowlist() {
        return allowlist.toList();
    }

    public int getBlocklistCount() {
        return blocklist.size();
    }

    public int getAllowlistCount() {
        return allowlist.size();
    }
}
