package com.mikov.emailvalidator.classifier;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Duplicate-free set of domains that keeps insertion order for export.
 * Every domain is trimmed and lowercased before it is stored or compared.
 *
 * @author zahari.mikov
 */
public final class DomainSet {
    private final Set<String> domains = new LinkedHashSet<>();

    public DomainSet() {
    }

    public DomainSet(final Collection<String> initial) {
        addAll(initial);
    }

    public static String normalize(final String domain) {
        return domain == null ? null : domain.trim().toLowerCase(Locale.ROOT);
    }

    public synchronized boolean add(final String domain) {
        final var normalized = normalize(domain);
        if (normalized == null) {
            return false;
        }
        return domains.add(normalized);
    }

    public synchronized void addAll(final Collection<String> toAdd) {
        if (toAdd == null) {
            return;
        }
        for (final var domain : toAdd) {
            add(domain);
        }
    }

    public synchronized boolean remove(final String domain) {
        final var normalized = normalize(domain);
        return normalized != null && domains.remove(normalized);
    }

    public synchronized boolean contains(final String domain) {
        final var normalized = normalize(domain);
        return normalized != null && domains.contains(normalized);
    }

    public synchronized int size() {
        return domains.size();
    }

    public synchronized void clear() {
        domains.clear();
    }

    /**
     * @return an immutable snapshot in insertion order
     */
    public synchronized List<String> toList() {
        return List.copyOf(domains);
    }
}
