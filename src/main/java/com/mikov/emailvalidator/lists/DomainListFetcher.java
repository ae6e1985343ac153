package com.mikov.emailvalidator.lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Loads and saves line-oriented domain list files.
 *
 * <p>Format: one domain per line. Blank lines and lines starting with {@code #} or {@code ;}
 * are skipped; every other line is trimmed and lowercased.
 *
 * <p>The default blocklist and allowlist are read from configurable resource locations
 * ({@code classpath:} or {@code file:}) and kept in the injected {@link DomainListCache}.
 *
 * @author zahari.mikov
 */
public class DomainListFetcher {
    private static final Logger logger = LoggerFactory.getLogger(DomainListFetcher.class);

    private final ResourceLoader resourceLoader;
    private final String blocklistLocation;
    private final String allowlistLocation;
    private final DomainListCache cache;

    public DomainListFetcher(final ResourceLoader resourceLoader,
                             final String blocklistLocation,
                             final String allowlistLocation,
                             final DomainListCache cache) {
        this.resourceLoader = resourceLoader;
        this.blocklistLocation = blocklistLocation;
        this.allowlistLocation = allowlistLocation;
        this.cache = cache;
    }

    public List<String> loadBlocklist(final boolean useCache) {
        return loadDefault(blocklistLocation, useCache);
    }

    public List<String> loadBlocklist() {
        return loadBlocklist(true);
    }

    public List<String> loadAllowlist(final boolean useCache) {
        return loadDefault(allowlistLocation, useCache);
    }

    public List<String> loadAllowlist() {
        return loadAllowlist(true);
    }

    public DomainLists loadAll(final boolean useCache) {
        return new DomainLists(loadBlocklist(useCache), loadAllowlist(useCache));
    }

    /**
     * Loads a list from a file on disk. Never cached.
     */
    public List<String> loadCustomList(final Path path) {
        return loadList(new FileSystemResource(path), path.toString());
    }

    /**
     * Loads several files and returns their domains deduplicated, in first-seen order.
     */
    public List<String> mergeLists(final Collection<Path> paths) {
        final var merged = new LinkedHashSet<String>();
        for (final var path : paths) {
            merged.addAll(loadCustomList(path));
        }
        return new ArrayList<>(merged);
    }

    /**
     * Writes the domains trimmed, lowercased, deduplicated and sorted, one per line.
     * Null and blank entries are dropped.
     */
    public void saveList(final Path path, final Collection<String> domains) {
        final var sorted = domains.stream()
                .filter(Objects::nonNull)
                .map(domain -> domain.trim().toLowerCase(Locale.ROOT))
                .filter(domain -> !domain.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new));

        try {
            Files.write(path, sorted, StandardCharsets.UTF_8);
            logger.info("Saved {} domains to {}", sorted.size(), path);
        } catch (final IOException e) {
            throw DomainListException.writeFailed(path.toString(), e);
        }
    }

    public void clearCache() {
        cache.clear();
    }

    public boolean blocklistExists() {
        return resourceLoader.getResource(blocklistLocation).exists();
    }

    public boolean allowlistExists() {
        return resourceLoader.getResource(allowlistLocation).exists();
    }

    public int getBlocklistCount() {
        return loadBlocklist().size();
    }

    public int getAllowlistCount() {
        return loadAllowlist().size();
    }

    public String getBlocklistLocation() {
        return blocklistLocation;
    }

    public String getAllowlistLocation() {
        return allowlistLocation;
    }

    private List<String> loadDefault(final String location, final boolean useCache) {
        if (useCache) {
            final var cached = cache.get(location);
            if (cached != null) {
                return cached;
            }
        }

        final var domains = loadList(resourceLoader.getResource(location), location);
        if (useCache) {
            cache.put(location, domains);
        }
        return domains;
    }

    private List<String> loadList(final Resource resource, final String location) {
        if (!resource.exists()) {
            throw DomainListException.notFound(location);
        }
        if (!resource.isReadable()) {
            throw DomainListException.notReadable(location);
        }

        try (final var reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            final var domains = reader.lines()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#") && !line.startsWith(";"))
                    .map(line -> line.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toList());
            logger.info("Loaded {} domains from {}", domains.size(), location);
            return domains;
        } catch (final IOException | UncheckedIOException e) {
            throw DomainListException.readFailed(location, e);
        }
    }
}
