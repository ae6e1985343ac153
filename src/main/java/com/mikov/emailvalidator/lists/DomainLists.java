package com.mikov.emailvalidator.lists;

import java.util.List;

/**
 * Blocklist and allowlist loaded together.
 */
public record DomainLists(List<String> blocklist, List<String> allowlist) { }
