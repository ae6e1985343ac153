package com.mikov.emailvalidator.classifier;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DomainSetTest {

    @Test
    void storesTrimmedLowercaseDomains() {
        final var set = new DomainSet(List.of("  Example.COM  "));

        assertEquals(List.of("example.com"), set.toList());
        assertTrue(set.contains("EXAMPLE.com"));
    }

    @Test
    void ignoresNulls() {
        final var set = new DomainSet(Arrays.asList("a.com", null));

        assertFalse(set.add(null));
        assertFalse(set.remove(null));
        assertFalse(set.contains(null));
        assertEquals(1, set.size());
    }

    @Test
    void addReportsWhetherDomainWasNew() {
        final var set = new DomainSet();

        assertTrue(set.add("a.com"));
        assertFalse(set.add("A.COM"));
        assertTrue(set.remove("a.com"));
        assertFalse(set.remove("a.com"));
    }
}
