package com.mikov.emailvalidator.controller;

import com.mikov.emailvalidator.cache.MxRecordCache;
import com.mikov.emailvalidator.classifier.DomainClassifier;
import com.mikov.emailvalidator.dns.DnsRecordChecker;
import com.mikov.emailvalidator.lists.DomainListCache;
import com.mikov.emailvalidator.lists.DomainListFetcher;
import com.mikov.emailvalidator.services.MxLookupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DomainListControllerTest {

    private DomainClassifier classifier;
    private MxRecordCache cache;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        classifier = new DomainClassifier(List.of("tempmail.com"), List.of("gmail.com"));
        cache = new MxRecordCache(true);
        final var mxLookupService = new MxLookupService(mock(DnsRecordChecker.class), cache);
        final var fetcher = new DomainListFetcher(new DefaultResourceLoader(),
                "classpath:data/blocklist.conf", "classpath:data/allowlist.conf", new DomainListCache());

        mockMvc = MockMvcBuilders.standaloneSetup(new DomainListController(classifier, mxLookupService, fetcher)).build();
    }

    @Test
    void listsDomains() throws Exception {
        mockMvc.perform(get("/emailvalidator/blocklist"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.domains", contains("tempmail.com")));

        mockMvc.perform(get("/emailvalidator/allowlist"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.domains", contains("gmail.com")));
    }

    @Test
    void addsAndRemovesBlockedDomains() throws Exception {
        mockMvc.perform(post("/emailvalidator/blocklist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domains\":[\"Yopmail.com\",\"tempmail.com\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.domains", contains("tempmail.com", "yopmail.com")));

        mockMvc.perform(delete("/emailvalidator/blocklist/tempmail.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.domains", contains("yopmail.com")));

        assertTrue(classifier.isDisposable("yopmail.com"));
        assertFalse(classifier.isDisposable("tempmail.com"));
    }

    @Test
    void allowlistingOverridesBlocklist() throws Exception {
        mockMvc.perform(post("/emailvalidator/allowlist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domains\":[\"tempmail.com\"]}"))
                .andExpect(status().isOk());

        assertFalse(classifier.isDisposable("tempmail.com"));

        mockMvc.perform(delete("/emailvalidator/allowlist/tempmail.com"))
                .andExpect(status().isOk());

        assertTrue(classifier.isDisposable("tempmail.com"));
    }

    @Test
    void rejectsMissingDomains() throws Exception {
        mockMvc.perform(post("/emailvalidator/allowlist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Domains field is required."));
    }

    @Test
    void reloadReplacesRuntimeChanges() throws Exception {
        classifier.addToBlocklist("runtime-only.com");

        mockMvc.perform(post("/emailvalidator/lists/reload"))
                .andExpect(status().isOk());

        assertFalse(classifier.isBlocklisted("runtime-only.com"));
        assertTrue(classifier.isDisposable("mailinator.com"));

        mockMvc.perform(get("/emailvalidator/allowlist"))
                .andExpect(jsonPath("$.domains", hasItem("gmail.com")));
    }

    @Test
    void reloadFailureIsReported() throws Exception {
        final var broken = new DomainListFetcher(new DefaultResourceLoader(),
                "classpath:data/missing.conf", "classpath:data/allowlist.conf", new DomainListCache());
        final var brokenMvc = MockMvcBuilders.standaloneSetup(new DomainListController(
                classifier, new MxLookupService(mock(DnsRecordChecker.class), cache), broken)).build();

        brokenMvc.perform(post("/emailvalidator/lists/reload"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Domain list unavailable"));

        assertTrue(classifier.isBlocklisted("tempmail.com"));
    }

    @Test
    void managesMxCache() throws Exception {
        cache.put("example.com", true);

        mockMvc.perform(put("/emailvalidator/cache").param("enabled", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false))
                .andExpect(jsonPath("$.size").value(1));

        mockMvc.perform(delete("/emailvalidator/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(0));

        assertEquals(0, cache.size());
    }
}
