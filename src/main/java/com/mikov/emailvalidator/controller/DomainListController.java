package com.mikov.emailvalidator.controller;

import com.mikov.emailvalidator.classifier.DomainClassifier;
import com.mikov.emailvalidator.lists.DomainListException;
import com.mikov.emailvalidator.lists.DomainListFetcher;
import com.mikov.emailvalidator.model.DomainListRequest;
import com.mikov.emailvalidator.model.DomainListResponse;
import com.mikov.emailvalidator.model.ErrorResponse;
import com.mikov.emailvalidator.services.MxLookupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Manages the blocklist, the allowlist and the MX cache at runtime.
 *
 * @author zahari.mikov
 */
@Slf4j
@RestController
@RequestMapping("/emailvalidator")
@RequiredArgsConstructor
public class DomainListController {
    private final DomainClassifier classifier;
    private final MxLookupService mxLookupService;
    private final DomainListFetcher domainListFetcher;

    @GetMapping("/blocklist")
    public ResponseEntity<DomainListResponse> getBlocklist() {
        return ResponseEntity.ok(DomainListResponse.of(classifier.getBlocklist()));
    }

    @GetMapping("/allowlist")
    public ResponseEntity<DomainListResponse> getAllowlist() {
        return ResponseEntity.ok(DomainListResponse.of(classifier.getAllowlist()));
    }

    @PostMapping("/blocklist")
    public ResponseEntity<?> addToBlocklist(@RequestBody(required = false) final DomainListRequest request) {
        if (isEmpty(request)) {
            return ResponseEntity.badRequest().body(new ErrorResponse("Domains field is required."));
        }
        classifier.addMultipleToBlocklist(request.getDomains());
        log.info("Added {} domains to blocklist", request.getDomains().size());
        return ResponseEntity.ok(DomainListResponse.of(classifier.getBlocklist()));
    }

    @PostMapping("/allowlist")
    public ResponseEntity<?> addToAllowlist(@RequestBody(required = false) final DomainListRequest request) {
        if (isEmpty(request)) {
            return ResponseEntity.badRequest().body(new ErrorResponse("Domains field is required."));
        }
        classifier.addMultipleToAllowlist(request.getDomains());
        log.info("Added {} domains to allowlist", request.getDomains().size());
        return ResponseEntity.ok(DomainListResponse.of(classifier.getAllowlist()));
    }

    @DeleteMapping("/blocklist/{domain:.+}")
    public ResponseEntity<DomainListResponse> removeFromBlocklist(@PathVariable final String domain) {
        classifier.removeFromBlocklist(domain);
        return ResponseEntity.ok(DomainListResponse.of(classifier.getBlocklist()));
    }

    @DeleteMapping("/allowlist/{domain:.+}")
    public ResponseEntity<DomainListResponse> removeFromAllowlist(@PathVariable final String domain) {
        classifier.removeFromAllowlist(domain);
        return ResponseEntity.ok(DomainListResponse.of(classifier.getAllowlist()));
    }

    /**
     * Replaces both lists with a fresh read of the configured list files.
     * Runtime additions and removals are discarded.
     */
    @PostMapping("/lists/reload")
    public ResponseEntity<Map<String, Object>> reloadLists() {
        final var lists = domainListFetcher.loadAll(false);
        classifier.clearBlocklist()
                .clearAllowlist()
                .addMultipleToBlocklist(lists.blocklist())
                .addMultipleToAllowlist(lists.allowlist());
        log.info("Reloaded lists from {} and {}", domainListFetcher.getBlocklistLocation(), domainListFetcher.getAllowlistLocation());
        return ResponseEntity.ok(Map.of(
                "blocklist", classifier.getBlocklistCount(),
                "allowlist", classifier.getAllowlistCount()));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clearCache() {
        mxLookupService.clearCache();
        return ResponseEntity.ok(cacheState());
    }

    @PutMapping("/cache")
    public ResponseEntity<Map<String, Object>> setCaching(@RequestParam("enabled") final boolean enabled) {
        mxLookupService.setCachingEnabled(enabled);
        return ResponseEntity.ok(cacheState());
    }

    @ExceptionHandler(DomainListException.class)
    public ResponseEntity<ErrorResponse> handleDomainListException(final DomainListException e) {
        log.error("Domain list error ({}): {}", e.getReason(), e.getMessage());
        return ResponseEntity.internalServerError().body(new ErrorResponse("Domain list unavailable", e.getMessage()));
    }

    private Map<String, Object> cacheState() {
        return Map.of(
                "enabled", mxLookupService.isCachingEnabled(),
                "size", mxLookupService.getCacheSize());
    }

    private static boolean isEmpty(final DomainListRequest request) {
        return request == null || request.getDomains() == null || request.getDomains().isEmpty();
    }
}
