package com.mikov.emailvalidator.controller;

import com.mikov.emailvalidator.model.BulkEmailValidationRequest;
import com.mikov.emailvalidator.model.EmailValidationResult;
import com.mikov.emailvalidator.model.ErrorResponse;
import com.mikov.emailvalidator.validation.EmailValidationPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.function.Function;

/**
 * REST controller for single and batch email validation.
 *
 * @author zahari.mikov
 */
@RestController
@RequestMapping("/emailvalidator")
public class EmailValidatorController {
    private static final Logger logger = LoggerFactory.getLogger(EmailValidatorController.class);

    private final EmailValidationPipeline pipeline;

    public EmailValidatorController(final EmailValidationPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @GetMapping("/validate/{email:.+}")
    public ResponseEntity<EmailValidationResult> validate(
            @PathVariable final String email,
            @RequestParam(value = "checkMx", defaultValue = "true") final boolean checkMx) {
        return ResponseEntity.ok(pipeline.validateWithDetails(email, checkMx));
    }

    @PostMapping(value = "/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> validateMultiple(@RequestBody(required = false) final BulkEmailValidationRequest request) {
        return withEmails(request, "validation", emails -> pipeline.validateMultiple(emails, request.isCheckMx()));
    }

    @PostMapping(value = "/filter/valid", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> filterValid(@RequestBody(required = false) final BulkEmailValidationRequest request) {
        return withEmails(request, "filter", emails -> pipeline.filterValid(emails, request.isCheckMx()));
    }

    @PostMapping(value = "/filter/invalid", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> filterInvalid(@RequestBody(required = false) final BulkEmailValidationRequest request) {
        return withEmails(request, "filter", emails -> pipeline.filterInvalid(emails, request.isCheckMx()));
    }

    @PostMapping(value = "/statistics", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> statistics(@RequestBody(required = false) final BulkEmailValidationRequest request) {
        return withEmails(request, "statistics", emails -> pipeline.getStatistics(emails, request.isCheckMx()));
    }

    @PostMapping(value = "/normalize", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> normalize(@RequestBody(required = false) final BulkEmailValidationRequest request) {
        return withEmails(request, "normalize", pipeline::normalizeMultiple);
    }

    private ResponseEntity<?> withEmails(final BulkEmailValidationRequest request,
                                         final String operation,
                                         final Function<List<String>, Object> handler) {
        if (request == null || request.getEmails() == null || request.getEmails().isEmpty()) {
            logger.warn("Received empty request for {}", operation);
            return ResponseEntity.badRequest().body(new ErrorResponse("Emails field is required."));
        }
        logger.info("Processing {} request for {} emails", operation, request.getEmails().size());
        return ResponseEntity.ok(handler.apply(request.getEmails()));
    }
}
