package com.mikov.emailvalidator.validation;

import com.mikov.emailvalidator.classifier.DomainClassifier;
import com.mikov.emailvalidator.model.EmailValidationResult;
import com.mikov.emailvalidator.model.ValidationStatistics;
import com.mikov.emailvalidator.services.MxLookupService;
import com.mikov.emailvalidator.utils.EmailAddressUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Runs the syntax, disposable-domain and MX stages in that order and aggregates batches.
 *
 * <p>Batches are processed sequentially. A malformed address never aborts a batch; it is
 * reported like any other invalid entry.
 *
 * @author zahari.mikov
 */
@Service
public class EmailValidationPipeline {
    private static final Logger logger = LoggerFactory.getLogger(EmailValidationPipeline.class);

    private final SyntaxValidator syntaxValidator;
    private final DisposableDomainValidator disposableDomainValidator;
    private final MXRecordValidator mxRecordValidator;
    private final DomainClassifier classifier;
    private final MxLookupService mxLookupService;

    public EmailValidationPipeline(final SyntaxValidator syntaxValidator,
                                   final DisposableDomainValidator disposableDomainValidator,
                                   final MXRecordValidator mxRecordValidator,
                                   final DomainClassifier classifier,
                                   final MxLookupService mxLookupService) {
        this.syntaxValidator = syntaxValidator;
        this.disposableDomainValidator = disposableDomainValidator;
        this.mxRecordValidator = mxRecordValidator;
        this.classifier = classifier;
        this.mxLookupService = mxLookupService;
    }

    public boolean isValidFormat(final String email) {
        return syntaxValidator.isValidFormat(email);
    }

    public boolean isDisposable(final String email) {
        return disposableDomainValidator.isDisposable(email);
    }

    public boolean hasValidMX(final String email) {
        return mxRecordValidator.hasValidMX(email);
    }

    public boolean hasValidDNS(final String email) {
        final var domain = EmailAddressUtils.extractDomain(email);
        return domain != null && mxLookupService.hasValidDNS(domain);
    }

    public boolean isAllowlisted(final String email) {
        final var domain = EmailAddressUtils.extractDomain(email);
        return domain != null && classifier.isAllowlisted(domain);
    }

    public boolean isBlocklisted(final String email) {
        final var domain = EmailAddressUtils.extractDomain(email);
        return domain != null && classifier.isBlocklisted(domain);
    }

    /**
     * Stops at the first failing stage, so no DNS query is made for malformed or disposable addresses.
     */
    public boolean isValid(final String email, final boolean checkMx) {
        for (final var validator : stages(checkMx)) {
            final var result = validator.validate(email);
            if (!result.isValid()) {
                logger.debug("{} rejected by {}: {}", email, validator.getName(), result.getReason());
                return false;
            }
        }
        return true;
    }

    public boolean isValid(final String email) {
        return isValid(email, true);
    }

    public EmailValidationResult validateWithDetails(final String email, final boolean checkMx) {
        final var builder = EmailValidationResult.builder()
                .domain(EmailAddressUtils.extractDomain(email));

        final var syntax = syntaxValidator.validate(email);
        var valid = syntax.isValid();
        builder.format(syntax.isValid());
        if (!syntax.isValid()) {
            builder.error(syntax.getReason());
        } else {
            final var disposable = disposableDomainValidator.validate(email);
            builder.disposable(!disposable.isValid());
            if (!disposable.isValid()) {
                valid = false;
                builder.error(disposable.getReason());
            }

            if (checkMx) {
                final var mx = mxRecordValidator.validate(email);
                builder.mx(mx.isValid());
                if (!mx.isValid()) {
                    valid = false;
                    builder.error(mx.getReason());
                }
            }
        }

        return builder.valid(valid).build();
    }

    public EmailValidationResult validateWithDetails(final String email) {
        return validateWithDetails(email, true);
    }

    /**
     * Validates each address, keyed by the exact input string. Repeated inputs collapse to one entry
     * and null entries are skipped, since they cannot be used as a key.
     */
    public Map<String, EmailValidationResult> validateMultiple(final List<String> emails, final boolean checkMx) {
        final var results = new LinkedHashMap<String, EmailValidationResult>();
        for (final var email : emails) {
            if (email == null) {
                logger.debug("Skipping null entry in batch");
                continue;
            }
            results.put(email, validateWithDetails(email, checkMx));
        }
        logger.debug("Validated {} emails ({} distinct)", emails.size(), results.size());
        return results;
    }

    public List<String> filterValid(final List<String> emails, final boolean checkMx) {
        return filter(emails, email -> isValid(email, checkMx));
    }

    public List<String> filterInvalid(final List<String> emails, final boolean checkMx) {
        return filter(emails, email -> !isValid(email, checkMx));
    }

    public ValidationStatistics getStatistics(final List<String> emails, final boolean checkMx) {
        var valid = 0;
        var invalid = 0;
        var invalidFormat = 0;
        var disposable = 0;
        var noMx = 0;

        for (final var email : emails) {
            final var result = validateWithDetails(email, checkMx);
            if (result.isValid()) {
                valid++;
            } else {
                invalid++;
            }
            if (!result.isFormat()) {
                invalidFormat++;
            }
            if (result.isDisposable()) {
                disposable++;
            }
            if (checkMx && Boolean.FALSE.equals(result.getMx())) {
                noMx++;
            }
        }

        return ValidationStatistics.builder()
                .total(emails.size())
                .valid(valid)
                .invalid(invalid)
                .invalidFormat(invalidFormat)
                .disposable(disposable)
                .noMx(noMx)
                .build();
    }

    public String extractDomain(final String email) {
        return EmailAddressUtils.extractDomain(email);
    }

    public String extractLocalPart(final String email) {
        return EmailAddressUtils.extractLocalPart(email);
    }

    public String normalize(final String email) {
        return EmailAddressUtils.normalize(email);
    }

    public List<String> normalizeMultiple(final List<String> emails) {
        return emails.stream()
                .map(EmailAddressUtils::normalize)
                .collect(Collectors.toList());
    }

    public DomainClassifier getClassifier() {
        return classifier;
    }

    public MxLookupService getMxLookupService() {
        return mxLookupService;
    }

    private List<EmailValidator> stages(final boolean checkMx) {
        final var stages = new ArrayList<EmailValidator>(3);
        stages.add(syntaxValidator);
        stages.add(disposableDomainValidator);
        if (checkMx) {
            stages.add(mxRecordValidator);
        }
        return stages;
    }

    private static List<String> filter(final List<String> emails, final Predicate<String> predicate) {
        return emails.stream()
                .filter(predicate)
                .collect(Collectors.toList());
    }
}
