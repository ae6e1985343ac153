package com.mikov.emailvalidator.validation;

import com.mikov.emailvalidator.classifier.DomainClassifier;
import com.mikov.emailvalidator.dtos.CheckResult;
import com.mikov.emailvalidator.utils.EmailAddressUtils;
import org.springframework.stereotype.Component;

/**
 * Validator that checks if an email uses a disposable or temporary domain.
 *
 * @author zahari.mikov
 */
@Component
public class DisposableDomainValidator implements EmailValidator {

    public static final String NAME = "disposable-domain";
    public static final String REASON = "Disposable email address";

    private final DomainClassifier classifier;

    public DisposableDomainValidator(final DomainClassifier classifier) {
        this.classifier = classifier;
    }

    public boolean isDisposable(final String email) {
        final var domain = EmailAddressUtils.extractDomain(email);
        return domain != null && classifier.isDisposable(domain);
    }

    @Override
    public CheckResult validate(final String email) {
        return isDisposable(email) ? CheckResult.invalid(getName(), REASON) : CheckResult.valid(getName());
    }

    @Override
    public String getName() {
        return NAME;
    }
}
