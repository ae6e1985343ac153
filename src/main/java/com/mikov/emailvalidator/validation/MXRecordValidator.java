package com.mikov.emailvalidator.validation;

import com.mikov.emailvalidator.dtos.CheckResult;
import com.mikov.emailvalidator.services.MxLookupService;
import com.mikov.emailvalidator.utils.EmailAddressUtils;
import org.springframework.stereotype.Component;

/**
 * Validator that checks if a domain has valid MX records for email delivery.
 *
 * @author zahari.mikov
 */
@Component
public class MXRecordValidator implements EmailValidator {

    public static final String NAME = "mx-record";
    public static final String REASON = "No valid MX record found";

    private final MxLookupService mxLookupService;

    public MXRecordValidator(final MxLookupService mxLookupService) {
        this.mxLookupService = mxLookupService;
    }

    public boolean hasValidMX(final String email) {
        final var domain = EmailAddressUtils.extractDomain(email);
        return domain != null && mxLookupService.hasValidMX(domain);
    }

    @Override
    public CheckResult validate(final String email) {
        return hasValidMX(email) ? CheckResult.valid(getName()) : CheckResult.invalid(getName(), REASON);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
