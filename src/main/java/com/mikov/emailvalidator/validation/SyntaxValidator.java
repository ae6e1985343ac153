package com.mikov.emailvalidator.validation;

import com.mikov.emailvalidator.config.EmailValidatorProperties;
import com.mikov.emailvalidator.dtos.CheckResult;
import org.apache.commons.validator.routines.DomainValidator;
import org.apache.commons.validator.routines.DomainValidator.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static org.apache.commons.validator.routines.DomainValidator.ArrayType.GENERIC_PLUS;

/**
 * Validator for email syntax and format.
 * Delegates the address grammar to Commons Validator; local addresses are rejected, and so are
 * top-level domains that are neither in its IANA list nor configured as allowed.
 *
 * @author zahari.mikov
 */
@Component
public class SyntaxValidator implements EmailValidator {
    private static final Logger logger = LoggerFactory.getLogger(SyntaxValidator.class);

    public static final String NAME = "syntax";
    public static final String REASON = "Invalid email format";

    private final org.apache.commons.validator.routines.EmailValidator delegate;

    public SyntaxValidator() {
        this(List.of());
    }

    @Autowired
    public SyntaxValidator(final EmailValidatorProperties properties) {
        this(properties.getFormat().getAllowedTlds());
    }

    public SyntaxValidator(final Collection<String> allowedTlds) {
        if (allowedTlds.isEmpty()) {
            delegate = org.apache.commons.validator.routines.EmailValidator.getInstance(false, false);
        } else {
            final var tlds = allowedTlds.stream()
                    .map(tld -> tld.trim().toLowerCase(Locale.ROOT))
                    .toArray(String[]::new);
            final var domainValidator = DomainValidator.getInstance(false,
                    Collections.singletonList(new Item(GENERIC_PLUS, tlds)));
            delegate = new org.apache.commons.validator.routines.EmailValidator(false, false, domainValidator);
            logger.info("Accepting extra top-level domains: {}", allowedTlds);
        }
    }

    public boolean isValidFormat(final String email) {
        if (email == null || email.isEmpty()) {
            return false;
        }
        return delegate.isValid(email);
    }

    @Override
    public CheckResult validate(final String email) {
        return isValidFormat(email) ? CheckResult.valid(getName()) : CheckResult.invalid(getName(), REASON);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
