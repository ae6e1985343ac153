package com.mikov.emailvalidator.validation;

import com.mikov.emailvalidator.dtos.CheckResult;

/**
 * A single stage of the validation pipeline.
 *
 * @author zahari.mikov
 */
public interface EmailValidator {

    /**
     * Validates an email and returns the stage result.
     *
     * @param email The email to validate
     * @return The stage result
     */
    CheckResult validate(final String email);

    /**
     * Returns the name of this validator, used for identification in results.
     *
     * @return The validator name
     */
    String getName();
}
