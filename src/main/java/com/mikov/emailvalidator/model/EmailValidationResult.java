package com.mikov.emailvalidator.model;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Detailed outcome of validating one email address.
 *
 * <p>{@code mx} is null when the MX check was skipped, {@code domain} is null when the
 * address has no {@code @}. {@code errors} holds one entry per failed check, in the order
 * format, disposable, MX.
 *
 * @author zahari.mikov
 */
@Data
@Builder
public class EmailValidationResult {

    private final boolean valid;
    private final boolean format;
    private final boolean disposable;
    private final Boolean mx;
    private final String domain;

    @Singular
    private final List<String> errors;
}
