package com.mikov.emailvalidator.dtos;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a single validation stage. {@code reason} is null when the stage passed.
 *
 * @author zahari.mikov
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CheckResult {

    boolean valid;
    String validatorName;
    String reason;

    public static CheckResult valid(final String validatorName) {
        return new CheckResult(true, validatorName, null);
    }

    public static CheckResult invalid(final String validatorName, final String reason) {
        return new CheckResult(false, validatorName, reason);
    }
}
