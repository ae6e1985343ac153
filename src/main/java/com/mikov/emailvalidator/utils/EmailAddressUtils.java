package com.mikov.emailvalidator.utils;

import java.util.Locale;

/**
 * Plain string splitting helpers for email addresses. No format validation is done here.
 *
 * @author zahari.mikov
 */
public final class EmailAddressUtils {

    private EmailAddressUtils() {
    }

    /**
     * @return the lowercased text after the last {@code @}, or null when there is no {@code @}
     */
    public static String extractDomain(final String email) {
        if (email == null) {
            return null;
        }
        final var at = email.lastIndexOf('@');
        if (at < 0) {
            return null;
        }
        return email.substring(at + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * @return the text before the last {@code @}, or null when there is no {@code @}
     */
    public static String extractLocalPart(final String email) {
        if (email == null) {
            return null;
        }
        final var at = email.lastIndexOf('@');
        if (at < 0) {
            return null;
        }
        return email.substring(0, at);
    }

    /**
     * Trims and lowercases the whole address, local part included.
     */
    public static String normalize(final String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
