package com.mikov.emailvalidator.lists;

import lombok.Getter;

/**
 * Raised when a domain list file cannot be loaded or written.
 *
 * @author zahari.mikov
 */
@Getter
public class DomainListException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        NOT_READABLE,
        READ_FAILED,
        WRITE_FAILED
    }

    private final Reason reason;
    private final String location;

    public DomainListException(final Reason reason, final String location, final String message) {
        super(message);
        this.reason = reason;
        this.location = location;
    }

    public DomainListException(final Reason reason, final String location, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.location = location;
    }

    public static DomainListException notFound(final String location) {
        return new DomainListException(Reason.NOT_FOUND, location, "List file not found: " + location);
    }

    public static DomainListException notReadable(final String location) {
        return new DomainListException(Reason.NOT_READABLE, location, "List file is not readable: " + location);
    }

    public static DomainListException readFailed(final String location, final Throwable cause) {
        return new DomainListException(Reason.READ_FAILED, location, "Failed to read list file: " + location, cause);
    }

    public static DomainListException writeFailed(final String location, final Throwable cause) {
        return new DomainListException(Reason.WRITE_FAILED, location, "Unable to write list file: " + location, cause);
    }
}
