package com.openavail.availability.document;

import org.springframework.boot.ExitCodeGenerator;

/**
 * The request document could not be read into an {@link AvailRequestDocument}:
 * not well-formed, or a value that cannot be typed (a non-numeric age, a quota beyond the int range).
 * <p>
 * Kept apart from business-rule violations; it is never rendered as an error response.
 */
public class MalformedRequestException extends RuntimeException implements ExitCodeGenerator {

    public MalformedRequestException(String message) {
        super(message);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return 2;
    }
}
