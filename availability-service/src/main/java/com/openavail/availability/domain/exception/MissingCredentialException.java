package com.openavail.availability.domain.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class MissingCredentialException extends AvailabilityValidationException {

    /** Attribute names that were absent or empty, e.g. {@code password}. */
    private final List<String> missingParameters;

    public MissingCredentialException(List<String> missingParameters) {
        super("Missing required parameters: password, username, or CompanyID.", "MISSING_CREDENTIAL");
        this.missingParameters = List.copyOf(missingParameters);
    }
}
