package com.openavail.availability.domain.exception;

import lombok.Getter;

import java.util.Set;

@Getter
public class InvalidLanguageException extends AvailabilityValidationException {

    private final String languageCode;
    private final Set<String> allowedLanguages;

    public InvalidLanguageException(String languageCode, Set<String> allowedLanguages) {
        super("Invalid language code: " + languageCode, "INVALID_LANGUAGE");
        this.languageCode = languageCode;
        this.allowedLanguages = Set.copyOf(allowedLanguages);
    }
}
