package com.openavail.availability.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum SearchType {
    SINGLE("Single"),
    MULTIPLE("Multiple");

    private final String wireValue;

    SearchType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Matches the value exactly as written in the request document.
     */
    public static Optional<SearchType> fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireValue.equals(value))
                .findFirst();
    }
}
