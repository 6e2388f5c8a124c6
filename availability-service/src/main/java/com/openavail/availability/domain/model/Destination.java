package com.openavail.availability.domain.model;

/**
 * One hotel or location the caller wants availability for.
 *
 * @param code destination code as supplied; empty when the entry carries none
 */
public record Destination(String code) {

    public Destination {
        code = code == null ? "" : code;
    }
}
