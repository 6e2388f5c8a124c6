package com.openavail.availability.document;

import java.util.Locale;

/**
 * Encodings an availability request document may arrive in.
 */
public enum DocumentFormat {
    XML,
    JSON;

    public static DocumentFormat fromFileName(String fileName) {
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".json") ? JSON : XML;
    }

    public static DocumentFormat fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported document format: " + name, ex);
        }
    }
}
