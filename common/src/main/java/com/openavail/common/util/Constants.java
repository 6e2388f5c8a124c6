package com.openavail.common.util;

/**
 * Wire-format constants shared across modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    /** Stay dates are written day/month/year, e.g. 14/10/2024. */
    public static final String STAY_DATE_PATTERN = "d/M/uuuu";

    public static final String OFFER_ID_PREFIX = "A#";
}
