package com.openavail.availability.domain.exception;

import lombok.Getter;

@Getter
public class QuotaExceededException extends AvailabilityValidationException {

    private final int optionsQuota;
    private final int limit;

    public QuotaExceededException(int optionsQuota, int limit) {
        super(String.format("OptionsQuota must be no greater than %d.", limit), "QUOTA_EXCEEDED");
        this.optionsQuota = optionsQuota;
        this.limit = limit;
    }
}
