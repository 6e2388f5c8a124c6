package com.openavail.availability.domain.exception;

import lombok.Getter;

import java.time.LocalDate;

@Getter
public class DateRuleException extends AvailabilityValidationException {

    public enum Rule {
        DATES_REQUIRED,
        INVALID_FORMAT,
        LEAD_TIME,
        MINIMUM_STAY
    }

    private final Rule rule;
    private final LocalDate startDate;
    private final LocalDate endDate;
    /** Days of lead time or nights of stay, depending on {@link #rule}. */
    private final int limit;
    /** Date text as written in the request, set for {@link Rule#INVALID_FORMAT}. */
    private final String rejectedValue;

    private DateRuleException(String message, Throwable cause, Rule rule, LocalDate startDate,
                              LocalDate endDate, int limit, String rejectedValue) {
        super(message, cause, "DATE_RULE_VIOLATION");
        this.rule = rule;
        this.startDate = startDate;
        this.endDate = endDate;
        this.limit = limit;
        this.rejectedValue = rejectedValue;
    }

    public static DateRuleException datesRequired() {
        return new DateRuleException("StartDate and EndDate are required.", null,
                Rule.DATES_REQUIRED, null, null, 0, null);
    }

    public static DateRuleException invalidFormat(String field, String value, Throwable cause) {
        return new DateRuleException(
                String.format("%s must be a day/month/year date: %s", field, value), cause,
                Rule.INVALID_FORMAT, null, null, 0, value);
    }

    public static DateRuleException leadTime(LocalDate startDate, LocalDate endDate, int minLeadDays) {
        return new DateRuleException(
                String.format("Start date must be at least %d days after today.", minLeadDays), null,
                Rule.LEAD_TIME, startDate, endDate, minLeadDays, null);
    }

    public static DateRuleException minimumStay(LocalDate startDate, LocalDate endDate, int minNights) {
        return new DateRuleException(
                String.format("Stay duration must be at least %d nights.", minNights), null,
                Rule.MINIMUM_STAY, startDate, endDate, minNights, null);
    }
}
