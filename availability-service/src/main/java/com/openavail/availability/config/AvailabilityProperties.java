package com.openavail.availability.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Business rules for availability requests, bound once from {@code availability.*}.
 * <p>
 * Currency, nationality and market fall back to {@link Defaults} when absent or not allowed;
 * the language only falls back when absent and is rejected when not allowed.
 *
 * @param maxDestinations           upper bound for a "Multiple" search
 * @param childAgeThreshold         occupants this age or younger count as children
 * @param minLeadDays               start date must be strictly after today plus this many days
 * @param enforceChildAccompaniment reject rooms holding children without an adult
 */
@Validated
@ConfigurationProperties(prefix = "availability")
public record AvailabilityProperties(
        @NotEmpty Set<String> allowedCurrencies,
        @NotEmpty Set<String> allowedNationalities,
        @NotEmpty Set<String> allowedMarkets,
        @NotEmpty Set<String> allowedLanguages,
        @Positive int maxDestinations,
        @Positive int maxRooms,
        @Positive int maxGuestsPerRoom,
        @Positive int maxOptionsQuota,
        @Positive int defaultOptionsQuota,
        @PositiveOrZero int childAgeThreshold,
        @PositiveOrZero int minLeadDays,
        @Positive int minNights,
        boolean enforceChildAccompaniment,
        @Valid @NotNull Defaults defaults,
        @Valid @NotNull Pricing pricing
) {

    public record Defaults(
            @NotBlank String language,
            @NotBlank String currency,
            @NotBlank String nationality,
            @NotBlank String market
    ) {
    }

    /**
     * Fixed rate applied to every destination until a real rate source is plugged in.
     */
    public record Pricing(
            @NotBlank String supplierHotelCode,
            @NotNull @Positive BigDecimal netAmount,
            @NotBlank String netCurrency,
            @NotNull @PositiveOrZero BigDecimal markupPercentage,
            @NotNull @Positive BigDecimal exchangeRate
    ) {
    }
}
