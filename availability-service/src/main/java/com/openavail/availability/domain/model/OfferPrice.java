package com.openavail.availability.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

/**
 * Price block of a {@link PricedOffer}. Field names follow the supplier response format.
 *
 * @param minimumSellingPrice not provided by the current rate source, always serialized as null
 * @param netCurrency         currency of the net amount
 * @param sellingCurrency     currency resolved from the request
 */
@JsonPropertyOrder({"minimumSellingPrice", "currency", "net", "selling_price",
        "selling_currency", "markup", "exchange_rate"})
public record OfferPrice(
        BigDecimal minimumSellingPrice,
        @JsonProperty("currency") String netCurrency,
        BigDecimal net,
        @JsonProperty("selling_price") BigDecimal sellingPrice,
        @JsonProperty("selling_currency") String sellingCurrency,
        BigDecimal markup,
        @JsonProperty("exchange_rate") BigDecimal exchangeRate
) {
}
