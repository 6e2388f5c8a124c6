package com.openavail.availability.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"id", "hotelCodeSupplier", "market", "price"})
public record PricedOffer(
        String id,
        @JsonProperty("hotelCodeSupplier") String supplierHotelCode,
        String market,
        OfferPrice price
) {
}
