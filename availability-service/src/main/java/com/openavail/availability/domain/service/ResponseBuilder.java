package com.openavail.availability.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.openavail.availability.domain.model.Destination;
import com.openavail.availability.domain.model.OfferPrice;
import com.openavail.availability.domain.model.PricedOffer;
import com.openavail.availability.domain.model.ValidatedRequest;
import com.openavail.availability.domain.pricing.NetRate;
import com.openavail.availability.domain.pricing.NetRateSource;
import com.openavail.common.dto.ErrorResponse;
import com.openavail.common.exception.BusinessException;
import com.openavail.common.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a validated request into priced offers, one per destination, and writes them as JSON.
 */
@Slf4j
@Component
public class ResponseBuilder {

    private final NetRateSource netRateSource;
    private final ObjectMapper objectMapper;
    private final ObjectWriter prettyWriter;

    public ResponseBuilder(NetRateSource netRateSource, ObjectMapper objectMapper) {
        this.netRateSource = netRateSource;
        this.objectMapper = objectMapper;
        this.prettyWriter = objectMapper.writer(new ResponsePrettyPrinter());
    }

    /**
     * Offers keep destination order and are numbered A#1, A#2, ...
     */
    public List<PricedOffer> build(ValidatedRequest request) {
        List<PricedOffer> offers = new ArrayList<>(request.destinations().size());
        int sequence = 1;
        for (Destination destination : request.destinations()) {
            NetRate rate = netRateSource.rateFor(destination);
            OfferPrice price = new OfferPrice(
                    null,
                    rate.netCurrency(),
                    rate.netAmount(),
                    sellingPrice(rate.netAmount(), rate.markupPercentage()),
                    request.currency(),
                    rate.markupPercentage(),
                    rate.exchangeRate());
            offers.add(new PricedOffer(
                    Constants.OFFER_ID_PREFIX + sequence++,
                    rate.supplierHotelCode(),
                    request.market(),
                    price));
        }
        log.debug("Priced {} offers for market {}", offers.size(), request.market());
        return offers;
    }

    /**
     * {@code net * (1 + markup / 100)}, unrounded.
     */
    public static BigDecimal sellingPrice(BigDecimal netAmount, BigDecimal markupPercentage) {
        return netAmount.multiply(BigDecimal.ONE.add(markupPercentage.movePointLeft(2)));
    }

    public String render(List<PricedOffer> offers) {
        try {
            return prettyWriter.writeValueAsString(offers);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize priced offers", e);
        }
    }

    public String renderError(BusinessException ex) {
        try {
            return objectMapper.writeValueAsString(ErrorResponse.from(ex));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize error response", e);
        }
    }
}
