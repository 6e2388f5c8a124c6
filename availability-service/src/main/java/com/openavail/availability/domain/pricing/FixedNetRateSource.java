package com.openavail.availability.domain.pricing;

import com.openavail.availability.config.AvailabilityProperties;
import com.openavail.availability.domain.model.Destination;
import org.springframework.stereotype.Component;

@Component
public class FixedNetRateSource implements NetRateSource {

    private final NetRate rate;

    public FixedNetRateSource(AvailabilityProperties properties) {
        AvailabilityProperties.Pricing pricing = properties.pricing();
        this.rate = new NetRate(
                pricing.supplierHotelCode(),
                pricing.netAmount(),
                pricing.netCurrency(),
                pricing.markupPercentage(),
                pricing.exchangeRate());
    }

    @Override
    public NetRate rateFor(Destination destination) {
        return rate;
    }
}
