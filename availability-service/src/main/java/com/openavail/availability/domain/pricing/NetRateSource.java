package com.openavail.availability.domain.pricing;

import com.openavail.availability.domain.model.Destination;

/**
 * Source of net rates for priced offers.
 *
 * Implementations:
 * - FixedNetRateSource: the same configured rate for every destination
 */
public interface NetRateSource {

    /**
     * Returns the rate to price the given destination with.
     *
     * @param destination requested destination
     * @return net rate, never null
     */
    NetRate rateFor(Destination destination);
}
