package com.shippingmanagement.shipping.service.strategy;

import java.math.BigDecimal;

/**
 * Strategy interface for pricing a shipment by weight.
 * Implementations are stateless and registered under a mode name.
 */
public interface ShippingStrategy {

    /**
     * Mode name this strategy is resolved by, e.g. {@code "Ground"}.
     * @return Mode name, case-sensitive
     */
    String getMode();

    /**
     * Calculates the shipping cost for a weight.
     * @param weight Weight in kilograms, assumed non-negative
     * @return Shipping cost
     */
    BigDecimal calculateShippingCost(BigDecimal weight);
}
