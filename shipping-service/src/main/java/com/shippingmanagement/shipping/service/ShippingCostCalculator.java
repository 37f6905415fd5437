package com.shippingmanagement.shipping.service;

import com.shippingmanagement.shipping.service.strategy.ShippingStrategy;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Applies the active shipping strategy to a weight.
 * The strategy can be swapped at runtime and is never unset.
 *
 * Owned by a single caller, not a shared bean. A swap followed by a calculation
 * is not atomic; callers sharing an instance must lock around such sequences.
 */
@Slf4j
public class ShippingCostCalculator {

    private final AtomicReference<ShippingStrategy> strategy = new AtomicReference<>();

    public ShippingCostCalculator(ShippingStrategy strategy) {
        this.strategy.set(Objects.requireNonNull(strategy, "strategy must not be null"));
    }

    public void setStrategy(ShippingStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        ShippingStrategy previous = this.strategy.getAndSet(strategy);
        log.debug("Shipping strategy changed: {} -> {}", previous.getMode(), strategy.getMode());
    }

    public ShippingStrategy getStrategy() {
        return strategy.get();
    }

    /**
     * Calculates the cost with the active strategy.
     * Weight is expected to be non-negative; it is not validated here.
     */
    public BigDecimal calculateCost(BigDecimal weight) {
        ShippingStrategy active = strategy.get();
        BigDecimal cost = active.calculateShippingCost(weight);
        log.debug("Calculated shipping cost: mode={}, weight={}, cost={}", active.getMode(), weight, cost);
        return cost;
    }
}
