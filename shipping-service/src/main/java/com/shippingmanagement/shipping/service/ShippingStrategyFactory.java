package com.shippingmanagement.shipping.service;

import com.shippingmanagement.shipping.exception.InvalidShippingModeException;
import com.shippingmanagement.shipping.service.strategy.ShippingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves a shipping strategy from its mode name.
 * Mode names are matched exactly; unknown names fail with {@link InvalidShippingModeException}.
 */
@Component
@Slf4j
public class ShippingStrategyFactory {

    private final Map<String, ShippingStrategy> strategiesByMode;

    public ShippingStrategyFactory(List<ShippingStrategy> strategies) {
        Map<String, ShippingStrategy> byMode = new LinkedHashMap<>();
        for (ShippingStrategy strategy : strategies) {
            ShippingStrategy previous = byMode.putIfAbsent(strategy.getMode(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate shipping strategy for mode: " + strategy.getMode());
            }
        }
        this.strategiesByMode = Collections.unmodifiableMap(byMode);
        log.debug("Registered shipping strategies: {}", strategiesByMode.keySet());
    }

    public ShippingStrategy createStrategy(String mode) {
        ShippingStrategy strategy = mode == null ? null : strategiesByMode.get(mode);
        if (strategy == null) {
            log.warn("Invalid shipping mode requested: {}", mode);
            throw new InvalidShippingModeException(mode, strategiesByMode.keySet());
        }

        log.debug("Resolved shipping strategy: mode={}, strategy={}", mode, strategy.getClass().getSimpleName());
        return strategy;
    }

    public Set<String> getSupportedModes() {
        return strategiesByMode.keySet();
    }
}
