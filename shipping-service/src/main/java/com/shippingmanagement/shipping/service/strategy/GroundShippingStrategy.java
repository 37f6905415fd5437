package com.shippingmanagement.shipping.service.strategy;

import com.shippingmanagement.shipping.constants.ShippingConstants;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
@Order(1)
public class GroundShippingStrategy implements ShippingStrategy {

    @Override
    public String getMode() {
        return ShippingConstants.MODE_GROUND;
    }

    @Override
    public BigDecimal calculateShippingCost(BigDecimal weight) {
        return weight.multiply(ShippingConstants.GROUND_RATE_PER_KG);
    }
}
