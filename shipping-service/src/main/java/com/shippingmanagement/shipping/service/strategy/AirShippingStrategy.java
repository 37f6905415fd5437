package com.shippingmanagement.shipping.service.strategy;

import com.shippingmanagement.shipping.constants.ShippingConstants;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
@Order(2)
public class AirShippingStrategy implements ShippingStrategy {

    @Override
    public String getMode() {
        return ShippingConstants.MODE_AIR;
    }

    @Override
    public BigDecimal calculateShippingCost(BigDecimal weight) {
        return weight.multiply(ShippingConstants.AIR_RATE_PER_KG);
    }
}
