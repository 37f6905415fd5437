package com.shippingmanagement.shipping.constants;

import java.math.BigDecimal;

public final class ShippingConstants {

    private ShippingConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final String MODE_GROUND = "Ground";
    public static final String MODE_AIR = "Air";

    public static final BigDecimal GROUND_RATE_PER_KG = new BigDecimal("1.5");
    public static final BigDecimal AIR_RATE_PER_KG = new BigDecimal("3.0");

    public static final BigDecimal DEMO_WEIGHT_KG = BigDecimal.valueOf(10);

    public static final String ERROR_INVALID_SHIPPING_MODE = "INVALID_SHIPPING_MODE";
    public static final String MESSAGE_INVALID_SHIPPING_MODE = "Invalid shipping type";
}
