package com.shippingmanagement.shipping.exception;

import com.shippingmanagement.shipping.constants.ShippingConstants;

import java.util.Collection;

/**
 * Exception thrown when a shipping mode name has no registered strategy.
 */
public class InvalidShippingModeException extends ShippingException {

    private final String mode;

    public InvalidShippingModeException(String mode, Collection<String> supportedModes) {
        super(ShippingConstants.ERROR_INVALID_SHIPPING_MODE,
                ShippingConstants.MESSAGE_INVALID_SHIPPING_MODE + ": " + mode
                        + " (supported: " + String.join(", ", supportedModes) + ")");
        this.mode = mode;
    }

    public String getMode() {
        return mode;
    }
}
