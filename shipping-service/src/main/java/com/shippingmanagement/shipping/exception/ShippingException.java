package com.shippingmanagement.shipping.exception;

import lombok.Getter;


@Getter
public class ShippingException extends RuntimeException {

    private final String errorCode;

    public ShippingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
