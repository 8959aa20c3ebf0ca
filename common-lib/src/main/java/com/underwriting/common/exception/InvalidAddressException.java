package com.underwriting.common.exception;

public class InvalidAddressException extends AggregationException {

    private final String component;

    public InvalidAddressException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
