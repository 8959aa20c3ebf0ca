package com.underwriting.propertydata.provider;

import com.underwriting.common.model.ProviderErrorKind;

public class ProviderParseException extends ProviderCallException {

    public ProviderParseException(String providerId, String message) {
        super(providerId, ProviderErrorKind.PARSE_ERROR, message);
    }

    public ProviderParseException(String providerId, String message, Throwable cause) {
        super(providerId, ProviderErrorKind.PARSE_ERROR, message, cause);
    }
}
