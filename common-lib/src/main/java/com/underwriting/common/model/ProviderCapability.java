package com.underwriting.common.model;

/**
 * Scope of the data an adapter can return. An adapter may declare both.
 */
public enum ProviderCapability {
    /** Facts about one specific property (valuation, taxes, structure). */
    PROPERTY_LEVEL,
    /** Statistics scoped to the property's ZIP or metro area. */
    AREA_LEVEL
}
