package com.underwriting.propertydata.registry;

/**
 * Precedence tiers, highest first. Declaration order is the merge precedence order.
 */
public enum ProviderTier {
    /** Paid sources with address-level records. */
    COMMERCIAL,
    /** Public datasets such as HUD Fair Market Rents. */
    OPEN_DATA,
    /** Comparable-listing estimates; only consulted when comps are requested. */
    COMPS,
    /** Deterministic mock, used only when nothing live is configured. */
    FALLBACK
}
