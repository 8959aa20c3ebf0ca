package com.underwriting.common.model;

public enum ProviderOutcome {
    SUCCESS,
    FAILED
}
