package com.heronix.surveytiers.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How identifiable a kind of data is.
 */
@Getter
@RequiredArgsConstructor
public enum IdentifiabilityTier {

    /**
     * Personally identifying (names, login credentials)
     */
    PID("PID"),

    /**
     * Re-identifiable only through the rewrite map
     */
    PSEUDONYMOUS("Pseudonymous"),

    /**
     * Aggregated but still small enough to risk re-identification
     */
    ANONYMOUS_REIDENTIFIABLE("Anonymous (re-identifiable)"),

    ANONYMOUS("Anonymous (fully)");

    private final String label;
}
