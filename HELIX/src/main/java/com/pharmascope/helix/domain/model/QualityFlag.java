package com.pharmascope.helix.domain.model;

/**
 * Coarse quality marker carried on every agent result envelope.
 */
public enum QualityFlag {
    HIGH,
    MEDIUM,
    LOW
}
