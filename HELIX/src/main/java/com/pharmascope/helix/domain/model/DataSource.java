package com.pharmascope.helix.domain.model;

/**
 * Origin of an agent's data.
 */
public enum DataSource {
    LIVE,       // Upstream source answered within its deadline
    FALLBACK,   // Degraded path: local estimate or breaker short-circuit
    CACHED      // Last-known-good result served on the fallback path
}
