package com.leadscoring.model;

/**
 * Service package an opportunity maps to.
 */
public enum ServiceTier {
    BASIC,          // entry automation package
    PROFESSIONAL,   // multi-process package
    ENTERPRISE      // full engagement
}
