package com.faultguard.common;

/**
 * Implemented by errors that carry an explicit kind discriminant (e.g. "CONNECTION_REFUSED",
 * "RATE_LIMITED") instead of relying on their class name.
 */
public interface KindedError {

    String kind();
}
