package com.cuttlefish.backend.service;

import java.math.BigInteger;

/**
 * Pluggable compliance predicate. Implementations must fail closed: a configured signal that
 * cannot be read is a rejection.
 */
public interface ComplianceGate {

    boolean validatePrediction(String requestId, BigInteger predictedPrice);

    boolean validateTrade(String actor, BigInteger amountIn, BigInteger price);
}
