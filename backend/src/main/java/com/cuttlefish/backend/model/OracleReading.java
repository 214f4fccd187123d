package com.cuttlefish.backend.model;

import java.math.BigInteger;
import java.time.Instant;

public record OracleReading(BigInteger value, Instant updatedAt) {
}
