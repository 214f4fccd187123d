package com.cuttlefish.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OracleReadingRequest {

    private BigInteger value;

    // defaults to now
    private Instant updatedAt;

    // marks the feed unreadable instead of pushing a value
    private boolean unavailable;
}
