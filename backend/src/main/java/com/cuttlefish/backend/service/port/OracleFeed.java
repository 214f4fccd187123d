package com.cuttlefish.backend.service.port;

import com.cuttlefish.backend.model.OracleReading;

/**
 * A price-like data source. Readings are untrusted: they may be stale, non-positive, or the
 * read may fail with {@link com.cuttlefish.backend.exception.OracleUnavailableException}.
 */
public interface OracleFeed {

    String id();

    int decimals();

    String description();

    OracleReading latestReading();
}
