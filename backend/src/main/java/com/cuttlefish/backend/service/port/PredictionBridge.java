package com.cuttlefish.backend.service.port;

import java.util.List;
import java.util.Map;

/**
 * Request side of the off-chain prediction service. The answer arrives later through the
 * fulfillment callback.
 */
public interface PredictionBridge {

    String submitRequest(String sourceCode, List<String> args, Map<String, Object> metadata);
}
