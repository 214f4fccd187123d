package com.cuttlefish.backend.service.port;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues request ids locally; the prediction service answers through the REST callback.
 */
@Service
@Slf4j
public class LoopbackPredictionBridge implements PredictionBridge {

    private final Map<String, SubmittedRequest> submitted = new ConcurrentHashMap<>();

    @Override
    public String submitRequest(String sourceCode, List<String> args, Map<String, Object> metadata) {
        UUID uuid = UUID.randomUUID();
        String requestId = "0x" + HexFormat.of().toHexDigits(uuid.getMostSignificantBits())
                + HexFormat.of().toHexDigits(uuid.getLeastSignificantBits());
        submitted.put(requestId, new SubmittedRequest(sourceCode, List.copyOf(args), Map.copyOf(metadata)));
        log.info("Prediction request submitted requestId={} args={} metadata={}", requestId, args, metadata);
        return requestId;
    }

    public Map<String, SubmittedRequest> getSubmitted() {
        return Map.copyOf(submitted);
    }

    public record SubmittedRequest(String sourceCode, List<String> args, Map<String, Object> metadata) {}
}
