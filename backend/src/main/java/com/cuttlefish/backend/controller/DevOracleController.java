package com.cuttlefish.backend.controller;

import com.cuttlefish.backend.dto.OracleReadingRequest;
import com.cuttlefish.backend.exception.BadRequestException;
import com.cuttlefish.backend.model.OracleReading;
import com.cuttlefish.backend.service.port.LoopbackPredictionBridge;
import com.cuttlefish.backend.service.port.OracleFeed;
import com.cuttlefish.backend.service.port.OracleRegistry;
import com.cuttlefish.backend.service.port.PaperCustodyPort;
import com.cuttlefish.backend.service.port.StaticOracleFeed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Conditional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Local tooling: push oracle readings and inspect the in-process adapters.
 */
@Slf4j
@RestController
@RequestMapping("/api/dev")
@RequiredArgsConstructor
@Conditional(com.cuttlefish.backend.config.DevEndpointCondition.class)
public class DevOracleController {

    private final OracleRegistry oracleRegistry;
    private final PaperCustodyPort custodyPort;
    private final LoopbackPredictionBridge predictionBridge;
    private final Clock clock;

    @GetMapping("/oracles")
    public ResponseEntity<List<String>> feeds() {
        return ResponseEntity.ok(oracleRegistry.ids());
    }

    @PutMapping("/oracles/{feedId}")
    public ResponseEntity<FeedStateResponse> pushReading(@PathVariable String feedId,
                                                         @RequestBody OracleReadingRequest request) {
        OracleFeed feed = oracleRegistry.require(feedId);
        if (!(feed instanceof StaticOracleFeed)) {
            throw new BadRequestException("Feed " + feedId + " does not accept pushed readings");
        }
        StaticOracleFeed staticFeed = (StaticOracleFeed) feed;
        if (request.isUnavailable()) {
            staticFeed.markUnavailable("marked unavailable via dev endpoint");
            log.info("Dev oracle feed marked unavailable feed={}", feedId);
            return ResponseEntity.ok(new FeedStateResponse(feedId, null, null, false));
        }
        if (request.getValue() == null) {
            throw new BadRequestException("value is required");
        }
        Instant updatedAt = request.getUpdatedAt() != null ? request.getUpdatedAt() : clock.instant();
        staticFeed.update(request.getValue(), updatedAt);
        log.info("Dev oracle reading pushed feed={} value={} updatedAt={}", feedId, request.getValue(), updatedAt);
        OracleReading reading = staticFeed.latestReading();
        return ResponseEntity.ok(new FeedStateResponse(feedId, reading.value(), reading.updatedAt(), true));
    }

    @GetMapping("/custody")
    public ResponseEntity<CustodyResponse> custody() {
        return ResponseEntity.ok(new CustodyResponse(custodyPort.getBalance(), custodyPort.getFeesAccrued()));
    }

    @GetMapping("/bridge/requests")
    public ResponseEntity<Map<String, LoopbackPredictionBridge.SubmittedRequest>> submittedRequests() {
        return ResponseEntity.ok(predictionBridge.getSubmitted());
    }

    public record FeedStateResponse(String feedId, BigInteger value, Instant updatedAt, boolean available) {}

    public record CustodyResponse(BigInteger balance, BigInteger feesAccrued) {}
}
