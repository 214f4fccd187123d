package com.cuttlefish.backend.controller;

import com.cuttlefish.backend.dto.BatchTradeRequest;
import com.cuttlefish.backend.dto.TradeRequest;
import com.cuttlefish.backend.model.PriceSnapshot;
import com.cuttlefish.backend.model.TradingStats;
import com.cuttlefish.backend.service.PriceOracleGateway;
import com.cuttlefish.backend.service.TradeAuthorizer;
import com.cuttlefish.backend.security.ActorPrincipal;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

@RestController
@RequestMapping("/api/agent/trades")
@RequiredArgsConstructor
@Tag(name = "Trades")
public class TradeController {

    private final TradeAuthorizer tradeAuthorizer;
    private final PriceOracleGateway priceOracle;

    @PostMapping
    @Operation(summary = "Authorize and execute a single trade")
    public ResponseEntity<TradeAuthorizer.TradeResult> trigger(@AuthenticationPrincipal ActorPrincipal principal,
                                                               @Valid @RequestBody TradeRequest request) {
        return ResponseEntity.ok(tradeAuthorizer.triggerTrade(principal.getActorId(), request.toCommand()));
    }

    @PostMapping("/batch")
    @Operation(summary = "Authorize a batch of up to 10 trades; halts at the first failing element")
    public ResponseEntity<TradeAuthorizer.BatchTradeResult> triggerBatch(@AuthenticationPrincipal ActorPrincipal principal,
                                                                         @Valid @RequestBody BatchTradeRequest request) {
        return ResponseEntity.ok(tradeAuthorizer.triggerBatchTrade(principal.getActorId(), request.toCommand()));
    }

    @GetMapping("/eligibility")
    public ResponseEntity<TradeAuthorizer.TradeEligibility> eligibility(
            @AuthenticationPrincipal ActorPrincipal principal,
            @RequestParam BigInteger amountIn,
            @RequestParam int confidenceBps) {
        return ResponseEntity.ok(tradeAuthorizer.canTrade(principal.getActorId(), amountIn, confidenceBps));
    }

    @GetMapping("/stats")
    public ResponseEntity<TradingStats> stats() {
        return ResponseEntity.ok(tradeAuthorizer.getTradingStats());
    }

    @GetMapping("/price")
    public ResponseEntity<PriceSnapshot> latestPrice() {
        return ResponseEntity.ok(priceOracle.getLatestPrice());
    }
}
