package com.cuttlefish.backend.controller;

import com.cuttlefish.backend.dto.ClaimRequest;
import com.cuttlefish.backend.dto.FulfillmentRequest;
import com.cuttlefish.backend.exception.BadRequestException;
import com.cuttlefish.backend.model.AdvancedStats;
import com.cuttlefish.backend.model.PredictionRequest;
import com.cuttlefish.backend.model.PredictionToken;
import com.cuttlefish.backend.service.PredictionLifecycle;
import com.cuttlefish.backend.service.PredictionTokenService;
import com.cuttlefish.backend.security.ActorPrincipal;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/agent/predictions")
@RequiredArgsConstructor
@Tag(name = "Predictions")
public class PredictionController {

    private final PredictionLifecycle lifecycle;
    private final PredictionTokenService tokenService;

    @PostMapping
    public ResponseEntity<PredictionRequest> request(@AuthenticationPrincipal ActorPrincipal principal) {
        return ResponseEntity.ok(lifecycle.requestPrediction(principal.getActorId()));
    }

    @PostMapping("/{requestId}/fulfillment")
    @Operation(summary = "Prediction bridge callback; decode and compliance failures are reported in the body")
    public ResponseEntity<PredictionLifecycle.FulfillmentResult> fulfill(@AuthenticationPrincipal ActorPrincipal principal,
                                                                         @PathVariable String requestId,
                                                                         @RequestBody FulfillmentRequest request) {
        return ResponseEntity.ok(lifecycle.fulfillHex(principal.getActorId(), requestId, request.getResponse(),
                request.getError()));
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<PredictionRequest> get(@PathVariable String requestId) {
        return ResponseEntity.ok(lifecycle.getRequest(requestId)
                .orElseThrow(() -> new BadRequestException("Unknown prediction request: " + requestId)));
    }

    @GetMapping
    public ResponseEntity<List<PredictionRequest>> list() {
        return ResponseEntity.ok(lifecycle.getRequests());
    }

    @GetMapping("/upkeep")
    public ResponseEntity<PredictionLifecycle.UpkeepCheck> checkUpkeep() {
        return ResponseEntity.ok(lifecycle.checkUpkeep());
    }

    @PostMapping("/upkeep")
    public ResponseEntity<PredictionRequest> performUpkeep(@AuthenticationPrincipal ActorPrincipal principal) {
        return ResponseEntity.ok(lifecycle.performUpkeep(principal.getActorId()));
    }

    @GetMapping("/stats")
    public ResponseEntity<AdvancedStats> stats() {
        return ResponseEntity.ok(lifecycle.getAdvancedStats());
    }

    @GetMapping("/tokens")
    public ResponseEntity<TokensResponse> tokens(@RequestParam(defaultValue = "false") boolean pendingOnly) {
        List<PredictionToken> tokens = pendingOnly ? tokenService.pendingTokens() : tokenService.allTokens();
        return ResponseEntity.ok(new TokensResponse(PredictionTokenService.NAME, PredictionTokenService.SYMBOL,
                tokenService.totalSupply(), tokens));
    }

    @PostMapping("/tokens/{tokenId}/claim")
    public ResponseEntity<PredictionToken> claim(@AuthenticationPrincipal ActorPrincipal principal,
                                                 @PathVariable long tokenId,
                                                 @Valid @RequestBody ClaimRequest request) {
        return ResponseEntity.ok(tokenService.claim(principal.getActorId(), tokenId, request.getRecipient()));
    }

    public record TokensResponse(String name, String symbol, long totalSupply, List<PredictionToken> tokens) {}
}
