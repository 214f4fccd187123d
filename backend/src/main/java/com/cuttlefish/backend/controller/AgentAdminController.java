package com.cuttlefish.backend.controller;

import com.cuttlefish.backend.dto.ComplianceFeedsRequest;
import com.cuttlefish.backend.dto.ConfigUpdateRequest;
import com.cuttlefish.backend.dto.EmergencyActivateRequest;
import com.cuttlefish.backend.dto.FeedRotationRequest;
import com.cuttlefish.backend.dto.PriceThresholdRequest;
import com.cuttlefish.backend.dto.RoleChangeRequest;
import com.cuttlefish.backend.dto.TargetAssetRequest;
import com.cuttlefish.backend.model.Capability;
import com.cuttlefish.backend.model.EmergencyState;
import com.cuttlefish.backend.model.PredictionRequest;
import com.cuttlefish.backend.model.RateState;
import com.cuttlefish.backend.model.TradingConfig;
import com.cuttlefish.backend.service.AccessControlService;
import com.cuttlefish.backend.service.AgentAdminService;
import com.cuttlefish.backend.service.EcoGate;
import com.cuttlefish.backend.service.EmergencyControl;
import com.cuttlefish.backend.service.PredictionLifecycle;
import com.cuttlefish.backend.service.PriceOracleGateway;
import com.cuttlefish.backend.service.TradingAgentState;
import com.cuttlefish.backend.security.ActorPrincipal;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

@RestController
@RequestMapping("/api/agent/admin")
@RequiredArgsConstructor
@Tag(name = "Agent administration")
public class AgentAdminController {

    private final AgentAdminService adminService;
    private final EmergencyControl emergencyControl;
    private final AccessControlService accessControl;
    private final PredictionLifecycle predictionLifecycle;
    private final TradingAgentState agentState;
    private final PriceOracleGateway priceOracle;
    private final EcoGate ecoGate;

    @GetMapping("/state")
    public ResponseEntity<AgentStateResponse> state() {
        return ResponseEntity.ok(new AgentStateResponse(
                agentState.config(),
                agentState.rateState(),
                agentState.emergencyState(),
                agentState.sourceAsset(),
                agentState.targetAsset(),
                priceOracle.currentFeedId(),
                ecoGate.currentFeedId(),
                agentState.consecutiveExecutionFailures()
        ));
    }

    @PutMapping("/config")
    public ResponseEntity<TradingConfig> updateConfig(@AuthenticationPrincipal ActorPrincipal principal,
                                                      @Valid @RequestBody ConfigUpdateRequest request) {
        return ResponseEntity.ok(adminService.updateConfig(principal.getActorId(), request.toConfig()));
    }

    @PutMapping("/config/price-threshold")
    public ResponseEntity<TradingConfig> setPriceThreshold(@AuthenticationPrincipal ActorPrincipal principal,
                                                           @Valid @RequestBody PriceThresholdRequest request) {
        return ResponseEntity.ok(adminService.setPriceThreshold(principal.getActorId(), request.getPriceThreshold()));
    }

    @PostMapping("/emergency/activate")
    public ResponseEntity<EmergencyState> activateEmergency(@AuthenticationPrincipal ActorPrincipal principal,
                                                            @Valid @RequestBody EmergencyActivateRequest request) {
        return ResponseEntity.ok(emergencyControl.activate(principal.getActorId(), request.getReason()));
    }

    @PostMapping("/emergency/deactivate")
    public ResponseEntity<EmergencyState> deactivateEmergency(@AuthenticationPrincipal ActorPrincipal principal) {
        return ResponseEntity.ok(emergencyControl.deactivate(principal.getActorId()));
    }

    @PostMapping("/pause")
    public ResponseEntity<EmergencyState> pause(@AuthenticationPrincipal ActorPrincipal principal) {
        return ResponseEntity.ok(emergencyControl.pause(principal.getActorId()));
    }

    @PostMapping("/unpause")
    public ResponseEntity<EmergencyState> unpause(@AuthenticationPrincipal ActorPrincipal principal) {
        return ResponseEntity.ok(emergencyControl.unpause(principal.getActorId()));
    }

    @PutMapping("/target-asset")
    public ResponseEntity<AssetResponse> setTargetAsset(@AuthenticationPrincipal ActorPrincipal principal,
                                                        @Valid @RequestBody TargetAssetRequest request) {
        String asset = adminService.setTargetAsset(principal.getActorId(), request.getAsset());
        return ResponseEntity.ok(new AssetResponse(agentState.sourceAsset(), asset));
    }

    @PutMapping("/oracles/price")
    public ResponseEntity<FeedResponse> rotatePriceFeed(@AuthenticationPrincipal ActorPrincipal principal,
                                                        @RequestBody FeedRotationRequest request) {
        return ResponseEntity.ok(new FeedResponse(adminService.rotatePriceFeed(principal.getActorId(), request.getFeedId())));
    }

    @PutMapping("/oracles/eco")
    public ResponseEntity<FeedResponse> rotateEcoFeed(@AuthenticationPrincipal ActorPrincipal principal,
                                                      @RequestBody FeedRotationRequest request) {
        return ResponseEntity.ok(new FeedResponse(adminService.rotateEcoFeed(principal.getActorId(), request.getFeedId())));
    }

    @PutMapping("/oracles/compliance")
    public ResponseEntity<Void> setComplianceFeeds(@AuthenticationPrincipal ActorPrincipal principal,
                                                   @RequestBody ComplianceFeedsRequest request) {
        adminService.setComplianceFeeds(principal.getActorId(), request.getVolatilityFeedId(), request.getRegulatoryFeedId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/roles/grant")
    public ResponseEntity<RolesResponse> grant(@AuthenticationPrincipal ActorPrincipal principal,
                                               @Valid @RequestBody RoleChangeRequest request) {
        accessControl.grant(principal.getActorId(), request.getActor(), request.getCapability());
        return ResponseEntity.ok(new RolesResponse(request.getActor(), accessControl.capabilitiesOf(request.getActor())));
    }

    @PostMapping("/roles/revoke")
    public ResponseEntity<RolesResponse> revoke(@AuthenticationPrincipal ActorPrincipal principal,
                                                @Valid @RequestBody RoleChangeRequest request) {
        accessControl.revoke(principal.getActorId(), request.getActor(), request.getCapability());
        return ResponseEntity.ok(new RolesResponse(request.getActor(), accessControl.capabilitiesOf(request.getActor())));
    }

    @GetMapping("/roles/{actor}")
    public ResponseEntity<RolesResponse> roles(@PathVariable String actor) {
        return ResponseEntity.ok(new RolesResponse(actor, accessControl.capabilitiesOf(actor)));
    }

    @PostMapping("/predictions/reset-pending")
    public ResponseEntity<PredictionRequest> resetPending(@AuthenticationPrincipal ActorPrincipal principal) {
        return ResponseEntity.ok(predictionLifecycle.resetPendingRequest(principal.getActorId()));
    }

    public record AgentStateResponse(TradingConfig config, RateState rateState, EmergencyState emergency,
                                     String sourceAsset, String targetAsset, String priceFeed, String ecoFeed,
                                     int consecutiveExecutionFailures) {}

    public record AssetResponse(String sourceAsset, String targetAsset) {}

    public record FeedResponse(String feedId) {}

    public record RolesResponse(String actor, Set<Capability> capabilities) {}
}
