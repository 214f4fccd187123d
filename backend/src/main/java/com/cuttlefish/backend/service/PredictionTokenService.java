package com.cuttlefish.backend.service;

import com.cuttlefish.backend.event.PredictionTokenMintedEvent;
import com.cuttlefish.backend.exception.BadRequestException;
import com.cuttlefish.backend.model.Capability;
import com.cuttlefish.backend.model.PredictionToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Reward tokens for high-confidence predictions. Tokens are minted into a pending pool and leave
 * it only through an explicit claim.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PredictionTokenService {

    public static final String NAME = "CuttlefishPredictions";
    public static final String SYMBOL = "CFPRED";

    private final AccessControlService accessControl;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<Long, PredictionToken> tokens = new ConcurrentSkipListMap<>();
    private long nextTokenId = 1;

    synchronized PredictionToken mint(String requestId, BigInteger predictedPrice, int confidenceBps) {
        Instant now = clock.instant();
        PredictionToken token = new PredictionToken(nextTokenId++, requestId, predictedPrice, confidenceBps, now, null, null);
        tokens.put(token.tokenId(), token);
        log.info("Reward token minted tokenId={} requestId={} confidenceBps={}", token.tokenId(), requestId, confidenceBps);
        eventPublisher.publishEvent(new PredictionTokenMintedEvent(token.tokenId(), requestId, confidenceBps, now));
        return token;
    }

    public synchronized PredictionToken claim(String actor, long tokenId, String recipient) {
        accessControl.requireCapability(actor, Capability.REWARD_CLAIMER);
        if (recipient == null || recipient.isBlank()) {
            throw new BadRequestException("Recipient is required");
        }
        PredictionToken token = tokens.get(tokenId);
        if (token == null) {
            throw new BadRequestException("Unknown reward token: " + tokenId);
        }
        if (token.isClaimed()) {
            throw new BadRequestException("Reward token already claimed: " + tokenId);
        }
        PredictionToken claimed = token.claimedBy(recipient, clock.instant());
        tokens.put(tokenId, claimed);
        log.info("Reward token claimed tokenId={} recipient={} by={}", tokenId, recipient, actor);
        return claimed;
    }

    public Optional<PredictionToken> find(long tokenId) {
        return Optional.ofNullable(tokens.get(tokenId));
    }

    public List<PredictionToken> pendingTokens() {
        return tokens.values().stream().filter(token -> !token.isClaimed()).toList();
    }

    public List<PredictionToken> allTokens() {
        return List.copyOf(tokens.values());
    }

    public long totalSupply() {
        return tokens.size();
    }
}
