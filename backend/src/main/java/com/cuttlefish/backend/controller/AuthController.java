package com.cuttlefish.backend.controller;

import com.cuttlefish.backend.config.SecurityProperties;
import com.cuttlefish.backend.dto.TokenRequest;
import com.cuttlefish.backend.security.JwtTokenProvider;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exchanges an actor's API key for a bearer token.
 */
@Slf4j
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication")
public class AuthController {

    private final SecurityProperties securityProperties;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;

    @PostMapping("/token")
    @Operation(summary = "Issue a bearer token for an actor holding a configured API key")
    public ResponseEntity<JwtTokenProvider.IssuedToken> token(@Valid @RequestBody TokenRequest request) {
        String encoded = securityProperties.getApiKeys().get(request.getActorId());
        if (encoded == null || !passwordEncoder.matches(request.getApiKey(), encoded)) {
            log.warn("Token request rejected actor={}", request.getActorId());
            throw new BadCredentialsException("Invalid actor credentials");
        }
        JwtTokenProvider.IssuedToken issued = jwtTokenProvider.generateToken(request.getActorId());
        log.info("Token issued actor={} expiresAt={}", issued.actorId(), issued.expiresAt());
        return ResponseEntity.ok(issued);
    }
}
