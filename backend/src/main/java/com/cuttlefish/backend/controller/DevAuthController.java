package com.cuttlefish.backend.controller;

import com.cuttlefish.backend.config.DevEndpointCondition;
import com.cuttlefish.backend.exception.BadRequestException;
import com.cuttlefish.backend.security.JwtTokenProvider;
import com.cuttlefish.backend.service.AccessControlService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Conditional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Local tooling: mints a token for any actor holding at least one capability, no API key needed.
 */
@Slf4j
@RestController
@RequestMapping("/api/dev")
@RequiredArgsConstructor
@Conditional(DevEndpointCondition.class)
public class DevAuthController {

    private final JwtTokenProvider jwtTokenProvider;
    private final AccessControlService accessControl;

    @PostMapping("/token")
    public ResponseEntity<JwtTokenProvider.IssuedToken> devToken(@RequestBody DevTokenRequest request) {
        if (request.actorId() == null || accessControl.capabilitiesOf(request.actorId()).isEmpty()) {
            throw new BadRequestException("Unknown actor for dev token generation");
        }
        log.warn("Dev token issued actor={}", request.actorId());
        return ResponseEntity.ok(jwtTokenProvider.generateToken(request.actorId()));
    }

    public record DevTokenRequest(String actorId) {}
}
