package com.cuttlefish.backend.security;

import com.cuttlefish.backend.config.AccessProperties;
import com.cuttlefish.backend.config.SecurityProperties;
import com.cuttlefish.backend.model.Capability;
import com.cuttlefish.backend.service.AccessControlService;
import com.cuttlefish.backend.util.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.time.Instant;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class JwtAuthenticationFilterTest {

    private JwtTokenProvider tokenProvider;
    private AccessControlService accessControl;
    private JwtAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        SecurityProperties securityProperties = new SecurityProperties();
        securityProperties.setJwtSecret("01234567890123456789012345678901");
        tokenProvider = new JwtTokenProvider(securityProperties, new MutableClock(Instant.now()));
        tokenProvider.validateSecret();

        AccessProperties accessProperties = new AccessProperties();
        accessProperties.getGrants().put("deployer", EnumSet.of(Capability.ADMIN, Capability.EMERGENCY));
        accessProperties.getGrants().put("ai-agent", EnumSet.of(Capability.AI_TRADER));
        accessControl = new AccessControlService(accessProperties);
        filter = new JwtAuthenticationFilter(tokenProvider, accessControl);
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private Authentication authenticate(String authorizationHeader) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/agent/trades");
        request.setServletPath("/api/agent/trades");
        if (authorizationHeader != null) {
            request.addHeader("Authorization", authorizationHeader);
        }
        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());
        return SecurityContextHolder.getContext().getAuthentication();
    }

    @Test
    void bearerTokenBecomesActorWithCapabilityAuthorities() throws Exception {
        Authentication authentication = authenticate("Bearer " + tokenProvider.generateToken("deployer").token());

        assertThat(authentication.getPrincipal()).isInstanceOf(ActorPrincipal.class);
        assertThat(((ActorPrincipal) authentication.getPrincipal()).getActorId()).isEqualTo("deployer");
        assertThat(authentication.getAuthorities())
                .extracting(GrantedAuthority::getAuthority)
                .containsExactlyInAnyOrder("CAP_ADMIN", "CAP_EMERGENCY");
    }

    @Test
    void revokedCapabilityDisappearsFromExistingToken() throws Exception {
        String token = tokenProvider.generateToken("ai-agent").token();
        accessControl.revoke("deployer", "ai-agent", Capability.AI_TRADER);

        Authentication authentication = authenticate("Bearer " + token);

        assertThat(authentication.getAuthorities()).isEmpty();
        assertThat(((ActorPrincipal) authentication.getPrincipal()).getCapabilities()).isEmpty();
    }

    @Test
    void missingOrInvalidTokenLeavesRequestAnonymous() throws Exception {
        assertThat(authenticate(null)).isNull();
        assertThat(authenticate("Bearer garbage")).isNull();
        assertThat(authenticate("deployer")).isNull();
    }
}
