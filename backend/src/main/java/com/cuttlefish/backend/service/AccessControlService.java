package com.cuttlefish.backend.service;

import com.cuttlefish.backend.config.AccessProperties;
import com.cuttlefish.backend.exception.BadRequestException;
import com.cuttlefish.backend.exception.UnauthorizedActorException;
import com.cuttlefish.backend.model.Capability;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capability sets per actor. Every mutating entry point asks {@link #requireCapability} before
 * doing anything else.
 */
@Service
@Slf4j
public class AccessControlService {

    private final Map<String, Set<Capability>> grants = new ConcurrentHashMap<>();

    public AccessControlService(AccessProperties properties) {
        properties.getGrants().forEach((actor, capabilities) -> {
            if (capabilities != null && !capabilities.isEmpty()) {
                grants.put(actor, EnumSet.copyOf(capabilities));
            }
        });
        log.info("Access control initialised actors={}", grants.keySet());
    }

    public boolean hasCapability(String actor, Capability capability) {
        if (actor == null || actor.isBlank()) {
            return false;
        }
        Set<Capability> capabilities = grants.get(actor);
        return capabilities != null && capabilities.contains(capability);
    }

    public void requireCapability(String actor, Capability capability) {
        if (!hasCapability(actor, capability)) {
            log.warn("Access denied actor={} capability={}", actor, capability);
            throw new UnauthorizedActorException(actor, capability);
        }
    }

    public Set<Capability> capabilitiesOf(String actor) {
        Set<Capability> capabilities = grants.get(actor);
        return capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public synchronized void grant(String admin, String actor, Capability capability) {
        requireCapability(admin, Capability.ADMIN);
        if (actor == null || actor.isBlank()) {
            throw new BadRequestException("Actor id is required");
        }
        grants.compute(actor, (key, current) -> {
            Set<Capability> next = current == null ? EnumSet.noneOf(Capability.class) : EnumSet.copyOf(current);
            next.add(capability);
            return next;
        });
        log.info("Capability granted actor={} capability={} by={}", actor, capability, admin);
    }

    public synchronized void revoke(String admin, String actor, Capability capability) {
        requireCapability(admin, Capability.ADMIN);
        if (capability == Capability.ADMIN && admin.equals(actor) && adminCount() == 1) {
            throw new BadRequestException("Cannot revoke the last ADMIN capability");
        }
        grants.computeIfPresent(actor, (key, current) -> {
            Set<Capability> next = EnumSet.copyOf(current);
            next.remove(capability);
            return next.isEmpty() ? null : next;
        });
        log.info("Capability revoked actor={} capability={} by={}", actor, capability, admin);
    }

    private long adminCount() {
        return grants.values().stream().filter(set -> set.contains(Capability.ADMIN)).count();
    }
}
