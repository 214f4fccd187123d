package com.cuttlefish.backend.security;

import com.cuttlefish.backend.model.Capability;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActorPrincipal {
    private String actorId;
    private Set<Capability> capabilities;
}
