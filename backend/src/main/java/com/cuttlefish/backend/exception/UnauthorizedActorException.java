package com.cuttlefish.backend.exception;

import com.cuttlefish.backend.model.Capability;
import lombok.Getter;

@Getter
public class UnauthorizedActorException extends RuntimeException {

    private final String actor;
    private final Capability capability;

    public UnauthorizedActorException(String actor, Capability capability) {
        super("Actor " + actor + " lacks capability " + capability);
        this.actor = actor;
        this.capability = capability;
    }
}
