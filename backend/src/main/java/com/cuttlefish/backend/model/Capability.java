package com.cuttlefish.backend.model;

public enum Capability {
    ADMIN,
    AI_TRADER,
    EMERGENCY,
    KEEPER,
    PREDICTION_BRIDGE,
    REWARD_CLAIMER
}
