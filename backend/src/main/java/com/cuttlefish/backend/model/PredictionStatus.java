package com.cuttlefish.backend.model;

public enum PredictionStatus {
    REQUESTED,
    FULFILLED,
    REJECTED,
    ERRORED,
    ABANDONED
}
