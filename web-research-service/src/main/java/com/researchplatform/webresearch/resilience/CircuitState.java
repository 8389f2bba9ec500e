package com.researchplatform.webresearch.resilience;

public enum CircuitState {
    CLOSED,     // calls flow, failures are counted
    OPEN,       // calls fail fast until the cool-down elapses
    HALF_OPEN   // one trial call decides between CLOSED and OPEN
}
