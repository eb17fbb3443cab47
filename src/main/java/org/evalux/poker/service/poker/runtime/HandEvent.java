package org.evalux.poker.service.poker.runtime;

public enum HandEvent {
    STREET_DEALT,
    HAND_COMPLETED,
    INTER_HAND_RESOLVED,
    ABORTED
}
