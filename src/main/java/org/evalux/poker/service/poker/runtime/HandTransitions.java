package org.evalux.poker.service.poker.runtime;

import org.evalux.poker.model.poker.HandStatus;

/**
 * Fonction de transition du cycle de vie d'une main.
 * PREFLOP → FLOP → TURN → RIVER → INTER_HAND_WAIT → ENDED ; ABORTED depuis tout état non terminal.
 */
public final class HandTransitions {
    private HandTransitions(){}

    public static HandStatus next(HandStatus status, HandEvent event) {
        return switch (status) {
            case PREFLOP -> betting(status, event, HandStatus.FLOP);
            case FLOP -> betting(status, event, HandStatus.TURN);
            case TURN -> betting(status, event, HandStatus.RIVER);
            case RIVER -> betting(status, event, null);
            case INTER_HAND_WAIT -> switch (event) {
                case INTER_HAND_RESOLVED -> HandStatus.ENDED;
                case ABORTED -> HandStatus.ABORTED;
                case STREET_DEALT, HAND_COMPLETED -> throw illegal(status, event);
            };
            case ENDED, ABORTED -> throw illegal(status, event);
        };
    }

    private static HandStatus betting(HandStatus status, HandEvent event, HandStatus nextStreet) {
        return switch (event) {
            case STREET_DEALT -> {
                if (nextStreet == null) throw illegal(status, event);
                yield nextStreet;
            }
            case HAND_COMPLETED -> HandStatus.INTER_HAND_WAIT;
            case ABORTED -> HandStatus.ABORTED;
            case INTER_HAND_RESOLVED -> throw illegal(status, event);
        };
    }

    private static IllegalStateException illegal(HandStatus status, HandEvent event) {
        return new IllegalStateException("Transition impossible: " + status + " + " + event);
    }
}
