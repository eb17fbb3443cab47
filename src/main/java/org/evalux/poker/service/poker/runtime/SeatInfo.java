package org.evalux.poker.service.poker.runtime;

import org.evalux.poker.model.poker.Seat;

/** Copie immuable d'un siège actif, détachée de la session JPA. */
public record SeatInfo(Long seatId, Long userId, String displayName, int position, long chips, boolean sittingOutNextHand) {

    public static SeatInfo of(Seat s) {
        return new SeatInfo(s.getId(), s.getUserId(), s.getDisplayName(), s.getPosition(), s.getChips(), s.isSittingOutNextHand());
    }
}
