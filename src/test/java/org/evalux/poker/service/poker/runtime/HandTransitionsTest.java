package org.evalux.poker.service.poker.runtime;

import org.evalux.poker.model.poker.HandStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;
import static org.evalux.poker.service.poker.runtime.HandTransitions.next;

class HandTransitionsTest {

    @Test
    void cheminNominal() {
        HandStatus s = HandStatus.PREFLOP;
        s = next(s, HandEvent.STREET_DEALT);
        assertThat(s).isEqualTo(HandStatus.FLOP);
        s = next(s, HandEvent.STREET_DEALT);
        assertThat(s).isEqualTo(HandStatus.TURN);
        s = next(s, HandEvent.STREET_DEALT);
        assertThat(s).isEqualTo(HandStatus.RIVER);
        s = next(s, HandEvent.HAND_COMPLETED);
        assertThat(s).isEqualTo(HandStatus.INTER_HAND_WAIT);
        s = next(s, HandEvent.INTER_HAND_RESOLVED);
        assertThat(s).isEqualTo(HandStatus.ENDED);
    }

    @Test
    void foldPreflop_passeDirectementEnAttente() {
        assertThat(next(HandStatus.PREFLOP, HandEvent.HAND_COMPLETED)).isEqualTo(HandStatus.INTER_HAND_WAIT);
    }

    @ParameterizedTest
    @EnumSource(value = HandStatus.class, names = {"PREFLOP", "FLOP", "TURN", "RIVER", "INTER_HAND_WAIT"})
    void abandon_depuisToutEtatNonTerminal(HandStatus from) {
        assertThat(next(from, HandEvent.ABORTED)).isEqualTo(HandStatus.ABORTED);
    }

    @ParameterizedTest
    @EnumSource(value = HandStatus.class, names = {"ENDED", "ABORTED"})
    void etatsTerminaux_sansSortie(HandStatus from) {
        for (HandEvent e : HandEvent.values()) {
            assertThatThrownBy(() -> next(from, e)).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void transitionsInterdites() {
        assertThatThrownBy(() -> next(HandStatus.RIVER, HandEvent.STREET_DEALT)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> next(HandStatus.INTER_HAND_WAIT, HandEvent.STREET_DEALT)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> next(HandStatus.FLOP, HandEvent.INTER_HAND_RESOLVED)).isInstanceOf(IllegalStateException.class);
    }
}
