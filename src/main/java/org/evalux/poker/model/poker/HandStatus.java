package org.evalux.poker.model.poker;

import java.util.EnumSet;
import java.util.Set;

public enum HandStatus {
    PREFLOP, FLOP, TURN, RIVER, INTER_HAND_WAIT, ENDED, ABORTED;

    public static final Set<HandStatus> TERMINAL = EnumSet.of(ENDED, ABORTED);

    public boolean isTerminal() { return TERMINAL.contains(this); }

    public boolean isBetting() { return this == PREFLOP || this == FLOP || this == TURN || this == RIVER; }
}
