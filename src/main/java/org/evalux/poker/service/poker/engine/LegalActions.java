package org.evalux.poker.service.poker.engine;

public record LegalActions(boolean canFold, boolean canCheck, boolean canCall, long callAmount,
                           boolean canBet, boolean canRaise, long minRaiseTo, long maxRaiseTo,
                           long currentPot, long playerStack) {

    public static LegalActions none() {
        return new LegalActions(false, false, false, 0, false, false, 0, 0, 0, 0);
    }
}
