package org.evalux.poker.service.poker.engine;

import java.util.List;

/**
 * Gain brut d'un joueur sur le pot contesté.
 * {@code handRank} est null quand le pot est gagné sans abattage.
 */
public record WinnerInfo(int playerIndex, long amount, String handRank, List<String> bestHandCards) {

    public WinnerInfo withAmount(long newAmount) {
        return new WinnerInfo(playerIndex, newAmount, handRank, bestHandCards);
    }
}
