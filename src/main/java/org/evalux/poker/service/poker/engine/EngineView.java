package org.evalux.poker.service.poker.engine;

import java.util.List;

/** Lecture complète (non filtrée) de l'état moteur ; le filtrage par spectateur se fait dans Payloads. */
public record EngineView(int playerCount,
                         int buttonIndex,
                         String street,
                         Integer actorIndex,
                         List<Long> stacks,
                         List<Long> bets,
                         List<Boolean> folded,
                         List<Boolean> allIn,
                         List<List<String>> holeCards,
                         List<String> board,
                         List<PotView> pots,
                         long totalPot,
                         long currentBet,
                         long smallBlind,
                         long bigBlind,
                         boolean showdown,
                         boolean complete) {
}
