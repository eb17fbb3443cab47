package org.evalux.poker.service.poker.engine;

import java.util.List;

/** Paramètres de création d'une main : ordre des joueurs = ordre canonique de la main. */
public record EngineConfig(List<Long> startingStacks, long smallBlind, long bigBlind, long ante, int buttonIndex) {

    public EngineConfig {
        startingStacks = List.copyOf(startingStacks);
    }

    public int playerCount() { return startingStacks.size(); }
}
