package org.evalux.poker.service.poker.engine;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** Forme sérialisable (JSON) de l'état complet du moteur. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EngineSnapshot {
    // configuration
    private int playerCount;
    private List<Long> startingStacks = new ArrayList<>();
    private long smallBlind;
    private long bigBlind;
    private long ante;
    private int buttonIndex;

    // état de la main
    private List<Long> preHandStacks = new ArrayList<>();
    private List<Long> stacks = new ArrayList<>();
    private List<Long> bets = new ArrayList<>();
    private List<Long> committed = new ArrayList<>();
    private List<Boolean> folded = new ArrayList<>();
    private List<Boolean> acted = new ArrayList<>();
    private List<List<String>> holeCards = new ArrayList<>();
    private List<String> board = new ArrayList<>();
    private List<String> deck = new ArrayList<>();
    private List<PotView> pots = new ArrayList<>();
    private int streetIndex;
    private Integer actorIndex;
    private long currentBet;
    private long minRaise;
    private boolean dealt;
    private boolean complete;
    private boolean showdown;
    private long settledPot;
    private List<WinnerInfo> winners = new ArrayList<>();
}
