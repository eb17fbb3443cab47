package org.evalux.poker.service.poker.engine;

import org.evalux.poker.model.poker.Card;
import org.evalux.poker.model.poker.rules.HandEvaluator;
import org.evalux.poker.model.poker.rules.HandValue;
import org.evalux.poker.service.poker.error.IllegalActionException;
import org.evalux.poker.service.poker.error.RestorationException;

import java.util.*;

/**
 * Hold'em no-limit, 2 à 8 joueurs. Implémentation par défaut de {@link RulesEngine}, fournie par
 * {@link HoldemRulesEngineFactory} ; le runtime de table ne dépend que de l'interface et un autre
 * moteur se branche en déclarant son propre {@link RulesEngineFactory}.
 * <p>
 * Les mises de la rue en cours sont dans {@code bets} ; {@code committed} cumule tout ce qu'un joueur
 * a mis dans la main (antes compris) et sert à construire les pots au règlement.
 * Heads-up : le bouton poste la petite blinde et parle en premier preflop.
 */
public class HoldemRulesEngine implements RulesEngine {
    public static final int MIN_PLAYERS = 2, MAX_PLAYERS = 8;
    private static final String[] STREETS = {"preflop", "flop", "turn", "river"};

    private final EngineConfig config;
    private final Random rnd;
    private final int n;

    private long[] preHandStacks;
    private final long[] stacks;
    private final long[] bets;
    private final long[] committed;
    private final boolean[] folded;
    private final boolean[] acted;
    private final List<List<Card>> holeCards = new ArrayList<>();
    private final List<Card> board = new ArrayList<>();
    private final Deque<Card> deck = new ArrayDeque<>();

    private int streetIndex;
    private Integer actorIndex;
    private long currentBet;
    private long minRaise;
    private boolean dealt;
    private boolean complete;
    private boolean showdown;
    private long settledPot;
    private List<WinnerInfo> winners = new ArrayList<>();

    public HoldemRulesEngine(EngineConfig config, Random rnd) {
        int count = config.playerCount();
        if (count < MIN_PLAYERS || count > MAX_PLAYERS)
            throw new IllegalArgumentException("Nombre de joueurs invalide: " + count);
        if (config.bigBlind() <= 0 || config.smallBlind() < 0 || config.ante() < 0)
            throw new IllegalArgumentException("Blindes invalides");
        if (config.buttonIndex() < 0 || config.buttonIndex() >= count)
            throw new IllegalArgumentException("Bouton hors table: " + config.buttonIndex());
        this.config = config;
        this.rnd = rnd;
        this.n = count;
        this.stacks = new long[n];
        this.bets = new long[n];
        this.committed = new long[n];
        this.folded = new boolean[n];
        this.acted = new boolean[n];
        for (int i = 0; i < n; i++) {
            long s = config.startingStacks().get(i);
            if (s <= 0) throw new IllegalArgumentException("Tapis vide pour le joueur " + i);
            stacks[i] = s;
            holeCards.add(new ArrayList<>());
        }
        this.preHandStacks = stacks.clone();
        this.minRaise = config.bigBlind();
    }

    // ---------------------------------------------------------------- distribution

    @Override
    public void dealNewHand() {
        if (dealt) throw new IllegalStateException("Main déjà distribuée");
        dealt = true;
        preHandStacks = stacks.clone();

        List<Card> cards = Card.fullDeck();
        Collections.shuffle(cards, rnd);
        deck.addAll(cards);

        if (config.ante() > 0) {
            for (int i = 0; i < n; i++) {
                long a = Math.min(stacks[i], config.ante());
                stacks[i] -= a;
                committed[i] += a;
            }
        }
        int sb = smallBlindIndex(), bb = next(sb);
        post(sb, config.smallBlind());
        post(bb, config.bigBlind());
        currentBet = Math.max(bets[sb], bets[bb]);
        minRaise = config.bigBlind();

        for (int round = 0; round < 2; round++)
            for (int k = 0; k < n; k++) holeCards.get((sb + k) % n).add(deck.pollFirst());

        int first = n == 2 ? sb : next(bb);
        actorIndex = findActor(first);
        refresh();
    }

    @Override
    public void dealNextStreet() {
        if (!dealt || complete) throw new IllegalStateException("Aucune main en cours");
        if (actorIndex != null) throw new IllegalStateException("Tour d'enchères non terminé");
        if (streetIndex >= 3) throw new IllegalStateException("River déjà distribuée");

        Arrays.fill(bets, 0L);
        Arrays.fill(acted, false);
        currentBet = 0;
        minRaise = config.bigBlind();

        int count = streetIndex == 0 ? 3 : 1;
        for (int k = 0; k < count; k++) board.add(deck.pollFirst());
        streetIndex++;

        actorIndex = findActor(next(config.buttonIndex()));
        refresh();
    }

    // ---------------------------------------------------------------- actions

    @Override
    public void fold() {
        int i = requireActor();
        if (currentBet - bets[i] <= 0) throw new IllegalActionException("Impossible de se coucher : check possible");
        folded[i] = true;
        acted[i] = true;
        advance(i);
    }

    @Override
    public void checkOrCall() {
        int i = requireActor();
        long call = Math.min(currentBet - bets[i], stacks[i]);
        if (call > 0) move(i, call);
        acted[i] = true;
        advance(i);
    }

    @Override
    public void betOrRaiseTo(long amount) {
        int i = requireActor();
        long maxTo = stacks[i] + bets[i];
        long to = Math.min(amount, maxTo);
        if (to <= currentBet)
            throw new IllegalActionException("Mise trop faible : il faut dépasser " + currentBet);
        if (othersAbleToRespond(i) == 0)
            throw new IllegalActionException("Relance impossible : plus aucun adversaire ne peut suivre");
        long minTo = minRaiseTo();
        if (to < minTo && to != maxTo)
            throw new IllegalActionException("Relance hors limites : min " + minTo + ", max " + maxTo);

        long raiseSize = to - currentBet;
        if (raiseSize >= minRaise) minRaise = raiseSize;
        currentBet = to;
        move(i, to - bets[i]);
        acted[i] = true;
        advance(i);
    }

    // ---------------------------------------------------------------- lecture

    @Override
    public boolean isHandComplete() { return complete; }

    @Override
    public boolean hasPendingActor() { return actorIndex != null; }

    @Override
    public Integer actorIndex() { return actorIndex; }

    @Override
    public LegalActions legalActions(int playerIndex) {
        if (complete || actorIndex == null || actorIndex != playerIndex) return LegalActions.none();
        int i = playerIndex;
        long call = Math.min(currentBet - bets[i], stacks[i]);
        long maxTo = stacks[i] + bets[i];
        boolean canAggress = maxTo > currentBet && othersAbleToRespond(i) > 0;
        long minTo = Math.min(minRaiseTo(), maxTo);
        return new LegalActions(
                call > 0,
                call <= 0,
                call > 0,
                Math.max(call, 0),
                canAggress && currentBet == 0,
                canAggress && currentBet > 0,
                canAggress ? minTo : 0,
                canAggress ? maxTo : 0,
                totalPot(),
                stacks[i]);
    }

    @Override
    public List<WinnerInfo> winners() { return List.copyOf(winners); }

    @Override
    public EngineView view() {
        List<Boolean> allIn = new ArrayList<>(n);
        List<List<String>> holes = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            allIn.add(!folded[i] && stacks[i] == 0);
            holes.add(Card.codes(holeCards.get(i)));
        }
        String street = complete && showdown ? "showdown" : STREETS[streetIndex];
        return new EngineView(n, config.buttonIndex(), street, actorIndex,
                boxed(stacks), boxed(bets), boxed(folded), allIn, holes, Card.codes(board),
                computePots(), complete ? settledPot : totalPot(), currentBet,
                config.smallBlind(), config.bigBlind(), showdown, complete);
    }

    // ---------------------------------------------------------------- snapshot

    @Override
    public EngineSnapshot serialize() {
        EngineSnapshot s = new EngineSnapshot();
        s.setPlayerCount(n);
        s.setStartingStacks(new ArrayList<>(config.startingStacks()));
        s.setSmallBlind(config.smallBlind());
        s.setBigBlind(config.bigBlind());
        s.setAnte(config.ante());
        s.setButtonIndex(config.buttonIndex());
        s.setPreHandStacks(boxed(preHandStacks));
        s.setStacks(boxed(stacks));
        s.setBets(boxed(bets));
        s.setCommitted(boxed(committed));
        s.setFolded(boxed(folded));
        s.setActed(boxed(acted));
        List<List<String>> holes = new ArrayList<>(n);
        for (List<Card> h : holeCards) holes.add(Card.codes(h));
        s.setHoleCards(holes);
        s.setBoard(Card.codes(board));
        s.setDeck(Card.codes(new ArrayList<>(deck)));
        s.setPots(computePots());
        s.setStreetIndex(streetIndex);
        s.setActorIndex(actorIndex);
        s.setCurrentBet(currentBet);
        s.setMinRaise(minRaise);
        s.setDealt(dealt);
        s.setComplete(complete);
        s.setShowdown(showdown);
        s.setSettledPot(settledPot);
        s.setWinners(new ArrayList<>(winners));
        return s;
    }

    /** Inverse exact de {@link #serialize()} : aucun nouveau mélange. */
    public static HoldemRulesEngine restore(EngineSnapshot s, Random rnd) {
        if (s == null) throw new RestorationException("Snapshot absent");
        int count = s.getPlayerCount();
        HoldemRulesEngine e;
        try {
            e = new HoldemRulesEngine(new EngineConfig(s.getStartingStacks(), s.getSmallBlind(), s.getBigBlind(),
                    s.getAnte(), s.getButtonIndex()), rnd);
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new RestorationException("Configuration moteur invalide: " + ex.getMessage(), ex);
        }
        requireSize("startingStacks", s.getStartingStacks(), count);
        requireSize("preHandStacks", s.getPreHandStacks(), count);
        requireSize("stacks", s.getStacks(), count);
        requireSize("bets", s.getBets(), count);
        requireSize("committed", s.getCommitted(), count);
        requireSize("folded", s.getFolded(), count);
        requireSize("acted", s.getActed(), count);
        requireSize("holeCards", s.getHoleCards(), count);
        if (s.getStreetIndex() < 0 || s.getStreetIndex() > 3)
            throw new RestorationException("Rue invalide: " + s.getStreetIndex());
        if (s.getActorIndex() != null && (s.getActorIndex() < 0 || s.getActorIndex() >= count))
            throw new RestorationException("Joueur actif invalide: " + s.getActorIndex());

        for (int i = 0; i < count; i++) {
            e.stacks[i] = s.getStacks().get(i);
            e.bets[i] = s.getBets().get(i);
            e.committed[i] = s.getCommitted().get(i);
            e.folded[i] = s.getFolded().get(i);
            e.acted[i] = s.getActed().get(i);
        }
        e.preHandStacks = unboxed(s.getPreHandStacks());

        Set<Card> seen = new HashSet<>();
        try {
            for (int i = 0; i < count; i++) {
                List<Card> h = Card.parseAll(s.getHoleCards().get(i));
                e.holeCards.get(i).addAll(h);
                seen.addAll(h);
            }
            List<Card> b = Card.parseAll(s.getBoard());
            List<Card> d = Card.parseAll(s.getDeck());
            e.board.addAll(b);
            e.deck.addAll(d);
            int total = b.size() + d.size() + e.holeCards.stream().mapToInt(List::size).sum();
            seen.addAll(b);
            seen.addAll(d);
            if (seen.size() != total) throw new RestorationException("Cartes en double dans le snapshot");
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new RestorationException("Carte illisible: " + ex.getMessage(), ex);
        }

        e.streetIndex = s.getStreetIndex();
        e.actorIndex = s.getActorIndex();
        e.currentBet = s.getCurrentBet();
        e.minRaise = s.getMinRaise();
        e.dealt = s.isDealt();
        e.complete = s.isComplete();
        e.showdown = s.isShowdown();
        e.settledPot = s.getSettledPot();
        e.winners = s.getWinners() == null ? new ArrayList<>() : new ArrayList<>(s.getWinners());
        return e;
    }

    // ---------------------------------------------------------------- interne

    private int smallBlindIndex() {
        return n == 2 ? config.buttonIndex() : next(config.buttonIndex());
    }

    private int next(int i) { return (i + 1) % n; }

    private void post(int i, long blind) {
        long amount = Math.min(stacks[i], blind);
        move(i, amount);
    }

    private void move(int i, long amount) {
        stacks[i] -= amount;
        bets[i] += amount;
        committed[i] += amount;
    }

    private int requireActor() {
        if (!dealt || complete || actorIndex == null) throw new IllegalActionException("Aucune action attendue");
        return actorIndex;
    }

    private long minRaiseTo() {
        return currentBet == 0 ? config.bigBlind() : currentBet + minRaise;
    }

    private int othersAbleToRespond(int i) {
        int c = 0;
        for (int k = 0; k < n; k++) if (k != i && !folded[k] && stacks[k] > 0) c++;
        return c;
    }

    private boolean needsAction(int i) {
        if (folded[i] || stacks[i] == 0) return false;
        if (bets[i] < currentBet) return true;
        if (acted[i]) return false;
        return othersAbleToRespond(i) > 0;
    }

    private Integer findActor(int start) {
        for (int k = 0; k < n; k++) {
            int i = (start + k) % n;
            if (needsAction(i)) return i;
        }
        return null;
    }

    private void advance(int from) {
        actorIndex = findActor(next(from));
        refresh();
    }

    private int liveCount() {
        int c = 0;
        for (boolean f : folded) if (!f) c++;
        return c;
    }

    private void refresh() {
        if (complete) return;
        if (liveCount() == 1 || (actorIndex == null && streetIndex == 3)) settle();
    }

    private long totalPot() {
        long t = 0;
        for (long c : committed) t += c;
        return t;
    }

    /**
     * Pots par paliers de contribution. Un palier auquel un seul joueur a contribué est une mise
     * non suivie : il n'apparaît pas (il est rendu au règlement). Les paliers sans joueur encore
     * en lice sont versés au pot précédent.
     */
    private List<PotView> computePots() {
        List<PotView> pots = new ArrayList<>();
        TreeSet<Long> levels = new TreeSet<>();
        for (long c : committed) if (c > 0) levels.add(c);
        long prev = 0, orphan = 0;
        for (long level : levels) {
            List<Integer> contributors = new ArrayList<>();
            List<Integer> eligible = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                if (committed[i] >= level) {
                    contributors.add(i);
                    if (!folded[i]) eligible.add(i);
                }
            }
            long amount = (level - prev) * contributors.size() + orphan;
            orphan = 0;
            prev = level;
            if (contributors.size() == 1 && !eligible.isEmpty()) continue;
            if (eligible.isEmpty()) {
                if (pots.isEmpty()) orphan = amount;
                else {
                    PotView last = pots.remove(pots.size() - 1);
                    pots.add(new PotView(last.amount() + amount, last.playerIndices()));
                }
                continue;
            }
            if (!pots.isEmpty() && pots.get(pots.size() - 1).playerIndices().equals(eligible)) {
                PotView last = pots.remove(pots.size() - 1);
                pots.add(new PotView(last.amount() + amount, eligible));
            } else {
                pots.add(new PotView(amount, eligible));
            }
        }
        return pots;
    }

    private void settle() {
        complete = true;
        actorIndex = null;
        int live = liveCount();
        showdown = live > 1;

        // mise non suivie : rendue au joueur
        long top = 0, second = 0;
        int topIdx = -1;
        for (int i = 0; i < n; i++) {
            if (committed[i] > top) { second = top; top = committed[i]; topIdx = i; }
            else if (committed[i] > second) second = committed[i];
        }
        List<PotView> pots = computePots();
        if (topIdx >= 0 && top > second && !folded[topIdx]) {
            long refund = top - second;
            stacks[topIdx] += refund;
            committed[topIdx] -= refund;
        }

        long[] award = new long[n];
        Map<Integer, HandValue> values = new HashMap<>();
        for (PotView pot : pots) {
            List<Integer> contenders = pot.playerIndices();
            List<Integer> best;
            if (contenders.size() == 1) {
                best = new ArrayList<>(contenders);
            } else {
                best = new ArrayList<>();
                HandValue bestValue = null;
                for (int i : contenders) {
                    HandValue v = values.computeIfAbsent(i, this::evaluate);
                    int c = bestValue == null ? 1 : v.compareTo(bestValue);
                    if (c > 0) { best.clear(); best.add(i); bestValue = v; }
                    else if (c == 0) best.add(i);
                }
            }
            long share = pot.amount() / best.size();
            long odd = pot.amount() % best.size();
            best.sort(Comparator.comparingInt(this::distanceFromButton));
            for (int i : best) {
                award[i] += share + (odd-- > 0 ? 1 : 0);
            }
        }

        settledPot = 0;
        List<WinnerInfo> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (award[i] <= 0) continue;
            stacks[i] += award[i];
            settledPot += award[i];
            HandValue v = showdown ? values.computeIfAbsent(i, this::evaluate) : null;
            out.add(new WinnerInfo(i, award[i],
                    v == null ? null : v.rank().label(),
                    v == null ? List.of() : Card.codes(v.cards())));
        }
        out.sort(Comparator.comparingLong(WinnerInfo::amount).reversed().thenComparingInt(WinnerInfo::playerIndex));
        winners = out;
        Arrays.fill(bets, 0L);
    }

    private HandValue evaluate(int i) {
        List<Card> all = new ArrayList<>(holeCards.get(i));
        all.addAll(board);
        return HandEvaluator.best(all);
    }

    private int distanceFromButton(int i) {
        return (i - config.buttonIndex() - 1 + n) % n;
    }

    private static void requireSize(String field, List<?> list, int size) {
        if (list == null || list.size() != size)
            throw new RestorationException("Champ " + field + " incohérent (attendu " + size + ")");
        if (list.stream().anyMatch(Objects::isNull)) throw new RestorationException("Champ " + field + " : valeur nulle");
    }

    private static List<Long> boxed(long[] values) {
        List<Long> out = new ArrayList<>(values.length);
        for (long v : values) out.add(v);
        return out;
    }

    private static List<Boolean> boxed(boolean[] values) {
        List<Boolean> out = new ArrayList<>(values.length);
        for (boolean v : values) out.add(v);
        return out;
    }

    private static long[] unboxed(List<Long> values) {
        long[] out = new long[values.size()];
        for (int i = 0; i < out.length; i++) out[i] = values.get(i);
        return out;
    }
}
