package org.evalux.poker.service.poker.runtime;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.evalux.poker.model.poker.HandStatus;
import org.evalux.poker.model.poker.PokerTable;
import org.evalux.poker.model.poker.Seat;
import org.evalux.poker.service.poker.engine.EngineConfig;
import org.evalux.poker.service.poker.engine.EngineSnapshot;
import org.evalux.poker.service.poker.engine.LegalActions;
import org.evalux.poker.service.poker.engine.RulesEngine;
import org.evalux.poker.service.poker.engine.RulesEngineFactory;
import org.evalux.poker.service.poker.error.IllegalActionException;
import org.evalux.poker.service.poker.error.PokerValidationException;

import java.time.Instant;
import java.util.*;

/**
 * État vivant d'une table : moteur, sièges, numéro de main, votes "prêt".
 * <p>
 * Pas thread-safe : toute lecture/écriture se fait sous le verrou de la table
 * ({@link org.evalux.poker.service.poker.util.Locks}).
 */
@Slf4j
@Getter
public class TableRuntime {
    private final Long tableId;
    private final RulesEngineFactory engines;

    private TableSettings table;
    private List<SeatInfo> seats = List.of();

    private RulesEngine engine;
    private final List<Long> handPlayerOrder = new ArrayList<>();
    private final Map<Long, Integer> playerIndexByUser = new LinkedHashMap<>();

    private Long currentHandId;
    private Integer currentHandNo;
    private HandStatus handStatus;

    private final Set<Long> readyPlayers = new LinkedHashSet<>();
    private Instant interHandWaitStart;
    private long eventSequence;

    // dernier snapshot écrit ou relu : un autre process a pu faire avancer la main entre-temps
    private String syncedSnapshot;

    public TableRuntime(Long tableId, RulesEngineFactory engines) {
        this.tableId = tableId;
        this.engines = engines;
    }

    public void refresh(PokerTable t, List<Seat> activeSeats) {
        this.table = TableSettings.of(t);
        List<SeatInfo> copy = new ArrayList<>(activeSeats.size());
        for (Seat s : activeSeats) copy.add(SeatInfo.of(s));
        this.seats = List.copyOf(copy);
    }

    public boolean hasEngine() { return engine != null; }

    public Optional<SeatInfo> seatOf(Long userId) {
        return seats.stream().filter(s -> Objects.equals(s.userId(), userId)).findFirst();
    }

    // ---------------------------------------------------------------- démarrage

    /**
     * Crée le moteur et distribue. L'ordre de {@code participants} devient l'ordre moteur de la main.
     * Le bouton tourne d'un cran par main.
     */
    public void startHand(Long handId, int handNo, List<SeatInfo> participants) {
        if (participants.size() < 2) throw new PokerValidationException("Il faut au moins 2 joueurs");
        List<Long> stacks = new ArrayList<>(participants.size());
        List<Long> order = new ArrayList<>(participants.size());
        for (SeatInfo s : participants) {
            stacks.add(s.chips());
            order.add(s.userId());
        }
        int button = Math.floorMod(handNo - 1, participants.size());
        RulesEngine e = engines.create(new EngineConfig(stacks, table.smallBlind(), table.bigBlind(), table.ante(), button));
        e.dealNewHand();

        this.engine = e;
        bindPlayers(order);
        this.currentHandId = handId;
        this.currentHandNo = handNo;
        this.handStatus = HandStatus.PREFLOP;
        this.readyPlayers.clear();
        this.interHandWaitStart = null;
        this.eventSequence++;
        log.info("Table {} : main #{} distribuée ({} joueurs, bouton {})", tableId, handNo, order.size(), button);
    }

    private void bindPlayers(List<Long> order) {
        handPlayerOrder.clear();
        handPlayerOrder.addAll(order);
        playerIndexByUser.clear();
        for (int i = 0; i < order.size(); i++) playerIndexByUser.put(order.get(i), i);
    }

    // ---------------------------------------------------------------- actions

    /**
     * Applique l'action puis enchaîne les rues tant que personne n'a à parler.
     * @return vrai si la main vient de se terminer (le règlement reste à faire par l'appelant)
     */
    public boolean applyAction(Long userId, ActionType action, Long amount) {
        if (engine == null) throw new PokerValidationException("Aucune main active");
        if (handStatus == null || !handStatus.isBetting())
            throw new PokerValidationException("La main n'accepte plus d'actions");
        Integer idx = playerIndexByUser.get(userId);
        if (idx == null) throw new PokerValidationException("Joueur absent de la main");
        if (!Objects.equals(engine.actorIndex(), idx)) throw new PokerValidationException("Pas ton tour");

        LegalActions legal = engine.legalActions(idx);
        switch (action) {
            case FOLD -> engine.fold();
            case CHECK -> {
                if (legal.callAmount() > 0) throw new IllegalActionException("Check impossible : " + legal.callAmount() + " à suivre");
                engine.checkOrCall();
            }
            case CALL -> engine.checkOrCall();
            case BET, RAISE -> {
                if (amount == null || amount <= 0) throw new IllegalActionException("Montant requis");
                engine.betOrRaiseTo(amount);
            }
            case ALL_IN -> {
                if (legal.canBet() || legal.canRaise()) engine.betOrRaiseTo(legal.maxRaiseTo());
                else engine.checkOrCall();
            }
            case READY -> throw new PokerValidationException("READY n'est accepté qu'entre deux mains");
        }
        eventSequence++;
        autoAdvance();
        return engine.isHandComplete();
    }

    /** Distribue les rues suivantes quand personne n'a à parler ; couvre aussi les run-outs à tapis. */
    private void autoAdvance() {
        while (!engine.isHandComplete() && !engine.hasPendingActor()) {
            engine.dealNextStreet();
            handStatus = HandTransitions.next(handStatus, HandEvent.STREET_DEALT);
        }
    }

    public Long currentActorUserId() {
        if (engine == null || engine.actorIndex() == null) return null;
        return handPlayerOrder.get(engine.actorIndex());
    }

    // ---------------------------------------------------------------- inter-main

    public void enterInterHandWait(Instant now) {
        handStatus = HandTransitions.next(handStatus, HandEvent.HAND_COMPLETED);
        readyPlayers.clear();
        interHandWaitStart = now;
        eventSequence++;
    }

    public void markReady(Long userId) {
        if (handStatus != HandStatus.INTER_HAND_WAIT)
            throw new PokerValidationException("Aucune attente inter-main en cours");
        readyPlayers.add(userId);
        eventSequence++;
    }

    public boolean allSeatedReady() {
        if (seats.isEmpty()) return false;
        for (SeatInfo s : seats) if (!readyPlayers.contains(s.userId())) return false;
        return true;
    }

    /** INTER_HAND_WAIT → ENDED ; le moteur est libéré. */
    public void closeHand() {
        handStatus = HandTransitions.next(handStatus, HandEvent.INTER_HAND_RESOLVED);
        engine = null;
        interHandWaitStart = null;
        eventSequence++;
    }

    /** Oublie la main en mémoire (terminée ailleurs, ou snapshot inexploitable). */
    public void clearHand() {
        engine = null;
        handPlayerOrder.clear();
        playerIndexByUser.clear();
        currentHandId = null;
        currentHandNo = null;
        handStatus = null;
        readyPlayers.clear();
        interHandWaitStart = null;
        syncedSnapshot = null;
    }

    public void markSynced(String snapshotJson) { this.syncedSnapshot = snapshotJson; }

    /** Vrai si la ligne lue en base correspond déjà à l'état mémoire. */
    public boolean isSyncedWith(Long handId, String snapshotJson) {
        return engine != null && Objects.equals(currentHandId, handId) && Objects.equals(syncedSnapshot, snapshotJson);
    }

    public void abort() {
        if (handStatus != null && !handStatus.isTerminal())
            handStatus = HandTransitions.next(handStatus, HandEvent.ABORTED);
        engine = null;
        handPlayerOrder.clear();
        playerIndexByUser.clear();
        readyPlayers.clear();
        interHandWaitStart = null;
        eventSequence++;
    }

    // ---------------------------------------------------------------- persistance

    public PersistedHandState persistedState() {
        EngineSnapshot snap = engine == null ? null : engine.serialize();
        return new PersistedHandState(snap, new ArrayList<>(handPlayerOrder), new ArrayList<>(readyPlayers));
    }

    /**
     * Reconstruit le moteur depuis la ligne de main.
     * @return faux si l'ordre des joueurs a dû être déduit des sièges (snapshot ancien format)
     */
    public boolean restore(Long handId, int handNo, HandStatus status, Instant interHandWaitStart,
                           PersistedHandState state) {
        RulesEngine e = engines.restore(state.getEngine());
        List<Long> order = state.getHandPlayerOrder();
        boolean exact = order != null && order.size() == state.getEngine().getPlayerCount();
        if (!exact) {
            order = seats.stream().map(SeatInfo::userId).limit(state.getEngine().getPlayerCount()).toList();
        }
        this.engine = e;
        bindPlayers(order);
        this.currentHandId = handId;
        this.currentHandNo = handNo;
        this.handStatus = status;
        this.readyPlayers.clear();
        if (state.getReadyPlayers() != null) this.readyPlayers.addAll(state.getReadyPlayers());
        this.interHandWaitStart = interHandWaitStart;
        return exact;
    }

    /** Point de reprise mémoire avant une action ; restauré si le commit échoue. */
    public Checkpoint checkpoint() {
        return new Checkpoint(engine == null ? null : engine.serialize(), List.copyOf(handPlayerOrder),
                currentHandId, currentHandNo, handStatus, List.copyOf(readyPlayers), interHandWaitStart, eventSequence);
    }

    public void rollbackTo(Checkpoint cp) {
        this.engine = cp.engine() == null ? null : engines.restore(cp.engine());
        bindPlayers(cp.handPlayerOrder());
        this.currentHandId = cp.handId();
        this.currentHandNo = cp.handNo();
        this.handStatus = cp.status();
        this.readyPlayers.clear();
        this.readyPlayers.addAll(cp.readyPlayers());
        this.interHandWaitStart = cp.interHandWaitStart();
        this.eventSequence = cp.eventSequence();
        this.syncedSnapshot = null;
        log.warn("Table {} : état mémoire ramené à la main #{} ({})", tableId, currentHandNo, handStatus);
    }

    public record Checkpoint(EngineSnapshot engine, List<Long> handPlayerOrder, Long handId, Integer handNo,
                             HandStatus status, List<Long> readyPlayers, Instant interHandWaitStart,
                             long eventSequence) {
    }
}
