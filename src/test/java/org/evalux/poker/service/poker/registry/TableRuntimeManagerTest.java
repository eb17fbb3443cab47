package org.evalux.poker.service.poker.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.evalux.poker.config.PokerSettings;
import org.evalux.poker.model.poker.*;
import org.evalux.poker.repo.HandRepository;
import org.evalux.poker.repo.PokerTableRepository;
import org.evalux.poker.repo.SeatRepository;
import org.evalux.poker.service.HandHistoryService;
import org.evalux.poker.service.WalletService;
import org.evalux.poker.service.poker.completion.HandCompletionService;
import org.evalux.poker.service.poker.engine.*;
import org.evalux.poker.service.poker.error.InsufficientBalanceException;
import org.evalux.poker.service.poker.error.PersistenceFailureException;
import org.evalux.poker.service.poker.error.PokerValidationException;
import org.evalux.poker.service.poker.lifecycle.TableLifecycleService;
import org.evalux.poker.service.poker.runtime.ActionType;
import org.evalux.poker.service.poker.runtime.SnapshotCodec;
import org.evalux.poker.service.poker.runtime.TableRuntime;
import org.evalux.poker.service.poker.util.Locks;
import org.evalux.poker.service.poker.util.Payloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.*;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TableRuntimeManagerTest {

    @Mock PokerTableRepository tables;
    @Mock SeatRepository seatRepo;
    @Mock HandRepository hands;
    @Mock WalletService wallet;
    @Mock HandHistoryService history;

    final List<Hand> stored = new ArrayList<>();
    final PokerSettings settings = new PokerSettings(20, 10, 2);
    PokerTable table;
    List<Seat> seats;
    TableRuntimeManager manager;

    static final RulesEngineFactory SEEDED = new RulesEngineFactory() {
        @Override public RulesEngine create(EngineConfig config) { return new HoldemRulesEngine(config, new Random(11)); }
        @Override public RulesEngine restore(EngineSnapshot snapshot) { return HoldemRulesEngine.restore(snapshot, new Random(11)); }
    };

    static Seat seat(long userId, int position, long chips) {
        Seat s = new Seat();
        s.setId(userId * 100);
        s.setTableId(1L);
        s.setUserId(userId);
        s.setDisplayName("joueur" + userId);
        s.setPosition(position);
        s.setChips(chips);
        return s;
    }

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        table = new PokerTable();
        table.setId(1L);
        table.setName("Table test");
        table.setSmallBlind(10);
        table.setBigBlind(20);
        table.setExpiresAt(Instant.now().plusSeconds(600));
        seats = new ArrayList<>(List.of(seat(10, 0, 1000), seat(20, 1, 1000)));

        when(tables.findById(1L)).thenReturn(Optional.of(table));
        when(seatRepo.findByTableIdAndLeftAtIsNullOrderByPositionAsc(1L))
                .thenAnswer(inv -> seats.stream().filter(Seat::isActive).toList());
        when(hands.findActive(1L)).thenAnswer(inv -> active());
        when(hands.findActiveForUpdate(1L)).thenAnswer(inv -> active());
        when(hands.maxHandNo(1L)).thenAnswer(inv -> stored.stream().mapToInt(Hand::getHandNo).max().orElse(0));
        when(hands.save(any(Hand.class))).thenAnswer(inv -> {
            Hand h = inv.getArgument(0);
            if (h.getId() == null) {
                h.setId((long) stored.size() + 1);
                stored.add(h);
            }
            return h;
        });

        manager = newManager();
    }

    private Optional<Hand> active() {
        return stored.stream().filter(h -> !h.getStatus().isTerminal()).reduce((a, b) -> b);
    }

    private TableRuntimeManager newManager() {
        TableLifecycleService lifecycle = new TableLifecycleService(tables, seatRepo, settings);
        Payloads payloads = new Payloads();
        HandCompletionService completion = new HandCompletionService(wallet, history, lifecycle, seatRepo, settings, payloads);
        return new TableRuntimeManager(tables, seatRepo, hands, SEEDED, new SnapshotCodec(new ObjectMapper()),
                completion, lifecycle, settings, payloads, new Locks(),
                new TransactionTemplate(mock(PlatformTransactionManager.class)));
    }

    private TableRuntime runtime() {
        return manager.cached(1L).orElseThrow();
    }

    private void playToInterHand() {
        manager.handleAction(1L, 10L, ActionType.ALL_IN, null);
        manager.handleAction(1L, 20L, ActionType.CALL, null);
    }

    // -------------------------------------------------------------- démarrage

    @Test
    void startGame_ouvreLaMainUn() {
        Map<String, Object> started = manager.startGame(1L);

        assertThat(started.get("type")).isEqualTo("hand_started");
        assertThat(started.get("hand_no")).isEqualTo(1);
        assertThat(started.get("actor_user_id")).isEqualTo(10L);
        assertThat(table.getStatus()).isEqualTo(TableStatus.ACTIVE);
        assertThat(table.getExpiresAt()).isNull();

        Hand hand = stored.get(0);
        assertThat(hand.getStatus()).isEqualTo(HandStatus.PREFLOP);
        assertThat(hand.getEngineSnapshot()).contains("\"hand_player_order\":[10,20]");
        assertThat(hand.getActionDeadline()).isAfter(Instant.now());
    }

    @Test
    void startGame_refuseSiMainEnCours() {
        manager.startGame(1L);

        assertThatThrownBy(() -> manager.startGame(1L))
                .isInstanceOf(PokerValidationException.class)
                .hasMessageContaining("déjà en cours");
        assertThat(stored).hasSize(1);
    }

    @Test
    void startGame_refuseSansDeuxJoueursSolvables() {
        seats.get(1).setChips(25);

        assertThatThrownBy(() -> manager.startGame(1L))
                .isInstanceOf(PokerValidationException.class);
        assertThat(stored).isEmpty();
    }

    @Test
    void startGame_refuseTableFermee() {
        table.setStatus(TableStatus.ENDED);

        assertThatThrownBy(() -> manager.startGame(1L))
                .isInstanceOf(PokerValidationException.class)
                .hasMessage("Table fermée");
    }

    // -------------------------------------------------------------- actions

    @Test
    void handleAction_horsTour_etatInchange() {
        manager.startGame(1L);
        EngineSnapshot before = runtime().getEngine().serialize();

        assertThatThrownBy(() -> manager.handleAction(1L, 20L, ActionType.CALL, null))
                .isInstanceOf(PokerValidationException.class)
                .hasMessage("Pas ton tour");
        assertThat(runtime().getEngine().serialize()).isEqualTo(before);
    }

    @Test
    void handleAction_mainCompleteVersInterMain() {
        manager.startGame(1L);

        manager.handleAction(1L, 10L, ActionType.ALL_IN, null);
        Map<String, Object> result = manager.handleAction(1L, 20L, ActionType.CALL, null);

        assertThat(result).containsKey("hand_ended");
        Hand hand = stored.get(0);
        assertThat(hand.getStatus()).isEqualTo(HandStatus.INTER_HAND_WAIT);
        assertThat(hand.getPotSize()).isEqualTo(2000);
        assertThat(hand.getActionDeadline()).isNull();
        assertThat(hand.getInterHandDeadline()).isNotNull();
        assertThat(seats).allMatch(Seat::isSittingOutNextHand);
        verify(wallet).applyHandResult(any(), any(), any(), any());
    }

    @Test
    void handleAction_apresMain_seulReadyAccepte() {
        manager.startGame(1L);
        playToInterHand();

        assertThatThrownBy(() -> manager.handleAction(1L, 10L, ActionType.CHECK, null))
                .isInstanceOf(PokerValidationException.class)
                .hasMessageContaining("READY");
    }

    @Test
    void handleAction_readyPendantLesEncheres_refuse() {
        manager.startGame(1L);

        assertThatThrownBy(() -> manager.handleAction(1L, 10L, ActionType.READY, null))
                .isInstanceOf(PokerValidationException.class)
                .hasMessage("Aucune attente inter-main en cours");
    }

    @Test
    void handleAction_echecEcriture_memoireRestauree() {
        manager.startGame(1L);
        EngineSnapshot before = runtime().getEngine().serialize();
        doThrow(new DataIntegrityViolationException("contrainte")).when(hands).save(any(Hand.class));

        assertThatThrownBy(() -> manager.handleAction(1L, 10L, ActionType.CALL, null))
                .isInstanceOf(PersistenceFailureException.class);
        assertThat(runtime().getEngine().serialize()).isEqualTo(before);
        assertThat(runtime().currentActorUserId()).isEqualTo(10L);
    }

    // -------------------------------------------------------------- restauration

    @Test
    void ensureTable_idempotent() {
        manager.startGame(1L);
        clearInvocations(hands);

        TableRuntime first = manager.ensureTable(1L);
        EngineSnapshot snap = first.getEngine().serialize();
        TableRuntime second = manager.ensureTable(1L);

        assertThat(second).isSameAs(first);
        assertThat(second.getEngine().serialize()).isEqualTo(snap);
        verify(hands, never()).save(any(Hand.class));
    }

    @Test
    void ensureTable_apresRedemarrage_reprendLaMain() {
        manager.startGame(1L);
        EngineSnapshot snap = runtime().getEngine().serialize();

        TableRuntimeManager restarted = newManager();
        TableRuntime rt = restarted.ensureTable(1L);

        assertThat(rt.hasEngine()).isTrue();
        assertThat(rt.getHandPlayerOrder()).containsExactly(10L, 20L);
        assertThat(rt.getEngine().serialize()).isEqualTo(snap);
        Map<String, Object> result = restarted.handleAction(1L, 10L, ActionType.CALL, null);
        assertThat(result.get("type")).isEqualTo("action");
    }

    @Test
    void snapshotCorrompu_pasDeMoteur_puisAbandonEtNouvelleMain() {
        manager.startGame(1L);
        stored.get(0).setEngineSnapshot("{\"engine\": 12}");

        TableRuntimeManager restarted = newManager();
        assertThat(restarted.ensureTable(1L).hasEngine()).isFalse();
        assertThatThrownBy(() -> restarted.handleAction(1L, 10L, ActionType.CALL, null))
                .isInstanceOf(PokerValidationException.class)
                .hasMessage("Aucune main active");

        Map<String, Object> aborted = restarted.abortHand(1L, "snapshot illisible");
        assertThat(aborted.get("type")).isEqualTo("hand_aborted");
        assertThat(stored.get(0).getStatus()).isEqualTo(HandStatus.ABORTED);
        assertThat(table.getStatus()).isEqualTo(TableStatus.WAITING);

        Map<String, Object> started = restarted.startGame(1L);
        assertThat(started.get("hand_no")).isEqualTo(2);
    }

    @Test
    void snapshotAvecValeurNulle_tableRecuperable() {
        manager.startGame(1L);
        Hand hand = stored.get(0);
        hand.setEngineSnapshot(hand.getEngineSnapshot().replaceFirst("\"stacks\":\\[\\d+", "\"stacks\":[null"));
        assertThat(hand.getEngineSnapshot()).contains("\"stacks\":[null,");

        TableRuntimeManager restarted = newManager();
        assertThat(restarted.getState(1L, 10L)).containsEntry("table_id", 1L);
        assertThatThrownBy(() -> restarted.handleAction(1L, 10L, ActionType.CALL, null))
                .isInstanceOf(PokerValidationException.class)
                .hasMessage("Aucune main active");

        Map<String, Object> aborted = restarted.abortHand(1L, "snapshot illisible");
        assertThat(aborted.get("type")).isEqualTo("hand_aborted");
        assertThat(hand.getStatus()).isEqualTo(HandStatus.ABORTED);
        assertThat(restarted.startGame(1L).get("hand_no")).isEqualTo(2);
    }

    @Test
    void deuxProcess_convergentParLaLigneDeMain() {
        TableRuntimeManager other = newManager();
        manager.startGame(1L);
        other.ensureTable(1L);

        manager.handleAction(1L, 10L, ActionType.CALL, null);
        Map<String, Object> result = other.handleAction(1L, 20L, ActionType.CHECK, null);

        assertThat(result.get("type")).isEqualTo("action");
        TableRuntime otherRt = other.cached(1L).orElseThrow();
        assertThat(otherRt.getHandStatus()).isEqualTo(HandStatus.FLOP);
        assertThat(otherRt.getEngine().view().board()).hasSize(3);
        assertThat(stored.get(0).getStatus()).isEqualTo(HandStatus.FLOP);

        TableRuntime rt = manager.ensureTable(1L);
        assertThat(rt.getHandStatus()).isEqualTo(HandStatus.FLOP);
        assertThat(rt.getEngine().serialize()).isEqualTo(otherRt.getEngine().serialize());
        assertThat(rt.currentActorUserId()).isEqualTo(20L);
    }

    // -------------------------------------------------------------- inter-main

    @Test
    void ready_soldeInsuffisant() {
        manager.startGame(1L);
        playToInterHand();
        seats.get(0).setChips(5);

        assertThatThrownBy(() -> manager.markPlayerReady(1L, 10L))
                .isInstanceOfSatisfying(InsufficientBalanceException.class, e -> {
                    assertThat(e.getRequired()).isEqualTo(30);
                    assertThat(e.getAvailable()).isEqualTo(5);
                });
        assertThat(runtime().getReadyPlayers()).isEmpty();
    }

    @Test
    void completeInterHand_tousPrets_nouvelleMain() {
        manager.startGame(1L);
        playToInterHand();

        Map<String, Object> first = manager.handleAction(1L, 10L, ActionType.READY, null);
        Map<String, Object> second = manager.markPlayerReady(1L, 20L);
        assertThat(first.get("all_ready")).isEqualTo(false);
        assertThat(second.get("all_ready")).isEqualTo(true);

        Map<String, Object> next = manager.completeInterHandPhase(1L);

        assertThat(next.get("type")).isEqualTo("hand_started");
        assertThat(next.get("hand_no")).isEqualTo(2);
        assertThat(stored.get(0).getStatus()).isEqualTo(HandStatus.ENDED);
        assertThat(stored.get(1).getStatus()).isEqualTo(HandStatus.PREFLOP);
        assertThat(runtime().getCurrentHandNo()).isEqualTo(2);
        assertThat(runtime().getReadyPlayers()).isEmpty();
        assertThat(seats).noneMatch(Seat::isSittingOutNextHand);
    }

    @Test
    void completeInterHand_unSeulPret_tableFermee() {
        manager.startGame(1L);
        playToInterHand();
        manager.markPlayerReady(1L, 10L);

        Map<String, Object> out = manager.completeInterHandPhase(1L);

        assertThat(out.get("type")).isEqualTo("table_ended");
        assertThat(out.get("reason")).isEqualTo(TableLifecycleService.NOT_ENOUGH_READY_PLAYERS);
        assertThat(table.getStatus()).isEqualTo(TableStatus.ENDED);
        assertThat(seats).allMatch(s -> s.getLeftAt() != null);
        assertThat(runtime().hasEngine()).isFalse();
        assertThat(stored).hasSize(1);
    }

    // -------------------------------------------------------------- timeouts

    @Test
    void timeout_avantEcheance_rienAFaire() {
        manager.startGame(1L);

        assertThat(manager.handleTurnTimeout(1L)).isNull();
        assertThat(runtime().currentActorUserId()).isEqualTo(10L);
    }

    @Test
    void timeout_foldAutomatiqueEtCompteur() {
        manager.startGame(1L);
        stored.get(0).setActionDeadline(Instant.now().minusSeconds(1));

        Map<String, Object> result = manager.handleTurnTimeout(1L);

        assertThat(result.get("timeout")).isEqualTo(true);
        assertThat(result.get("action")).isEqualTo("FOLD");
        assertThat(result.get("consecutive_timeouts")).isEqualTo(1);
        assertThat(result).containsKey("hand_ended");
        assertThat(stored.get(0).getTimeoutTracking()).contains("\"10\":1");
    }

    @Test
    void actionManuelle_remetLeCompteurAZero() {
        manager.startGame(1L);
        stored.get(0).setTimeoutTracking("{\"10\":1}");

        manager.handleAction(1L, 10L, ActionType.CALL, null);

        assertThat(stored.get(0).getTimeoutTracking()).doesNotContain("\"10\"");
    }
}
