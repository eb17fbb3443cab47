package org.evalux.poker.service.poker.registry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.evalux.poker.config.PokerSettings;
import org.evalux.poker.model.poker.*;
import org.evalux.poker.repo.HandRepository;
import org.evalux.poker.repo.PokerTableRepository;
import org.evalux.poker.repo.SeatRepository;
import org.evalux.poker.service.poker.completion.HandCompletionService;
import org.evalux.poker.service.poker.engine.LegalActions;
import org.evalux.poker.service.poker.engine.RulesEngineFactory;
import org.evalux.poker.service.poker.error.InsufficientBalanceException;
import org.evalux.poker.service.poker.error.PersistenceFailureException;
import org.evalux.poker.service.poker.error.PokerValidationException;
import org.evalux.poker.service.poker.error.RestorationException;
import org.evalux.poker.service.poker.lifecycle.TableLifecycleService;
import org.evalux.poker.service.poker.runtime.*;
import org.evalux.poker.service.poker.util.Locks;
import org.evalux.poker.service.poker.util.Payloads;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registre des runtimes de table du process et point d'entrée de toutes les opérations de jeu.
 * <p>
 * Chaque opération : verrou de table → transaction (verrou de ligne sur la main active) →
 * relecture table/sièges → calcul → écriture du snapshot → commit. Si le commit échoue,
 * l'état mémoire est ramené au point d'avant l'action.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableRuntimeManager {
    private final PokerTableRepository tables;
    private final SeatRepository seatRepo;
    private final HandRepository hands;
    private final RulesEngineFactory engines;
    private final SnapshotCodec codec;
    private final HandCompletionService completion;
    private final TableLifecycleService lifecycle;
    private final PokerSettings settings;
    private final Payloads payloads;
    private final Locks locks;
    private final TransactionTemplate tx;

    private final Map<Long, TableRuntime> runtimes = new ConcurrentHashMap<>();

    /** Contexte relu en base pour une opération. */
    private record Loaded(TableRuntime rt, PokerTable table, List<Seat> seats, Optional<Hand> active) {
        Hand requireHand() {
            return active.orElseThrow(() -> new PokerValidationException("Aucune main active"));
        }
    }

    // ---------------------------------------------------------------- lecture

    /** Charge (ou resynchronise) le runtime sans rien écrire. */
    public TableRuntime ensureTable(Long tableId) {
        synchronized (locks.of(tableId)) {
            return tx.execute(status -> load(tableId, false).rt());
        }
    }

    public Map<String, Object> getState(Long tableId, Long viewerId) {
        synchronized (locks.of(tableId)) {
            return tx.execute(status -> payloads.tableState(load(tableId, false).rt(), viewerId));
        }
    }

    public Optional<TableRuntime> cached(Long tableId) {
        return Optional.ofNullable(runtimes.get(tableId));
    }

    // ---------------------------------------------------------------- démarrage

    public Map<String, Object> startGame(Long tableId) {
        return mutate(tableId, ctx -> {
            if (ctx.active().isPresent())
                throw new PokerValidationException("Une main est déjà en cours (main #" + ctx.active().get().getHandNo() + ")");
            PokerTable table = ctx.table();
            if (table.getStatus() == TableStatus.ENDED || table.getStatus() == TableStatus.EXPIRED)
                throw new PokerValidationException("Table fermée");

            List<Seat> funded = fundedSeats(table, ctx.seats(), ctx.seats());
            if (funded.size() < 2) throw new PokerValidationException("Il faut au moins 2 joueurs avec assez de jetons");

            Instant now = Instant.now();
            table.setExpiresAt(null);
            table.setStatus(TableStatus.ACTIVE);
            table.setLastActionAt(now);
            tables.save(table);
            ctx.rt().refresh(table, ctx.seats());

            Hand hand = openHand(ctx.rt(), tableId, funded, now);
            log.info("Table {} : partie lancée, main #{}", tableId, hand.getHandNo());
            return handStarted(ctx.rt(), hand);
        });
    }

    // ---------------------------------------------------------------- actions

    public Map<String, Object> handleAction(Long tableId, Long userId, ActionType action, Long amount) {
        if (action == ActionType.READY) return markPlayerReady(tableId, userId);
        return mutate(tableId, ctx -> {
            TableRuntime rt = ctx.rt();
            // pas de moteur restauré = pas de main jouable, même si une ligne existe
            if (!rt.hasEngine()) throw new PokerValidationException("Aucune main active");
            if (rt.getHandStatus() == HandStatus.INTER_HAND_WAIT)
                throw new PokerValidationException("Main terminée : seul READY est accepté");
            Hand hand = ctx.requireHand();
            resetTimeouts(hand, userId);
            return apply(ctx, hand, userId, action, amount, Instant.now());
        });
    }

    public Map<String, Object> markPlayerReady(Long tableId, Long userId) {
        return mutate(tableId, ctx -> {
            TableRuntime rt = ctx.rt();
            Hand hand = ctx.requireHand();
            if (rt.getHandStatus() != HandStatus.INTER_HAND_WAIT)
                throw new PokerValidationException("Aucune attente inter-main en cours");
            Seat seat = ctx.seats().stream().filter(s -> Objects.equals(s.getUserId(), userId)).findFirst()
                    .orElseThrow(() -> new PokerValidationException("Joueur non assis à cette table"));
            PokerTable t = ctx.table();
            TableLifecycleService.BalanceCheck check =
                    lifecycle.checkBalanceRequirement(seat, t.getSmallBlind(), t.getBigBlind(), t.getAnte());
            if (!check.ok()) throw new InsufficientBalanceException(check.required(), seat.getChips());

            rt.markReady(userId);
            persist(rt, hand, Instant.now());

            Map<String, Object> out = new LinkedHashMap<>();
            out.put("type", "player_ready");
            out.put("table_id", tableId);
            out.put("user_id", userId);
            out.put("ready_players", new ArrayList<>(rt.getReadyPlayers()));
            out.put("all_ready", rt.allSeatedReady());
            return out;
        });
    }

    /**
     * Fin de l'attente inter-main (tous prêts ou délai écoulé). Les joueurs non prêts restent
     * sitting out ; moins de 2 volontaires ferme la table.
     */
    public Map<String, Object> completeInterHandPhase(Long tableId) {
        return mutate(tableId, ctx -> {
            TableRuntime rt = ctx.rt();
            Hand hand = ctx.requireHand();
            if (rt.getHandStatus() != HandStatus.INTER_HAND_WAIT)
                throw new PokerValidationException("Aucune attente inter-main en cours");
            Instant now = Instant.now();
            PokerTable table = ctx.table();
            Set<Long> ready = new LinkedHashSet<>(rt.getReadyPlayers());

            for (Seat s : ctx.seats()) s.setSittingOutNextHand(!ready.contains(s.getUserId()));
            seatRepo.saveAll(ctx.seats());

            rt.closeHand();
            hand.setStatus(HandStatus.ENDED);
            hand.setEndedAt(now);
            hand.setInterHandDeadline(null);
            hand.setActionDeadline(null);
            hands.save(hand);

            List<Seat> willing = ctx.seats().stream().filter(s -> ready.contains(s.getUserId())).toList();
            List<Seat> funded = fundedSeats(table, ctx.seats(), willing);
            if (funded.size() < 2) {
                String reason = TableLifecycleService.NOT_ENOUGH_READY_PLAYERS;
                lifecycle.markTableEnded(table, ctx.seats(), reason);
                rt.clearHand();
                rt.refresh(table, List.of());
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("type", "table_ended");
                out.put("table_id", tableId);
                out.put("hand_no", hand.getHandNo());
                out.put("reason", reason);
                return out;
            }

            table.setLastActionAt(now);
            tables.save(table);
            rt.refresh(table, ctx.seats());
            Hand next = openHand(rt, tableId, funded, now);
            return handStarted(rt, next);
        });
    }

    /**
     * Délai de parole dépassé : check si possible, sinon fold, soumis par le chemin normal.
     * @return null si rien n'était à faire (main déjà avancée entre-temps)
     */
    public Map<String, Object> handleTurnTimeout(Long tableId) {
        return mutate(tableId, ctx -> {
            TableRuntime rt = ctx.rt();
            if (!rt.hasEngine() || ctx.active().isEmpty() || rt.getHandStatus() == null || !rt.getHandStatus().isBetting())
                return null;
            Hand hand = ctx.active().get();
            Instant now = Instant.now();
            if (hand.getActionDeadline() != null && now.isBefore(hand.getActionDeadline())) return null;
            Long actor = rt.currentActorUserId();
            if (actor == null) return null;

            LegalActions legal = rt.getEngine().legalActions(rt.getPlayerIndexByUser().get(actor));
            ActionType auto = legal.canCheck() ? ActionType.CHECK : ActionType.FOLD;

            Map<String, Integer> tracking = codec.readTimeouts(hand.getTimeoutTracking());
            int count = tracking.merge(String.valueOf(actor), 1, Integer::sum);
            hand.setTimeoutTracking(codec.writeTimeouts(tracking));
            if (count >= settings.getMaxConsecutiveTimeouts()) {
                ctx.seats().stream().filter(s -> Objects.equals(s.getUserId(), actor)).findFirst().ifPresent(s -> {
                    s.setSittingOutNextHand(true);
                    seatRepo.save(s);
                });
                log.info("Table {} : joueur {} absent ({} timeouts consécutifs)", tableId, actor, count);
            }

            Map<String, Object> result = apply(ctx, hand, actor, auto, null, now);
            result.put("timeout", true);
            result.put("consecutive_timeouts", count);
            return result;
        });
    }

    /** Récupération d'une main fantôme : ABORTED, table remise en attente pour un nouveau startGame. */
    public Map<String, Object> abortHand(Long tableId, String reason) {
        return mutate(tableId, ctx -> {
            Hand hand = ctx.requireHand();
            Instant now = Instant.now();
            hand.setStatus(HandStatus.ABORTED);
            hand.setEndedAt(now);
            hand.setActionDeadline(null);
            hand.setInterHandDeadline(null);
            hands.save(hand);
            ctx.rt().abort();
            ctx.rt().clearHand();

            PokerTable table = ctx.table();
            table.setStatus(TableStatus.WAITING);
            tables.save(table);
            log.warn("Table {} : main #{} abandonnée ({})", tableId, hand.getHandNo(), reason);

            Map<String, Object> out = new LinkedHashMap<>();
            out.put("type", "hand_aborted");
            out.put("table_id", tableId);
            out.put("hand_no", hand.getHandNo());
            out.put("reason", reason);
            return out;
        });
    }

    // ---------------------------------------------------------------- interne

    /**
     * Verrou de table + transaction. Les erreurs de validation et de contention remontent telles quelles ;
     * toute autre erreur d'écriture devient {@link PersistenceFailureException}. Dans tous les cas
     * l'état mémoire revient au point d'avant l'opération.
     */
    private <T> T mutate(Long tableId, Function<Loaded, T> work) {
        synchronized (locks.of(tableId)) {
            TableRuntime cachedRt = runtimes.get(tableId);
            TableRuntime.Checkpoint cp = cachedRt == null ? null : cachedRt.checkpoint();
            try {
                return tx.execute(status -> work.apply(load(tableId, true)));
            } catch (PokerValidationException | PessimisticLockingFailureException e) {
                rollback(tableId, cachedRt, cp);
                throw e;
            } catch (DataAccessException | TransactionException e) {
                rollback(tableId, cachedRt, cp);
                log.error("Table {} : échec d'écriture, état mémoire restauré", tableId, e);
                throw new PersistenceFailureException("Échec d'enregistrement pour la table " + tableId, e);
            } catch (RuntimeException e) {
                rollback(tableId, cachedRt, cp);
                throw e;
            }
        }
    }

    private void rollback(Long tableId, TableRuntime cachedRt, TableRuntime.Checkpoint cp) {
        if (cachedRt == null) {
            runtimes.remove(tableId);
            return;
        }
        try {
            cachedRt.rollbackTo(cp);
        } catch (RestorationException e) {
            log.error("Table {} : retour arrière impossible, runtime oublié", tableId, e);
            runtimes.remove(tableId);
        }
    }

    private Loaded load(Long tableId, boolean forUpdate) {
        PokerTable table = tables.findById(tableId).orElseThrow(() -> new PokerValidationException("Table inconnue"));
        List<Seat> seats = seatRepo.findByTableIdAndLeftAtIsNullOrderByPositionAsc(tableId);
        TableRuntime rt = runtimes.computeIfAbsent(tableId, id -> new TableRuntime(id, engines));
        rt.refresh(table, seats);
        Optional<Hand> active = forUpdate ? hands.findActiveForUpdate(tableId) : hands.findActive(tableId);
        sync(rt, active.orElse(null));
        return new Loaded(rt, table, seats, active);
    }

    /** Aligne la mémoire sur la ligne de main ; un échec de restauration laisse le moteur vide. */
    private void sync(TableRuntime rt, Hand hand) {
        if (hand == null) {
            if (rt.getCurrentHandId() != null) rt.clearHand();
            return;
        }
        if (rt.isSyncedWith(hand.getId(), hand.getEngineSnapshot())) return;
        try {
            PersistedHandState state = codec.read(hand.getEngineSnapshot());
            if (state == null) {
                log.warn("Table {} : main #{} sans état moteur", rt.getTableId(), hand.getHandNo());
                rt.clearHand();
                return;
            }
            Instant waitStart = hand.getInterHandDeadline() == null ? null
                    : hand.getInterHandDeadline().minusSeconds(settings.getPostHandDelaySeconds());
            boolean exact = rt.restore(hand.getId(), hand.getHandNo(), hand.getStatus(), waitStart, state);
            if (!exact) {
                log.warn("Table {} : main #{} sans hand_player_order, ordre déduit des sièges (ancien format)",
                        rt.getTableId(), hand.getHandNo());
            }
            rt.markSynced(hand.getEngineSnapshot());
            log.debug("Table {} : main #{} restaurée ({})", rt.getTableId(), hand.getHandNo(), hand.getStatus());
        } catch (RestorationException e) {
            log.error("Table {} : restauration de la main #{} impossible", rt.getTableId(), hand.getHandNo(), e);
            rt.clearHand();
        }
    }

    private Map<String, Object> apply(Loaded ctx, Hand hand, Long userId, ActionType action, Long amount, Instant now) {
        TableRuntime rt = ctx.rt();
        boolean completed = rt.applyAction(userId, action, amount);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("type", "action");
        result.put("table_id", rt.getTableId());
        result.put("hand_no", rt.getCurrentHandNo());
        result.put("user_id", userId);
        result.put("action", action.name());
        result.put("amount", amount);

        PokerTable table = ctx.table();
        table.setLastActionAt(now);
        if (completed) {
            result.put("hand_ended", completion.complete(rt, hand, table, ctx.seats(), now));
        }
        persist(rt, hand, now);
        tables.save(table);
        return result;
    }

    private Hand openHand(TableRuntime rt, Long tableId, List<Seat> participants, Instant now) {
        Hand hand = new Hand();
        hand.setTableId(tableId);
        hand.setHandNo(hands.maxHandNo(tableId) + 1);
        hand.setStatus(HandStatus.PREFLOP);
        hand.setStartedAt(now);
        hand = hands.save(hand);

        List<SeatInfo> infos = new ArrayList<>(participants.size());
        for (Seat s : participants) {
            s.setSittingOutNextHand(false);
            infos.add(SeatInfo.of(s));
        }
        seatRepo.saveAll(participants);
        rt.startHand(hand.getId(), hand.getHandNo(), infos);
        persist(rt, hand, now);
        return hand;
    }

    private void persist(TableRuntime rt, Hand hand, Instant now) {
        hand.setStatus(rt.getHandStatus());
        String json = codec.write(rt.persistedState());
        hand.setEngineSnapshot(json);
        boolean waitingOnPlayer = rt.getHandStatus().isBetting() && rt.currentActorUserId() != null;
        hand.setActionDeadline(waitingOnPlayer ? now.plusSeconds(rt.getTable().turnTimeoutSeconds()) : null);
        hands.save(hand);
        rt.markSynced(json);
    }

    private void resetTimeouts(Hand hand, Long userId) {
        Map<String, Integer> tracking = codec.readTimeouts(hand.getTimeoutTracking());
        if (tracking.remove(String.valueOf(userId)) != null) hand.setTimeoutTracking(codec.writeTimeouts(tracking));
    }

    private List<Seat> fundedSeats(PokerTable table, List<Seat> all, List<Seat> candidates) {
        List<Seat> out = new ArrayList<>();
        for (Seat s : all) {
            if (!candidates.contains(s)) continue;
            if (lifecycle.checkBalanceRequirement(s, table.getSmallBlind(), table.getBigBlind(), table.getAnte()).ok())
                out.add(s);
        }
        return out;
    }

    private Map<String, Object> handStarted(TableRuntime rt, Hand hand) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", "hand_started");
        out.put("table_id", rt.getTableId());
        out.put("hand_id", hand.getId());
        out.put("hand_no", hand.getHandNo());
        out.put("players", new ArrayList<>(rt.getHandPlayerOrder()));
        out.put("actor_user_id", rt.currentActorUserId());
        return out;
    }
}
