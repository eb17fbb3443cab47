package org.evalux.poker.service.poker.completion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.evalux.poker.config.PokerSettings;
import org.evalux.poker.model.poker.Hand;
import org.evalux.poker.model.poker.PokerTable;
import org.evalux.poker.model.poker.Seat;
import org.evalux.poker.model.poker.rules.RakeRules;
import org.evalux.poker.repo.SeatRepository;
import org.evalux.poker.service.HandHistoryService;
import org.evalux.poker.service.WalletService;
import org.evalux.poker.service.poker.engine.EngineView;
import org.evalux.poker.service.poker.engine.WinnerInfo;
import org.evalux.poker.service.poker.lifecycle.TableLifecycleService;
import org.evalux.poker.service.poker.runtime.TableRuntime;
import org.evalux.poker.service.poker.util.Payloads;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Règlement d'une main terminée, dans cet ordre : rake, pot/historique, portefeuilles et stats,
 * sitting-out général, remise à zéro des votes, évaluation d'inactivité, payload {@code hand_ended}.
 * Appelé sous le verrou de table, dans la transaction de l'action.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HandCompletionService {
    public static final String READY_ACTION = "READY";

    private final WalletService wallet;
    private final HandHistoryService history;
    private final TableLifecycleService lifecycle;
    private final SeatRepository seatRepo;
    private final PokerSettings settings;
    private final Payloads payloads;

    public Map<String, Object> complete(TableRuntime rt, Hand hand, PokerTable table, List<Seat> seats, Instant now) {
        EngineView view = rt.getEngine().view();
        List<WinnerInfo> gross = rt.getEngine().winners();
        List<Long> order = rt.getHandPlayerOrder();

        // (a) rake, retenu sur les gagnants au prorata
        long pot = gross.stream().mapToLong(WinnerInfo::amount).sum();
        long rake = RakeRules.compute(pot, table.getRakeBasisPoints(), table.getRakeCap());
        List<Long> shares = RakeRules.distribute(gross.stream().map(WinnerInfo::amount).toList(), rake);
        List<WinnerInfo> net = new ArrayList<>(gross.size());
        for (int i = 0; i < gross.size(); i++) net.add(gross.get(i).withAmount(gross.get(i).amount() - shares.get(i)));

        Map<Long, Long> finalStacks = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) finalStacks.put(order.get(i), view.stacks().get(i));
        List<HandResult.SettledWinner> settled = new ArrayList<>();
        for (int i = 0; i < net.size(); i++) {
            WinnerInfo w = net.get(i);
            Long uid = order.get(w.playerIndex());
            finalStacks.merge(uid, -shares.get(i), Long::sum);
            settled.add(new HandResult.SettledWinner(uid, w.amount(), w.handRank(), w.bestHandCards()));
        }
        List<Map<String, Object>> winnersPayload = payloads.winnersPayload(rt, net);

        // (b) pot, rake, historique
        Instant deadline = now.plusSeconds(settings.getPostHandDelaySeconds());
        hand.setPotSize(pot);
        hand.setRakeAmount(rake);
        hand.setActionDeadline(null);
        hand.setInterHandDeadline(deadline);
        Map<String, Object> historyPayload = new LinkedHashMap<>();
        historyPayload.put("winners", winnersPayload);
        historyPayload.put("board", view.board());
        historyPayload.put("pot", pot);
        historyPayload.put("rake", rake);
        historyPayload.put("players", new ArrayList<>(order));
        history.record(table.getId(), hand.getHandNo(), historyPayload);

        // (c) portefeuilles et stats
        HandResult result = new HandResult(table.getId(), hand.getId(), hand.getHandNo(), pot, rake,
                new ArrayList<>(order), finalStacks, settled);
        wallet.applyHandResult(hand, table, seats, result);
        wallet.recordRake(rake, hand.getId(), table.getId());

        // (d) tout le monde doit reconfirmer
        for (Seat s : seats) s.setSittingOutNextHand(true);
        seatRepo.saveAll(seats);

        // (e) votes remis à zéro, passage en INTER_HAND_WAIT
        rt.enterInterHandWait(now);

        // (f) évaluée pour information seulement : la décision se prend à la fin de l'attente
        TableLifecycleService.InactivityVerdict verdict = lifecycle.computeInactivity(table, seats, now);

        // (g)
        Map<String, Object> ended = new LinkedHashMap<>();
        ended.put("type", "hand_ended");
        ended.put("table_id", table.getId());
        ended.put("hand_no", hand.getHandNo());
        ended.put("winners", winnersPayload);
        ended.put("board", view.board());
        ended.put("rake", rake);
        ended.put("pot", pot);
        ended.put("status", rt.getHandStatus().name());
        ended.put("next_hand_in", settings.getPostHandDelaySeconds());
        ended.put("inter_hand_wait", true);
        ended.put("inter_hand_wait_seconds", settings.getPostHandDelaySeconds());
        ended.put("inter_hand_wait_deadline", deadline.toString());
        ended.put("ready_action", Map.of("action", READY_ACTION, "label", "Prêt pour la main suivante"));
        ended.put("table_will_end", verdict.shouldEnd());
        ended.put("end_reason", verdict.reason());

        log.info("Table {} main #{} terminée : pot={}, rake={}, gagnants={}", table.getId(), hand.getHandNo(), pot, rake,
                settled.stream().map(HandResult.SettledWinner::userId).toList());
        return ended;
    }
}
