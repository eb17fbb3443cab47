package org.evalux.poker.service.poker.util;

import org.evalux.poker.service.poker.engine.EngineView;
import org.evalux.poker.service.poker.engine.LegalActions;
import org.evalux.poker.service.poker.engine.PotView;
import org.evalux.poker.service.poker.engine.WinnerInfo;
import org.evalux.poker.service.poker.runtime.SeatInfo;
import org.evalux.poker.service.poker.runtime.TableRuntime;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Construit les payloads JSON envoyés aux clients.
 * Les cartes des adversaires restent cachées tant qu'il n'y a pas d'abattage.
 */
@Component
public class Payloads {
    public static final String HIDDEN = "??";

    public Map<String, Object> tableState(TableRuntime rt, Long viewerId) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("table_id", rt.getTableId());
        if (rt.getTable() != null) {
            m.put("table_name", rt.getTable().name());
            m.put("table_status", rt.getTable().status());
            m.put("small_blind", rt.getTable().smallBlind());
            m.put("big_blind", rt.getTable().bigBlind());
            m.put("ante", rt.getTable().ante());
        }
        m.put("hand_id", rt.getCurrentHandId());
        m.put("hand_no", rt.getCurrentHandNo());
        m.put("status", rt.getHandStatus());
        m.put("event_sequence", rt.getEventSequence());
        m.put("ready_players", new ArrayList<>(rt.getReadyPlayers()));

        EngineView v = rt.hasEngine() ? rt.getEngine().view() : null;
        if (v == null) {
            m.put("players", seatsOnly(rt));
            return m;
        }
        m.put("street", v.street());
        m.put("board", v.board());
        m.put("pot", v.totalPot());
        m.put("pots", potsPayload(rt, v.pots()));
        m.put("current_bet", v.currentBet());
        m.put("button_user_id", userAt(rt, v.buttonIndex()));
        m.put("actor_user_id", rt.currentActorUserId());
        m.put("players", playersPayload(rt, v, viewerId));

        Integer viewerIndex = viewerId == null ? null : rt.getPlayerIndexByUser().get(viewerId);
        if (viewerIndex != null && Objects.equals(v.actorIndex(), viewerIndex)) {
            m.put("legal_actions", legalPayload(rt.getEngine().legalActions(viewerIndex)));
        }
        if (v.complete()) m.put("winners", winnersPayload(rt, rt.getEngine().winners()));
        return m;
    }

    public List<Map<String, Object>> playersPayload(TableRuntime rt, EngineView v, Long viewerId) {
        List<Map<String, Object>> out = new ArrayList<>();
        List<Long> order = rt.getHandPlayerOrder();
        for (int i = 0; i < order.size() && i < v.playerCount(); i++) {
            Long uid = order.get(i);
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("user_id", uid);
            p.put("display_name", rt.seatOf(uid).map(SeatInfo::displayName).orElse(null));
            p.put("position", rt.seatOf(uid).map(SeatInfo::position).orElse(null));
            p.put("stack", v.stacks().get(i));
            p.put("bet", v.bets().get(i));
            p.put("folded", v.folded().get(i));
            p.put("all_in", v.allIn().get(i));
            p.put("is_actor", Objects.equals(v.actorIndex(), i));
            p.put("ready", rt.getReadyPlayers().contains(uid));

            boolean visible = Objects.equals(uid, viewerId) || (v.showdown() && !v.folded().get(i));
            List<String> hole = v.holeCards().get(i);
            p.put("hole_cards", visible ? hole : Collections.nCopies(hole.size(), HIDDEN));
            out.add(p);
        }
        return out;
    }

    public List<Map<String, Object>> winnersPayload(TableRuntime rt, List<WinnerInfo> winners) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (WinnerInfo w : winners) {
            Long uid = userAt(rt, w.playerIndex());
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("user_id", uid);
            m.put("display_name", rt.seatOf(uid).map(SeatInfo::displayName).orElse(null));
            m.put("amount", w.amount());
            m.put("hand_rank", w.handRank());
            m.put("best_hand_cards", w.bestHandCards());
            out.add(m);
        }
        return out;
    }

    private List<Map<String, Object>> potsPayload(TableRuntime rt, List<PotView> pots) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (PotView p : pots) {
            List<Long> users = new ArrayList<>();
            for (int i : p.playerIndices()) users.add(userAt(rt, i));
            out.add(Map.of("amount", p.amount(), "eligible_user_ids", users));
        }
        return out;
    }

    private Map<String, Object> legalPayload(LegalActions a) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("can_fold", a.canFold());
        m.put("can_check", a.canCheck());
        m.put("can_call", a.canCall());
        m.put("call_amount", a.callAmount());
        m.put("can_bet", a.canBet());
        m.put("can_raise", a.canRaise());
        m.put("min_raise_to", a.minRaiseTo());
        m.put("max_raise_to", a.maxRaiseTo());
        return m;
    }

    private List<Map<String, Object>> seatsOnly(TableRuntime rt) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (SeatInfo s : rt.getSeats()) {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("user_id", s.userId());
            p.put("display_name", s.displayName());
            p.put("position", s.position());
            p.put("stack", s.chips());
            p.put("sitting_out_next_hand", s.sittingOutNextHand());
            p.put("ready", rt.getReadyPlayers().contains(s.userId()));
            out.add(p);
        }
        return out;
    }

    private static Long userAt(TableRuntime rt, int index) {
        List<Long> order = rt.getHandPlayerOrder();
        return index >= 0 && index < order.size() ? order.get(index) : null;
    }
}
