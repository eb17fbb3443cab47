package org.evalux.poker.service.poker;

import lombok.RequiredArgsConstructor;
import org.evalux.poker.service.poker.registry.TableRuntimeManager;
import org.evalux.poker.service.poker.runtime.ActionType;
import org.evalux.poker.service.poker.runtime.SeatInfo;
import org.evalux.poker.service.poker.runtime.TableRuntime;
import org.evalux.poker.service.poker.util.TableBroadcaster;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Façade utilisée par les contrôleurs et les tâches planifiées : appelle le manager puis diffuse
 * les résultats une fois l'opération validée (jamais avant le commit).
 */
@Service
@RequiredArgsConstructor
public class PokerGameService {
    private final TableRuntimeManager manager;
    private final TableBroadcaster broadcaster;

    public Map<String, Object> start(Long tableId) {
        Map<String, Object> result = manager.startGame(tableId);
        publish(tableId, result);
        return result;
    }

    public Map<String, Object> act(Long tableId, Long userId, String rawAction, Long amount) {
        ActionType action = ActionType.parse(rawAction);
        if (action == ActionType.READY) return ready(tableId, userId);
        Map<String, Object> result = manager.handleAction(tableId, userId, action, amount);
        publish(tableId, result);
        return withState(tableId, userId, result);
    }

    /** Vote "prêt" ; si tous les joueurs assis sont prêts, la main suivante part sans attendre le délai. */
    public Map<String, Object> ready(Long tableId, Long userId) {
        Map<String, Object> result = manager.markPlayerReady(tableId, userId);
        publish(tableId, result);
        if (Boolean.TRUE.equals(result.get("all_ready"))) {
            result = new LinkedHashMap<>(result);
            result.put("next", completeInterHand(tableId));
        }
        return withState(tableId, userId, result);
    }

    public Map<String, Object> completeInterHand(Long tableId) {
        Map<String, Object> result = manager.completeInterHandPhase(tableId);
        publish(tableId, result);
        return result;
    }

    public Map<String, Object> turnTimeout(Long tableId) {
        Map<String, Object> result = manager.handleTurnTimeout(tableId);
        if (result != null) publish(tableId, result);
        return result;
    }

    public Map<String, Object> abort(Long tableId, String reason) {
        Map<String, Object> result = manager.abortHand(tableId, reason == null ? "manual" : reason);
        publish(tableId, result);
        return result;
    }

    public Map<String, Object> state(Long tableId, Long viewerId) {
        return manager.getState(tableId, viewerId);
    }

    private Map<String, Object> withState(Long tableId, Long viewerId, Map<String, Object> result) {
        Map<String, Object> out = new LinkedHashMap<>(result);
        out.put("state", manager.getState(tableId, viewerId));
        return out;
    }

    private void publish(Long tableId, Map<String, Object> result) {
        broadcaster.broadcastToTable(tableId, String.valueOf(result.get("type")), result);
        Object ended = result.get("hand_ended");
        if (ended != null) broadcaster.broadcastToTable(tableId, "hand_ended", ended);

        // vue privée (cartes du joueur) pour chaque joueur assis
        Optional<TableRuntime> rt = manager.cached(tableId);
        if (rt.isEmpty()) return;
        for (SeatInfo s : rt.get().getSeats()) {
            broadcaster.sendToPlayer(tableId, s.userId(), "state", manager.getState(tableId, s.userId()));
        }
    }
}
