package org.evalux.poker.service.poker.util;

import lombok.RequiredArgsConstructor;
import org.evalux.poker.dto.poker.TableEvent;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/** Diffusion STOMP : public sur /topic/poker/table/{id}, privé sur /user/queue/poker/table/{id}. */
@Component
@RequiredArgsConstructor
public class TableBroadcaster {
    public static final String TOPIC_PREFIX = "/topic/poker";
    public static final String QUEUE_PREFIX = "/queue/poker";

    private final SimpMessagingTemplate broker;

    public void broadcastToTable(Long tableId, String type, Object payload) {
        broker.convertAndSend(TOPIC_PREFIX + "/table/" + tableId, event(tableId, type, payload));
    }

    public void sendToPlayer(Long tableId, Long userId, String type, Object payload) {
        broker.convertAndSendToUser(String.valueOf(userId), QUEUE_PREFIX + "/table/" + tableId, event(tableId, type, payload));
    }

    public void sendError(String user, String message) {
        broker.convertAndSendToUser(user, QUEUE_PREFIX + "/errors",
                Map.of("error", message == null ? "Erreur inattendue" : message));
    }

    private static TableEvent event(Long tableId, String type, Object payload) {
        return TableEvent.builder()
                .type(type.toUpperCase(Locale.ROOT))
                .tableId(tableId)
                .payload(payload)
                .build();
    }
}
