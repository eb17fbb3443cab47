package org.evalux.poker.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.evalux.poker.dto.poker.ActionMsg;
import org.evalux.poker.dto.poker.ReadyMsg;
import org.evalux.poker.service.poker.PokerGameService;
import org.evalux.poker.service.poker.error.PokerValidationException;
import org.evalux.poker.service.poker.util.TableBroadcaster;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.stereotype.Controller;

import java.security.Principal;

@Slf4j
@Controller
@RequiredArgsConstructor
public class PokerWsController {
    private final PokerGameService game;
    private final TableBroadcaster broadcaster;

    // ----------------------------------------------------------------
    @MessageMapping("/poker/action")
    public void action(ActionMsg msg, Principal principal) {
        String user = resolveUser(principal, msg.getUserId());
        try {
            if (msg.getTableId() == null) throw new PokerValidationException("Table inconnue ou invalide.");
            game.act(msg.getTableId(), actingUser(principal, msg.getUserId()), msg.getAction(), msg.getAmount());
        } catch (PokerValidationException ex) {
            broadcaster.sendError(user, ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Action poker en échec (table {}, joueur {})", msg.getTableId(), msg.getUserId(), ex);
            broadcaster.sendError(user, ex.getMessage());
        }
    }

    // ----------------------------------------------------------------
    @MessageMapping("/poker/ready")
    public void ready(ReadyMsg msg, Principal principal) {
        String user = resolveUser(principal, msg.getUserId());
        try {
            if (msg.getTableId() == null) throw new PokerValidationException("Table inconnue ou invalide.");
            game.ready(msg.getTableId(), actingUser(principal, msg.getUserId()));
        } catch (PokerValidationException ex) {
            broadcaster.sendError(user, ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("READY en échec (table {}, joueur {})", msg.getTableId(), msg.getUserId(), ex);
            broadcaster.sendError(user, ex.getMessage());
        }
    }

    private static String resolveUser(Principal principal, Long userId) {
        if (principal != null) return principal.getName();
        return String.valueOf(userId);
    }

    // le principal de la session fait foi ; le userId du message ne sert qu'aux sessions anonymes
    static Long actingUser(Principal principal, Long declared) {
        if (principal != null) {
            try {
                return Long.valueOf(principal.getName());
            } catch (NumberFormatException e) {
                throw new PokerValidationException("Identité de session invalide: " + principal.getName());
            }
        }
        if (declared == null) throw new PokerValidationException("Utilisateur non identifié sur la socket");
        return declared;
    }
}
