package org.evalux.poker.task;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.evalux.poker.model.poker.Hand;
import org.evalux.poker.model.poker.HandStatus;
import org.evalux.poker.repo.HandRepository;
import org.evalux.poker.service.poker.PokerGameService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;

/** Check ou fold automatique quand le joueur au tour dépasse son délai. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "poker.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class TurnTimeoutScheduler {
    private static final EnumSet<HandStatus> BETTING =
            EnumSet.of(HandStatus.PREFLOP, HandStatus.FLOP, HandStatus.TURN, HandStatus.RIVER);

    private final HandRepository hands;
    private final PokerGameService game;

    @Scheduled(fixedDelayString = "${poker.scheduler.turn-timeout-interval-ms:1000}")
    public void expireTurns() {
        for (Hand h : hands.findByStatusInAndActionDeadlineBefore(BETTING, Instant.now())) {
            try {
                game.turnTimeout(h.getTableId());
            } catch (RuntimeException e) {
                log.warn("Table {} : timeout de parole en échec", h.getTableId(), e);
            }
        }
    }
}
