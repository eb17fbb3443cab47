package org.evalux.poker.task;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.evalux.poker.model.poker.Hand;
import org.evalux.poker.model.poker.HandStatus;
import org.evalux.poker.repo.HandRepository;
import org.evalux.poker.service.poker.PokerGameService;
import org.evalux.poker.service.poker.error.PokerValidationException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

/** Clôt les attentes inter-main dont le délai est dépassé. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "poker.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class InterHandScheduler {
    private final HandRepository hands;
    private final PokerGameService game;

    @Scheduled(fixedDelayString = "${poker.scheduler.inter-hand-interval-ms:1000}")
    public void completeExpiredWaits() {
        for (Hand h : hands.findByStatusAndInterHandDeadlineBefore(HandStatus.INTER_HAND_WAIT, Instant.now())) {
            try {
                game.completeInterHand(h.getTableId());
            } catch (PokerValidationException e) {
                // déjà traitée par un autre process
                log.debug("Table {} : attente inter-main déjà close ({})", h.getTableId(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Table {} : fin d'attente inter-main en échec", h.getTableId(), e);
            }
        }
    }
}
