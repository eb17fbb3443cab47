package org.evalux.poker.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.evalux.poker.model.poker.*;
import org.evalux.poker.model.poker.rules.HandRank;
import org.evalux.poker.repo.LedgerEntryRepository;
import org.evalux.poker.repo.PlayerStatsRepository;
import org.evalux.poker.repo.SeatRepository;
import org.evalux.poker.service.poker.completion.HandResult;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;

/**
 * Mouvements de jetons après une main : tapis des sièges, écritures de ledger, statistiques joueur.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WalletService {
    private final SeatRepository seatRepo;
    private final LedgerEntryRepository ledger;
    private final PlayerStatsRepository statsRepo;

    @Transactional
    public void applyHandResult(Hand hand, PokerTable table, List<Seat> seats, HandResult result) {
        Instant now = Instant.now();
        for (Seat s : seats) {
            Long stack = result.finalStacks().get(s.getUserId());
            if (stack != null) s.setChips(stack);
        }
        seatRepo.saveAll(seats);

        Set<Long> winnerIds = new HashSet<>();
        for (HandResult.SettledWinner w : result.winners()) {
            if (w.amount() <= 0) continue;
            winnerIds.add(w.userId());
            ledger.save(LedgerEntry.builder()
                    .userId(w.userId())
                    .tableId(table.getId())
                    .handId(hand.getId())
                    .type(LedgerEntry.Type.GAME_WIN)
                    .amount(w.amount())
                    .createdAt(now)
                    .build());
        }

        Map<Long, HandResult.SettledWinner> byUser = new HashMap<>();
        for (HandResult.SettledWinner w : result.winners()) byUser.put(w.userId(), w);
        for (Long uid : result.participants()) {
            PlayerStats st = statsRepo.findById(uid).orElseGet(() -> PlayerStats.builder().userId(uid).build());
            st.setHandsPlayed(st.getHandsPlayed() + 1);
            HandResult.SettledWinner w = byUser.get(uid);
            if (w != null && winnerIds.contains(uid)) {
                st.setHandsWon(st.getHandsWon() + 1);
                st.setTotalWinnings(st.getTotalWinnings() + w.amount());
                st.setBestHandRank(better(st.getBestHandRank(), w.handRank()));
            }
            st.setUpdatedAt(now);
            statsRepo.save(st);
        }
        log.debug("Table {} main #{} : {} gagnant(s) crédité(s)", table.getId(), hand.getHandNo(), winnerIds.size());
    }

    @Transactional
    public void recordRake(long amount, Long handId, Long tableId) {
        if (amount <= 0) return;
        ledger.save(LedgerEntry.builder()
                .userId(null)
                .tableId(tableId)
                .handId(handId)
                .type(LedgerEntry.Type.RAKE)
                .amount(amount)
                .createdAt(Instant.now())
                .build());
    }

    static String better(String current, String candidate) {
        if (candidate == null) return current;
        if (current == null) return candidate;
        return rankOf(candidate) > rankOf(current) ? candidate : current;
    }

    private static int rankOf(String label) {
        for (HandRank r : HandRank.values()) if (r.label().equals(label)) return r.ordinal();
        return -1;
    }
}
