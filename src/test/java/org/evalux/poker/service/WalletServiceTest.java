package org.evalux.poker.service;

import org.evalux.poker.model.poker.*;
import org.evalux.poker.repo.LedgerEntryRepository;
import org.evalux.poker.repo.PlayerStatsRepository;
import org.evalux.poker.repo.SeatRepository;
import org.evalux.poker.service.poker.completion.HandResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.*;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WalletServiceTest {

    @Mock SeatRepository seatRepo;
    @Mock LedgerEntryRepository ledger;
    @Mock PlayerStatsRepository statsRepo;

    @InjectMocks WalletService wallet;

    PokerTable table;
    Hand hand;
    List<Seat> seats;

    static Seat seat(long userId, long chips) {
        Seat s = new Seat();
        s.setUserId(userId);
        s.setChips(chips);
        return s;
    }

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        table = new PokerTable();
        table.setId(1L);
        hand = new Hand();
        hand.setId(9L);
        hand.setHandNo(4);
        seats = List.of(seat(10, 1000), seat(20, 1000));
        when(statsRepo.findById(any())).thenReturn(Optional.empty());
    }

    private HandResult result(long stack10, long stack20, HandResult.SettledWinner... winners) {
        Map<Long, Long> stacks = new LinkedHashMap<>();
        stacks.put(10L, stack10);
        stacks.put(20L, stack20);
        return new HandResult(1L, 9L, 4, 2000, 50, List.of(10L, 20L), stacks, List.of(winners));
    }

    @Test
    void applyHandResult_tapisEtLedger() {
        wallet.applyHandResult(hand, table, seats,
                result(1950, 0, new HandResult.SettledWinner(10L, 1950, "three_of_a_kind", List.of("Ah", "Ad", "Ac", "Kd", "2s"))));

        assertThat(seats.get(0).getChips()).isEqualTo(1950);
        assertThat(seats.get(1).getChips()).isEqualTo(0);
        ArgumentCaptor<LedgerEntry> captor = ArgumentCaptor.forClass(LedgerEntry.class);
        verify(ledger).save(captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo(LedgerEntry.Type.GAME_WIN);
        assertThat(captor.getValue().getAmount()).isEqualTo(1950);
        assertThat(captor.getValue().getUserId()).isEqualTo(10L);
    }

    @Test
    void applyHandResult_statsPourChaqueParticipant() {
        wallet.applyHandResult(hand, table, seats,
                result(1950, 0, new HandResult.SettledWinner(10L, 1950, "three_of_a_kind", List.of())));

        ArgumentCaptor<PlayerStats> captor = ArgumentCaptor.forClass(PlayerStats.class);
        verify(statsRepo, times(2)).save(captor.capture());
        PlayerStats winner = captor.getAllValues().get(0);
        PlayerStats loser = captor.getAllValues().get(1);
        assertThat(winner.getHandsPlayed()).isEqualTo(1);
        assertThat(winner.getHandsWon()).isEqualTo(1);
        assertThat(winner.getTotalWinnings()).isEqualTo(1950);
        assertThat(winner.getBestHandRank()).isEqualTo("three_of_a_kind");
        assertThat(loser.getHandsPlayed()).isEqualTo(1);
        assertThat(loser.getHandsWon()).isZero();
    }

    @Test
    void recordRake_ignoreZero() {
        wallet.recordRake(0, 9L, 1L);
        verify(ledger, never()).save(any());

        wallet.recordRake(50, 9L, 1L);
        ArgumentCaptor<LedgerEntry> captor = ArgumentCaptor.forClass(LedgerEntry.class);
        verify(ledger).save(captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo(LedgerEntry.Type.RAKE);
        assertThat(captor.getValue().getUserId()).isNull();
    }

    @Test
    void better_garderLaMeilleureCombinaison() {
        assertThat(WalletService.better(null, "pair")).isEqualTo("pair");
        assertThat(WalletService.better("flush", "pair")).isEqualTo("flush");
        assertThat(WalletService.better("pair", "straight_flush")).isEqualTo("straight_flush");
        assertThat(WalletService.better("three_of_a_kind", null)).isEqualTo("three_of_a_kind");
    }
}
