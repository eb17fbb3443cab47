package org.evalux.poker.service.poker.lifecycle;

import org.evalux.poker.config.PokerSettings;
import org.evalux.poker.model.poker.PokerTable;
import org.evalux.poker.model.poker.Seat;
import org.evalux.poker.model.poker.TableStatus;
import org.evalux.poker.repo.PokerTableRepository;
import org.evalux.poker.repo.SeatRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class TableLifecycleServiceTest {

    @Mock PokerTableRepository tables;
    @Mock SeatRepository seatRepo;

    TableLifecycleService service;
    PokerTable table;
    final Instant now = Instant.parse("2026-03-01T12:00:00Z");

    static Seat seat(long userId, long chips) {
        Seat s = new Seat();
        s.setUserId(userId);
        s.setChips(chips);
        return s;
    }

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        service = new TableLifecycleService(tables, seatRepo, new PokerSettings(20, 10, 2));
        table = new PokerTable();
        table.setId(3L);
        table.setStatus(TableStatus.ACTIVE);
        table.setSmallBlind(10);
        table.setBigBlind(20);
        table.setLastActionAt(now.minusSeconds(30));
    }

    @Test
    void inactivite_tableSaine() {
        var v = service.computeInactivity(table, List.of(seat(1, 500), seat(2, 500)), now);
        assertThat(v.shouldEnd()).isFalse();
        assertThat(v.reason()).isNull();
    }

    @Test
    void inactivite_aucunSiege() {
        var v = service.computeInactivity(table, List.of(), now);
        assertThat(v.shouldEnd()).isTrue();
        assertThat(v.reason()).isEqualTo(TableLifecycleService.NO_ACTIVE_SEATS);
    }

    @Test
    void inactivite_unSeulJoueurSolvable() {
        var v = service.computeInactivity(table, List.of(seat(1, 500), seat(2, 29)), now);
        assertThat(v.shouldEnd()).isTrue();
        assertThat(v.reason()).isEqualTo(TableLifecycleService.NOT_ENOUGH_FUNDED_PLAYERS);
    }

    @Test
    void inactivite_delaiDepasse() {
        table.setLastActionAt(now.minus(Duration.ofMinutes(11)));
        var v = service.computeInactivity(table, List.of(seat(1, 500), seat(2, 500)), now);
        assertThat(v.shouldEnd()).isTrue();
        assertThat(v.reason()).isEqualTo(TableLifecycleService.INACTIVITY_TIMEOUT);
    }

    @Test
    void inactivite_ignoreLesTablesNonActives() {
        table.setStatus(TableStatus.WAITING);
        var v = service.computeInactivity(table, List.of(), now);
        assertThat(v.shouldEnd()).isFalse();
    }

    @Test
    void soldeMinimum_blindesPlusAnte() {
        var check = service.checkBalanceRequirement(seat(1, 34), 10, 20, 5);
        assertThat(check.ok()).isFalse();
        assertThat(check.required()).isEqualTo(35);

        assertThat(service.checkBalanceRequirement(seat(1, 35), 10, 20, 5).ok()).isTrue();
    }

    @Test
    void fermeture_libereLesSieges() {
        List<Seat> seats = List.of(seat(1, 500), seat(2, 500));

        service.markTableEnded(table, seats, TableLifecycleService.NOT_ENOUGH_READY_PLAYERS);

        assertThat(table.getStatus()).isEqualTo(TableStatus.ENDED);
        assertThat(seats).allMatch(s -> s.getLeftAt() != null);
        verify(seatRepo).saveAll(seats);
        verify(tables).save(table);
    }
}
