package org.evalux.poker.service.poker.lifecycle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.evalux.poker.config.PokerSettings;
import org.evalux.poker.model.poker.PokerTable;
import org.evalux.poker.model.poker.Seat;
import org.evalux.poker.model.poker.TableStatus;
import org.evalux.poker.repo.PokerTableRepository;
import org.evalux.poker.repo.SeatRepository;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Règles de vie d'une table : inactivité, solde minimum, fermeture. */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableLifecycleService {
    public static final String NO_ACTIVE_SEATS = "no_active_seats";
    public static final String NOT_ENOUGH_FUNDED_PLAYERS = "not_enough_funded_players";
    public static final String INACTIVITY_TIMEOUT = "inactivity_timeout";
    public static final String NOT_ENOUGH_READY_PLAYERS = "not_enough_ready_players";

    private final PokerTableRepository tables;
    private final SeatRepository seatRepo;
    private final PokerSettings settings;

    public record InactivityVerdict(boolean shouldEnd, String reason) {
        static InactivityVerdict keep() { return new InactivityVerdict(false, null); }
    }

    public record BalanceCheck(boolean ok, long required) {}

    /** N'évalue que les tables ACTIVE ; ne modifie rien. */
    public InactivityVerdict computeInactivity(PokerTable table, List<Seat> seats, Instant now) {
        if (table.getStatus() != TableStatus.ACTIVE) return InactivityVerdict.keep();
        List<Seat> active = seats.stream().filter(Seat::isActive).toList();
        if (active.isEmpty()) return new InactivityVerdict(true, NO_ACTIVE_SEATS);

        long funded = active.stream()
                .filter(s -> checkBalanceRequirement(s, table.getSmallBlind(), table.getBigBlind(), table.getAnte()).ok())
                .count();
        if (funded < 2) return new InactivityVerdict(true, NOT_ENOUGH_FUNDED_PLAYERS);

        Instant last = table.getLastActionAt();
        Duration limit = Duration.ofMinutes(settings.getTableInactivityTimeoutMinutes());
        if (last != null && Duration.between(last, now).compareTo(limit) > 0)
            return new InactivityVerdict(true, INACTIVITY_TIMEOUT);
        return InactivityVerdict.keep();
    }

    public BalanceCheck checkBalanceRequirement(Seat seat, long smallBlind, long bigBlind, long ante) {
        long required = smallBlind + bigBlind + ante;
        return new BalanceCheck(seat != null && seat.getChips() >= required, required);
    }

    public void markTableEnded(PokerTable table, List<Seat> seats, String reason) {
        Instant now = Instant.now();
        for (Seat s : seats) if (s.getLeftAt() == null) s.setLeftAt(now);
        seatRepo.saveAll(seats);
        table.setStatus(TableStatus.ENDED);
        tables.save(table);
        log.info("Table {} fermée ({})", table.getId(), reason);
    }
}
