package org.evalux.poker.repo;

import org.evalux.poker.model.poker.Seat;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SeatRepository extends JpaRepository<Seat, Long> {
    List<Seat> findByTableIdAndLeftAtIsNullOrderByPositionAsc(Long tableId);

    Optional<Seat> findByTableIdAndUserIdAndLeftAtIsNull(Long tableId, Long userId);
}
