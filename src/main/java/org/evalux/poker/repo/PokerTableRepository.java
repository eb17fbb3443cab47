package org.evalux.poker.repo;

import org.evalux.poker.model.poker.PokerTable;
import org.evalux.poker.model.poker.TableStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PokerTableRepository extends JpaRepository<PokerTable, Long> {
    List<PokerTable> findByStatus(TableStatus status);
}
