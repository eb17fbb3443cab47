package org.evalux.poker.repo;

import org.evalux.poker.model.poker.HandHistory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface HandHistoryRepository extends JpaRepository<HandHistory, Long> {
    List<HandHistory> findTop20ByTableIdOrderByHandNoDesc(Long tableId);
}
