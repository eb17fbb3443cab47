package org.evalux.poker.repo;

import org.evalux.poker.model.poker.LedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {
    List<LedgerEntry> findByHandId(Long handId);
}
