package org.evalux.poker.repo;

import jakarta.persistence.LockModeType;
import org.evalux.poker.model.poker.Hand;
import org.evalux.poker.model.poker.HandStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface HandRepository extends JpaRepository<Hand, Long> {

    /** Dernière main non terminale (ni ENDED ni ABORTED). */
    Optional<Hand> findFirstByTableIdAndStatusNotInOrderByHandNoDesc(Long tableId, Collection<HandStatus> statuses);

    default Optional<Hand> findActive(Long tableId) {
        return findFirstByTableIdAndStatusNotInOrderByHandNoDesc(tableId, HandStatus.TERMINAL);
    }

    /** Même recherche, avec verrou de ligne : c'est la base qui arbitre entre les process. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select h from Hand h where h.tableId = :tableId and h.status not in :terminal order by h.handNo desc")
    List<Hand> lockActive(@Param("tableId") Long tableId, @Param("terminal") Collection<HandStatus> terminal);

    default Optional<Hand> findActiveForUpdate(Long tableId) {
        return lockActive(tableId, HandStatus.TERMINAL).stream().findFirst();
    }

    @Query("select coalesce(max(h.handNo), 0) from Hand h where h.tableId = :tableId")
    int maxHandNo(@Param("tableId") Long tableId);

    List<Hand> findByStatusAndInterHandDeadlineBefore(HandStatus status, Instant deadline);

    List<Hand> findByStatusInAndActionDeadlineBefore(Collection<HandStatus> statuses, Instant deadline);

    List<Hand> findByTableIdOrderByHandNoAsc(Long tableId);
}
