package com.example.almanac.repository;

import com.example.almanac.domain.OutboxMessage;
import com.example.almanac.outbox.OutboxLane;
import com.example.almanac.outbox.OutboxStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface OutboxRepository extends JpaRepository<OutboxMessage, Long> {

    List<OutboxMessage> findByStatusOrderByIdAsc(OutboxStatus status, Pageable pageable);

    /**
     * Lanes whose oldest pending message is due, oldest head first. A lane whose head is backing off
     * is not returned, whatever else it has queued.
     */
    @Query("SELECT new com.example.almanac.outbox.OutboxLane(m.channel, m.target) FROM OutboxMessage m " +
            "WHERE m.status = :status AND m.nextAttemptAt <= :now " +
            "AND m.id = (SELECT MIN(h.id) FROM OutboxMessage h " +
            "WHERE h.status = :status AND h.channel = m.channel AND h.target = m.target) " +
            "ORDER BY m.id")
    List<OutboxLane> findLanesWithDueHead(@Param("status") OutboxStatus status, @Param("now") Instant now,
                                          Pageable pageable);

    List<OutboxMessage> findByChannelAndTargetAndStatusOrderByIdAsc(String channel, String target,
                                                                    OutboxStatus status, Pageable pageable);

    List<OutboxMessage> findByStatusOrderByIdDesc(OutboxStatus status, Pageable pageable);

    List<OutboxMessage> findAllByOrderByIdDesc(Pageable pageable);

    Optional<OutboxMessage> findByDedupKey(String dedupKey);

    long countByStatus(OutboxStatus status);
}
