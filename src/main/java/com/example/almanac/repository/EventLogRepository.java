package com.example.almanac.repository;

import com.example.almanac.domain.EventLogEntry;
import com.example.almanac.eventlog.EventLevel;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Source filters match a dotted source and everything below it: {@code herald} matches
 * {@code herald} and {@code herald.bot}, not {@code heraldry}. {@code children} is the escaped
 * LIKE pattern built by {@link EventLogService}.
 */
@Repository
public interface EventLogRepository extends JpaRepository<EventLogEntry, Long> {

    @Query("SELECT e FROM EventLogEntry e WHERE " +
           "(:source IS NULL OR e.source = :source OR e.source LIKE :children ESCAPE '!') AND " +
           "(:level IS NULL OR e.level = :level) AND " +
           "e.timestamp >= :since AND e.timestamp <= :until " +
           "ORDER BY e.timestamp ASC, e.id ASC")
    List<EventLogEntry> query(String source, String children, EventLevel level, Instant since, Instant until, Pageable pageable);

    @Query("SELECT COUNT(e) FROM EventLogEntry e WHERE " +
           "e.level IN :levels AND " +
           "(:source IS NULL OR e.source = :source OR e.source LIKE :children ESCAPE '!') AND " +
           "e.timestamp >= :since AND e.timestamp <= :until")
    long countByLevels(Collection<EventLevel> levels, String source, String children, Instant since, Instant until);

    @Query("SELECT e FROM EventLogEntry e WHERE " +
           "(:source IS NULL OR e.source = :source OR e.source LIKE :children ESCAPE '!') AND " +
           "e.timestamp >= :since AND e.timestamp <= :until " +
           "ORDER BY e.timestamp DESC, e.id DESC")
    List<EventLogEntry> findLatest(String source, String children, Instant since, Instant until, Pageable pageable);

    @Modifying
    @Transactional
    @Query("DELETE FROM EventLogEntry e WHERE e.timestamp < :cutoff")
    int deleteOlderThan(Instant cutoff);
}
