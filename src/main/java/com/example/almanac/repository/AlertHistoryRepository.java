package com.example.almanac.repository;

import com.example.almanac.domain.AlertHistoryEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AlertHistoryRepository extends JpaRepository<AlertHistoryEntry, Long> {

    List<AlertHistoryEntry> findAllByOrderByFiredAtDescIdDesc(Pageable pageable);

    List<AlertHistoryEntry> findByRuleIdOrderByFiredAtDescIdDesc(String ruleId, Pageable pageable);

    Optional<AlertHistoryEntry> findFirstByRuleIdAndResolvedFalseOrderByIdDesc(String ruleId);
}
