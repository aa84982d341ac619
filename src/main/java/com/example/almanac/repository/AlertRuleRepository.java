package com.example.almanac.repository;

import com.example.almanac.domain.AlertRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AlertRuleRepository extends JpaRepository<AlertRule, String> {

    List<AlertRule> findByEnabledTrueOrderByIdAsc();

    List<AlertRule> findAllByOrderByCreatedAtAsc();
}
