package com.example.almanac.repository;

import com.example.almanac.domain.Job;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface JobRepository extends JpaRepository<Job, String> {

    @Query("SELECT j FROM Job j WHERE j.enabled = true AND j.nextRunAt IS NOT NULL AND j.nextRunAt <= :now " +
           "ORDER BY j.nextRunAt ASC, j.id ASC")
    List<Job> findDue(Instant now);

    List<Job> findByRunStartedAtIsNotNull();

    List<Job> findByEnabledTrueOrderByNextRunAtAsc();

    List<Job> findAllByOrderByCreatedAtAsc();
}
