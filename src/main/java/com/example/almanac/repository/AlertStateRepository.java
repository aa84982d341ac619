package com.example.almanac.repository;

import com.example.almanac.domain.AlertState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AlertStateRepository extends JpaRepository<AlertState, String> {
}
