package com.vedant.analyticsbot.repository;

import com.vedant.analyticsbot.entity.QueryHistory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface QueryHistoryRepository extends JpaRepository<QueryHistory, Long> {

    List<QueryHistory> findTop20BySessionIdOrderByExecutedAtDesc(String sessionId);
}
