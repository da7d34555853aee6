package com.flamingo.ai.chartreader.domain.repository;

import com.flamingo.ai.chartreader.domain.entity.WorkerSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for the single worker settings row. */
@Repository
public interface WorkerSettingsRepository extends JpaRepository<WorkerSettings, Long> {}
