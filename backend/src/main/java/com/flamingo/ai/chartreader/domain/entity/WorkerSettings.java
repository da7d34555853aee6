package com.flamingo.ai.chartreader.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Operator-tunable worker settings, stored as a single row and re-read on every poll. */
@Entity
@Table(name = "worker_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkerSettings {

  public static final long SINGLETON_ID = 1L;

  @Id @Builder.Default private Long id = SINGLETON_ID;

  @Column(nullable = false)
  private int concurrency;

  @Column(nullable = false)
  private boolean paused;

  @Column(nullable = false)
  private String model;
}
