package com.signalrelay.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "equity_snapshot")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquitySnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "balance", nullable = false, precision = 24, scale = 8)
    private BigDecimal balance;

    @Column(name = "source", nullable = false, length = 32)
    private String source;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;
}
