package com.signalrelay.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
@Table(name = "signal_audit")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalAudit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", length = 128)
    private String orderId;

    @Column(name = "raw_symbol", length = 64)
    private String rawSymbol;

    @Column(name = "instrument", length = 64)
    private String instrument;

    @Column(name = "side", length = 8)
    private String side;

    @Column(name = "price", precision = 24, scale = 8)
    private BigDecimal price;

    @Column(name = "sl_price", precision = 24, scale = 8)
    private BigDecimal slPrice;

    @Column(name = "tp_price", precision = 24, scale = 8)
    private BigDecimal tpPrice;

    @Column(name = "risk_pct_applied")
    private Double riskPctApplied;

    @Column(name = "units")
    private Integer units;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private SignalStatus status;

    @Column(name = "reason", length = 512)
    private String reason;

    @Column(name = "guard_decisions", length = 2000)
    private String guardDecisions;

    @Column(name = "broker_message", length = 1000)
    private String brokerMessage;

    @Column(name = "relay_status")
    private Integer relayStatus;

    @Column(name = "dry_run", nullable = false)
    private boolean dryRun;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
