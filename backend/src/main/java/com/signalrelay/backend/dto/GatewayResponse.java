package com.signalrelay.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.signalrelay.backend.model.SignalStatus;
import com.signalrelay.backend.service.execution.TargetOutcome;
import com.signalrelay.backend.service.guard.GuardDecision;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayResponse {

    private SignalStatus status;
    private String reason;
    private String orderId;
    private String symbol;
    private String instrument;
    private String side;
    private BigDecimal price;
    private BigDecimal slPrice;
    private BigDecimal tpPrice;
    private Double riskPctRequested;
    private Double riskPctApplied;
    private Integer units;
    private Boolean dryRun;
    private Boolean tradingEnabled;
    private String vetoedBy;
    private List<GuardDecision> guardDecisions;
    private List<TargetOutcome> targets;
}
