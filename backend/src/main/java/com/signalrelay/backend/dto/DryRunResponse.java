package com.signalrelay.backend.dto;

import com.signalrelay.backend.service.DailyLossService.DailyLossStatus;
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
public class DryRunResponse {

    private String side;
    private String symbol;
    private String instrument;
    private BigDecimal entry;
    private BigDecimal slPrice;
    private BigDecimal tpPrice;
    private double riskPctRequested;
    private double riskPctApplied;
    private int units;
    private BigDecimal balance;
    private boolean balanceDegraded;
    private boolean admitted;
    private String vetoedBy;
    private List<GuardDecision> guardDecisions;
    private DailyLossStatus dailyLoss;
    private int openPositionsTotal;
    private int openPositionsForInstrument;
    private String note;
}
