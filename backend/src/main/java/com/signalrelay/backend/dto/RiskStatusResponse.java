package com.signalrelay.backend.dto;

import com.signalrelay.backend.service.DailyLossService.DailyLossStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskStatusResponse {

    private BigDecimal balance;
    private boolean balanceDegraded;       // true when the fallback balance is in use
    private double maxRiskPct;
    private int maxUnits;
    private Set<String> allowlist;
    private Map<String, Double> symbolRiskCaps;
    private Map<String, Integer> symbolUnitCaps;
    private boolean tradingEnabled;
    private boolean tradingWindowOk;
    private String tradingWindowReason;
    private DailyLossStatus dailyLoss;
    private int openPositionsTotal;
    private Map<String, Integer> openPositionsByInstrument;
    private boolean positionsDegraded;
}
