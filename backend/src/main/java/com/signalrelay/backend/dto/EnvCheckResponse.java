package com.signalrelay.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Effective configuration. Tokens are masked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnvCheckResponse {

    private boolean tradingEnabled;
    private boolean dryRun;
    private String timezone;
    private String tradingWindow;
    private List<String> allowlist;
    private double maxRiskPct;
    private int maxUnits;
    private double fallbackBalance;
    private double dailyLossStopPct;
    private int maxOpenPositions;
    private int maxOpenPerInstrument;
    private Map<String, Double> symbolRiskCaps;
    private boolean forwardToOanda;
    private String oandaBaseUrl;
    private String oandaAccountId;
    private String oandaToken;
    private boolean forwardToDuplikium;
    private String duplikiumBaseUrl;
    private String duplikiumUser;
    private String duplikiumToken;
    private String duplikiumAuthStyle;
    private String duplikiumOrdersPath;
    private boolean discordWebhookSet;
}
