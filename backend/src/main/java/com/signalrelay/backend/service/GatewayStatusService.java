package com.signalrelay.backend.service;

import com.signalrelay.backend.config.NotificationProperties;
import com.signalrelay.backend.config.OandaProperties;
import com.signalrelay.backend.config.RelayProperties;
import com.signalrelay.backend.config.RiskProperties;
import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.dto.EnvCheckResponse;
import com.signalrelay.backend.dto.RiskStatusResponse;
import com.signalrelay.backend.model.RiskPolicy;
import com.signalrelay.backend.service.oracle.BalanceOracle;
import com.signalrelay.backend.service.oracle.BalanceReading;
import com.signalrelay.backend.service.oracle.PositionCensus;
import com.signalrelay.backend.service.oracle.PositionCensusReading;
import com.signalrelay.backend.util.SecretMasker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

@Service
@RequiredArgsConstructor
public class GatewayStatusService {

    private final TradingProperties tradingProperties;
    private final RiskProperties riskProperties;
    private final OandaProperties oandaProperties;
    private final RelayProperties relayProperties;
    private final NotificationProperties notificationProperties;
    private final RiskPolicy riskPolicy;
    private final BalanceOracle balanceOracle;
    private final PositionCensus positionCensus;
    private final TradingWindowService tradingWindowService;
    private final DailyLossService dailyLossService;
    private final Clock clock;

    public EnvCheckResponse envCheck() {
        return EnvCheckResponse.builder()
                .tradingEnabled(tradingProperties.isEnabled())
                .dryRun(tradingProperties.isDryRun())
                .timezone(tradingProperties.getTimezone())
                .tradingWindow(tradingProperties.getWindow())
                .allowlist(tradingProperties.getAllowlist())
                .maxRiskPct(riskProperties.getMaxRiskPct())
                .maxUnits(riskProperties.getMaxUnits())
                .fallbackBalance(riskProperties.getFallbackBalance())
                .dailyLossStopPct(riskProperties.getDailyLossStopPct())
                .maxOpenPositions(riskProperties.getMaxOpenPositions())
                .maxOpenPerInstrument(riskProperties.getMaxOpenPerInstrument())
                .symbolRiskCaps(riskPolicy.riskCaps())
                .forwardToOanda(oandaProperties.isForward())
                .oandaBaseUrl(oandaProperties.getBaseUrl())
                .oandaAccountId(oandaProperties.getAccountId())
                .oandaToken(SecretMasker.mask(oandaProperties.getToken()))
                .forwardToDuplikium(relayProperties.isForward())
                .duplikiumBaseUrl(relayProperties.getBaseUrl())
                .duplikiumUser(relayProperties.getUser())
                .duplikiumToken(SecretMasker.mask(relayProperties.getToken()))
                .duplikiumAuthStyle(relayProperties.getAuthStyle().name().toLowerCase(Locale.ROOT))
                .duplikiumOrdersPath(relayProperties.getOrdersPath())
                .discordWebhookSet(notificationProperties.isActive())
                .build();
    }

    public RiskStatusResponse riskStatus() {
        Instant now = clock.instant();
        BalanceReading balance = balanceOracle.currentBalance();
        PositionCensusReading positions = positionCensus.openPositions();
        TradingWindowService.WindowDecision window = tradingWindowService.evaluate(now);
        return RiskStatusResponse.builder()
                .balance(balance.amount())
                .balanceDegraded(balance.degraded())
                .maxRiskPct(riskPolicy.maxRiskPct())
                .maxUnits(riskPolicy.maxUnits())
                .allowlist(riskPolicy.allowlist())
                .symbolRiskCaps(riskPolicy.riskCaps())
                .symbolUnitCaps(riskPolicy.unitCaps())
                .tradingEnabled(tradingProperties.isEnabled())
                .tradingWindowOk(window.allowed())
                .tradingWindowReason(window.reason())
                .dailyLoss(dailyLossService.evaluate(balance, now))
                .openPositionsTotal(positions.total())
                .openPositionsByInstrument(positions.perInstrument())
                .positionsDegraded(positions.degraded())
                .build();
    }
}
