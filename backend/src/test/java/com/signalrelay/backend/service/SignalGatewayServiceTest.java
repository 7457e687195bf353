package com.signalrelay.backend.service;

import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.dto.DryRunResponse;
import com.signalrelay.backend.dto.WebhookRequest;
import com.signalrelay.backend.model.RiskPolicy;
import com.signalrelay.backend.model.SignalAudit;
import com.signalrelay.backend.model.SignalStatus;
import com.signalrelay.backend.service.execution.AggregateOutcome;
import com.signalrelay.backend.service.execution.DualExecutionRouter;
import com.signalrelay.backend.service.execution.OrderTicket;
import com.signalrelay.backend.service.execution.TargetOutcome;
import com.signalrelay.backend.service.guard.AdmissionGuardChain;
import com.signalrelay.backend.service.guard.AllowListGuard;
import com.signalrelay.backend.service.guard.ConcurrencyGuard;
import com.signalrelay.backend.service.guard.DailyLossGuard;
import com.signalrelay.backend.service.guard.GuardContextAssembler;
import com.signalrelay.backend.service.guard.KillSwitchGuard;
import com.signalrelay.backend.service.guard.MinStopDistanceGuard;
import com.signalrelay.backend.service.guard.TradingWindowGuard;
import com.signalrelay.backend.service.oracle.BalanceOracle;
import com.signalrelay.backend.service.oracle.BalanceReading;
import com.signalrelay.backend.service.oracle.PositionCensus;
import com.signalrelay.backend.service.oracle.PositionCensusReading;
import com.signalrelay.backend.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SignalGatewayServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-04T15:00:00Z"));
    private final TradingProperties trading = new TradingProperties();
    private final BalanceOracle balanceOracle = mock(BalanceOracle.class);
    private final PositionCensus census = mock(PositionCensus.class);
    private final EquityCurveService equityCurve = mock(EquityCurveService.class);
    private final DualExecutionRouter router = mock(DualExecutionRouter.class);
    private final AuditTrailService auditTrail = mock(AuditTrailService.class);
    private final NotificationService notifications = mock(NotificationService.class);

    private PositionSizingEngine sizer;

    @BeforeEach
    void setUp() {
        trading.setDryRun(true);
        trading.setTimezone("America/Halifax");
        when(balanceOracle.currentBalance()).thenReturn(BalanceReading.live(new BigDecimal("1000000")));
        when(census.openPositions()).thenReturn(PositionCensusReading.empty(false));
        when(equityCurve.firstSince(any())).thenReturn(Optional.empty());
        when(router.execute(any())).thenReturn(new AggregateOutcome(SignalStatus.OK, List.of(
                TargetOutcome.noop("oanda", "dry run"), TargetOutcome.noop("duplikium", "dry run"))));
    }

    private SignalGatewayService gateway(double dailyLossPct, int maxPerInstrument) {
        RiskPolicy policy = new RiskPolicy(0.5, 300000, dailyLossPct, 0, maxPerInstrument,
                Map.of(), Map.of(), Map.of(), Map.of(), Set.of("US30_USD", "NAS100_USD", "XAU_USD", "EUR_USD"));
        InstrumentCatalog catalog = TestInstruments.catalog();
        MetricsService metrics = new MetricsService(new SimpleMeterRegistry());
        metrics.init();
        DailyLossService dailyLoss = new DailyLossService(policy, trading, equityCurve);
        AdmissionGuardChain chain = new AdmissionGuardChain(List.of(
                new KillSwitchGuard(),
                new TradingWindowGuard(new TradingWindowService(trading)),
                new DailyLossGuard(),
                new ConcurrencyGuard(),
                new MinStopDistanceGuard(),
                new AllowListGuard()), policy, metrics);
        sizer = spy(new PositionSizingEngine(policy));
        return new SignalGatewayService(
                new SignalParser(trading),
                new IdempotencyService(trading, clock),
                new SymbolResolver(catalog),
                new UnitConverter(catalog),
                new GuardContextAssembler(balanceOracle, census, dailyLoss, equityCurve, trading),
                chain,
                sizer,
                router,
                auditTrail,
                notifications,
                metrics,
                trading,
                clock);
    }

    private static WebhookRequest us30Buy(String orderId) {
        return WebhookRequest.builder()
                .symbol("US30")
                .action("BUY")
                .price(new BigDecimal("39250"))
                .sl(new BigDecimal("150"))
                .slType("points")
                .tp(new BigDecimal("300"))
                .tpType("points")
                .riskPct(0.05)
                .orderId(orderId)
                .build();
    }

    @Test
    void dryRunSignalIsSizedAndRouted() {
        GatewayResult result = gateway(0, 0).process(us30Buy("tv-a"));

        assertThat(result.httpStatus()).isEqualTo(200);
        assertThat(result.body().getStatus()).isEqualTo(SignalStatus.OK);
        assertThat(result.body().getInstrument()).isEqualTo("US30_USD");
        assertThat(result.body().getUnits()).isEqualTo(3);
        assertThat(result.body().getSlPrice()).isEqualByComparingTo("39100");
        assertThat(result.body().getTpPrice()).isEqualByComparingTo("39550");
        ArgumentCaptor<OrderTicket> ticket = ArgumentCaptor.forClass(OrderTicket.class);
        verify(router).execute(ticket.capture());
        assertThat(ticket.getValue().units()).isEqualTo(3);
        verify(auditTrail, times(1)).record(any());
        verify(notifications, times(1)).publish(eq("New Signal"), anyMap(), eq(NotificationService.GREEN));
    }

    @Test
    void sellFlipsStopAndTarget() {
        WebhookRequest request = us30Buy("tv-sell");
        request.setAction(null);
        request.setSignal("SELL_SIGNAL");

        GatewayResult result = gateway(0, 0).process(request);

        assertThat(result.body().getSide()).isEqualTo("SELL");
        assertThat(result.body().getSlPrice()).isEqualByComparingTo("39400");
        assertThat(result.body().getTpPrice()).isEqualByComparingTo("38950");
    }

    @Test
    void dailyLossStopRejectsWithoutRouting() {
        when(balanceOracle.currentBalance()).thenReturn(BalanceReading.live(new BigDecimal("9800")));
        when(equityCurve.firstSince(any())).thenReturn(Optional.of(new BigDecimal("10000")));

        GatewayResult result = gateway(1.5, 0).process(us30Buy("tv-b"));

        assertThat(result.httpStatus()).isEqualTo(422);
        assertThat(result.body().getStatus()).isEqualTo(SignalStatus.REJECTED);
        assertThat(result.body().getVetoedBy()).isEqualTo("daily_loss_stop");
        verify(router, never()).execute(any());
        verify(auditTrail, times(1)).record(any());
    }

    @Test
    void duplicateOrderIdIsIgnored() {
        SignalGatewayService gateway = gateway(0, 0);

        GatewayResult first = gateway.process(us30Buy("tv-c"));
        GatewayResult second = gateway.process(us30Buy("tv-c"));

        assertThat(first.body().getStatus()).isEqualTo(SignalStatus.OK);
        assertThat(second.httpStatus()).isEqualTo(200);
        assertThat(second.body().getStatus()).isEqualTo(SignalStatus.IGNORED);
        assertThat(second.body().getReason()).isEqualTo("duplicate order_id");
        verify(router, times(1)).execute(any());
        verify(census, times(1)).openPositions();
        ArgumentCaptor<SignalAudit> audits = ArgumentCaptor.forClass(SignalAudit.class);
        verify(auditTrail, times(2)).record(audits.capture());
        assertThat(audits.getAllValues()).extracting(SignalAudit::getStatus)
                .containsExactly(SignalStatus.OK, SignalStatus.IGNORED);
    }

    @Test
    void instrumentConcurrencyCapRejects() {
        when(census.openPositions()).thenReturn(new PositionCensusReading(2, Map.of("US30_USD", 2), false));

        GatewayResult result = gateway(0, 2).process(us30Buy("tv-d"));

        assertThat(result.httpStatus()).isEqualTo(422);
        assertThat(result.body().getVetoedBy()).isEqualTo("concurrency");
        verify(router, never()).execute(any());
    }

    @Test
    void symbolOutsideAllowListNeverReachesSizerOrRouter() {
        WebhookRequest request = us30Buy("tv-btc");
        request.setSymbol("BTCUSD");

        GatewayResult result = gateway(0, 0).process(request);

        assertThat(result.body().getStatus()).isEqualTo(SignalStatus.REJECTED);
        assertThat(result.body().getVetoedBy()).isEqualTo("allowlist");
        verify(sizer, never()).size(anyString(), any(), anyDouble(), any(), any());
        verify(router, never()).execute(any());
    }

    @Test
    void aliasesOfAllowedSymbolsAreAccepted() {
        WebhookRequest request = us30Buy("tv-alias");
        request.setSymbol("OANDA:US30USD");

        assertThat(gateway(0, 0).process(request).body().getStatus()).isEqualTo(SignalStatus.OK);
    }

    @Test
    void killSwitchSkipsButStillAudits() {
        trading.setEnabled(false);

        GatewayResult result = gateway(0, 0).process(us30Buy("tv-off"));

        assertThat(result.httpStatus()).isEqualTo(200);
        assertThat(result.body().getStatus()).isEqualTo(SignalStatus.SKIPPED);
        verify(router, never()).execute(any());
        verify(auditTrail).record(any());
        verify(notifications).publish(eq("Trading Disabled"), anyMap(), eq(NotificationService.YELLOW));
    }

    @Test
    void malformedSignalIsRejectedBeforeGuards() {
        WebhookRequest request = us30Buy("tv-bad");
        request.setAction("HOLD");

        GatewayResult result = gateway(0, 0).process(request);

        assertThat(result.httpStatus()).isEqualTo(400);
        assertThat(result.body().getStatus()).isEqualTo(SignalStatus.ERROR);
        verify(balanceOracle, never()).currentBalance();
        verify(auditTrail).record(any());
    }

    @Test
    void missingBodyIsMalformed() {
        GatewayResult result = gateway(0, 0).process(null);

        assertThat(result.httpStatus()).isEqualTo(400);
        assertThat(result.body().getReason()).isEqualTo("No data received");
    }

    @Test
    void missingOrderIdIsGenerated() {
        GatewayResult result = gateway(0, 0).process(us30Buy(null));

        assertThat(result.body().getOrderId()).matches("tv-[0-9a-f]{8}");
    }

    @Test
    void routingFailureOfBothTargetsIsError() {
        when(router.execute(any())).thenReturn(new AggregateOutcome(SignalStatus.ERROR, List.of(
                TargetOutcome.failure("oanda", 401, "unauthorized"), TargetOutcome.failure("duplikium", 500, "down"))));

        GatewayResult result = gateway(0, 0).process(us30Buy("tv-err"));

        assertThat(result.httpStatus()).isEqualTo(500);
        assertThat(result.body().getStatus()).isEqualTo(SignalStatus.ERROR);
        ArgumentCaptor<SignalAudit> audit = ArgumentCaptor.forClass(SignalAudit.class);
        verify(auditTrail).record(audit.capture());
        assertThat(audit.getValue().getRelayStatus()).isEqualTo(500);
        assertThat(audit.getValue().getBrokerMessage()).isEqualTo("unauthorized");
    }

    @Test
    void internalFaultBecomesErrorOutcome() {
        when(router.execute(any())).thenThrow(new IllegalStateException("boom"));

        GatewayResult result = gateway(0, 0).process(us30Buy("tv-boom"));

        assertThat(result.httpStatus()).isEqualTo(500);
        assertThat(result.body().getReason()).isEqualTo("boom");
        verify(auditTrail, times(1)).record(any());
        verify(notifications).publish(eq("Webhook Exception"), anyMap(), anyInt());
    }

    @Test
    void previewNeverRoutesAuditsOrRemembersTheOrderId() {
        SignalGatewayService gateway = gateway(0, 0);

        DryRunResponse preview = gateway.preview(WebhookRequest.builder().orderId("tv-preview").build());
        GatewayResult real = gateway.process(us30Buy("tv-preview"));

        assertThat(preview.getInstrument()).isEqualTo("US30_USD");
        assertThat(preview.getUnits()).isEqualTo(3);
        assertThat(preview.getSlPrice()).isEqualByComparingTo("39100");
        assertThat(preview.isAdmitted()).isTrue();
        assertThat(real.body().getStatus()).isEqualTo(SignalStatus.OK);
        verify(router, times(1)).execute(any());
        verify(auditTrail, times(1)).record(any());
    }
}
