package com.signalrelay.backend.service;

import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.dto.DryRunResponse;
import com.signalrelay.backend.dto.GatewayResponse;
import com.signalrelay.backend.dto.WebhookRequest;
import com.signalrelay.backend.exception.MalformedSignalException;
import com.signalrelay.backend.model.Side;
import com.signalrelay.backend.model.Signal;
import com.signalrelay.backend.model.SignalAudit;
import com.signalrelay.backend.model.SignalStatus;
import com.signalrelay.backend.service.execution.AggregateOutcome;
import com.signalrelay.backend.service.execution.DualExecutionRouter;
import com.signalrelay.backend.service.execution.DuplikiumRelayClient;
import com.signalrelay.backend.service.execution.OandaOrderClient;
import com.signalrelay.backend.service.execution.OrderTicket;
import com.signalrelay.backend.service.execution.TargetOutcome;
import com.signalrelay.backend.service.guard.AdmissionGuardChain;
import com.signalrelay.backend.service.guard.GuardContext;
import com.signalrelay.backend.service.guard.GuardContextAssembler;
import com.signalrelay.backend.service.guard.GuardDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs one webhook signal through parse, dedup, guards, sizing and routing. Whatever the exit, the
 * signal leaves exactly one audit record and one notification behind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalGatewayService {

    private final SignalParser signalParser;
    private final IdempotencyService idempotencyService;
    private final SymbolResolver symbolResolver;
    private final UnitConverter unitConverter;
    private final GuardContextAssembler contextAssembler;
    private final AdmissionGuardChain guardChain;
    private final PositionSizingEngine sizingEngine;
    private final DualExecutionRouter router;
    private final AuditTrailService auditTrailService;
    private final NotificationService notificationService;
    private final MetricsService metricsService;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    public GatewayResult process(WebhookRequest request) {
        metricsService.recordReceived();
        Instant now = clock.instant();
        Signal signal;
        try {
            signal = signalParser.parse(request, now);
        } catch (MalformedSignalException e) {
            log.info("Malformed signal: {}", e.getMessage());
            GatewayResponse response = GatewayResponse.builder()
                    .status(SignalStatus.ERROR)
                    .reason(e.getMessage())
                    .orderId(request == null ? null : request.getOrderId())
                    .symbol(request == null ? null : request.getSymbol())
                    .build();
            return finish(400, response, "Malformed Signal", NotificationService.RED);
        }
        try {
            return route(signal, now);
        } catch (RuntimeException e) {
            log.error("Signal {} failed with an internal fault", signal.orderId(), e);
            GatewayResponse response = base(signal)
                    .status(SignalStatus.ERROR)
                    .reason(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage())
                    .build();
            return finish(500, response, "Webhook Exception", NotificationService.RED);
        }
    }

    /**
     * Computes what {@link #process} would do without forwarding, auditing or touching the idempotency map.
     */
    public DryRunResponse preview(WebhookRequest request) {
        Instant now = clock.instant();
        Signal signal = signalParser.parsePreview(request, now);
        String instrument = symbolResolver.resolve(signal.rawSymbol());
        BigDecimal stopDelta = stopDelta(signal, instrument);
        BigDecimal stopPrice = stopDelta == null ? null : offset(signal.price(), stopDelta, signal.side(), false);
        BigDecimal targetPrice = targetPrice(signal, instrument);
        GuardContext context = contextAssembler.assemble(instrument, signal.side(), stopDelta, now);
        AdmissionGuardChain.ChainResult chain = guardChain.evaluate(context);
        PositionSizingEngine.SizingResult sizing = sizingEngine.size(instrument, context.balance().amount(),
                signal.requestedRiskPct(), signal.price(), stopPrice);
        return DryRunResponse.builder()
                .side(signal.side().name())
                .symbol(signal.rawSymbol())
                .instrument(instrument)
                .entry(signal.price())
                .slPrice(stopPrice)
                .tpPrice(targetPrice)
                .riskPctRequested(signal.requestedRiskPct())
                .riskPctApplied(sizing.appliedRiskPct())
                .units(sizing.units())
                .balance(context.balance().amount())
                .balanceDegraded(context.balance().degraded())
                .admitted(chain.admitted())
                .vetoedBy(chain.vetoDecision().map(GuardDecision::guard).orElse(null))
                .guardDecisions(chain.decisions())
                .dailyLoss(context.dailyLoss())
                .openPositionsTotal(context.positions().total())
                .openPositionsForInstrument(context.positions().countFor(instrument))
                .note("dry run only; nothing sent")
                .build();
    }

    private GatewayResult route(Signal signal, Instant now) {
        // generated ids are unique per request and never enter the dedup map
        if (!signal.generatedOrderId() && idempotencyService.seen(signal.orderId())) {
            metricsService.recordDuplicate();
            GatewayResponse response = base(signal)
                    .status(SignalStatus.IGNORED)
                    .reason("duplicate order_id")
                    .build();
            return finish(200, response, "Duplicate Signal Ignored", NotificationService.GREY);
        }

        String instrument = symbolResolver.resolve(signal.rawSymbol());
        BigDecimal stopDelta = stopDelta(signal, instrument);
        BigDecimal stopPrice = stopDelta == null ? null : offset(signal.price(), stopDelta, signal.side(), false);
        BigDecimal targetPrice = targetPrice(signal, instrument);

        GuardContext context = contextAssembler.assemble(instrument, signal.side(), stopDelta, now);
        AdmissionGuardChain.ChainResult chain = guardChain.evaluate(context);
        if (!chain.admitted()) {
            GuardDecision veto = chain.veto();
            GatewayResponse response = base(signal)
                    .status(veto.vetoStatus())
                    .reason(veto.reason())
                    .instrument(instrument)
                    .slPrice(stopPrice)
                    .tpPrice(targetPrice)
                    .vetoedBy(veto.guard())
                    .guardDecisions(chain.decisions())
                    .build();
            int httpStatus = veto.vetoStatus() == SignalStatus.SKIPPED ? 200 : 422;
            return finish(httpStatus, response, vetoTitle(veto), vetoColor(veto));
        }

        PositionSizingEngine.SizingResult sizing = sizingEngine.size(instrument, context.balance().amount(),
                signal.requestedRiskPct(), signal.price(), stopPrice);
        OrderTicket ticket = new OrderTicket(signal.orderId(), instrument, signal.side(), sizing.units(),
                signal.price(), stopPrice, targetPrice);
        AggregateOutcome outcome = router.execute(ticket);

        GatewayResponse response = base(signal)
                .status(outcome.status())
                .instrument(instrument)
                .slPrice(stopPrice)
                .tpPrice(targetPrice)
                .riskPctApplied(sizing.appliedRiskPct())
                .units(sizing.units())
                .guardDecisions(chain.decisions())
                .targets(outcome.outcomes())
                .build();
        return switch (outcome.status()) {
            case OK -> finish(200, response, "New Signal", NotificationService.GREEN);
            case PARTIAL -> finish(200, response, "New Signal (partial)", NotificationService.ORANGE);
            default -> finish(500, response, "Execution Error", NotificationService.RED);
        };
    }

    private GatewayResponse.GatewayResponseBuilder base(Signal signal) {
        return GatewayResponse.builder()
                .orderId(signal.orderId())
                .symbol(signal.rawSymbol())
                .side(signal.side().name())
                .price(signal.price())
                .riskPctRequested(signal.requestedRiskPct())
                .dryRun(tradingProperties.isDryRun())
                .tradingEnabled(tradingProperties.isEnabled());
    }

    private BigDecimal stopDelta(Signal signal, String instrument) {
        if (!signal.hasStop()) {
            return null;
        }
        return unitConverter.toPriceDelta(instrument, signal.stop().value(), signal.stop().unit());
    }

    private BigDecimal targetPrice(Signal signal, String instrument) {
        if (!signal.hasTarget()) {
            return null;
        }
        BigDecimal delta = unitConverter.toPriceDelta(instrument, signal.target().value(), signal.target().unit());
        return offset(signal.price(), delta, signal.side(), true);
    }

    /**
     * Stops sit below a BUY and above a SELL; targets the other way round.
     */
    static BigDecimal offset(BigDecimal price, BigDecimal delta, Side side, boolean target) {
        boolean up = (side == Side.BUY) == target;
        return up ? price.add(delta) : price.subtract(delta);
    }

    private GatewayResult finish(int httpStatus, GatewayResponse response, String title, int color) {
        metricsService.recordOutcome(response.getStatus());
        auditTrailService.record(toAudit(response));
        try {
            notificationService.publish(title, notificationFields(response), color);
        } catch (RuntimeException e) {
            log.warn("Could not queue notification for {}: {}", response.getOrderId(), e.getMessage());
        }
        return new GatewayResult(httpStatus, response);
    }

    private SignalAudit toAudit(GatewayResponse response) {
        TargetOutcome broker = findTarget(response, OandaOrderClient.NAME);
        TargetOutcome relay = findTarget(response, DuplikiumRelayClient.NAME);
        return SignalAudit.builder()
                .orderId(truncate(response.getOrderId(), 128))
                .rawSymbol(truncate(response.getSymbol(), 64))
                .instrument(truncate(response.getInstrument(), 64))
                .side(response.getSide())
                .price(response.getPrice())
                .slPrice(response.getSlPrice())
                .tpPrice(response.getTpPrice())
                .riskPctApplied(response.getRiskPctApplied())
                .units(response.getUnits())
                .status(response.getStatus())
                .reason(truncate(response.getReason(), 512))
                .guardDecisions(truncate(describe(response.getGuardDecisions()), 2000))
                .brokerMessage(broker == null ? null : truncate(broker.message(), 1000))
                .relayStatus(relay == null ? null : relay.statusCode())
                .dryRun(tradingProperties.isDryRun())
                .build();
    }

    private Map<String, Object> notificationFields(GatewayResponse response) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("status", response.getStatus().wireName());
        fields.put("order_id", response.getOrderId());
        fields.put("symbol", response.getSymbol());
        if (response.getInstrument() != null) {
            fields.put("instrument", response.getInstrument());
        }
        fields.put("side", response.getSide());
        fields.put("price", response.getPrice());
        if (response.getUnits() != null) {
            fields.put("units", response.getUnits());
            fields.put("risk_pct", response.getRiskPctApplied());
            fields.put("sl", response.getSlPrice());
            fields.put("tp", response.getTpPrice());
        }
        if (response.getReason() != null) {
            fields.put("reason", response.getReason());
        }
        if (response.getTargets() != null) {
            response.getTargets().forEach(outcome -> fields.put(outcome.target(),
                    outcome.statusCode() + " " + truncate(outcome.message(), 200)));
        }
        return fields;
    }

    private static TargetOutcome findTarget(GatewayResponse response, String name) {
        if (response.getTargets() == null) {
            return null;
        }
        return response.getTargets().stream().filter(t -> t.target().equals(name)).findFirst().orElse(null);
    }

    private static String describe(List<GuardDecision> decisions) {
        if (decisions == null || decisions.isEmpty()) {
            return null;
        }
        return decisions.stream()
                .map(d -> d.guard() + ":" + (d.allowed() ? "allow" : d.vetoStatus().wireName() + "(" + d.reason() + ")"))
                .collect(Collectors.joining("; "));
    }

    private static String vetoTitle(GuardDecision veto) {
        return switch (veto.guard()) {
            case "kill_switch" -> "Trading Disabled";
            case "trading_window" -> "Blocked by Trading Window";
            case "daily_loss_stop" -> "Blocked by Daily Loss Stop";
            default -> "Rejected by " + veto.guard();
        };
    }

    private static int vetoColor(GuardDecision veto) {
        return switch (veto.guard()) {
            case "kill_switch" -> NotificationService.YELLOW;
            case "trading_window" -> NotificationService.AMBER;
            default -> NotificationService.RED;
        };
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
