package com.signalrelay.backend.service;

import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.dto.WebhookRequest;
import com.signalrelay.backend.exception.MalformedSignalException;
import com.signalrelay.backend.model.Distance;
import com.signalrelay.backend.model.Side;
import com.signalrelay.backend.model.Signal;
import com.signalrelay.backend.model.UnitKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Validates webhook bodies into {@link Signal}s.
 */
@Component
@RequiredArgsConstructor
public class SignalParser {

    static final String PREVIEW_SYMBOL = "US30";
    static final BigDecimal PREVIEW_PRICE = new BigDecimal("39250");
    static final BigDecimal PREVIEW_SL = new BigDecimal("150");
    static final BigDecimal PREVIEW_TP = new BigDecimal("300");

    private final TradingProperties tradingProperties;

    public Signal parse(WebhookRequest request, Instant receivedAt) {
        if (request == null) {
            throw new MalformedSignalException("No data received");
        }
        Side side = Side.fromAlertText(request.getAction() != null && !request.getAction().isBlank()
                        ? request.getAction() : request.getSignal())
                .orElseThrow(() -> new MalformedSignalException("Missing side/symbol"));
        String symbol = request.getSymbol() == null ? "" : request.getSymbol().trim().toUpperCase(Locale.ROOT);
        if (symbol.isEmpty()) {
            throw new MalformedSignalException("Missing side/symbol");
        }
        BigDecimal price = request.getPrice();
        if (price == null || price.signum() <= 0) {
            throw new MalformedSignalException("Missing or non-positive price");
        }
        boolean generated = request.getOrderId() == null || request.getOrderId().isBlank();
        String orderId = generated ? generateOrderId() : request.getOrderId().trim();
        double riskPct = request.getRiskPct() == null ? tradingProperties.getDefaultRiskPct() : request.getRiskPct();
        return new Signal(
                side,
                symbol,
                price,
                distance(request.getSl(), request.getSlType()),
                distance(request.getTp(), request.getTpType()),
                riskPct,
                orderId,
                generated,
                receivedAt
        );
    }

    /**
     * Same as {@link #parse} but fills absent fields with preview defaults: a BUY on US30 at 39250 with
     * a 150 point stop and a 300 point target.
     */
    public Signal parsePreview(WebhookRequest request, Instant receivedAt) {
        WebhookRequest source = request == null ? new WebhookRequest() : request;
        WebhookRequest filled = WebhookRequest.builder()
                .action(firstNonBlank(source.getAction(), source.getSignal(), "BUY_SIGNAL"))
                .symbol(firstNonBlank(source.getSymbol(), PREVIEW_SYMBOL))
                .price(source.getPrice() == null ? PREVIEW_PRICE : source.getPrice())
                .orderId(source.getOrderId())
                .sl(source.getSl() == null ? PREVIEW_SL : source.getSl())
                .slType(source.getSlType())
                .tp(source.getTp() == null ? PREVIEW_TP : source.getTp())
                .tpType(source.getTpType())
                .riskPct(source.getRiskPct())
                .build();
        return parse(filled, receivedAt);
    }

    static String generateOrderId() {
        return "tv-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    private static Distance distance(BigDecimal value, String unit) {
        return value == null ? null : new Distance(value, UnitKind.parse(unit));
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
