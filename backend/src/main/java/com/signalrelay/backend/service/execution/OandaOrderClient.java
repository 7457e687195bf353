package com.signalrelay.backend.service.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalrelay.backend.config.OandaProperties;
import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.exception.DownstreamException;
import com.signalrelay.backend.service.OandaHttpClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Places market orders on the OANDA master account.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class OandaOrderClient implements ExecutionTarget {

    public static final String NAME = "oanda";

    private final OandaHttpClient httpClient;
    private final OandaProperties oandaProperties;
    private final TradingProperties tradingProperties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public TargetOutcome submit(OrderTicket ticket) {
        if (tradingProperties.isDryRun() || !oandaProperties.isForward() || !tradingProperties.isEnabled()) {
            return TargetOutcome.noop(NAME, "OANDA not called (dry run / forwarding disabled / trading disabled)");
        }
        Map<String, Object> order = new LinkedHashMap<>();
        order.put("instrument", ticket.instrument());
        order.put("units", String.valueOf(ticket.signedUnits()));
        order.put("type", "MARKET");
        order.put("positionFill", "DEFAULT");
        try {
            JsonNode response = httpClient.post(httpClient.accountPath("/orders"), Map.of("order", order));
            for (String rejection : new String[]{"orderCancelTransaction", "orderRejectTransaction"}) {
                if (response.hasNonNull(rejection)) {
                    String reason = response.path(rejection).path("reason").asText("UNKNOWN");
                    log.warn("OANDA refused order {}: {}", ticket.orderId(), reason);
                    return TargetOutcome.failure(NAME, 422, "OANDA order failed: " + reason);
                }
            }
            String fillId = response.path("orderFillTransaction").path("id").asText("");
            log.info("OANDA order placed for {} units={} fill={}", ticket.instrument(), ticket.signedUnits(), fillId);
            return TargetOutcome.success(NAME, 201, fillId.isEmpty() ? "OANDA order placed" : "OANDA order placed (" + fillId + ")");
        } catch (DownstreamException e) {
            return TargetOutcome.failure(NAME, e.getStatusCode(), "OANDA order failed: " + e.getMessage());
        }
    }
}
