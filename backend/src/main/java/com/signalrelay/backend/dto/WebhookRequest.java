package com.signalrelay.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Alert body as posted by the charting platform. Side comes from either {@code action} or {@code signal}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookRequest {

    private String action;

    private String signal;

    private String symbol;

    private BigDecimal price;

    @JsonProperty("order_id")
    private String orderId;

    private BigDecimal sl;

    @JsonProperty("sl_type")
    private String slType;

    private BigDecimal tp;

    @JsonProperty("tp_type")
    private String tpType;

    @JsonProperty("risk_pct")
    private Double riskPct;
}
