package com.signalrelay.backend.controller;

import com.signalrelay.backend.dto.DryRunResponse;
import com.signalrelay.backend.dto.EnvCheckResponse;
import com.signalrelay.backend.dto.GatewayResponse;
import com.signalrelay.backend.dto.RiskStatusResponse;
import com.signalrelay.backend.dto.WebhookRequest;
import com.signalrelay.backend.service.GatewayResult;
import com.signalrelay.backend.service.GatewayStatusService;
import com.signalrelay.backend.service.SignalGatewayService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "Signal Gateway")
public class WebhookController {

    private final SignalGatewayService gatewayService;
    private final GatewayStatusService statusService;

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Liveness")
    public String home() {
        return "Trade Execution Server is running";
    }

    @PostMapping("/webhook")
    @Operation(summary = "Receive a trading alert and route it to the broker and the copy-trade relay")
    public ResponseEntity<GatewayResponse> webhook(@RequestBody(required = false) WebhookRequest request) {
        GatewayResult result = gatewayService.process(request);
        return ResponseEntity.status(result.httpStatus()).body(result.body());
    }

    @PostMapping("/dryrun")
    @Operation(summary = "Compute mapping, stop/target and sizing for an alert without sending anything")
    public DryRunResponse dryRun(@RequestBody(required = false) WebhookRequest request) {
        return gatewayService.preview(request);
    }

    @GetMapping("/env-check")
    @Operation(summary = "Effective configuration with secrets masked")
    public EnvCheckResponse envCheck() {
        return statusService.envCheck();
    }

    @GetMapping("/risk-status")
    @Operation(summary = "Balance, caps and guard state")
    public RiskStatusResponse riskStatus() {
        return statusService.riskStatus();
    }
}
