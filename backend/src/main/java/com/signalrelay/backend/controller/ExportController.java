package com.signalrelay.backend.controller;

import com.signalrelay.backend.model.EquitySnapshot;
import com.signalrelay.backend.model.SignalAudit;
import com.signalrelay.backend.service.AuditTrailService;
import com.signalrelay.backend.service.EquityCurveService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/download")
@RequiredArgsConstructor
@Tag(name = "Exports")
public class ExportController {

    private final AuditTrailService auditTrailService;
    private final EquityCurveService equityCurveService;

    @GetMapping(value = "/trades", produces = "text/csv")
    @Operation(summary = "Export the signal audit log as CSV")
    public ResponseEntity<byte[]> exportTrades() {
        StringBuilder csv = new StringBuilder("timestamp,order_id,symbol,instrument,side,price,sl_price,tp_price,risk_pct,units,status,reason,dry_run\n");
        for (SignalAudit audit : auditTrailService.history()) {
            csv.append(audit.getCreatedAt()).append(',')
                    .append(cell(audit.getOrderId())).append(',')
                    .append(cell(audit.getRawSymbol())).append(',')
                    .append(cell(audit.getInstrument())).append(',')
                    .append(cell(audit.getSide())).append(',')
                    .append(cell(audit.getPrice())).append(',')
                    .append(cell(audit.getSlPrice())).append(',')
                    .append(cell(audit.getTpPrice())).append(',')
                    .append(cell(audit.getRiskPctApplied())).append(',')
                    .append(cell(audit.getUnits())).append(',')
                    .append(audit.getStatus().wireName()).append(',')
                    .append(cell(audit.getReason())).append(',')
                    .append(audit.isDryRun()).append('\n');
        }
        return csv("trades.csv", csv);
    }

    @GetMapping(value = "/equity", produces = "text/csv")
    @Operation(summary = "Export the equity series as CSV")
    public ResponseEntity<byte[]> exportEquity() {
        StringBuilder csv = new StringBuilder("timestamp,balance,source\n");
        for (EquitySnapshot snapshot : equityCurveService.history()) {
            csv.append(snapshot.getRecordedAt()).append(',')
                    .append(snapshot.getBalance().toPlainString()).append(',')
                    .append(cell(snapshot.getSource())).append('\n');
        }
        return csv("equity.csv", csv);
    }

    private ResponseEntity<byte[]> csv(String filename, StringBuilder body) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + filename)
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(body.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static String cell(Object value) {
        if (value == null) {
            return "";
        }
        String text = value instanceof BigDecimal decimal ? decimal.toPlainString() : value.toString();
        if (text.contains(",") || text.contains("\"") || text.contains("\n")) {
            return "\"" + text.replace("\"", "\"\"") + "\"";
        }
        return text;
    }
}
