package com.signalrelay.backend.service;

import com.signalrelay.backend.model.SignalAudit;
import com.signalrelay.backend.repository.SignalAuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class AuditTrailService {

    private final SignalAuditRepository repository;
    private final Clock clock;

    /**
     * Appends one record. Storage trouble is logged and swallowed so the signal still gets a response.
     */
    public void record(SignalAudit audit) {
        try {
            audit.setCorrelationId(MDC.get("correlationId"));
            audit.setCreatedAt(clock.instant());
            repository.save(audit);
        } catch (Exception e) {
            log.warn("Failed to record audit for order {} ({}): {}", audit.getOrderId(), audit.getStatus(), e.getMessage());
        }
    }

    public List<SignalAudit> history() {
        return repository.findAllByOrderByCreatedAtAsc();
    }
}
