package com.signalrelay.backend.service;

import com.signalrelay.backend.model.EquitySnapshot;
import com.signalrelay.backend.repository.EquitySnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only balance series. Writes are best effort and never fail the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EquityCurveService {

    private final EquitySnapshotRepository repository;
    private final Clock clock;

    public void record(BigDecimal balance, String source) {
        try {
            repository.save(EquitySnapshot.builder()
                    .balance(balance)
                    .source(source)
                    .recordedAt(clock.instant())
                    .build());
        } catch (Exception e) {
            log.warn("Failed to record equity snapshot {} ({}): {}", balance, source, e.getMessage());
        }
    }

    public Optional<BigDecimal> firstSince(Instant from) {
        return repository.findFirstByRecordedAtGreaterThanEqualOrderByRecordedAtAsc(from)
                .map(EquitySnapshot::getBalance);
    }

    public List<EquitySnapshot> history() {
        return repository.findAllByOrderByRecordedAtAsc();
    }
}
