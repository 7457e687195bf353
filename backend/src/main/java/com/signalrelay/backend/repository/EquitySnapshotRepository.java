package com.signalrelay.backend.repository;

import com.signalrelay.backend.model.EquitySnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface EquitySnapshotRepository extends JpaRepository<EquitySnapshot, Long> {

    Optional<EquitySnapshot> findFirstByRecordedAtGreaterThanEqualOrderByRecordedAtAsc(Instant from);

    List<EquitySnapshot> findAllByOrderByRecordedAtAsc();
}
