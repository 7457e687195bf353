package com.signalrelay.backend.repository;

import com.signalrelay.backend.model.SignalAudit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SignalAuditRepository extends JpaRepository<SignalAudit, Long> {

    List<SignalAudit> findAllByOrderByCreatedAtAsc();

    List<SignalAudit> findByOrderId(String orderId);
}
