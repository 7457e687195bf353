package com.signalrelay.backend.service.execution;

import com.signalrelay.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Sends a ticket to every execution target in turn. Each target is attempted regardless of how the
 * previous one fared; nothing is retried.
 */
@Slf4j
@Service
public class DualExecutionRouter {

    private final List<ExecutionTarget> targets;
    private final MetricsService metricsService;

    public DualExecutionRouter(List<ExecutionTarget> targets, MetricsService metricsService) {
        this.targets = List.copyOf(targets);
        this.metricsService = metricsService;
    }

    public AggregateOutcome execute(OrderTicket ticket) {
        List<TargetOutcome> outcomes = new ArrayList<>(targets.size());
        for (ExecutionTarget target : targets) {
            TargetOutcome outcome = submit(target, ticket);
            if (!outcome.success()) {
                metricsService.recordDownstreamFailure(target.name());
            }
            outcomes.add(outcome);
        }
        AggregateOutcome aggregate = OutcomeAggregator.aggregate(outcomes);
        log.info("Order {} {} {} x{} routed: {}", ticket.orderId(), ticket.side(), ticket.instrument(),
                ticket.units(), aggregate.status().wireName());
        return aggregate;
    }

    private TargetOutcome submit(ExecutionTarget target, OrderTicket ticket) {
        try {
            return target.submit(ticket);
        } catch (RuntimeException e) {
            log.warn("Execution target {} failed for order {}: {}", target.name(), ticket.orderId(), e.getMessage(), e);
            return TargetOutcome.failure(target.name(), 500, e.getMessage());
        }
    }
}
