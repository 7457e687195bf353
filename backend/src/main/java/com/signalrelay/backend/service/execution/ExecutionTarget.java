package com.signalrelay.backend.service.execution;

/**
 * A downstream party that receives sized orders. Implementations report failures through the outcome
 * rather than throwing.
 */
public interface ExecutionTarget {

    String name();

    TargetOutcome submit(OrderTicket ticket);
}
