package com.signalrelay.backend.service.execution;

/**
 * Result of one execution target. A no-op counts as a success.
 */
public record TargetOutcome(String target, boolean success, int statusCode, String message, boolean noop) {

    public static TargetOutcome success(String target, int statusCode, String message) {
        return new TargetOutcome(target, true, statusCode, message, false);
    }

    public static TargetOutcome failure(String target, int statusCode, String message) {
        return new TargetOutcome(target, false, statusCode, message, false);
    }

    public static TargetOutcome noop(String target, String message) {
        return new TargetOutcome(target, true, 200, message, true);
    }
}
