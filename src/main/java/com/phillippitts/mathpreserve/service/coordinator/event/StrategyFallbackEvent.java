package com.phillippitts.mathpreserve.service.coordinator.event;

import java.time.Instant;

/**
 * Published when the enhanced strategy was abandoned in favour of legacy.
 *
 * @param strategy strategy that was abandoned
 * @param reason unavailable, sentinel or the exception type
 * @param at when it happened
 */
public record StrategyFallbackEvent(String strategy, String reason, Instant at) {
}
