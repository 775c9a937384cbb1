package com.phillippitts.mathpreserve.service.coordinator.event;

import java.time.Instant;

/** Published when legacy failed after enhanced was skipped or abandoned. */
public record AllStrategiesFailedEvent(String reason, Instant at) {
}
