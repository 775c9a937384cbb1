package com.phillippitts.mathpreserve.service.health;

import com.phillippitts.mathpreserve.service.coordinator.AvailabilityReport;
import com.phillippitts.mathpreserve.service.coordinator.ReconstructionCoordinator;
import com.phillippitts.mathpreserve.service.registry.RegistryStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the reconstruction strategies.
 *
 * <ul>
 *   <li>UP: enhanced strategy deployed and registry usable</li>
 *   <li>DEGRADED: legacy only (enhanced disabled, or registry empty, stale or inconsistent)</li>
 *   <li>DOWN: registry views inconsistent, which should never happen</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class PreservationHealthIndicator implements HealthIndicator {

    private final ReconstructionCoordinator coordinator;

    public PreservationHealthIndicator(ReconstructionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public Health health() {
        AvailabilityReport availability = coordinator.availability(null);
        RegistryStatus registry = availability.registry();

        Health.Builder builder = new Health.Builder();
        if (registry.initialised() && !registry.consistent()) {
            builder.down().withDetail("status", "Registry views inconsistent");
        } else if (availability.enhancedAvailable()) {
            builder.up().withDetail("status", "Enhanced and legacy reconstruction available");
        } else {
            builder.status("DEGRADED").withDetail("status", "Legacy reconstruction only");
        }
        return builder
                .withDetail("mode", coordinator.getMode())
                .withDetail("enhanced", enhancedStatus(availability))
                .withDetail("generation", registry.generation())
                .withDetail("expressions", registry.size())
                .build();
    }

    private static String enhancedStatus(AvailabilityReport availability) {
        if (!availability.enhancedPresent()) {
            return "disabled";
        }
        if (!availability.registryReady()) {
            RegistryStatus registry = availability.registry();
            if (!registry.initialised()) {
                return "awaiting capture";
            }
            return registry.stale() ? "stale" : "unusable";
        }
        return "ready";
    }
}
