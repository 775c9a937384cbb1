package com.phillippitts.mathpreserve.service.health;

import com.phillippitts.mathpreserve.domain.ProcessingMode;
import com.phillippitts.mathpreserve.service.coordinator.AvailabilityReport;
import com.phillippitts.mathpreserve.service.coordinator.ReconstructionCoordinator;
import com.phillippitts.mathpreserve.service.registry.RegistryStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PreservationHealthIndicatorTest {

    private ReconstructionCoordinator coordinator;
    private PreservationHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        coordinator = mock(ReconstructionCoordinator.class);
        when(coordinator.getMode()).thenReturn(ProcessingMode.AUTO);
        indicator = new PreservationHealthIndicator(coordinator);
    }

    private void givenAvailability(boolean enhancedPresent, boolean registryReady, RegistryStatus status) {
        when(coordinator.availability(any())).thenReturn(
                new AvailabilityReport(true, enhancedPresent, enhancedPresent, registryReady, status));
    }

    @Test
    void upWhenEnhancedAvailable() {
        givenAvailability(true, true, new RegistryStatus(true, 4, 4, true, 3, false, 2));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("enhanced", "ready")
                .containsEntry("generation", 3L)
                .containsEntry("expressions", 4)
                .containsEntry("mode", ProcessingMode.AUTO);
    }

    @Test
    void degradedBeforeFirstCapture() {
        givenAvailability(true, false, new RegistryStatus(false, 0, 0, true, 0, false, -1));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("enhanced", "awaiting capture");
    }

    @Test
    void degradedWhenEnhancedDisabled() {
        givenAvailability(false, true, new RegistryStatus(true, 1, 1, true, 1, false, 0));

        assertThat(indicator.health().getDetails()).containsEntry("enhanced", "disabled");
    }

    @Test
    void degradedWhenStale() {
        givenAvailability(true, false, new RegistryStatus(true, 1, 1, true, 1, true, 900));

        assertThat(indicator.health().getDetails()).containsEntry("enhanced", "stale");
    }

    @Test
    void downWhenViewsDisagree() {
        givenAvailability(true, false, new RegistryStatus(true, 3, 2, false, 1, false, 0));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("enhanced", "unusable");
    }
}
