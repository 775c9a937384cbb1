package com.phillippitts.mathpreserve.service.capture;

import com.phillippitts.mathpreserve.config.properties.RegistryProperties;
import com.phillippitts.mathpreserve.service.capture.event.NotationCapturedEvent;
import com.phillippitts.mathpreserve.service.registry.NotationRegistry;
import com.phillippitts.mathpreserve.testutil.EventCapturingPublisher;
import com.phillippitts.mathpreserve.testutil.Extractors;
import com.phillippitts.mathpreserve.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NotationCaptureServiceTest {

    private NotationRegistry registry;
    private EventCapturingPublisher publisher;
    private NotationCaptureService service;

    @BeforeEach
    void setUp() {
        registry = new NotationRegistry(new RegistryProperties(), MutableClock.startingNow());
        publisher = new EventCapturingPublisher();
        service = new NotationCaptureService(Extractors.standard(), registry, publisher);
    }

    @Test
    void captureInstallsGenerationAndPublishesEvent() {
        CaptureSummary summary = service.capture("Let $x$ be\\footnote{$y$} and $$z$$");

        assertThat(summary.installed()).isTrue();
        assertThat(registry.status().generation()).isEqualTo(summary.generation());
        assertThat(registry.status().isTrustworthy()).isTrue();
        assertThat(registry.getByPosition(1)).isEqualTo("z");
        assertThat(registry.snapshot().footnoteRecords()).hasSize(1);
        assertThat(publisher.eventsOfType(NotationCapturedEvent.class)).singleElement().satisfies(e -> {
            assertThat(e.expressionCount()).isEqualTo(2);
            assertThat(e.footnoteCount()).isEqualTo(1);
            assertThat(e.generation()).isEqualTo(summary.generation());
        });
    }

    @Test
    void laterCaptureReplacesEarlierOne() {
        CaptureSummary first = service.capture("$a$ $b$");
        CaptureSummary second = service.capture("$c$");

        assertThat(second.generation()).isGreaterThan(first.generation());
        assertThat(registry.status().size()).isEqualTo(1);
        assertThat(registry.getByPosition(0)).isEqualTo("c");
        assertThat(registry.snapshot().sourceText()).isEqualTo("$c$");
    }

    @Test
    void sourceWithoutNotationInstallsEmptyGeneration() {
        CaptureSummary summary = service.capture("plain prose");

        assertThat(summary.installed()).isTrue();
        assertThat(summary.extraction().isEmpty()).isTrue();
        assertThat(registry.status().initialised()).isTrue();
        assertThat(registry.status().size()).isZero();
    }
}
