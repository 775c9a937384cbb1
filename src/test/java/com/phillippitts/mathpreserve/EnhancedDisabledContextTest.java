package com.phillippitts.mathpreserve;

import com.phillippitts.mathpreserve.domain.ProcessingOptions;
import com.phillippitts.mathpreserve.domain.ProcessingResult;
import com.phillippitts.mathpreserve.service.capture.NotationCaptureService;
import com.phillippitts.mathpreserve.service.coordinator.ReconstructionCoordinator;
import com.phillippitts.mathpreserve.service.reconstruct.RegistryReconstructor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static com.phillippitts.mathpreserve.testutil.RenderedHtml.annotated;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "preserve.enhanced.enabled=false")
class EnhancedDisabledContextTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private NotationCaptureService capture;

    @Autowired
    private ReconstructionCoordinator coordinator;

    @Test
    void legacyServesEveryCallWhenEnhancedIsDisabled() {
        assertThat(context.getBeansOfType(RegistryReconstructor.class)).isEmpty();
        capture.capture("Let $x$ hold");

        ProcessingResult result = coordinator.process(ProcessingOptions.of("<p>Let " + annotated("x", false) + " hold</p>"));

        assertThat(result.method()).isEqualTo("legacy");
        assertThat(result.content()).isEqualTo("<p>Let \\(x\\) hold</p>");
        assertThat(coordinator.getDiagnostics().recommendations())
                .anySatisfy(r -> assertThat(r).contains("preserve.enhanced.enabled"));
    }
}
