package com.phillippitts.mathpreserve.service.capture;

import com.phillippitts.mathpreserve.domain.ExtractionResult;
import com.phillippitts.mathpreserve.service.capture.event.NotationCapturedEvent;
import com.phillippitts.mathpreserve.service.extraction.ExpressionExtractor;
import com.phillippitts.mathpreserve.service.extraction.RecordValidator;
import com.phillippitts.mathpreserve.service.registry.NotationRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Runs the capture half of the pipeline: source text to extractor to registry.
 *
 * <p>A new generation ticket is taken before extraction starts, so the previous generation stops
 * being trusted immediately, even if this pass never installs.
 */
@Service
public class NotationCaptureService {

    private static final Logger LOG = LogManager.getLogger(NotationCaptureService.class);

    private final ExpressionExtractor extractor;
    private final NotationRegistry registry;
    private final ApplicationEventPublisher publisher;

    public NotationCaptureService(ExpressionExtractor extractor,
                                  NotationRegistry registry,
                                  ApplicationEventPublisher publisher) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    public CaptureSummary capture(String source) {
        long ticket = registry.beginGeneration();
        ExtractionResult result = extractor.extract(source);

        List<String> problems = RecordValidator.validate(result.toIndexMap());
        if (!problems.isEmpty()) {
            LOG.warn("Generation {} has {} structural problems, first: {}", ticket, problems.size(), problems.get(0));
        }

        boolean installed = registry.replace(result.toIndexMap(), result.toPositionSequence(),
                result.footnoteRecords(), source, ticket);
        if (installed) {
            publisher.publishEvent(new NotationCapturedEvent(ticket, result.records().size(),
                    result.footnoteRecords().size(), result.integrityWarnings().size(), Instant.now()));
        }
        return new CaptureSummary(ticket, installed, result);
    }
}
