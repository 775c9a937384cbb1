package com.phillippitts.mathpreserve.presentation.controller;

import com.phillippitts.mathpreserve.config.properties.CleanupProperties;
import com.phillippitts.mathpreserve.domain.ProcessingMode;
import com.phillippitts.mathpreserve.domain.ProcessingResult;
import com.phillippitts.mathpreserve.presentation.dto.CaptureRequest;
import com.phillippitts.mathpreserve.presentation.dto.CaptureResponse;
import com.phillippitts.mathpreserve.presentation.dto.CleanupResponse;
import com.phillippitts.mathpreserve.presentation.dto.ModeRequest;
import com.phillippitts.mathpreserve.presentation.dto.ProcessRequest;
import com.phillippitts.mathpreserve.service.capture.NotationCaptureService;
import com.phillippitts.mathpreserve.service.cleanup.CleanupReport;
import com.phillippitts.mathpreserve.service.cleanup.JsoupRenderTree;
import com.phillippitts.mathpreserve.service.cleanup.LivenessStatus;
import com.phillippitts.mathpreserve.service.cleanup.RenderTreeCleaner;
import com.phillippitts.mathpreserve.service.coordinator.ComparisonResult;
import com.phillippitts.mathpreserve.service.coordinator.CoordinatorDiagnostics;
import com.phillippitts.mathpreserve.service.coordinator.ReconstructionCoordinator;
import com.phillippitts.mathpreserve.service.registry.NotationRegistry;
import com.phillippitts.mathpreserve.service.registry.RegistryStatus;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * HTTP surface of the preservation pipeline. Thin delegation only; errors are mapped by
 * {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/preservation")
class PreservationController {

    private static final Logger LOG = LogManager.getLogger(PreservationController.class);

    private final NotationCaptureService captureService;
    private final NotationRegistry registry;
    private final ReconstructionCoordinator coordinator;
    private final RenderTreeCleaner cleaner;
    private final CleanupProperties cleanupProperties;

    PreservationController(NotationCaptureService captureService,
                           NotationRegistry registry,
                           ReconstructionCoordinator coordinator,
                           RenderTreeCleaner cleaner,
                           CleanupProperties cleanupProperties) {
        this.captureService = captureService;
        this.registry = registry;
        this.coordinator = coordinator;
        this.cleaner = cleaner;
        this.cleanupProperties = cleanupProperties;
    }

    /** Captures notation from source text and installs a new registry generation. */
    @PostMapping("/capture")
    ResponseEntity<CaptureResponse> capture(@Valid @RequestBody CaptureRequest request) {
        return ResponseEntity.ok(CaptureResponse.from(captureService.capture(request.source())));
    }

    /** Reconstructs notation in rendered markup. */
    @PostMapping("/process")
    ResponseEntity<ProcessingResult> process(@Valid @RequestBody ProcessRequest request) {
        return ResponseEntity.ok(coordinator.process(request.toOptions()));
    }

    /** Runs both strategies for comparison. */
    @PostMapping("/compare")
    ResponseEntity<ComparisonResult> compare(@Valid @RequestBody ProcessRequest request) {
        return ResponseEntity.ok(coordinator.processComparison(request.toOptions()));
    }

    @GetMapping("/mode")
    ResponseEntity<Map<String, Object>> mode() {
        return ResponseEntity.ok(Map.of("mode", coordinator.getMode()));
    }

    @PutMapping("/mode")
    ResponseEntity<Map<String, Object>> setMode(@Valid @RequestBody ModeRequest request) {
        ProcessingMode mode = ProcessingMode.parse(request.mode());
        boolean changed = coordinator.setMode(mode);
        return ResponseEntity.ok(Map.of("mode", coordinator.getMode(), "changed", changed));
    }

    @GetMapping("/diagnostics")
    ResponseEntity<CoordinatorDiagnostics> diagnostics() {
        return ResponseEntity.ok(coordinator.getDiagnostics());
    }

    @GetMapping("/registry")
    ResponseEntity<RegistryStatus> registryStatus() {
        return ResponseEntity.ok(registry.status());
    }

    /** Operator action: empties the registry. */
    @DeleteMapping("/registry")
    ResponseEntity<Map<String, Object>> clearRegistry() {
        boolean cleared = registry.clear();
        LOG.info("Registry cleared by operator request (hadData={})", cleared);
        return ResponseEntity.ok(Map.of("cleared", cleared));
    }

    /** Annotation coverage of rendered markup. */
    @PostMapping("/liveness")
    ResponseEntity<LivenessStatus> liveness(@Valid @RequestBody ProcessRequest request) {
        JsoupRenderTree tree = JsoupRenderTree.parse(request.content(), cleanupProperties.getOutputSelector());
        return ResponseEntity.ok(cleaner.checkLiveness(tree));
    }

    /**
     * Cleans rendered markup and returns the result. A posted snapshot cannot gain annotations,
     * so a deferred pass is reported to the client instead of being retried through
     * {@link com.phillippitts.mathpreserve.service.cleanup.CleanupRetryScheduler}.
     */
    @PostMapping("/cleanup")
    ResponseEntity<CleanupResponse> cleanup(@Valid @RequestBody ProcessRequest request) {
        JsoupRenderTree tree = JsoupRenderTree.parse(request.content(), cleanupProperties.getOutputSelector());
        CleanupReport report = cleaner.performComprehensiveCleanup(tree);
        String content = report.performed() ? tree.html(request.content()) : request.content();
        return ResponseEntity.ok(new CleanupResponse(report, content));
    }
}
