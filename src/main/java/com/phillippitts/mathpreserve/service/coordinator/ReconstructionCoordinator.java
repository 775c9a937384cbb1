package com.phillippitts.mathpreserve.service.coordinator;

import com.phillippitts.mathpreserve.config.properties.CoordinatorProperties;
import com.phillippitts.mathpreserve.domain.ProcessingMethod;
import com.phillippitts.mathpreserve.domain.ProcessingMode;
import com.phillippitts.mathpreserve.domain.ProcessingOptions;
import com.phillippitts.mathpreserve.domain.ProcessingResult;
import com.phillippitts.mathpreserve.exception.ReconstructionExceptionBuilder;
import com.phillippitts.mathpreserve.exception.ReconstructionFailedException;
import com.phillippitts.mathpreserve.service.coordinator.event.AllStrategiesFailedEvent;
import com.phillippitts.mathpreserve.service.coordinator.event.StrategyFallbackEvent;
import com.phillippitts.mathpreserve.service.metrics.PreservationMetricsPublisher;
import com.phillippitts.mathpreserve.service.reconstruct.ReconstructionStrategy;
import com.phillippitts.mathpreserve.service.registry.NotationRegistry;
import com.phillippitts.mathpreserve.service.registry.RegistryStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Selects between the enhanced and legacy reconstruction strategies, with fallback.
 *
 * <p><b>Per invocation:</b>
 * <ol>
 *   <li>Resolve the enhanced strategy once through {@link EnhancedCapabilityProvider}</li>
 *   <li>Build an {@link AvailabilityReport} from it and the registry status</li>
 *   <li>Let {@link StrategySelector} pick a strategy for the current mode</li>
 *   <li>Run enhanced if picked; an empty result or an exception falls back to legacy at once</li>
 *   <li>Run legacy; its failure is the only error that reaches the caller, as a
 *       {@link ReconstructionFailedException}</li>
 * </ol>
 *
 * <p>Results have the same shape whichever strategy produced them. The mode is the only mutable
 * state and is held in an atomic reference.
 */
public class ReconstructionCoordinator {

    private static final Logger LOG = LogManager.getLogger(ReconstructionCoordinator.class);

    private final ReconstructionStrategy legacy;
    private final EnhancedCapabilityProvider capabilities;
    private final NotationRegistry registry;
    private final StrategySelector selector;
    private final ApplicationEventPublisher publisher;
    private final PreservationMetricsPublisher metrics;
    private final AtomicReference<ProcessingMode> mode;

    public ReconstructionCoordinator(ReconstructionStrategy legacy,
                                     EnhancedCapabilityProvider capabilities,
                                     NotationRegistry registry,
                                     StrategySelector selector,
                                     ApplicationEventPublisher publisher,
                                     PreservationMetricsPublisher metrics,
                                     CoordinatorProperties props) {
        this.legacy = Objects.requireNonNull(legacy, "legacy");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.mode = new AtomicReference<>(Objects.requireNonNull(props, "props").getMode());
    }

    /**
     * Reconstructs the rendered content.
     *
     * @throws ReconstructionFailedException when the legacy strategy fails
     */
    public ProcessingResult process(ProcessingOptions options) {
        Objects.requireNonNull(options, "options");
        Optional<ReconstructionStrategy> enhanced = capabilities.resolve();
        AvailabilityReport availability = availability(enhanced, options);
        StrategySelector.Selection selection = selector.select(mode.get(), availability);

        if (selection.method() == ProcessingMethod.ENHANCED) {
            Optional<ProcessingResult> result = runEnhanced(enhanced.get(), options);
            if (result.isPresent()) {
                return result.get();
            }
        } else if (selection.downgraded()) {
            fallback("unavailable");
        }
        return runLegacy(options);
    }

    private Optional<ProcessingResult> runEnhanced(ReconstructionStrategy enhanced, ProcessingOptions options) {
        long start = System.nanoTime();
        try {
            Optional<ProcessingResult> result = enhanced.reconstruct(options);
            if (result.isPresent()) {
                metrics.recordSuccess(ProcessingMethod.ENHANCED.label(), System.nanoTime() - start);
                return result;
            }
            LOG.info("Enhanced strategy reported registry unavailable, falling back to legacy");
            fallback("sentinel");
        } catch (RuntimeException e) {
            LOG.warn("Enhanced strategy failed, falling back to legacy: {}", e.toString());
            metrics.recordFailure(ProcessingMethod.ENHANCED.label());
            fallback(e.getClass().getSimpleName());
        }
        return Optional.empty();
    }

    private ProcessingResult runLegacy(ProcessingOptions options) {
        long start = System.nanoTime();
        try {
            ProcessingResult result = legacy.reconstruct(options)
                    .orElseThrow(() -> ReconstructionExceptionBuilder.create("Legacy strategy produced no result")
                            .strategy(ProcessingMethod.LEGACY.label())
                            .build());
            metrics.recordSuccess(ProcessingMethod.LEGACY.label(), System.nanoTime() - start);
            return result;
        } catch (RuntimeException e) {
            LOG.error("Legacy strategy failed", e);
            metrics.recordFailure(ProcessingMethod.LEGACY.label());
            publisher.publishEvent(new AllStrategiesFailedEvent(e.getClass().getSimpleName(), Instant.now()));
            throw new ReconstructionFailedException(e);
        }
    }

    private void fallback(String reason) {
        metrics.recordFallback(reason);
        publisher.publishEvent(new StrategyFallbackEvent(ProcessingMethod.ENHANCED.label(), reason, Instant.now()));
    }

    /**
     * Runs both strategies independently. Neither branch's failure affects the other, and the
     * operator mode is ignored.
     */
    public ComparisonResult processComparison(ProcessingOptions options) {
        Objects.requireNonNull(options, "options");
        Optional<ReconstructionStrategy> enhanced = capabilities.resolve();
        AvailabilityReport availability = availability(enhanced, options);

        BranchOutcome legacyOutcome = runBranch(legacy, options);
        BranchOutcome enhancedOutcome = enhanced
                .map(strategy -> runBranch(strategy, options))
                .orElseGet(() -> BranchOutcome.failure("Enhanced strategy not available"));

        boolean matches = legacyOutcome.success() && enhancedOutcome.success()
                && legacyOutcome.result().content().equals(enhancedOutcome.result().content());
        LOG.info("Comparison run: legacy={}, enhanced={}, contentMatches={}",
                legacyOutcome.success(), enhancedOutcome.success(), matches);
        return new ComparisonResult(legacyOutcome, enhancedOutcome, new ComparisonResult.Metadata(
                Instant.now(), availability.enhancedAvailable(), availability.registryReady(), matches));
    }

    private static BranchOutcome runBranch(ReconstructionStrategy strategy, ProcessingOptions options) {
        try {
            return strategy.reconstruct(options)
                    .map(BranchOutcome::success)
                    .orElseGet(() -> BranchOutcome.failure("Registry unavailable"));
        } catch (RuntimeException e) {
            LOG.debug("Comparison branch {} failed: {}", strategy.method().label(), e.toString());
            return BranchOutcome.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Availability for a call with the given options, resolving the enhanced strategy afresh.
     */
    public AvailabilityReport availability(ProcessingOptions options) {
        return availability(capabilities.resolve(), options);
    }

    private AvailabilityReport availability(Optional<ReconstructionStrategy> enhanced, ProcessingOptions options) {
        RegistryStatus status = registry.status();
        boolean recentEnough = options == null || options.minimumGeneration() == null
                || status.generation() >= options.minimumGeneration();
        boolean ready = enhanced.map(s -> s.method() == ProcessingMethod.ENHANCED).orElse(false);
        return new AvailabilityReport(true, enhanced.isPresent(), ready,
                status.isTrustworthy() && recentEnough, status);
    }

    public ProcessingMode getMode() {
        return mode.get();
    }

    /**
     * @return false when mode is null
     */
    public boolean setMode(ProcessingMode newMode) {
        if (newMode == null) {
            LOG.warn("Ignoring null processing mode");
            return false;
        }
        ProcessingMode previous = mode.getAndSet(newMode);
        LOG.info("Processing mode changed: {} -> {}", previous, newMode);
        return true;
    }

    /**
     * @return false when the name is not a valid mode
     */
    public boolean setMode(String name) {
        try {
            return setMode(ProcessingMode.parse(name));
        } catch (IllegalArgumentException e) {
            LOG.warn(e.getMessage());
            return false;
        }
    }

    public CoordinatorDiagnostics getDiagnostics() {
        ProcessingMode current = mode.get();
        AvailabilityReport availability = availability(capabilities.resolve(), null);
        ProcessingMethod next = availability.enhancedAvailable() && current != ProcessingMode.LEGACY
                ? ProcessingMethod.ENHANCED : ProcessingMethod.LEGACY;
        return new CoordinatorDiagnostics(current, availability, next, recommendations(current, availability));
    }

    private static List<String> recommendations(ProcessingMode mode, AvailabilityReport availability) {
        List<String> advice = new ArrayList<>();
        RegistryStatus registry = availability.registry();
        if (!availability.enhancedPresent()) {
            advice.add("Enable preserve.enhanced.enabled to restore original delimiters");
        }
        if (!registry.initialised()) {
            advice.add("Capture the source before rendering so the enhanced strategy can be used");
        } else if (!registry.consistent()) {
            advice.add("Registry views disagree; clear the registry and capture again");
        } else if (registry.stale()) {
            advice.add("Registry generation is stale; capture the current document again");
        }
        if (mode == ProcessingMode.ENHANCED && !availability.enhancedAvailable()) {
            advice.add("Mode is ENHANCED but enhanced processing is unavailable; results will use legacy");
        }
        if (mode == ProcessingMode.LEGACY && availability.enhancedAvailable()) {
            advice.add("Enhanced processing is available; consider AUTO mode");
        }
        if (advice.isEmpty()) {
            advice.add("All systems operational");
        }
        return advice;
    }
}
