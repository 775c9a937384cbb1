package com.phillippitts.mathpreserve.service.coordinator;

import com.phillippitts.mathpreserve.domain.ProcessingMethod;
import com.phillippitts.mathpreserve.domain.ProcessingMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Chooses a reconstruction strategy from the operator mode and current availability.
 *
 * <p><b>Selection Algorithm:</b>
 * <ol>
 *   <li>LEGACY mode: legacy, unconditionally</li>
 *   <li>ENHANCED mode: enhanced if available, otherwise legacy with a logged downgrade</li>
 *   <li>AUTO mode: enhanced if available, otherwise legacy</li>
 * </ol>
 *
 * <p><b>Thread Safety:</b> stateless.
 */
public final class StrategySelector {

    private static final Logger LOG = LogManager.getLogger(StrategySelector.class);

    /**
     * Outcome of a selection.
     *
     * @param method chosen strategy
     * @param downgraded true when ENHANCED mode had to settle for legacy
     */
    public record Selection(ProcessingMethod method, boolean downgraded) {
    }

    public Selection select(ProcessingMode mode, AvailabilityReport availability) {
        switch (mode) {
            case LEGACY:
                LOG.debug("Legacy mode selected");
                return new Selection(ProcessingMethod.LEGACY, false);
            case ENHANCED:
                if (availability.enhancedAvailable()) {
                    LOG.debug("Enhanced mode selected");
                    return new Selection(ProcessingMethod.ENHANCED, false);
                }
                LOG.warn("Enhanced mode requested but unavailable (present={}, registryReady={}), using legacy",
                        availability.enhancedPresent(), availability.registryReady());
                return new Selection(ProcessingMethod.LEGACY, true);
            case AUTO:
            default:
                ProcessingMethod method = availability.enhancedAvailable()
                        ? ProcessingMethod.ENHANCED : ProcessingMethod.LEGACY;
                LOG.debug("Auto mode selected {}", method.label());
                return new Selection(method, false);
        }
    }
}
