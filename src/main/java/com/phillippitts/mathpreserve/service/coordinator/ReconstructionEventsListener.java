package com.phillippitts.mathpreserve.service.coordinator;

import com.phillippitts.mathpreserve.service.capture.event.NotationCapturedEvent;
import com.phillippitts.mathpreserve.service.coordinator.event.AllStrategiesFailedEvent;
import com.phillippitts.mathpreserve.service.coordinator.event.StrategyFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Logs pipeline events succinctly (no notation content). */
@Component
class ReconstructionEventsListener {
    private static final Logger LOG = LogManager.getLogger(ReconstructionEventsListener.class);

    @EventListener
    void onCaptured(NotationCapturedEvent e) {
        LOG.info("Captured generation {}: expressions={}, footnotes={}, warnings={}",
                e.generation(), e.expressionCount(), e.footnoteCount(), e.warningCount());
    }

    @EventListener
    void onFallback(StrategyFallbackEvent e) {
        LOG.warn("Reconstruction fallback: strategy={}, reason={}", e.strategy(), e.reason());
    }

    @EventListener
    void onAllFailed(AllStrategiesFailedEvent e) {
        LOG.error("All reconstruction strategies failed: reason={}", e.reason());
    }
}
