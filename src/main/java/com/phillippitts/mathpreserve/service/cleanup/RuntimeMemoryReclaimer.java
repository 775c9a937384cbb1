package com.phillippitts.mathpreserve.service.cleanup;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Issues {@link System#gc()} as a hint. The JVM may ignore it.
 */
@Component
class RuntimeMemoryReclaimer implements MemoryReclaimer {

    private static final Logger LOG = LogManager.getLogger(RuntimeMemoryReclaimer.class);

    @Override
    public boolean requestReclamation() {
        try {
            System.gc();
            return true;
        } catch (RuntimeException e) {
            LOG.debug("Memory reclamation hint failed: {}", e.toString());
            return false;
        }
    }
}
