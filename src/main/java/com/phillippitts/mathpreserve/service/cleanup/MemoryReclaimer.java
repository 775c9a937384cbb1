package com.phillippitts.mathpreserve.service.cleanup;

/**
 * Best-effort memory reclamation hint to the host runtime.
 */
@FunctionalInterface
public interface MemoryReclaimer {

    /**
     * Requests reclamation. A failure is logged by the cleaner and otherwise ignored.
     *
     * @return true if the hint was issued
     */
    boolean requestReclamation();
}
