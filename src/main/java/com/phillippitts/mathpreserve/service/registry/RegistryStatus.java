package com.phillippitts.mathpreserve.service.registry;

/**
 * Point-in-time view of the registry used to decide whether it can be trusted.
 *
 * @param initialised whether a generation has been installed since the last clear
 * @param size entries in the index view
 * @param positionSize entries in the position view
 * @param consistent {@code size == positionSize}
 * @param generation generation marker of the installed data
 * @param stale whether a newer capture has started or the data exceeded its maximum age
 * @param ageSeconds seconds since install, -1 when nothing is installed
 */
public record RegistryStatus(
        boolean initialised,
        int size,
        int positionSize,
        boolean consistent,
        long generation,
        boolean stale,
        long ageSeconds
) {

    /**
     * True when the registry holds a consistent, fresh generation.
     */
    public boolean isTrustworthy() {
        return initialised && consistent && !stale;
    }
}
