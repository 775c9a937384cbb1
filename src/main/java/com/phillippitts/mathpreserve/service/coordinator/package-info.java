/**
 * Strategy selection and fallback for reconstruction.
 *
 * <p>This package contains:
 * <ul>
 *   <li>{@link com.phillippitts.mathpreserve.service.coordinator.ReconstructionCoordinator} -
 *       runs the selected strategy and falls back to legacy</li>
 *   <li>{@link com.phillippitts.mathpreserve.service.coordinator.StrategySelector} - mode and
 *       availability based selection</li>
 *   <li>{@link com.phillippitts.mathpreserve.service.coordinator.EnhancedCapabilityProvider} -
 *       resolves the optional enhanced strategy</li>
 * </ul>
 *
 * <p><b>Failure policy:</b> enhanced failures, including the empty-result signal, are logged,
 * published as {@link com.phillippitts.mathpreserve.service.coordinator.event.StrategyFallbackEvent}
 * and absorbed. Only a legacy failure escalates.
 */
package com.phillippitts.mathpreserve.service.coordinator;
