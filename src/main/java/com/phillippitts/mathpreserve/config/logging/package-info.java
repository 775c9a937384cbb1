/**
 * Logging support: request-scoped MDC values for Log4j2 pattern layouts.
 */
package com.phillippitts.mathpreserve.config.logging;
