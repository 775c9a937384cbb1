/**
 * Liveness-aware cleanup of the render tree.
 *
 * <p>Cleanup works only against the tree, through {@link com.phillippitts.mathpreserve.service.cleanup.RenderTree},
 * and never consults the registry. A node that carries a preserved annotation is never removed,
 * whatever its category.
 */
package com.phillippitts.mathpreserve.service.cleanup;
