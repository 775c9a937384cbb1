/**
 * Shared registry of the latest captured generation. Writes replace the whole snapshot; reads
 * never see a partial write.
 */
package com.phillippitts.mathpreserve.service.registry;
