/**
 * Notation extraction from source text.
 *
 * <p>Each delimiter family is a separate {@link com.phillippitts.mathpreserve.service.extraction.NotationPattern}
 * that scans the full text on its own. {@link com.phillippitts.mathpreserve.service.extraction.DefaultExpressionExtractor}
 * merges their candidates into document order, which is the order the renderer later emits
 * expression nodes in.
 *
 * <p>Footnote bodies are rendered outside the main flow. Expressions inside them are returned
 * separately and never receive a main-flow sequence index.
 *
 * <p><b>Recognised delimiters:</b>
 * <ul>
 *   <li>{@code \begin{env}...\end{env}} for configured display environments</li>
 *   <li>{@code $$...$$} and {@code \[...\]} for display notation</li>
 *   <li>{@code $...$} and {@code \(...\)} for inline notation</li>
 * </ul>
 */
package com.phillippitts.mathpreserve.service.extraction;
