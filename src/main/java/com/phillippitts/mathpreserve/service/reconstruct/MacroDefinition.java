package com.phillippitts.mathpreserve.service.reconstruct;

/**
 * A custom macro declared in the document preamble, in the shape MathJax accepts.
 *
 * @param body replacement text
 * @param arguments number of arguments
 * @param defaultArgument default for the first argument, null when none
 */
public record MacroDefinition(String body, int arguments, String defaultArgument) {
}
