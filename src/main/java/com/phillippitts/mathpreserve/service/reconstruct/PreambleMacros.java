package com.phillippitts.mathpreserve.service.reconstruct;

import java.util.List;
import java.util.Map;

/**
 * Macro declarations found in a source document.
 *
 * @param commands declaration commands as written, in source order
 * @param macros macro name (without backslash) to definition; later declarations win
 */
public record PreambleMacros(List<String> commands, Map<String, MacroDefinition> macros) {

    public PreambleMacros {
        commands = List.copyOf(commands);
        macros = Map.copyOf(macros);
    }
}
