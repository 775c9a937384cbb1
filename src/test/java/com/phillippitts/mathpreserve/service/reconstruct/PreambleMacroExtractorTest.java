package com.phillippitts.mathpreserve.service.reconstruct;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PreambleMacroExtractorTest {

    private final PreambleMacroExtractor extractor = new PreambleMacroExtractor();

    @Test
    void readsNewcommandWithNestedBraces() {
        PreambleMacros macros = extractor.extract("\\newcommand{\\R}{\\mathbb{R}} text");

        assertThat(macros.macros()).containsEntry("R", new MacroDefinition("\\mathbb{R}", 0, null));
        assertThat(macros.commands()).containsExactly("\\newcommand{\\R}{\\mathbb{R}}");
    }

    @Test
    void readsArgumentCountAndDefault() {
        PreambleMacros macros = extractor.extract(
                "\\newcommand{\\pair}[2]{(#1,#2)}\n\\newcommand{\\opt}[2][x]{#1+#2}");

        assertThat(macros.macros().get("pair")).isEqualTo(new MacroDefinition("(#1,#2)", 2, null));
        assertThat(macros.macros().get("opt")).isEqualTo(new MacroDefinition("#1+#2", 2, "x"));
    }

    @Test
    void acceptsUnbracedNamesAndVariants() {
        PreambleMacros macros = extractor.extract(
                "\\renewcommand\\vec[1]{\\mathbf{#1}} \\providecommand{\\P}{\\mathbb{P}} \\newcommand*{\\N}{\\mathbb{N}}");

        assertThat(macros.macros()).containsOnlyKeys("vec", "P", "N");
        assertThat(macros.macros().get("vec").arguments()).isEqualTo(1);
    }

    @Test
    void declaresMathOperators() {
        PreambleMacros macros = extractor.extract(
                "\\DeclareMathOperator{\\Tr}{Tr} \\DeclareMathOperator*{\\argmax}{arg\\,max}");

        assertThat(macros.macros().get("Tr").body()).isEqualTo("\\operatorname{Tr}");
        assertThat(macros.macros().get("argmax").body()).isEqualTo("\\operatorname*{arg\\,max}");
    }

    @Test
    void countsDefParameters() {
        PreambleMacros macros = extractor.extract("\\def\\half#1{\\frac{#1}{2}} \\definecolor{red}{rgb}{1,0,0}");

        assertThat(macros.macros()).containsOnlyKeys("half");
        assertThat(macros.macros().get("half")).isEqualTo(new MacroDefinition("\\frac{#1}{2}", 1, null));
    }

    @Test
    void skipsUnbalancedDeclarations() {
        PreambleMacros macros = extractor.extract("\\newcommand{\\bad}{\\frac{1}{2}");

        assertThat(macros.macros()).isEmpty();
        assertThat(macros.commands()).isEmpty();
    }

    @Test
    void laterDeclarationWins() {
        PreambleMacros macros = extractor.extract("\\newcommand{\\x}{1} \\renewcommand{\\x}{2}");

        assertThat(macros.macros().get("x").body()).isEqualTo("2");
        assertThat(macros.commands()).hasSize(2);
    }

    @Test
    void readGroupHonoursEscapes() {
        PreambleMacroExtractor.Group group = PreambleMacroExtractor.readGroup("{a\\}b}", 0, '{', '}');

        assertThat(group).isNotNull();
        assertThat(group.content()).isEqualTo("a\\}b");
        assertThat(group.end()).isEqualTo(6);
    }

    @Test
    void nullSourceHasNoMacros() {
        assertThat(extractor.extract(null).macros()).isEmpty();
    }
}
