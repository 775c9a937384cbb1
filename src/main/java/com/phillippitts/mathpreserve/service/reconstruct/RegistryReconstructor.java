package com.phillippitts.mathpreserve.service.reconstruct;

import com.phillippitts.mathpreserve.domain.ExpressionRecord;
import com.phillippitts.mathpreserve.domain.ProcessingMethod;
import com.phillippitts.mathpreserve.domain.ProcessingOptions;
import com.phillippitts.mathpreserve.domain.ProcessingResult;
import com.phillippitts.mathpreserve.exception.ReconstructionExceptionBuilder;
import com.phillippitts.mathpreserve.service.registry.NotationRegistry;
import com.phillippitts.mathpreserve.service.registry.RegistrySnapshot;
import com.phillippitts.mathpreserve.service.registry.RegistryStatus;
import com.phillippitts.mathpreserve.util.Markup;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Enhanced strategy: restores each rendered node from the registry record captured before
 * rendering, with its original delimiter.
 *
 * <p>Main-flow nodes map to registry positions in document order. Nodes inside the footnote
 * section map to the captured footnote records when the counts agree, and otherwise fall back to
 * their annotation. Macro declarations from the captured source are reported in the metadata.
 *
 * <p>Returns empty instead of throwing when the registry is uninitialised, inconsistent, stale,
 * older than the caller requires, or holds a different number of expressions than the markup.
 * The whole pass works on one snapshot, so a concurrent capture cannot mix generations.
 */
public class RegistryReconstructor implements ReconstructionStrategy {

    private static final Logger LOG = LogManager.getLogger(RegistryReconstructor.class);

    private final NotationRegistry registry;
    private final PreambleMacroExtractor macroExtractor;

    public RegistryReconstructor(NotationRegistry registry, PreambleMacroExtractor macroExtractor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.macroExtractor = Objects.requireNonNull(macroExtractor, "macroExtractor");
    }

    @Override
    public ProcessingMethod method() {
        return ProcessingMethod.ENHANCED;
    }

    @Override
    public Optional<ProcessingResult> reconstruct(ProcessingOptions options) {
        RegistrySnapshot snapshot = registry.snapshot();
        RegistryStatus status = registry.statusOf(snapshot);
        if (!status.isTrustworthy()) {
            LOG.debug("Registry not usable: {}", status);
            return Optional.empty();
        }
        if (options.minimumGeneration() != null && snapshot.generation() < options.minimumGeneration()) {
            LOG.debug("Registry generation {} older than required {}", snapshot.generation(),
                    options.minimumGeneration());
            return Optional.empty();
        }

        Document doc;
        try {
            doc = Markup.parse(options.content());
        } catch (RuntimeException e) {
            throw ReconstructionExceptionBuilder.create("Rendered markup could not be parsed")
                    .strategy(method().label())
                    .generation(snapshot.generation())
                    .cause(e)
                    .build();
        }

        List<Element> main = new ArrayList<>();
        List<Element> footnotes = new ArrayList<>();
        for (Element container : RenderedMarkup.eligibleContainers(doc)) {
            if (RenderedMarkup.inFootnoteSection(container)) {
                footnotes.add(container);
            } else {
                main.add(container);
            }
        }
        if (main.size() != snapshot.size()) {
            LOG.info("Rendered node count {} does not match registry generation {} size {}",
                    main.size(), snapshot.generation(), snapshot.size());
            return Optional.empty();
        }

        int mismatches = 0;
        for (int i = main.size() - 1; i >= 0; i--) {
            ExpressionRecord record = snapshot.byIndex().get(i);
            if (record == null) {
                throw ReconstructionExceptionBuilder.create("Registry index view has a gap")
                        .strategy(method().label())
                        .generation(snapshot.generation())
                        .metadata("index", i)
                        .build();
            }
            if (!annotationAgrees(main.get(i), record)) {
                mismatches++;
            }
            RenderedMarkup.replaceWithText(main.get(i), DelimiterStyle.restore(record));
        }

        FootnoteOutcome footnoteOutcome = restoreFootnotes(footnotes, snapshot.footnoteRecords());
        int assets = RenderedMarkup.removeRendererAssets(doc);
        PreambleMacros macros = macroExtractor.extract(snapshot.sourceText());

        LOG.debug("Enhanced reconstruction restored {} nodes from generation {} ({} assets removed)",
                main.size(), snapshot.generation(), assets);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("generation", snapshot.generation());
        meta.put("restored", main.size());
        meta.put("footnotesRestored", footnoteOutcome.restored());
        meta.put("unresolved", footnoteOutcome.unresolved());
        meta.put("annotationMismatches", mismatches);
        meta.put("commandCount", macros.commands().size());
        meta.put("macroCount", macros.macros().size());
        meta.put("customMacros", macros.macros());
        return Optional.of(ProcessingResult.of(Markup.serialize(doc, options.content()), method(), meta));
    }

    private static FootnoteOutcome restoreFootnotes(List<Element> nodes, List<ExpressionRecord> records) {
        int restored = 0;
        int unresolved = 0;
        boolean positional = nodes.size() == records.size();
        for (int i = nodes.size() - 1; i >= 0; i--) {
            Element node = nodes.get(i);
            if (positional) {
                RenderedMarkup.replaceWithText(node, DelimiterStyle.restore(records.get(i)));
                restored++;
                continue;
            }
            String tex = RenderedMarkup.annotationText(node);
            if (tex == null) {
                unresolved++;
                continue;
            }
            RenderedMarkup.replaceWithText(node, DelimiterStyle.wrap(tex, RenderedMarkup.isDisplay(node),
                    RenderedMarkup.storedEnvironment(node)));
            restored++;
        }
        return new FootnoteOutcome(restored, unresolved);
    }

    private static boolean annotationAgrees(Element node, ExpressionRecord record) {
        String tex = RenderedMarkup.annotationText(node);
        return tex == null || normalise(tex).equals(normalise(record.rawNotation()));
    }

    private static String normalise(String s) {
        return s.replaceAll("\\s+", "");
    }

    private record FootnoteOutcome(int restored, int unresolved) {
    }
}
