package com.phillippitts.mathpreserve.service.reconstruct;

import com.phillippitts.mathpreserve.domain.ProcessingMethod;
import com.phillippitts.mathpreserve.domain.ProcessingOptions;
import com.phillippitts.mathpreserve.domain.ProcessingResult;
import com.phillippitts.mathpreserve.exception.ReconstructionExceptionBuilder;
import com.phillippitts.mathpreserve.util.Markup;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Legacy strategy: rebuilds notation from the TeX annotations the renderer injected.
 *
 * <p>Independent of the registry. Delimiters are chosen by {@link DelimiterStyle#wrap}, so the
 * original delimiter style is not guaranteed. Nodes without an annotation are left in place and
 * counted as unresolved. Always produces a result unless the markup cannot be processed at all.
 */
@Component
public class AnnotationReconstructor implements ReconstructionStrategy {

    private static final Logger LOG = LogManager.getLogger(AnnotationReconstructor.class);

    @Override
    public ProcessingMethod method() {
        return ProcessingMethod.LEGACY;
    }

    @Override
    public Optional<ProcessingResult> reconstruct(ProcessingOptions options) {
        Document doc;
        try {
            doc = Markup.parse(options.content());
        } catch (RuntimeException e) {
            throw ReconstructionExceptionBuilder.create("Rendered markup could not be parsed")
                    .strategy(method().label())
                    .cause(e)
                    .metadata("chars", options.content().length())
                    .build();
        }

        List<Element> containers = RenderedMarkup.eligibleContainers(doc);
        int converted = 0;
        int unresolved = 0;
        // Reverse order keeps earlier siblings stable while replacing
        for (int i = containers.size() - 1; i >= 0; i--) {
            Element container = containers.get(i);
            String tex = RenderedMarkup.annotationText(container);
            if (tex == null) {
                unresolved++;
                continue;
            }
            String wrapped = DelimiterStyle.wrap(tex, RenderedMarkup.isDisplay(container),
                    RenderedMarkup.storedEnvironment(container));
            RenderedMarkup.replaceWithText(container, wrapped);
            converted++;
        }
        int assets = RenderedMarkup.removeRendererAssets(doc);

        LOG.debug("Legacy reconstruction converted {} of {} nodes ({} renderer assets removed)",
                converted, containers.size(), assets);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("converted", converted);
        meta.put("unresolved", unresolved);
        return Optional.of(ProcessingResult.of(Markup.serialize(doc, options.content()), method(), meta));
    }
}
