package com.phillippitts.mathpreserve.service.cleanup;

import com.phillippitts.mathpreserve.util.Markup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link RenderTree} over a jsoup document holding MathJax output.
 *
 * <p>Rendered expressions are {@code mjx-container} elements; preserved annotations are
 * {@code annotation} elements with a TeX encoding, as injected into the assistive MathML.
 */
public final class JsoupRenderTree implements RenderTree<Element> {

    public static final String EXPRESSION_SELECTOR = "mjx-container";
    public static final String ANNOTATION_SELECTOR = "annotation[encoding=application/x-tex], "
            + "annotation[encoding=TeX], annotation[encoding=LaTeX]";
    static final String TEMPORARY_SELECTOR = ".temp-math-processing, .processing-marker, .mathjax-temp, "
            + "[data-temp=true], .conversion-temp";
    static final String RENDERER_STYLE_SELECTOR = "style[id^=MJX]";

    private final Document document;
    private final String outputSelector;

    public JsoupRenderTree(Document document, String outputSelector) {
        this.document = Objects.requireNonNull(document, "document");
        this.outputSelector = Objects.requireNonNull(outputSelector, "outputSelector");
    }

    public static JsoupRenderTree parse(String html, String outputSelector) {
        return new JsoupRenderTree(Markup.parse(html), outputSelector);
    }

    public Document document() {
        return document;
    }

    @Override
    public int expressionNodeCount() {
        return document.select(EXPRESSION_SELECTOR).size();
    }

    @Override
    public int annotationCount() {
        return document.select(ANNOTATION_SELECTOR).size();
    }

    @Override
    public List<Element> findCandidates(CleanupCategory category) {
        return switch (category) {
            case TEMPORARY -> new ArrayList<>(document.select(TEMPORARY_SELECTOR));
            case ORPHANED_EXPRESSION -> document.select(EXPRESSION_SELECTOR).stream()
                    .filter(el -> !el.hasAttr("id"))
                    .filter(el -> !el.parents().is(outputSelector))
                    .toList();
            case EMPTY -> document.select("span, div").stream()
                    .filter(el -> el.childNodeSize() == 0)
                    .filter(el -> !el.hasAttr("id") && !el.hasAttr("class"))
                    .filter(el -> !el.parents().is(EXPRESSION_SELECTOR + ", annotation"))
                    .toList();
        };
    }

    @Override
    public int liveAnnotationCount(Element node) {
        return node.select(ANNOTATION_SELECTOR).size();
    }

    @Override
    public boolean remove(Element node) {
        if (node.ownerDocument() != document || node.parent() == null) {
            return false;
        }
        node.remove();
        return true;
    }

    @Override
    public int totalNodeCount() {
        return document.getAllElements().size();
    }

    @Override
    public int outputExpressionCount() {
        int count = 0;
        for (Element region : document.select(outputSelector)) {
            count += region.select(EXPRESSION_SELECTOR).size();
        }
        return count;
    }

    @Override
    public boolean clearRendererCache() {
        Elements styles = document.select(RENDERER_STYLE_SELECTOR);
        styles.remove();
        return !styles.isEmpty();
    }

    /**
     * Serializes the tree in the shape of the original markup.
     */
    public String html(String original) {
        return Markup.serialize(document, original);
    }
}
