package com.phillippitts.mathpreserve.service.reconstruct;

import com.phillippitts.mathpreserve.service.cleanup.JsoupRenderTree;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;

import java.util.List;

/**
 * Selectors and helpers shared by the reconstruction strategies for MathJax output.
 */
final class RenderedMarkup {

    static final String SKIP_SELECTOR = "[data-skip-latex-export=true]";
    static final String FOOTNOTE_SECTION_SELECTOR =
            "section.footnotes, div.footnotes, aside.footnotes, [role=doc-endnotes]";
    static final String RENDERER_ASSETS_SELECTOR = "script[src*=mathjax], script[id^=MathJax], style[id^=MJX]";

    private RenderedMarkup() {
    }

    /**
     * Expression nodes eligible for reconstruction, in document order.
     */
    static List<Element> eligibleContainers(Element root) {
        return root.select(JsoupRenderTree.EXPRESSION_SELECTOR).stream()
                .filter(el -> !el.hasAttr("data-tikz-math"))
                .filter(el -> !el.is(SKIP_SELECTOR) && !el.parents().is(SKIP_SELECTOR))
                .toList();
    }

    static boolean inFootnoteSection(Element container) {
        return container.parents().is(FOOTNOTE_SECTION_SELECTOR);
    }

    /**
     * TeX annotation text of a rendered node, or null when the renderer injected none.
     */
    static String annotationText(Element container) {
        Element annotation = container.selectFirst(JsoupRenderTree.ANNOTATION_SELECTOR);
        if (annotation == null) {
            return null;
        }
        String text = annotation.wholeText().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Whether the node was rendered as display math, including the older {@code span.math.display} wrapper.
     */
    static boolean isDisplay(Element container) {
        if ("true".equals(container.attr("display"))) {
            return true;
        }
        Element parent = container.parent();
        return parent != null && parent.is("span.math.display");
    }

    /**
     * Environment name stored on the node or its parent, or null.
     */
    static String storedEnvironment(Element container) {
        for (Element el : new Element[]{container, container.parent()}) {
            if (el == null) {
                continue;
            }
            String value = el.hasAttr("data-math-env") ? el.attr("data-math-env") : el.attr("data-latex-env");
            if (DelimiterStyle.isUsableEnvironment(value)) {
                return value;
            }
        }
        return null;
    }

    /**
     * Replaces the node, and an older-format {@code span.math} wrapper around it, with plain text.
     */
    static void replaceWithText(Element container, String text) {
        Element target = container;
        Element parent = container.parent();
        if (parent != null && parent.is("span.math") && parent.children().size() == 1) {
            target = parent;
        }
        target.replaceWith(new TextNode(text));
    }

    static int removeRendererAssets(Element root) {
        Elements assets = root.select(RENDERER_ASSETS_SELECTOR);
        assets.remove();
        return assets.size();
    }
}
