package com.phillippitts.mathpreserve.service.cleanup;

import com.phillippitts.mathpreserve.config.properties.CleanupProperties;
import com.phillippitts.mathpreserve.service.metrics.PreservationMetricsPublisher;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static com.phillippitts.mathpreserve.testutil.RenderedHtml.annotated;
import static com.phillippitts.mathpreserve.testutil.RenderedHtml.bare;
import static org.assertj.core.api.Assertions.assertThat;

class JsoupRenderTreeTest {

    private final RenderTreeCleaner cleaner =
            new RenderTreeCleaner(new CleanupProperties(), () -> true, PreservationMetricsPublisher.NOOP);

    private static final String PAGE = "<div id=\"output\"><p>Area " + annotated("x^2", false) + "</p></div>"
            + bare(false)
            + annotated("y", true)
            + "<span class=\"processing-marker\"></span>"
            + "<div data-temp=\"true\">" + annotated("z", false) + "</div>"
            + "<span></span>"
            + "<div id=\"keep\"></div>";

    @Test
    void findsCandidatesPerCategory() {
        JsoupRenderTree tree = JsoupRenderTree.parse(PAGE, "#output");

        assertThat(tree.expressionNodeCount()).isEqualTo(4);
        assertThat(tree.annotationCount()).isEqualTo(3);
        assertThat(tree.outputExpressionCount()).isEqualTo(1);
        assertThat(tree.findCandidates(CleanupCategory.TEMPORARY)).hasSize(2);
        assertThat(tree.findCandidates(CleanupCategory.ORPHANED_EXPRESSION)).hasSize(3);
        assertThat(tree.findCandidates(CleanupCategory.EMPTY)).singleElement()
                .extracting(Element::tagName).isEqualTo("span");
    }

    @Test
    void cleanupRemovesUnannotatedNodesOnly() {
        JsoupRenderTree tree = JsoupRenderTree.parse(PAGE, "#output");

        CleanupReport report = cleaner.performComprehensiveCleanup(tree);

        assertThat(report.performed()).isTrue();
        assertThat(report.removed())
                .containsEntry(CleanupCategory.TEMPORARY, 1)
                .containsEntry(CleanupCategory.ORPHANED_EXPRESSION, 1)
                .containsEntry(CleanupCategory.EMPTY, 1);
        assertThat(report.preserved()).isEqualTo(3);
        assertThat(report.cacheCleared()).isFalse();
        assertThat(tree.annotationCount()).isEqualTo(3);
        String html = tree.html(PAGE);
        assertThat(html).doesNotContain("processing-marker").contains("x^2").contains("id=\"keep\"");
        assertThat(tree.expressionNodeCount()).isEqualTo(3);
    }

    @Test
    void defersWhileAnnotationsAreMissing() {
        JsoupRenderTree tree = JsoupRenderTree.parse(bare(false) + bare(true) + bare(false), "#output");

        CleanupReport report = cleaner.performComprehensiveCleanup(tree);

        assertThat(report.performed()).isFalse();
        assertThat(report.liveness().expressionNodeCount()).isEqualTo(3);
        assertThat(tree.expressionNodeCount()).isEqualTo(3);
    }

    @Test
    void dropsRendererStylesWhenOutputIsEmpty() {
        JsoupRenderTree tree = JsoupRenderTree.parse(
                "<html><head><style id=\"MJX-CHTML-styles\">mjx-c{}</style></head>"
                        + "<body><div id=\"output\"></div></body></html>", "#output");

        CleanupReport report = cleaner.performComprehensiveCleanup(tree);

        assertThat(report.cacheCleared()).isTrue();
        assertThat(tree.document().select("style")).isEmpty();
    }

    @Test
    void removeIgnoresDetachedNodes() {
        JsoupRenderTree tree = JsoupRenderTree.parse("<span class=\"processing-marker\"></span>", "#output");
        Element marker = tree.findCandidates(CleanupCategory.TEMPORARY).get(0);

        assertThat(tree.remove(marker)).isTrue();
        assertThat(tree.remove(marker)).isFalse();
    }
}
