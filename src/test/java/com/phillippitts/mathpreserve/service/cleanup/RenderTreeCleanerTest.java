package com.phillippitts.mathpreserve.service.cleanup;

import com.phillippitts.mathpreserve.config.properties.CleanupProperties;
import com.phillippitts.mathpreserve.service.metrics.PreservationMetricsPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RenderTreeCleanerTest {

    private MemoryReclaimer reclaimer;
    private RenderTreeCleaner cleaner;

    @BeforeEach
    void setUp() {
        reclaimer = mock(MemoryReclaimer.class);
        when(reclaimer.requestReclamation()).thenReturn(true);
        cleaner = new RenderTreeCleaner(new CleanupProperties(), reclaimer, PreservationMetricsPublisher.NOOP);
    }

    @Test
    void defersWhenExpressionsHaveNoAnnotations() {
        FakeRenderTree tree = new FakeRenderTree(3, 0);
        tree.add("marker", CleanupCategory.TEMPORARY, 0);
        tree.add("orphan", CleanupCategory.ORPHANED_EXPRESSION, 0);

        CleanupReport report = cleaner.performComprehensiveCleanup(tree);

        assertThat(report.performed()).isFalse();
        assertThat(report.reason()).isEqualTo(CleanupReport.ANNOTATION_PROTECTION);
        assertThat(report.totalRemoved()).isZero();
        assertThat(report.removed()).containsOnlyKeys(CleanupCategory.values());
        assertThat(report.health()).isNull();
        assertThat(tree.attachedNames()).containsExactly("marker", "orphan");
        verify(reclaimer, never()).requestReclamation();
    }

    @Test
    void treeWithoutExpressionsIsSafeToClean() {
        FakeRenderTree tree = new FakeRenderTree(0, 0);
        tree.add("empty", CleanupCategory.EMPTY, 0);

        CleanupReport report = cleaner.performComprehensiveCleanup(tree);

        assertThat(report.performed()).isTrue();
        assertThat(report.removed()).containsEntry(CleanupCategory.EMPTY, 1);
        assertThat(report.liveness().safe()).isTrue();
    }

    @Test
    void removesCandidatesWithoutAnnotationsAndPreservesTheRest() {
        FakeRenderTree tree = new FakeRenderTree(4, 2);
        tree.add("marker", CleanupCategory.TEMPORARY, 0);
        tree.add("wrapper", CleanupCategory.TEMPORARY, 1);
        tree.add("stray", CleanupCategory.ORPHANED_EXPRESSION, 0);
        tree.add("annotated", CleanupCategory.ORPHANED_EXPRESSION, 1);
        tree.add("empty", CleanupCategory.EMPTY, 0);

        CleanupReport report = cleaner.performComprehensiveCleanup(tree);

        assertThat(report.performed()).isTrue();
        assertThat(report.removed())
                .containsEntry(CleanupCategory.TEMPORARY, 1)
                .containsEntry(CleanupCategory.ORPHANED_EXPRESSION, 1)
                .containsEntry(CleanupCategory.EMPTY, 1);
        assertThat(report.preserved()).isEqualTo(2);
        assertThat(tree.attachedNames()).containsExactly("wrapper", "annotated");
        assertThat(report.memoryHintApplied()).isTrue();
    }

    @Test
    void annotationInjectedAfterLookupStillProtectsNode() {
        FakeRenderTree tree = new FakeRenderTree(2, 1);
        tree.add("early", CleanupCategory.ORPHANED_EXPRESSION, 0);
        tree.add("late", CleanupCategory.ORPHANED_EXPRESSION, 0);
        tree.beforeLiveCheck = node -> {
            if (node.name.equals("late")) {
                node.annotations = 1;
            }
        };

        CleanupReport report = cleaner.performComprehensiveCleanup(tree);

        assertThat(tree.attachedNames()).containsExactly("late");
        assertThat(report.preserved()).isEqualTo(1);
        assertThat(report.removed()).containsEntry(CleanupCategory.ORPHANED_EXPRESSION, 1);
    }

    @Test
    void failingMemoryHintStillReturnsRemovalReport() {
        MemoryReclaimer broken = () -> {
            throw new IllegalStateException("no gc");
        };
        RenderTreeCleaner withBrokenHint =
                new RenderTreeCleaner(new CleanupProperties(), broken, PreservationMetricsPublisher.NOOP);
        FakeRenderTree tree = new FakeRenderTree(1, 1);
        tree.add("marker", CleanupCategory.TEMPORARY, 0);

        CleanupReport report = withBrokenHint.performComprehensiveCleanup(tree);

        assertThat(report.performed()).isTrue();
        assertThat(report.removed()).containsEntry(CleanupCategory.TEMPORARY, 1);
        assertThat(report.memoryHintApplied()).isFalse();
        assertThat(tree.attachedNames()).isEmpty();
    }

    @Test
    void clearsRendererCacheOnlyWhenOutputHasNoExpressions() {
        FakeRenderTree populated = new FakeRenderTree(1, 1);
        assertThat(cleaner.performComprehensiveCleanup(populated).cacheCleared()).isFalse();

        FakeRenderTree emptied = new FakeRenderTree(0, 0);
        emptied.outputExpressions = 0;
        assertThat(cleaner.performComprehensiveCleanup(emptied).cacheCleared()).isTrue();
        assertThat(emptied.cacheCleared).isTrue();
    }

    @Test
    void memoryHintSkippedWhenNothingRemovedOrDisabled() {
        FakeRenderTree clean = new FakeRenderTree(1, 1);
        assertThat(cleaner.performComprehensiveCleanup(clean).memoryHintApplied()).isFalse();
        verify(reclaimer, never()).requestReclamation();

        RenderTreeCleaner noHint = new RenderTreeCleaner(
                new CleanupProperties(null, false, null, null, null, null, null),
                reclaimer, PreservationMetricsPublisher.NOOP);
        FakeRenderTree dirty = new FakeRenderTree(1, 1);
        dirty.add("marker", CleanupCategory.TEMPORARY, 0);
        assertThat(noHint.performComprehensiveCleanup(dirty).memoryHintApplied()).isFalse();
        verify(reclaimer, never()).requestReclamation();
    }

    @Test
    void unavailableMemoryHintIsReportedNotThrown() {
        when(reclaimer.requestReclamation()).thenReturn(false);
        FakeRenderTree tree = new FakeRenderTree(1, 1);
        tree.add("marker", CleanupCategory.TEMPORARY, 0);

        CleanupReport report = cleaner.performComprehensiveCleanup(tree);

        assertThat(report.performed()).isTrue();
        assertThat(report.memoryHintApplied()).isFalse();
    }

    @Test
    void healthFlagsOversizedTrees() {
        RenderTreeCleaner strict = new RenderTreeCleaner(
                new CleanupProperties("#output", true, Duration.ofSeconds(1), 1, 100, 1, 1),
                reclaimer, PreservationMetricsPublisher.NOOP);
        FakeRenderTree tree = new FakeRenderTree(2, 0);
        tree.totalNodes = 500;
        tree.add("t1", CleanupCategory.TEMPORARY, 0);
        tree.add("t2", CleanupCategory.TEMPORARY, 0);
        tree.add("e1", CleanupCategory.EMPTY, 0);
        tree.add("e2", CleanupCategory.EMPTY, 0);

        TreeHealth health = strict.assessHealth(tree);

        assertThat(health.healthy()).isFalse();
        assertThat(health.warnings()).containsExactly(
                "High node count: 500",
                "Temporary nodes accumulating: 2",
                "Expression nodes present without annotations",
                "Many empty nodes: 2");
        assertThat(health.annotationRatio()).isZero();
    }

    @Test
    void livenessRatioReflectsCoverage() {
        LivenessStatus status = cleaner.checkLiveness(new FakeRenderTree(4, 2));

        assertThat(status.safe()).isTrue();
        assertThat(status.ratio()).isEqualTo(0.5);
    }
}
