package com.phillippitts.mathpreserve.service.registry;

import com.phillippitts.mathpreserve.config.properties.RegistryProperties;
import com.phillippitts.mathpreserve.domain.ExtractionResult;
import com.phillippitts.mathpreserve.testutil.Extractors;
import com.phillippitts.mathpreserve.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class NotationRegistryTest {

    private MutableClock clock;
    private NotationRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingNow();
        registry = new NotationRegistry(new RegistryProperties(Duration.ofMinutes(10), Duration.ofMinutes(5)), clock);
        registry.initialise();
    }

    private static ExtractionResult extract(String source) {
        return Extractors.standard().extract(source);
    }

    @Test
    void startsUninitialised() {
        RegistryStatus status = registry.status();

        assertThat(status.initialised()).isFalse();
        assertThat(status.size()).isZero();
        assertThat(status.ageSeconds()).isEqualTo(-1);
        assertThat(status.isTrustworthy()).isFalse();
        assertThat(registry.getByIndex(0)).isNull();
        assertThat(registry.getByPosition(0)).isNull();
    }

    @Test
    void installsBothViewsTogether() {
        ExtractionResult result = extract("$a$ and $$b$$");

        assertThat(registry.replace(result.toIndexMap(), result.toPositionSequence())).isTrue();

        RegistryStatus status = registry.status();
        assertThat(status.initialised()).isTrue();
        assertThat(status.size()).isEqualTo(2);
        assertThat(status.positionSize()).isEqualTo(2);
        assertThat(status.consistent()).isTrue();
        assertThat(status.isTrustworthy()).isTrue();
        assertThat(registry.getByIndex(1).rawNotation()).isEqualTo("b");
        assertThat(registry.getByPosition(0)).isEqualTo("a");
    }

    @Test
    void outOfRangeReadsReturnNull() {
        ExtractionResult result = extract("$a$");
        registry.replace(result.toIndexMap(), result.toPositionSequence());

        assertThat(registry.getByIndex(-1)).isNull();
        assertThat(registry.getByIndex(1)).isNull();
        assertThat(registry.getByPosition(-1)).isNull();
        assertThat(registry.getByPosition(1)).isNull();
    }

    @Test
    void rejectsMismatchedViewsAndKeepsPreviousGeneration() {
        ExtractionResult first = extract("$a$");
        registry.replace(first.toIndexMap(), first.toPositionSequence());
        long installed = registry.status().generation();

        ExtractionResult second = extract("$x$ $y$");
        boolean accepted = registry.replace(second.toIndexMap(), List.of("x"));

        assertThat(accepted).isFalse();
        assertThat(registry.status().generation()).isEqualTo(installed);
        assertThat(registry.getByPosition(0)).isEqualTo("a");
    }

    @Test
    void rejectsNullViews() {
        assertThat(registry.replace(null, List.of())).isFalse();
        assertThat(registry.replace(Map.of(), null)).isFalse();
    }

    @Test
    void rejectsViewsHoldingNullEntries() {
        ExtractionResult result = extract("$a$ $b$");
        List<String> positions = new ArrayList<>(result.toPositionSequence());
        positions.set(1, null);

        assertThat(registry.replace(result.toIndexMap(), positions)).isFalse();
        assertThat(registry.status().initialised()).isFalse();
    }

    @Test
    void replacementDropsEntriesBeyondNewSize() {
        ExtractionResult big = extract("$a$ $b$ $c$");
        registry.replace(big.toIndexMap(), big.toPositionSequence());
        ExtractionResult small = extract("$z$");
        registry.replace(small.toIndexMap(), small.toPositionSequence());

        assertThat(registry.getByIndex(0).rawNotation()).isEqualTo("z");
        assertThat(registry.getByIndex(2)).isNull();
        assertThat(registry.status().size()).isEqualTo(1);
    }

    @Test
    void beginningAGenerationMarksInstalledDataStale() {
        ExtractionResult result = extract("$a$");
        registry.replace(result.toIndexMap(), result.toPositionSequence());

        long ticket = registry.beginGeneration();

        assertThat(registry.status().stale()).isTrue();
        assertThat(registry.replace(result.toIndexMap(), result.toPositionSequence(), List.of(), "$a$", ticket))
                .isTrue();
        assertThat(registry.status().stale()).isFalse();
        assertThat(registry.status().generation()).isEqualTo(ticket);
    }

    @Test
    void olderTicketCannotOverwriteNewerGeneration() {
        long older = registry.beginGeneration();
        long newer = registry.beginGeneration();
        ExtractionResult fresh = extract("$new$");
        ExtractionResult old = extract("$old$");

        assertThat(registry.replace(fresh.toIndexMap(), fresh.toPositionSequence(), List.of(), "", newer)).isTrue();
        assertThat(registry.replace(old.toIndexMap(), old.toPositionSequence(), List.of(), "", older)).isFalse();
        assertThat(registry.getByPosition(0)).isEqualTo("new");
    }

    @Test
    void dataOlderThanMaxAgeIsStale() {
        ExtractionResult result = extract("$a$");
        registry.replace(result.toIndexMap(), result.toPositionSequence());

        clock.advance(Duration.ofMinutes(6));
        assertThat(registry.status().stale()).isFalse();
        assertThat(registry.status().ageSeconds()).isEqualTo(360);

        clock.advance(Duration.ofMinutes(5));
        assertThat(registry.status().stale()).isTrue();
        assertThat(registry.status().isTrustworthy()).isFalse();
    }

    @Test
    void agingGenerationWarnsOnlyOnce() {
        ExtractionResult result = extract("$a$");
        registry.replace(result.toIndexMap(), result.toPositionSequence());
        long first = registry.status().generation();

        assertThat(registry.noteAging(first, 360)).isTrue();
        assertThat(registry.noteAging(first, 420)).isFalse();

        registry.replace(result.toIndexMap(), result.toPositionSequence());
        assertThat(registry.noteAging(registry.status().generation(), 360)).isTrue();
    }

    @Test
    void repeatedStatusReadsOfAgingGenerationStayFresh() {
        ExtractionResult result = extract("$a$");
        registry.replace(result.toIndexMap(), result.toPositionSequence());
        clock.advance(Duration.ofMinutes(6));

        registry.status();
        registry.status();

        assertThat(registry.noteAging(registry.status().generation(), 360)).isFalse();
        assertThat(registry.status().stale()).isFalse();
    }

    @Test
    void clearEmptiesViews() {
        ExtractionResult result = extract("$a$");
        registry.replace(result.toIndexMap(), result.toPositionSequence());

        assertThat(registry.clear()).isTrue();
        assertThat(registry.status().initialised()).isFalse();
        assertThat(registry.getByIndex(0)).isNull();
        assertThat(registry.clear()).isFalse();
    }

    @Test
    void snapshotKeepsFootnotesAndSource() {
        ExtractionResult result = extract("$a$\\footnote{$f$}");
        long ticket = registry.beginGeneration();
        registry.replace(result.toIndexMap(), result.toPositionSequence(), result.footnoteRecords(), "src", ticket);

        RegistrySnapshot snapshot = registry.snapshot();

        assertThat(snapshot.footnoteRecords()).hasSize(1);
        assertThat(snapshot.sourceText()).isEqualTo("src");
        assertThat(snapshot.installedAt()).isEqualTo(clock.instant());
    }

    @Test
    void concurrentReadersNeverSeeMixedGenerations() throws Exception {
        ExtractionResult two = extract("$a$ $b$");
        ExtractionResult three = extract("$x$ $y$ $z$");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(1);
        AtomicInteger inconsistent = new AtomicInteger();
        List<Runnable> readers = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            readers.add(() -> {
                while (done.getCount() > 0) {
                    RegistrySnapshot s = registry.snapshot();
                    if (!s.isConsistent()) {
                        inconsistent.incrementAndGet();
                    }
                }
            });
        }
        try {
            readers.forEach(pool::submit);
            for (int i = 0; i < 500; i++) {
                ExtractionResult r = (i % 2 == 0) ? two : three;
                registry.replace(r.toIndexMap(), r.toPositionSequence());
            }
        } finally {
            done.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(inconsistent).hasValue(0);
    }
}
