package com.phillippitts.mathpreserve.service.registry;

import com.phillippitts.mathpreserve.config.properties.RegistryProperties;
import com.phillippitts.mathpreserve.domain.ExpressionRecord;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared store of the latest extraction output.
 *
 * <p>Holds a single {@link RegistrySnapshot} behind an atomic reference. Every write builds a
 * complete new snapshot and swaps it in one step, so readers see either the previous generation
 * or the new one, never a mix. Reads are O(1) and never throw.
 *
 * <p><b>Generations:</b> {@link #beginGeneration()} issues a ticket when a capture starts. Any
 * installed snapshot older than the latest ticket is stale, as is a snapshot older than
 * {@code preserve.registry.max-age}.
 *
 * <p>Constructed as a Spring singleton through {@code PipelineConfig}; tests create isolated
 * instances with a fixed {@link Clock}.
 */
public class NotationRegistry {

    private static final Logger LOG = LogManager.getLogger(NotationRegistry.class);

    private final RegistryProperties props;
    private final Clock clock;
    private final AtomicReference<RegistrySnapshot> current = new AtomicReference<>(RegistrySnapshot.EMPTY);
    private final AtomicLong latestTicket = new AtomicLong();
    private final AtomicLong agingWarnedFor = new AtomicLong(-1);

    public NotationRegistry(RegistryProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Resets to the empty state. Called once at bean start.
     */
    @PostConstruct
    public void initialise() {
        current.set(RegistrySnapshot.EMPTY);
        LOG.info("Notation registry initialised (maxAge={}, warnAge={})", props.getMaxAge(), props.getWarnAge());
    }

    /**
     * Issues a new generation ticket, invalidating trust in the installed generation until a
     * matching snapshot is installed.
     *
     * @return the ticket to install with
     */
    public long beginGeneration() {
        long ticket = latestTicket.incrementAndGet();
        LOG.debug("Generation {} started", ticket);
        return ticket;
    }

    /**
     * Installs a new generation under a fresh ticket.
     *
     * @see #replace(Map, List, List, String, long)
     */
    public boolean replace(Map<Integer, ExpressionRecord> byIndex, List<String> byPosition) {
        return replace(byIndex, byPosition, List.of(), "", beginGeneration());
    }

    /**
     * Installs a new generation. Both views are replaced together or not at all.
     *
     * @param byIndex index-keyed records
     * @param byPosition raw notation in index order
     * @param footnoteRecords footnote-scoped records of the same pass
     * @param sourceText captured source
     * @param ticket generation ticket from {@link #beginGeneration()}
     * @return false when the views are null, hold null entries or differ in size, or when a newer
     *         generation is already installed
     */
    public boolean replace(Map<Integer, ExpressionRecord> byIndex,
                           List<String> byPosition,
                           List<ExpressionRecord> footnoteRecords,
                           String sourceText,
                           long ticket) {
        if (byIndex == null || byPosition == null) {
            LOG.warn("Registry replace rejected: null view");
            return false;
        }
        if (hasNullEntry(byIndex, byPosition, footnoteRecords)) {
            LOG.warn("Registry replace rejected: view holds a null entry");
            return false;
        }
        if (byIndex.size() != byPosition.size()) {
            LOG.warn("Registry replace rejected: index view size {} != position view size {}",
                    byIndex.size(), byPosition.size());
            return false;
        }
        RegistrySnapshot next = new RegistrySnapshot(byIndex, byPosition,
                footnoteRecords == null ? List.of() : footnoteRecords, sourceText, ticket, clock.instant());
        RegistrySnapshot previous;
        do {
            previous = current.get();
            if (previous.generation() > ticket) {
                LOG.warn("Registry replace rejected: generation {} is older than installed {}",
                        ticket, previous.generation());
                return false;
            }
        } while (!current.compareAndSet(previous, next));
        LOG.info("Registry generation {} installed ({} expressions, {} footnote)",
                ticket, next.size(), next.footnoteRecords().size());
        return true;
    }

    /**
     * @return the record at the given sequence index, or null when out of range
     */
    public ExpressionRecord getByIndex(int index) {
        return current.get().byIndex().get(index);
    }

    /**
     * @return the raw notation at the given position, or null when out of range
     */
    public String getByPosition(int position) {
        List<String> positions = current.get().byPosition();
        if (position < 0 || position >= positions.size()) {
            return null;
        }
        return positions.get(position);
    }

    /**
     * Current snapshot for multi-read consumers that need a single consistent generation.
     */
    public RegistrySnapshot snapshot() {
        return current.get();
    }

    public RegistryStatus status() {
        return statusOf(current.get());
    }

    /**
     * Status of a given snapshot against the current ticket and clock.
     */
    public RegistryStatus statusOf(RegistrySnapshot snapshot) {
        boolean installed = snapshot.isInstalled();
        long ageSeconds = -1;
        boolean stale = false;
        if (installed) {
            Duration age = Duration.between(snapshot.installedAt(), clock.instant());
            ageSeconds = age.getSeconds();
            stale = snapshot.generation() < latestTicket.get() || age.compareTo(props.getMaxAge()) > 0;
            if (!stale && age.compareTo(props.getWarnAge()) > 0) {
                noteAging(snapshot.generation(), ageSeconds);
            }
        }
        return new RegistryStatus(installed, snapshot.byIndex().size(), snapshot.byPosition().size(),
                snapshot.isConsistent(), snapshot.generation(), stale, ageSeconds);
    }

    /**
     * Warns once per generation that it is aging; later status reads log at debug.
     *
     * @return true when this call issued the warning
     */
    boolean noteAging(long generation, long ageSeconds) {
        if (agingWarnedFor.getAndSet(generation) != generation) {
            LOG.warn("Registry generation {} is {}s old", generation, ageSeconds);
            return true;
        }
        LOG.debug("Registry generation {} is {}s old", generation, ageSeconds);
        return false;
    }

    private static boolean hasNullEntry(Map<Integer, ExpressionRecord> byIndex,
                                        List<String> byPosition,
                                        List<ExpressionRecord> footnoteRecords) {
        boolean nullInIndex = byIndex.entrySet().stream()
                .anyMatch(e -> e.getKey() == null || e.getValue() == null);
        boolean nullInFootnotes = footnoteRecords != null && footnoteRecords.stream().anyMatch(Objects::isNull);
        return nullInIndex || nullInFootnotes || byPosition.stream().anyMatch(Objects::isNull);
    }

    /**
     * Empties both views. The generation counter keeps counting.
     *
     * @return true when something was installed before the call
     */
    public boolean clear() {
        RegistrySnapshot previous = current.getAndSet(RegistrySnapshot.EMPTY);
        LOG.info("Registry cleared (previous generation {}, {} expressions)", previous.generation(), previous.size());
        return previous.isInstalled();
    }
}
