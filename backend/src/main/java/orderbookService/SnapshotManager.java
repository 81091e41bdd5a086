package orderbookService;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically captures the engine state together with the WAL sequence it reflects, bounding
 * how much of the log recovery has to replay.
 *
 * <p>Capture runs under the engine's exclusive lock, so the books and the sequence always
 * describe the same point between two completed operations. Writing happens outside the lock.
 */
public final class SnapshotManager {
    private static final Logger LOG = LoggerFactory.getLogger(SnapshotManager.class);

    private final MatchingEngine engine;
    private final SnapshotStore store;
    private final Duration interval;
    private final Clock clock;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;
    private LongSupplier currentSequence;
    private volatile long lastSavedSequence = -1;

    public SnapshotManager(MatchingEngine engine, SnapshotStore store, Duration interval) {
        this(engine, store, interval, Clock.systemUTC());
    }

    public SnapshotManager(MatchingEngine engine, SnapshotStore store, Duration interval, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.store = Objects.requireNonNull(store, "store");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    /**
     * Starts the fixed-rate timer. {@code currentSequence} is read at capture time to stamp
     * each snapshot.
     */
    public synchronized void start(LongSupplier currentSequence) {
        if (task != null) {
            throw new IllegalStateException("Snapshot manager already started");
        }
        this.currentSequence = Objects.requireNonNull(currentSequence, "currentSequence");
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "snapshot-manager");
            thread.setDaemon(true);
            return thread;
        });
        long millis = interval.toMillis();
        task = scheduler.scheduleAtFixedRate(this::tick, millis, millis, TimeUnit.MILLISECONDS);
        LOG.info("Snapshot manager started (interval: {}ms)", millis);
    }

    public synchronized void stop() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Snapshot in progress did not finish within 5s");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        task = null;
        scheduler = null;
        LOG.info("Snapshot manager stopped");
    }

    private void tick() {
        try {
            snapshotNow();
        } catch (RuntimeException ex) {
            // keep the timer alive; the next tick retries
            LOG.error("Periodic snapshot failed", ex);
        }
    }

    /**
     * Captures and stores a snapshot immediately, unless nothing was logged since the last one.
     *
     * @return the stored snapshot, or empty if it was skipped
     */
    public Optional<Snapshot> snapshotNow() {
        LongSupplier sequenceSource = this.currentSequence;
        if (sequenceSource == null) {
            throw new IllegalStateException("Snapshot manager has no sequence source; call start first");
        }
        return snapshotNow(sequenceSource);
    }

    public Optional<Snapshot> snapshotNow(LongSupplier sequenceSource) {
        Snapshot snapshot = engine.runExclusive(() ->
                new Snapshot(clock.millis(), sequenceSource.getAsLong(), engine.getFullState()));
        if (snapshot.sequence() == lastSavedSequence) {
            LOG.debug("No WAL activity since snapshot {}; skipping", lastSavedSequence);
            return Optional.empty();
        }
        store.save(snapshot);
        lastSavedSequence = snapshot.sequence();
        return Optional.of(snapshot);
    }

    /**
     * The most recent durable snapshot, or empty when recovery must replay the whole log.
     */
    public Optional<Snapshot> loadLatest() {
        Optional<Snapshot> latest = store.loadLatest();
        latest.ifPresent(snapshot -> lastSavedSequence = snapshot.sequence());
        return latest;
    }
}
