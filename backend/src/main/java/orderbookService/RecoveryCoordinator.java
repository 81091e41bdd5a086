package orderbookService;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds the engine at startup: restore the latest snapshot, then replay the WAL entries
 * recorded after it. The engine must not take live traffic before {@link #recover()} returns.
 */
public final class RecoveryCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(RecoveryCoordinator.class);

    private final MatchingEngine engine;
    private final WriteAheadLog wal;
    private final SnapshotManager snapshots;
    private volatile RecoveryState state = RecoveryState.START;

    public RecoveryCoordinator(MatchingEngine engine, WriteAheadLog wal, SnapshotManager snapshots) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
    }

    public RecoveryState getState() {
        return state;
    }

    public RecoveryReport recover() {
        if (state != RecoveryState.START) {
            throw new IllegalStateException("Recovery already ran (state " + state + ")");
        }
        LOG.info("Starting recovery");

        long startSeq = restoreSnapshot();

        state = RecoveryState.REPLAYING;
        List<WalEntry> entries = wal.readSince(startSeq);
        LOG.info("Replaying {} WAL entries after sequence {}", entries.size(), startSeq);
        ReplayStats stats = new WalReplayer(engine).replay(entries);

        // a snapshot ahead of the log means the log was lost; never reuse its sequence numbers
        wal.advanceSequenceTo(startSeq);

        state = RecoveryState.READY;
        RecoveryReport report = new RecoveryReport(startSeq, entries.size(), stats, wal.getCurrentSequence());
        LOG.info("Recovery complete: placed={}, cancelled={}, skipped={}, trades={}, sequence={}",
                stats.placed(), stats.cancelled(), stats.skipped(), stats.trades(), report.walSequence());
        return report;
    }

    private long restoreSnapshot() {
        Optional<Snapshot> latest = snapshots.loadLatest();
        if (latest.isEmpty()) {
            LOG.info("No snapshot found; replaying the full WAL");
            engine.restoreState(null);
            state = RecoveryState.NO_SNAPSHOT;
            return 0;
        }

        Snapshot snapshot = latest.get();
        try {
            engine.restoreState(snapshot.books());
        } catch (IllegalArgumentException ex) {
            LOG.warn("Snapshot at sequence {} could not be applied; replaying the full WAL",
                    snapshot.sequence(), ex);
            engine.restoreState(null);
            state = RecoveryState.NO_SNAPSHOT;
            return 0;
        }
        LOG.info("Loaded snapshot at sequence {}", snapshot.sequence());
        state = RecoveryState.SNAPSHOT_LOADED;
        return snapshot.sequence();
    }
}
