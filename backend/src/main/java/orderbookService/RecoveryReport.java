package orderbookService;

/**
 * Summary of a completed recovery.
 *
 * @param snapshotSequence sequence of the snapshot the engine was restored from, or 0 if none
 * @param entriesRead      WAL entries newer than the snapshot
 * @param stats            replay counts
 * @param walSequence      WAL sequence after recovery; new entries are numbered after it
 */
public record RecoveryReport(long snapshotSequence, int entriesRead, ReplayStats stats, long walSequence) {

    public boolean restoredFromSnapshot() {
        return snapshotSequence > 0;
    }
}
