package orderbookService;

import java.util.Optional;

/**
 * Durable home for engine snapshots.
 */
public interface SnapshotStore {

    /**
     * Persists the snapshot; it must be durable when this returns.
     */
    void save(Snapshot snapshot);

    /**
     * The readable snapshot with the highest sequence number, if any.
     */
    Optional<Snapshot> loadLatest();
}
