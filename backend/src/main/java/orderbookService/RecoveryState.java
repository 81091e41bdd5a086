package orderbookService;

/**
 * Progress of startup recovery.
 */
public enum RecoveryState {
    START,
    SNAPSHOT_LOADED,
    NO_SNAPSHOT,
    REPLAYING,
    READY
}
