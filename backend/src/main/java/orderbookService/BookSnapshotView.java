package orderbookService;

/**
 * Aggregated book of one symbol with the WAL position it reflects.
 */
public record BookSnapshotView(String symbol, OrderbookLevelInfos levels, long lastSequence) {
}
