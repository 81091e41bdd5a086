package orderbookService;

import java.util.Map;

/**
 * Point-in-time copy of every book together with the WAL position it reflects. Entries with
 * {@code seq <= sequence} are already contained in {@code books}.
 */
public record Snapshot(long timestamp, long sequence, Map<String, BookState> books) {
}
