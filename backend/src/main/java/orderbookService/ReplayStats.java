package orderbookService;

/**
 * Counts from one replay pass.
 *
 * @param placed         ORDER_PLACED entries applied
 * @param cancelled      ORDER_CANCELLED entries applied
 * @param matchedIgnored ORDER_MATCHED entries passed over
 * @param skipped        entries that failed to decode or apply
 * @param trades         trades re-derived while replaying placements
 */
public record ReplayStats(int placed, int cancelled, int matchedIgnored, int skipped, int trades) {

    public int replayed() {
        return placed + cancelled;
    }
}
