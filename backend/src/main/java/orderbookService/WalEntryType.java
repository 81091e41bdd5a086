package orderbookService;

/**
 * Kinds of state-changing events recorded in the write-ahead log.
 */
public enum WalEntryType {
    /** An accepted order, logged before it is matched. Replayed. */
    ORDER_PLACED,
    /** One trade produced by matching. Audit only; replay re-derives trades. */
    ORDER_MATCHED,
    /** A cancel request, logged before it is applied. Replayed. */
    ORDER_CANCELLED
}
