package orderbookService;

/**
 * Payload of {@link WalEntryType#ORDER_MATCHED}.
 */
public record OrderMatched(Trade trade) {
}
