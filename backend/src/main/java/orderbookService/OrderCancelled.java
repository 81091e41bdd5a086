package orderbookService;

/**
 * Payload of {@link WalEntryType#ORDER_CANCELLED}.
 */
public record OrderCancelled(String symbol, String orderId) {
}
