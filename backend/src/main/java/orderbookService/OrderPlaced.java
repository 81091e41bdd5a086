package orderbookService;

/**
 * Payload of {@link WalEntryType#ORDER_PLACED}.
 */
public record OrderPlaced(Order order) {
}
