package orderbookService;

/**
 * Body of {@code POST /cancel}.
 */
public record CancelPayload(String orderId, String symbol) {
}
