package orderbookService;

import java.util.List;

/**
 * Raw resting orders of one symbol, each side in matching priority order.
 */
public record BookState(List<Order> bids, List<Order> asks) {
}
