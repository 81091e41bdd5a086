package orderbookService;

import java.util.List;

/**
 * What the service reports for an accepted order.
 *
 * @param order    the order after matching
 * @param status   fill state derived from {@code order}
 * @param trades   trades in execution order
 * @param sequence WAL sequence of the ORDER_PLACED entry
 */
public record PlacementReceipt(Order order, OrderStatus status, List<Trade> trades, long sequence) {

    public boolean matched() {
        return !trades.isEmpty();
    }
}
