package orderbookService;

import java.util.List;

/**
 * Outcome of placing an order: the order as it stands after matching and the trades it produced.
 */
public record OrderResult(Order order, List<Trade> trades) {
}
