package orderbookService;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Resting orders of a single symbol. Each price level is a FIFO queue, so queue position is the
 * order in which orders were rested. Not thread-safe; {@link MatchingEngine} serializes access.
 */
final class Orderbook {
    private final String symbol;
    private final NavigableMap<Long, Deque<Order>> bids = new TreeMap<>(Comparator.reverseOrder());
    private final NavigableMap<Long, Deque<Order>> asks = new TreeMap<>();
    private final Map<String, Order> orders = new HashMap<>();

    Orderbook(String symbol) {
        this.symbol = symbol;
    }

    String symbol() {
        return symbol;
    }

    /**
     * Matches the incoming order against the opposite side until it is filled or the best
     * contra price no longer crosses. Fills are applied to both orders in place.
     */
    List<Trade> match(Order incoming) {
        NavigableMap<Long, Deque<Order>> contra = incoming.getSide() == OrderSide.BUY ? asks : bids;
        List<Trade> trades = new ArrayList<>();

        while (!incoming.isFilled()) {
            Map.Entry<Long, Deque<Order>> best = contra.firstEntry();
            if (best == null) {
                break;
            }
            long levelPrice = best.getKey();
            if (!crosses(incoming, levelPrice)) {
                break;
            }

            Deque<Order> level = best.getValue();
            Order resting = level.peekFirst();
            long quantity = Math.min(incoming.getRemainingQuantity(), resting.getRemainingQuantity());

            incoming.fill(quantity);
            resting.fill(quantity);

            if (incoming.getSide() == OrderSide.BUY) {
                trades.add(new Trade(incoming.getOrderId(), resting.getOrderId(), levelPrice, quantity));
            } else {
                trades.add(new Trade(resting.getOrderId(), incoming.getOrderId(), levelPrice, quantity));
            }

            if (resting.isFilled()) {
                level.pollFirst();
                orders.remove(resting.getOrderId());
                if (level.isEmpty()) {
                    contra.pollFirstEntry();
                }
            }
        }

        return trades;
    }

    private static boolean crosses(Order incoming, long levelPrice) {
        if (incoming.getType() == OrderType.MARKET) {
            return true;
        }
        long limit = incoming.getPrice();
        return incoming.getSide() == OrderSide.BUY ? limit >= levelPrice : limit <= levelPrice;
    }

    /**
     * Appends the order to the back of its price level.
     *
     * @throws IllegalStateException if the order cannot rest or its id is already resting
     */
    void rest(Order order) {
        if (order.getType() != OrderType.LIMIT || order.isFilled()) {
            throw new IllegalStateException("Only unfilled limit orders may rest: " + order);
        }
        if (orders.putIfAbsent(order.getOrderId(), order) != null) {
            throw new IllegalStateException("Order " + order.getOrderId() + " is already resting on " + symbol);
        }
        NavigableMap<Long, Deque<Order>> book = order.getSide() == OrderSide.BUY ? bids : asks;
        book.computeIfAbsent(order.getPrice(), __ -> new ArrayDeque<>()).addLast(order);
    }

    boolean cancel(String orderId) {
        Order order = orders.remove(orderId);
        if (order == null) {
            return false;
        }

        NavigableMap<Long, Deque<Order>> book = order.getSide() == OrderSide.BUY ? bids : asks;
        Deque<Order> ordersAtPrice = book.get(order.getPrice());
        if (ordersAtPrice != null) {
            ordersAtPrice.remove(order);
            if (ordersAtPrice.isEmpty()) {
                book.remove(order.getPrice());
            }
        }
        return true;
    }

    boolean contains(String orderId) {
        return orders.containsKey(orderId);
    }

    int size() {
        return orders.size();
    }

    OrderbookLevelInfos levelInfos() {
        return new OrderbookLevelInfos(aggregate(bids), aggregate(asks));
    }

    private static List<LevelInfo> aggregate(NavigableMap<Long, Deque<Order>> book) {
        List<LevelInfo> levels = new ArrayList<>(book.size());
        for (Map.Entry<Long, Deque<Order>> entry : book.entrySet()) {
            long quantity = 0;
            for (Order order : entry.getValue()) {
                quantity = Math.addExact(quantity, order.getRemainingQuantity());
            }
            levels.add(new LevelInfo(entry.getKey(), quantity));
        }
        return levels;
    }

    BookState state() {
        return new BookState(copyOrders(bids), copyOrders(asks));
    }

    private static List<Order> copyOrders(NavigableMap<Long, Deque<Order>> book) {
        List<Order> copies = new ArrayList<>();
        for (Deque<Order> level : book.values()) {
            for (Order order : level) {
                copies.add(order.copy());
            }
        }
        return copies;
    }
}
