package orderbookService;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Price-time priority matching over one book per symbol.
 *
 * <p>Matching is a pure function of the sequence of {@link #placeOrder} and {@link #cancelOrder}
 * calls: no clock, randomness or outside state is consulted, and queue position inside a price
 * level is the order of application. Replaying the write-ahead log in sequence order therefore
 * rebuilds exactly the books that existed live.
 *
 * <p>All access goes through a single lock. Callers that must make a multi-step unit atomic
 * (log then apply, or capture state together with a log position) wrap it in
 * {@link #runExclusive(Supplier)}.
 */
public class MatchingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MatchingEngine.class);

    private final Map<String, Orderbook> books = new TreeMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public <T> T runExclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Matches the order and rests any limit remainder. The engine works on its own copy; the
     * argument is never mutated and the returned order is detached from the book.
     */
    public OrderResult placeOrder(Order order) {
        Objects.requireNonNull(order, "order");
        return runExclusive(() -> {
            Order working = order.copy();
            Orderbook book = books.computeIfAbsent(working.getSymbol(), Orderbook::new);

            List<Trade> trades = book.match(working);

            if (!working.isFilled()) {
                if (working.getType() == OrderType.LIMIT) {
                    book.rest(working);
                } else {
                    LOG.debug("Discarding unfilled market remainder of order {}: {}",
                            working.getOrderId(), working.getRemainingQuantity());
                }
            }

            return new OrderResult(working.copy(), List.copyOf(trades));
        });
    }

    public boolean cancelOrder(String symbol, String orderId) {
        return runExclusive(() -> {
            Orderbook book = books.get(symbol);
            return book != null && book.cancel(orderId);
        });
    }

    /**
     * Aggregated price levels of a symbol; an unknown symbol yields an empty view.
     */
    public OrderbookLevelInfos getSnapshot(String symbol) {
        return runExclusive(() -> {
            Orderbook book = books.get(symbol);
            return book == null ? OrderbookLevelInfos.empty() : book.levelInfos();
        });
    }

    public boolean containsOrder(String symbol, String orderId) {
        return runExclusive(() -> {
            Orderbook book = books.get(symbol);
            return book != null && book.contains(orderId);
        });
    }

    public int restingOrderCount(String symbol) {
        return runExclusive(() -> {
            Orderbook book = books.get(symbol);
            return book == null ? 0 : book.size();
        });
    }

    public Set<String> symbols() {
        return runExclusive(() -> Set.copyOf(books.keySet()));
    }

    /**
     * Copies every book's raw resting orders, keyed by symbol in sorted order.
     */
    public Map<String, BookState> getFullState() {
        return runExclusive(() -> {
            Map<String, BookState> state = new LinkedHashMap<>();
            for (Orderbook book : books.values()) {
                state.put(book.symbol(), book.state());
            }
            return state;
        });
    }

    /**
     * Replaces all books with the given state. {@code null} clears the engine. Orders are rested
     * in list order, which restores their queue positions.
     *
     * @throws IllegalArgumentException if the state contains an order that could not be resting;
     *                                  the engine is left empty in that case
     */
    public void restoreState(Map<String, BookState> state) {
        runExclusive(() -> {
            books.clear();
            if (state == null) {
                return null;
            }
            try {
                for (Map.Entry<String, BookState> entry : state.entrySet()) {
                    Orderbook book = new Orderbook(entry.getKey());
                    BookState bookState = entry.getValue();
                    if (bookState != null) {
                        restoreSide(book, bookState.bids(), OrderSide.BUY);
                        restoreSide(book, bookState.asks(), OrderSide.SELL);
                    }
                    books.put(book.symbol(), book);
                }
            } catch (RuntimeException ex) {
                books.clear();
                throw new IllegalArgumentException("Cannot restore engine state: " + ex.getMessage(), ex);
            }
            LOG.info("Restored {} books", books.size());
            return null;
        });
    }

    private static void restoreSide(Orderbook book, List<Order> orders, OrderSide expectedSide) {
        if (orders == null) {
            return;
        }
        for (Order order : new ArrayList<>(orders)) {
            Order restored = Objects.requireNonNull(order, "null order in state").requireWellFormed().copy();
            if (restored.getSide() != expectedSide || !restored.getSymbol().equals(book.symbol())) {
                throw new IllegalArgumentException("order " + restored.getOrderId() + " is filed under the wrong book");
            }
            book.rest(restored);
        }
    }
}
