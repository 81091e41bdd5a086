package orderbookService;

import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for state-changing requests. Each request is logged to the WAL strictly before it
 * is applied, and the log-then-apply pair runs under the engine's exclusive lock, so WAL order is
 * the order in which the engine saw the operations.
 *
 * <p>Orders reaching this class are already validated.
 */
public final class OrderService {
    private static final Logger LOG = LoggerFactory.getLogger(OrderService.class);

    private final MatchingEngine engine;
    private final WriteAheadLog wal;
    private final FatalErrorHandler fatalErrorHandler;

    public OrderService(MatchingEngine engine, WriteAheadLog wal, FatalErrorHandler fatalErrorHandler) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.wal = Objects.requireNonNull(wal, "wal");
        this.fatalErrorHandler = Objects.requireNonNull(fatalErrorHandler, "fatalErrorHandler");
    }

    /**
     * @throws IllegalArgumentException if an order with the same id is resting on the symbol
     * @throws WalException             if the placement or one of its trades could not be logged
     */
    public PlacementReceipt placeOrder(Order order) {
        Objects.requireNonNull(order, "order");
        return engine.runExclusive(() -> {
            if (engine.containsOrder(order.getSymbol(), order.getOrderId())) {
                throw new IllegalArgumentException("Duplicate order_id");
            }

            long seq = wal.append(WalEntryType.ORDER_PLACED, new OrderPlaced(order));
            OrderResult result = apply(() -> engine.placeOrder(order));

            for (Trade trade : result.trades()) {
                wal.append(WalEntryType.ORDER_MATCHED, new OrderMatched(trade));
            }

            Order placed = result.order();
            LOG.info("Placed order: id={}, symbol={}, side={}, type={}, price={}, qty={}, filled={}, seq={}",
                    placed.getOrderId(), placed.getSymbol(), placed.getSide(), placed.getType(),
                    placed.getPrice(), placed.getQuantity(), placed.getFilledQuantity(), seq);
            return new PlacementReceipt(placed, OrderStatus.of(placed), result.trades(), seq);
        });
    }

    /**
     * Logs and applies a cancel. Cancelling an order that is not resting is logged too and
     * returns {@code false}.
     */
    public boolean cancelOrder(String symbol, String orderId) {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(orderId, "orderId");
        return engine.runExclusive(() -> {
            long seq = wal.append(WalEntryType.ORDER_CANCELLED, new OrderCancelled(symbol, orderId));
            boolean cancelled = apply(() -> engine.cancelOrder(symbol, orderId));
            LOG.info("Cancel request: id={}, symbol={}, cancelled={}, seq={}", orderId, symbol, cancelled, seq);
            return cancelled;
        });
    }

    public BookSnapshotView bookSnapshot(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        return engine.runExclusive(() ->
                new BookSnapshotView(symbol, engine.getSnapshot(symbol), wal.getCurrentSequence()));
    }

    public long currentSequence() {
        return wal.getCurrentSequence();
    }

    private <T> T apply(Supplier<T> step) {
        try {
            return step.get();
        } catch (RuntimeException ex) {
            LOG.error("Matching failed after the request was logged; halting", ex);
            fatalErrorHandler.onFatal(ex);
            throw ex;
        }
    }
}
