package orderbookService;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-applies logged placements and cancels to an engine in ascending sequence order. Trades are
 * re-derived by matching; logged ORDER_MATCHED entries are not applied. A failing entry is logged
 * and skipped.
 */
public final class WalReplayer {
    private static final Logger LOG = LoggerFactory.getLogger(WalReplayer.class);

    private final MatchingEngine engine;

    public WalReplayer(MatchingEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public ReplayStats replay(List<WalEntry> entries) {
        List<WalEntry> ordered = new ArrayList<>(entries);
        ordered.sort(Comparator.comparingLong(WalEntry::seq));

        int placed = 0;
        int cancelled = 0;
        int matchedIgnored = 0;
        int skipped = 0;
        int trades = 0;

        for (WalEntry entry : ordered) {
            try {
                switch (entry.type()) {
                    case ORDER_PLACED -> {
                        Order order = entry.payloadAs(OrderPlaced.class).order();
                        if (order == null) {
                            throw new IllegalArgumentException("ORDER_PLACED entry carries no order");
                        }
                        trades += engine.placeOrder(order.requireWellFormed()).trades().size();
                        placed++;
                    }
                    case ORDER_CANCELLED -> {
                        OrderCancelled cancel = entry.payloadAs(OrderCancelled.class);
                        if (cancel.symbol() == null || cancel.orderId() == null) {
                            throw new IllegalArgumentException("ORDER_CANCELLED entry is missing symbol or order_id");
                        }
                        engine.cancelOrder(cancel.symbol(), cancel.orderId());
                        cancelled++;
                    }
                    case ORDER_MATCHED -> matchedIgnored++;
                    default -> throw new IllegalArgumentException("Unsupported entry type " + entry.type());
                }
            } catch (RuntimeException ex) {
                skipped++;
                LOG.error("Failed to replay WAL entry {} ({}); skipping", entry.seq(), entry.type(), ex);
            }
        }

        return new ReplayStats(placed, cancelled, matchedIgnored, skipped, trades);
    }
}
