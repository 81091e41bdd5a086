package orderbookService;

import com.google.gson.JsonParseException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP surface of the order book service. Decimal prices and quantities are converted to
 * fixed-point units here and back again in responses.
 */
public final class OrderbookServer {
    private static final Logger LOG = LoggerFactory.getLogger(OrderbookServer.class);

    private final OrderService orders;
    private final OrderRequestValidator validator;
    private final Clock clock;

    public OrderbookServer(OrderService orders, OrderRequestValidator validator, Clock clock) {
        this.orders = orders;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Builds the Javalin app with all routes registered; the caller starts it.
     */
    public Javalin createApp() {
        Javalin app = Javalin.create(config -> {
            config.jsonMapper(new GsonJsonMapper(Json.GSON));
            config.showJavalinBanner = false;
        });

        app.post("/order", this::placeOrder);
        app.post("/cancel", this::cancelOrder);
        app.get("/snapshot", this::snapshot);
        app.get("/health", this::health);

        app.exception(IllegalArgumentException.class, (ex, ctx) -> {
            LOG.warn("Rejected {} {}: {}", ctx.method(), ctx.path(), ex.getMessage());
            ctx.status(400).json(Map.of("error", ex.getMessage()));
        });
        app.exception(JsonParseException.class, (ex, ctx) -> {
            LOG.warn("Malformed JSON body on {}: {}", ctx.path(), ex.getMessage());
            ctx.status(400).json(Map.of("error", "Malformed JSON body"));
        });
        app.exception(WalException.class, (ex, ctx) -> {
            LOG.error("WAL failure while handling {} {}", ctx.method(), ctx.path(), ex);
            ctx.status(500).json(Map.of("error", "Internal server error"));
        });
        app.exception(Exception.class, (ex, ctx) -> {
            LOG.error("Unexpected error while handling {} {}", ctx.method(), ctx.path(), ex);
            ctx.status(500).json(Map.of("error", "Internal server error"));
        });

        return app;
    }

    private void placeOrder(Context ctx) {
        OrderPayload payload = readBody(ctx, OrderPayload.class);
        Order order = validator.toOrder(payload, clock.millis());
        PlacementReceipt receipt = orders.placeOrder(order);

        List<TradeView> trades = new ArrayList<>(receipt.trades().size());
        for (Trade trade : receipt.trades()) {
            trades.add(TradeView.of(trade));
        }
        ctx.json(new OrderResponse(
                receipt.order().getOrderId(),
                receipt.status(),
                receipt.matched(),
                trades,
                receipt.sequence()));
    }

    private void cancelOrder(Context ctx) {
        CancelPayload payload = validator.requireCancel(readBody(ctx, CancelPayload.class));
        boolean cancelled = orders.cancelOrder(payload.symbol(), payload.orderId());
        ctx.json(Map.of("status", cancelled ? "cancelled" : "not_found"));
    }

    private void snapshot(Context ctx) {
        String symbol = ctx.queryParam("symbol");
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Missing symbol parameter");
        }
        BookSnapshotView view = orders.bookSnapshot(symbol.trim());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", view.symbol());
        body.put("bids", toPairs(view.levels().getBids()));
        body.put("asks", toPairs(view.levels().getAsks()));
        body.put("last_sequence", view.lastSequence());
        ctx.json(body);
    }

    private void health(Context ctx) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("sequence", orders.currentSequence());
        body.put("timestamp", clock.millis());
        ctx.json(body);
    }

    private static <T> T readBody(Context ctx, Class<T> type) {
        if (ctx.body().isBlank()) {
            return null;
        }
        return ctx.bodyAsClass(type);
    }

    private static List<List<BigDecimal>> toPairs(List<LevelInfo> levels) {
        List<List<BigDecimal>> pairs = new ArrayList<>(levels.size());
        for (LevelInfo level : levels) {
            pairs.add(List.of(
                    DecimalScale.PRICE.toDecimal(level.getPrice()),
                    DecimalScale.QUANTITY.toDecimal(level.getQuantity())));
        }
        return pairs;
    }

    record TradeView(String buyerOrderId, String sellerOrderId, BigDecimal price, BigDecimal quantity) {
        static TradeView of(Trade trade) {
            return new TradeView(
                    trade.getBuyerOrderId(),
                    trade.getSellerOrderId(),
                    DecimalScale.PRICE.toDecimal(trade.getPrice()),
                    DecimalScale.QUANTITY.toDecimal(trade.getQuantity()));
        }
    }

    record OrderResponse(
            String serverOrderId,
            OrderStatus status,
            boolean matched,
            List<TradeView> trades,
            long sequenceNumber) {
    }
}
