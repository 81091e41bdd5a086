package orderbookService;

import java.util.Objects;

/**
 * A single order submitted to the matching engine. Prices and quantities are fixed-point
 * units (see {@link DecimalScale}). Everything except the filled quantity is fixed at creation.
 */
public final class Order {

    private final String orderId;
    private final String userId;
    private final String symbol;
    private final OrderSide side;
    private final OrderType type;
    private final Long price;
    private final long quantity;
    private long filledQuantity;
    private final long timestamp;

    /**
     * Constructs an unfilled order.
     *
     * @param orderId   unique identifier for the order
     * @param userId    identifier of the submitting user
     * @param symbol    instrument symbol (e.g., "BTC-USD")
     * @param side      side of the market the order targets
     * @param type      execution logic for the order
     * @param price     limit price in price units; must be {@code null} for market orders
     * @param quantity  total quantity in quantity units
     * @param timestamp submission time in epoch milliseconds; informational only, never used for priority
     */
    public Order(
            String orderId,
            String userId,
            String symbol,
            OrderSide side,
            OrderType type,
            Long price,
            long quantity,
            long timestamp) {
        this(orderId, userId, symbol, side, type, price, quantity, 0L, timestamp);
    }

    private Order(
            String orderId,
            String userId,
            String symbol,
            OrderSide side,
            OrderType type,
            Long price,
            long quantity,
            long filledQuantity,
            long timestamp) {
        this.orderId = Objects.requireNonNull(orderId, "orderId");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.side = Objects.requireNonNull(side, "side");
        this.type = Objects.requireNonNull(type, "type");
        this.price = price;
        this.quantity = quantity;
        this.filledQuantity = filledQuantity;
        this.timestamp = timestamp;
        requireWellFormed();
    }

    /**
     * Re-checks the constructor invariants. Instances decoded from the write-ahead log or a
     * snapshot bypass the constructor, so readers call this before handing them to the engine.
     *
     * @return this order
     * @throws IllegalArgumentException if a field is missing or out of range
     */
    public Order requireWellFormed() {
        if (orderId == null || userId == null || symbol == null || side == null || type == null) {
            throw new IllegalArgumentException("order is missing required fields");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive");
        }
        if (filledQuantity < 0 || filledQuantity > quantity) {
            throw new IllegalArgumentException("filledQuantity must be within [0, quantity]");
        }
        if (type == OrderType.LIMIT && (price == null || price <= 0)) {
            throw new IllegalArgumentException("limit orders require a positive price");
        }
        if (type == OrderType.MARKET && price != null) {
            throw new IllegalArgumentException("market orders must not carry a price");
        }
        return this;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getUserId() {
        return userId;
    }

    public String getSymbol() {
        return symbol;
    }

    public OrderSide getSide() {
        return side;
    }

    public OrderType getType() {
        return type;
    }

    public Long getPrice() {
        return price;
    }

    public long getQuantity() {
        return quantity;
    }

    public long getFilledQuantity() {
        return filledQuantity;
    }

    public long getRemainingQuantity() {
        return quantity - filledQuantity;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public boolean isFilled() {
        return filledQuantity == quantity;
    }

    void fill(long executedQuantity) {
        if (executedQuantity <= 0) {
            throw new IllegalStateException("executedQuantity must be positive");
        }
        if (executedQuantity > getRemainingQuantity()) {
            throw new IllegalStateException("executedQuantity " + executedQuantity
                    + " exceeds remaining quantity of order " + orderId);
        }
        filledQuantity += executedQuantity;
    }

    Order copy() {
        return new Order(orderId, userId, symbol, side, type, price, quantity, filledQuantity, timestamp);
    }

    @Override
    public String toString() {
        return "Order{" + orderId + ' ' + symbol + ' ' + side + ' ' + type
                + " price=" + price + " qty=" + quantity + " filled=" + filledQuantity + '}';
    }
}
