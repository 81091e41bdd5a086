package orderbookService;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Turns request payloads into domain orders. Every rejection is an {@link IllegalArgumentException}
 * whose message is returned to the client as is; rejected requests never reach the WAL.
 */
public final class OrderRequestValidator {

    private final OrderIdGenerator orderIds;

    public OrderRequestValidator(OrderIdGenerator orderIds) {
        this.orderIds = orderIds;
    }

    public Order toOrder(OrderPayload payload, long timestamp) {
        if (payload == null
                || isBlank(payload.userId())
                || isBlank(payload.symbol())
                || isBlank(payload.side())
                || isBlank(payload.type())
                || payload.quantity() == null) {
            throw new IllegalArgumentException("Missing required fields");
        }

        OrderSide side = parseSide(payload.side());
        OrderType type = parseType(payload.type());

        if (type == OrderType.LIMIT && payload.price() == null) {
            throw new IllegalArgumentException("Limit orders require price");
        }
        if (payload.quantity().signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        long quantity = DecimalScale.QUANTITY.toUnits(payload.quantity());

        Long price = null;
        if (type == OrderType.LIMIT) {
            BigDecimal decimalPrice = payload.price();
            if (decimalPrice.signum() <= 0) {
                throw new IllegalArgumentException("Price must be positive");
            }
            price = DecimalScale.PRICE.toUnits(decimalPrice);
        }

        String orderId = isBlank(payload.orderId()) ? orderIds.nextId() : payload.orderId().trim();

        return new Order(
                orderId,
                payload.userId().trim(),
                payload.symbol().trim(),
                side,
                type,
                price,
                quantity,
                timestamp);
    }

    public CancelPayload requireCancel(CancelPayload payload) {
        if (payload == null || isBlank(payload.orderId()) || isBlank(payload.symbol())) {
            throw new IllegalArgumentException("Missing order_id or symbol");
        }
        return new CancelPayload(payload.orderId().trim(), payload.symbol().trim());
    }

    private static OrderSide parseSide(String token) {
        return switch (token.trim().toLowerCase(Locale.ROOT)) {
            case "buy" -> OrderSide.BUY;
            case "sell" -> OrderSide.SELL;
            default -> throw new IllegalArgumentException("Invalid side");
        };
    }

    private static OrderType parseType(String token) {
        return switch (token.trim().toLowerCase(Locale.ROOT)) {
            case "limit" -> OrderType.LIMIT;
            case "market" -> OrderType.MARKET;
            default -> throw new IllegalArgumentException("Invalid type");
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
