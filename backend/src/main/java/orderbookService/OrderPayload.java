package orderbookService;

import java.math.BigDecimal;

/**
 * Body of {@code POST /order}. Every field is optional at the JSON level; {@link OrderRequestValidator}
 * decides what is required.
 */
public record OrderPayload(
        String orderId,
        String userId,
        String symbol,
        String side,
        String type,
        BigDecimal price,
        BigDecimal quantity) {
}
