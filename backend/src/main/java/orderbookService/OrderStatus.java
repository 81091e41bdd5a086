package orderbookService;

import com.google.gson.annotations.SerializedName;

/**
 * Fill state reported back for a placed order.
 */
public enum OrderStatus {
    @SerializedName("accepted")
    ACCEPTED,
    @SerializedName("partially_filled")
    PARTIALLY_FILLED,
    @SerializedName("filled")
    FILLED;

    public static OrderStatus of(Order order) {
        if (order.getFilledQuantity() == 0) {
            return ACCEPTED;
        }
        return order.isFilled() ? FILLED : PARTIALLY_FILLED;
    }
}
