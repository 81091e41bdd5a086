package orderbookService;

import com.google.gson.annotations.SerializedName;

/**
 * Indicates whether an order intends to buy or sell the instrument.
 */
public enum OrderSide {
    @SerializedName("buy")
    BUY,
    @SerializedName("sell")
    SELL
}
