package orderbookService;

import com.google.gson.annotations.SerializedName;

/**
 * Defines the execution logic of an order.
 */
public enum OrderType {

    /**
     * Executes immediately against whatever liquidity is resting; any remainder is discarded.
     */
    @SerializedName("market")
    MARKET,

    /**
     * Executes at the given price or better; any remainder rests on the book until matched or cancelled.
     */
    @SerializedName("limit")
    LIMIT
}
