package orderbookService;

/**
 * An execution between one buy and one sell order. Price is the resting order's price.
 */
public final class Trade {
    private final String buyerOrderId;
    private final String sellerOrderId;
    private final long price;
    private final long quantity;

    public Trade(String buyerOrderId, String sellerOrderId, long price, long quantity) {
        this.buyerOrderId = buyerOrderId;
        this.sellerOrderId = sellerOrderId;
        this.price = price;
        this.quantity = quantity;
    }

    public String getBuyerOrderId() {
        return buyerOrderId;
    }

    public String getSellerOrderId() {
        return sellerOrderId;
    }

    public long getPrice() {
        return price;
    }

    public long getQuantity() {
        return quantity;
    }

    @Override
    public String toString() {
        return "Trade{buyer=" + buyerOrderId + ", seller=" + sellerOrderId
                + ", price=" + price + ", qty=" + quantity + '}';
    }
}
