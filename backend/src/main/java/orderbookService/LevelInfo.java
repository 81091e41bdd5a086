package orderbookService;

/**
 * Aggregated resting quantity at one price level.
 */
public final class LevelInfo {
    private final long price;
    private final long quantity;

    public LevelInfo(long price, long quantity) {
        this.price = price;
        this.quantity = quantity;
    }

    public long getPrice() {
        return price;
    }

    public long getQuantity() {
        return quantity;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LevelInfo level)) {
            return false;
        }
        return price == level.price && quantity == level.quantity;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(price) * 31 + Long.hashCode(quantity);
    }

    @Override
    public String toString() {
        return price + "x" + quantity;
    }
}
