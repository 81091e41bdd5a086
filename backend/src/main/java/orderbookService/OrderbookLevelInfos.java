package orderbookService;

import java.util.List;

/**
 * Price-level view of one symbol's book: bids best (highest) first, asks best (lowest) first.
 */
public final class OrderbookLevelInfos {
    private final List<LevelInfo> bids;
    private final List<LevelInfo> asks;

    public OrderbookLevelInfos(List<LevelInfo> bids, List<LevelInfo> asks) {
        this.bids = List.copyOf(bids);
        this.asks = List.copyOf(asks);
    }

    public static OrderbookLevelInfos empty() {
        return new OrderbookLevelInfos(List.of(), List.of());
    }

    public List<LevelInfo> getBids() {
        return bids;
    }

    public List<LevelInfo> getAsks() {
        return asks;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof OrderbookLevelInfos infos)) {
            return false;
        }
        return bids.equals(infos.bids) && asks.equals(infos.asks);
    }

    @Override
    public int hashCode() {
        return bids.hashCode() * 31 + asks.hashCode();
    }

    @Override
    public String toString() {
        return "bids=" + bids + " asks=" + asks;
    }
}
