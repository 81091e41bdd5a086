package orderbookService;

import static orderbookService.TestOrders.limit;
import static orderbookService.TestOrders.market;
import static orderbookService.TestOrders.price;
import static orderbookService.TestOrders.qty;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MatchingEngineTest {

    private final MatchingEngine engine = new MatchingEngine();

    @Test
    void crossingLimitTradesAtRestingPrice() {
        engine.placeOrder(limit("s1", "BTC-USD", OrderSide.SELL, "50000", "1"));

        OrderResult result = engine.placeOrder(limit("b1", "BTC-USD", OrderSide.BUY, "50100", "0.4"));

        Assertions.assertEquals(1, result.trades().size());
        Trade trade = result.trades().get(0);
        Assertions.assertEquals("b1", trade.getBuyerOrderId());
        Assertions.assertEquals("s1", trade.getSellerOrderId());
        Assertions.assertEquals(price("50000"), trade.getPrice());
        Assertions.assertEquals(qty("0.4"), trade.getQuantity());
        Assertions.assertTrue(result.order().isFilled());
        Assertions.assertEquals(
                List.of(new LevelInfo(price("50000"), qty("0.6"))),
                engine.getSnapshot("BTC-USD").getAsks());
    }

    @Test
    void sellBelowRestingBidTradesAtBidPrice() {
        engine.placeOrder(limit("b1", "BTC-USD", OrderSide.BUY, "50000", "1.0"));

        OrderResult result = engine.placeOrder(limit("s1", "BTC-USD", OrderSide.SELL, "49999", "0.5"));

        Assertions.assertEquals(1, result.trades().size());
        Assertions.assertEquals(price("50000"), result.trades().get(0).getPrice());
        Assertions.assertEquals(qty("0.5"), result.trades().get(0).getQuantity());
        Order resting = engine.getFullState().get("BTC-USD").bids().get(0);
        Assertions.assertEquals("b1", resting.getOrderId());
        Assertions.assertEquals(qty("0.5"), resting.getFilledQuantity());
        Assertions.assertTrue(engine.getFullState().get("BTC-USD").asks().isEmpty());
    }

    @Test
    void marketSellIntoEmptyBookLeavesNoTrace() {
        OrderResult result = engine.placeOrder(market("m1", "ETH-USD", OrderSide.SELL, "10"));

        Assertions.assertTrue(result.trades().isEmpty());
        Assertions.assertFalse(engine.containsOrder("ETH-USD", "m1"));
        BookState state = engine.getFullState().get("ETH-USD");
        Assertions.assertTrue(state.bids().isEmpty());
        Assertions.assertTrue(state.asks().isEmpty());
    }

    @Test
    void nonCrossingLimitRests() {
        engine.placeOrder(limit("s1", "BTC-USD", OrderSide.SELL, "50000", "1"));

        OrderResult result = engine.placeOrder(limit("b1", "BTC-USD", OrderSide.BUY, "49999", "1"));

        Assertions.assertTrue(result.trades().isEmpty());
        Assertions.assertEquals(0, result.order().getFilledQuantity());
        OrderbookLevelInfos levels = engine.getSnapshot("BTC-USD");
        Assertions.assertEquals(List.of(new LevelInfo(price("49999"), qty("1"))), levels.getBids());
        Assertions.assertEquals(List.of(new LevelInfo(price("50000"), qty("1"))), levels.getAsks());
    }

    @Test
    void marketOrderIntoEmptyBookIsDiscarded() {
        OrderResult result = engine.placeOrder(market("m1", "ETH-USD", OrderSide.BUY, "3"));

        Assertions.assertTrue(result.trades().isEmpty());
        Assertions.assertEquals(0, result.order().getFilledQuantity());
        Assertions.assertEquals(OrderStatus.ACCEPTED, OrderStatus.of(result.order()));
        Assertions.assertEquals(0, engine.restingOrderCount("ETH-USD"));
        Assertions.assertEquals(OrderbookLevelInfos.empty(), engine.getSnapshot("ETH-USD"));
    }

    @Test
    void marketRemainderNeverRests() {
        engine.placeOrder(limit("s1", "ETH-USD", OrderSide.SELL, "2000", "1"));

        OrderResult result = engine.placeOrder(market("m1", "ETH-USD", OrderSide.BUY, "3"));

        Assertions.assertEquals(qty("1"), result.order().getFilledQuantity());
        Assertions.assertEquals(OrderStatus.PARTIALLY_FILLED, OrderStatus.of(result.order()));
        Assertions.assertFalse(engine.containsOrder("ETH-USD", "m1"));
        Assertions.assertEquals(0, engine.restingOrderCount("ETH-USD"));
    }

    @Test
    void samePriceFillsInArrivalOrder() {
        engine.placeOrder(limit("s1", "BTC-USD", OrderSide.SELL, "100", "1"));
        engine.placeOrder(limit("s2", "BTC-USD", OrderSide.SELL, "100", "1"));
        engine.placeOrder(limit("s3", "BTC-USD", OrderSide.SELL, "100", "1"));

        OrderResult result = engine.placeOrder(market("m1", "BTC-USD", OrderSide.BUY, "2"));

        Assertions.assertEquals(2, result.trades().size());
        Assertions.assertEquals("s1", result.trades().get(0).getSellerOrderId());
        Assertions.assertEquals("s2", result.trades().get(1).getSellerOrderId());
        Assertions.assertTrue(engine.containsOrder("BTC-USD", "s3"));
    }

    @Test
    void betterPriceFillsFirstRegardlessOfArrival() {
        engine.placeOrder(limit("b1", "BTC-USD", OrderSide.BUY, "99", "1"));
        engine.placeOrder(limit("b2", "BTC-USD", OrderSide.BUY, "101", "1"));
        engine.placeOrder(limit("b3", "BTC-USD", OrderSide.BUY, "100", "1"));

        OrderResult result = engine.placeOrder(limit("s1", "BTC-USD", OrderSide.SELL, "99", "3"));

        Assertions.assertEquals(3, result.trades().size());
        Assertions.assertEquals("b2", result.trades().get(0).getBuyerOrderId());
        Assertions.assertEquals(price("101"), result.trades().get(0).getPrice());
        Assertions.assertEquals("b3", result.trades().get(1).getBuyerOrderId());
        Assertions.assertEquals("b1", result.trades().get(2).getBuyerOrderId());
        Assertions.assertEquals(price("99"), result.trades().get(2).getPrice());
    }

    @Test
    void tradedQuantityNeverExceedsEitherSide() {
        engine.placeOrder(limit("s1", "BTC-USD", OrderSide.SELL, "100", "0.3"));
        engine.placeOrder(limit("s2", "BTC-USD", OrderSide.SELL, "100.5", "0.3"));

        OrderResult result = engine.placeOrder(limit("b1", "BTC-USD", OrderSide.BUY, "101", "0.5"));

        long total = result.trades().stream().mapToLong(Trade::getQuantity).sum();
        Assertions.assertEquals(qty("0.5"), total);
        Assertions.assertEquals(qty("0.3"), result.trades().get(0).getQuantity());
        Assertions.assertEquals(qty("0.2"), result.trades().get(1).getQuantity());
        Assertions.assertEquals(
                List.of(new LevelInfo(price("100.5"), qty("0.1"))),
                engine.getSnapshot("BTC-USD").getAsks());
    }

    @Test
    void booksAreIsolatedPerSymbol() {
        engine.placeOrder(limit("s1", "BTC-USD", OrderSide.SELL, "100", "1"));

        OrderResult result = engine.placeOrder(limit("b1", "ETH-USD", OrderSide.BUY, "100", "1"));

        Assertions.assertTrue(result.trades().isEmpty());
        Assertions.assertEquals(1, engine.restingOrderCount("BTC-USD"));
        Assertions.assertEquals(1, engine.restingOrderCount("ETH-USD"));
    }

    @Test
    void cancelRemovesRestingOrderAndEmptyLevel() {
        engine.placeOrder(limit("b1", "BTC-USD", OrderSide.BUY, "100", "1"));

        Assertions.assertTrue(engine.cancelOrder("BTC-USD", "b1"));
        Assertions.assertFalse(engine.cancelOrder("BTC-USD", "b1"));
        Assertions.assertTrue(engine.getSnapshot("BTC-USD").getBids().isEmpty());
    }

    @Test
    void cancelOfUnknownSymbolReturnsFalse() {
        Assertions.assertFalse(engine.cancelOrder("DOGE-USD", "x"));
        Assertions.assertTrue(engine.symbols().isEmpty());
    }

    @Test
    void inputOrderIsNotMutated() {
        engine.placeOrder(limit("s1", "BTC-USD", OrderSide.SELL, "100", "1"));
        Order incoming = limit("b1", "BTC-USD", OrderSide.BUY, "100", "1");

        OrderResult result = engine.placeOrder(incoming);

        Assertions.assertEquals(0, incoming.getFilledQuantity());
        Assertions.assertTrue(result.order().isFilled());
        Assertions.assertNotSame(incoming, result.order());
    }

    @Test
    void fullStateRoundTripsThroughRestore() {
        engine.placeOrder(limit("b1", "BTC-USD", OrderSide.BUY, "99", "1"));
        engine.placeOrder(limit("b2", "BTC-USD", OrderSide.BUY, "99", "2"));
        engine.placeOrder(limit("s1", "BTC-USD", OrderSide.SELL, "101", "1"));
        engine.placeOrder(limit("s2", "ETH-USD", OrderSide.SELL, "2000", "5"));
        engine.placeOrder(market("m1", "ETH-USD", OrderSide.BUY, "2"));

        Map<String, BookState> state = engine.getFullState();
        MatchingEngine restored = new MatchingEngine();
        restored.restoreState(state);

        Assertions.assertEquals(
                Json.GSON.toJson(engine.getFullState()),
                Json.GSON.toJson(restored.getFullState()));

        // queue position survives the restore
        OrderResult result = restored.placeOrder(limit("s3", "BTC-USD", OrderSide.SELL, "99", "1"));
        Assertions.assertEquals("b1", result.trades().get(0).getBuyerOrderId());
        Assertions.assertEquals(qty("3"), restored.getSnapshot("ETH-USD").getAsks().get(0).getQuantity());
    }

    @Test
    void restoreNullClearsEngine() {
        engine.placeOrder(limit("b1", "BTC-USD", OrderSide.BUY, "99", "1"));

        engine.restoreState(null);

        Assertions.assertTrue(engine.getFullState().isEmpty());
    }

    @Test
    void restoreRejectsOrderFiledUnderWrongSide() {
        Order bid = limit("b1", "BTC-USD", OrderSide.BUY, "99", "1");
        Map<String, BookState> state = Map.of("BTC-USD", new BookState(List.of(), List.of(bid)));

        IllegalArgumentException ex = Assertions.assertThrows(IllegalArgumentException.class,
                () -> engine.restoreState(state));

        Assertions.assertTrue(ex.getMessage().startsWith("Cannot restore engine state"));
        Assertions.assertTrue(engine.getFullState().isEmpty());
    }

    @Test
    void restoreRejectsDuplicateOrderIds() {
        Order first = limit("dup", "BTC-USD", OrderSide.BUY, "99", "1");
        Order second = limit("dup", "BTC-USD", OrderSide.BUY, "98", "1");
        Map<String, BookState> state = Map.of("BTC-USD", new BookState(List.of(first, second), List.of()));

        Assertions.assertThrows(IllegalArgumentException.class, () -> engine.restoreState(state));
    }

    @Test
    void sameSequenceOfCallsBuildsIdenticalBooks() {
        MatchingEngine other = new MatchingEngine();
        List<Order> orders = List.of(
                limit("1", "BTC-USD", OrderSide.SELL, "100", "2"),
                limit("2", "BTC-USD", OrderSide.SELL, "100", "1"),
                limit("3", "BTC-USD", OrderSide.BUY, "98", "4"),
                market("4", "BTC-USD", OrderSide.BUY, "2.5"),
                limit("5", "BTC-USD", OrderSide.SELL, "97", "1"));

        for (Order order : orders) {
            engine.placeOrder(order);
            other.placeOrder(order);
        }
        engine.cancelOrder("BTC-USD", "3");
        other.cancelOrder("BTC-USD", "3");

        Assertions.assertEquals(
                Json.GSON.toJson(engine.getFullState()),
                Json.GSON.toJson(other.getFullState()));
    }

    @Test
    void levelQuantityOverflowFailsInsteadOfWrapping() {
        long half = Long.MAX_VALUE / 2 + 1;
        engine.placeOrder(new Order("b1", "u1", "BTC-USD", OrderSide.BUY, OrderType.LIMIT, price("100"), half, 1));
        engine.placeOrder(new Order("b2", "u2", "BTC-USD", OrderSide.BUY, OrderType.LIMIT, price("100"), half, 2));

        Assertions.assertThrows(ArithmeticException.class, () -> engine.getSnapshot("BTC-USD"));
        Assertions.assertEquals(2, engine.restingOrderCount("BTC-USD"));
    }
}
