package orderbookService;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.javalin.Javalin;
import io.javalin.testtools.HttpClient;
import io.javalin.testtools.JavalinTest;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import okhttp3.MediaType;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OrderbookServerTest {

    private static final MediaType JSON = MediaType.get("application/json");

    @TempDir
    Path tempDir;

    private WriteAheadLog wal;
    private Javalin app;

    @BeforeEach
    void setUp() {
        wal = new WriteAheadLog(tempDir.resolve("orderbook.wal"), 1);
        OrderService service = new OrderService(new MatchingEngine(), wal, error -> Assertions.fail(error));
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
        OrderbookServer server = new OrderbookServer(
                service, new OrderRequestValidator(new OrderIdGenerator(() -> "srv-1")), clock);
        app = server.createApp();
    }

    @AfterEach
    void tearDown() {
        wal.close();
    }

    private static Response post(HttpClient client, String path, String json) {
        return client.request(path, builder -> builder.post(RequestBody.create(json, JSON)));
    }

    private static JsonObject body(Response response) {
        try {
            return JsonParser.parseString(response.body().string()).getAsJsonObject();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    @Test
    void restingLimitOrderIsAccepted() {
        JavalinTest.test(app, (server, client) -> {
            Response response = post(client, "/order",
                    "{\"user_id\":\"u1\",\"symbol\":\"BTC-USD\",\"side\":\"buy\",\"type\":\"limit\","
                            + "\"price\":\"49999\",\"quantity\":\"1\"}");

            Assertions.assertEquals(200, response.code());
            JsonObject json = body(response);
            Assertions.assertEquals("srv-1", json.get("server_order_id").getAsString());
            Assertions.assertEquals("accepted", json.get("status").getAsString());
            Assertions.assertFalse(json.get("matched").getAsBoolean());
            Assertions.assertEquals(0, json.getAsJsonArray("trades").size());
            Assertions.assertEquals(1, json.get("sequence_number").getAsLong());
        });
    }

    @Test
    void crossingOrderReportsTrades() {
        JavalinTest.test(app, (server, client) -> {
            post(client, "/order", "{\"order_id\":\"s1\",\"user_id\":\"u1\",\"symbol\":\"BTC-USD\","
                    + "\"side\":\"sell\",\"type\":\"limit\",\"price\":50000,\"quantity\":1}").close();

            Response response = post(client, "/order", "{\"order_id\":\"b1\",\"user_id\":\"u2\","
                    + "\"symbol\":\"BTC-USD\",\"side\":\"buy\",\"type\":\"limit\",\"price\":50100,\"quantity\":0.25}");

            JsonObject json = body(response);
            Assertions.assertEquals("b1", json.get("server_order_id").getAsString());
            Assertions.assertEquals("filled", json.get("status").getAsString());
            Assertions.assertTrue(json.get("matched").getAsBoolean());
            JsonObject trade = json.getAsJsonArray("trades").get(0).getAsJsonObject();
            Assertions.assertEquals("b1", trade.get("buyer_order_id").getAsString());
            Assertions.assertEquals("s1", trade.get("seller_order_id").getAsString());
            Assertions.assertEquals(0, trade.get("price").getAsBigDecimal().compareTo(new BigDecimal("50000")));
            Assertions.assertEquals(0, trade.get("quantity").getAsBigDecimal().compareTo(new BigDecimal("0.25")));
            Assertions.assertEquals(2, json.get("sequence_number").getAsLong());
        });
    }

    @Test
    void invalidOrderIsRejectedWithoutLogging() {
        JavalinTest.test(app, (server, client) -> {
            Response response = post(client, "/order",
                    "{\"user_id\":\"u1\",\"symbol\":\"BTC-USD\",\"side\":\"buy\",\"type\":\"limit\",\"quantity\":1}");

            Assertions.assertEquals(400, response.code());
            Assertions.assertEquals("Limit orders require price", body(response).get("error").getAsString());
            Assertions.assertEquals(0, wal.getCurrentSequence());
        });
    }

    @Test
    void malformedAndEmptyBodiesAreBadRequests() {
        JavalinTest.test(app, (server, client) -> {
            Response malformed = post(client, "/order", "{\"user_id\":");
            Assertions.assertEquals(400, malformed.code());
            Assertions.assertEquals("Malformed JSON body", body(malformed).get("error").getAsString());

            Response empty = post(client, "/order", "");
            Assertions.assertEquals(400, empty.code());
            Assertions.assertEquals("Missing required fields", body(empty).get("error").getAsString());
        });
    }

    @Test
    void cancelReportsOutcome() {
        JavalinTest.test(app, (server, client) -> {
            post(client, "/order", "{\"order_id\":\"b1\",\"user_id\":\"u1\",\"symbol\":\"BTC-USD\","
                    + "\"side\":\"buy\",\"type\":\"limit\",\"price\":1,\"quantity\":1}").close();

            Response first = post(client, "/cancel", "{\"order_id\":\"b1\",\"symbol\":\"BTC-USD\"}");
            Assertions.assertEquals("cancelled", body(first).get("status").getAsString());

            Response second = post(client, "/cancel", "{\"order_id\":\"b1\",\"symbol\":\"BTC-USD\"}");
            Assertions.assertEquals(200, second.code());
            Assertions.assertEquals("not_found", body(second).get("status").getAsString());

            Response missing = post(client, "/cancel", "{\"order_id\":\"b1\"}");
            Assertions.assertEquals(400, missing.code());
            Assertions.assertEquals("Missing order_id or symbol", body(missing).get("error").getAsString());
        });
    }

    @Test
    void snapshotListsLevelsAsDecimalPairs() {
        JavalinTest.test(app, (server, client) -> {
            post(client, "/order", "{\"user_id\":\"u1\",\"symbol\":\"ETH-USD\",\"side\":\"buy\","
                    + "\"type\":\"limit\",\"price\":\"1999.5\",\"quantity\":\"2\"}").close();
            post(client, "/order", "{\"order_id\":\"x\",\"user_id\":\"u1\",\"symbol\":\"ETH-USD\",\"side\":\"sell\","
                    + "\"type\":\"limit\",\"price\":\"2001\",\"quantity\":\"0.5\"}").close();

            Response response = client.get("/snapshot?symbol=ETH-USD");

            Assertions.assertEquals(200, response.code());
            JsonObject json = body(response);
            Assertions.assertEquals("ETH-USD", json.get("symbol").getAsString());
            JsonArray bid = json.getAsJsonArray("bids").get(0).getAsJsonArray();
            Assertions.assertEquals("1999.5", bid.get(0).getAsBigDecimal().toPlainString());
            Assertions.assertEquals("2", bid.get(1).getAsBigDecimal().toPlainString());
            JsonArray ask = json.getAsJsonArray("asks").get(0).getAsJsonArray();
            Assertions.assertEquals("2001", ask.get(0).getAsBigDecimal().toPlainString());
            Assertions.assertEquals("0.5", ask.get(1).getAsBigDecimal().toPlainString());
            Assertions.assertEquals(2, json.get("last_sequence").getAsLong());
        });
    }

    @Test
    void snapshotOfUnknownSymbolIsEmpty() {
        JavalinTest.test(app, (server, client) -> {
            JsonObject json = body(client.get("/snapshot?symbol=NOPE"));

            Assertions.assertEquals(0, json.getAsJsonArray("bids").size());
            Assertions.assertEquals(0, json.getAsJsonArray("asks").size());
        });
    }

    @Test
    void snapshotRequiresSymbol() {
        JavalinTest.test(app, (server, client) -> {
            Response response = client.get("/snapshot");

            Assertions.assertEquals(400, response.code());
            Assertions.assertEquals("Missing symbol parameter", body(response).get("error").getAsString());
        });
    }

    @Test
    void walFailureIsAnInternalError() {
        JavalinTest.test(app, (server, client) -> {
            wal.close();

            Response response = post(client, "/order", "{\"user_id\":\"u1\",\"symbol\":\"BTC-USD\","
                    + "\"side\":\"buy\",\"type\":\"market\",\"quantity\":1}");

            Assertions.assertEquals(500, response.code());
            Assertions.assertEquals("Internal server error", body(response).get("error").getAsString());
        });
    }

    @Test
    void healthReportsSequenceAndTime() {
        JavalinTest.test(app, (server, client) -> {
            JsonObject json = body(client.get("/health"));

            Assertions.assertEquals("healthy", json.get("status").getAsString());
            Assertions.assertEquals(0, json.get("sequence").getAsLong());
            Assertions.assertEquals(1_700_000_000_000L, json.get("timestamp").getAsLong());
        });
    }
}
