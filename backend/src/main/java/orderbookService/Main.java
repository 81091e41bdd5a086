package orderbookService;

import io.javalin.Javalin;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        OrderbookConfig config = OrderbookConfig.fromEnvironment();
        Clock clock = Clock.systemUTC();

        MatchingEngine engine = new MatchingEngine();
        WriteAheadLog wal = new WriteAheadLog(config.walPath(), config.fsyncEveryN(), clock);
        SnapshotManager snapshots = new SnapshotManager(
                engine, new FileSnapshotStore(config.snapshotDir()), config.snapshotInterval(), clock);

        // 1. Rebuild the books before accepting any traffic
        RecoveryReport report = new RecoveryCoordinator(engine, wal, snapshots).recover();
        LOG.info("Recovered to sequence {} (snapshot {}, {} entries replayed, {} skipped)",
                report.walSequence(), report.snapshotSequence(),
                report.stats().replayed(), report.stats().skipped());

        // 2. Periodic snapshots stamped with the WAL position
        snapshots.start(wal::getCurrentSequence);

        // 3. HTTP
        OrderService orderService = new OrderService(engine, wal, FatalErrorHandler.haltProcess());
        OrderbookServer server = new OrderbookServer(
                orderService, new OrderRequestValidator(new OrderIdGenerator()), clock);
        Javalin app = server.createApp().start("0.0.0.0", config.port());

        LOG.info("Orderbook service running on port {}", config.port());
        LOG.info("WAL: {} (fsync every {} writes)", config.walPath(), config.fsyncEveryN());
        LOG.info("Snapshots: {} every {}ms", config.snapshotDir(), config.snapshotInterval().toMillis());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(app, snapshots, wal), "orderbook-shutdown"));
    }

    private static void shutdown(Javalin app, SnapshotManager snapshots, WriteAheadLog wal) {
        LOG.info("Shutting down...");
        app.stop();
        snapshots.stop();
        try {
            snapshots.snapshotNow();
        } catch (RuntimeException ex) {
            LOG.error("Final snapshot failed; the next start replays from the previous one", ex);
        }
        wal.close();
        LOG.info("Shutdown complete");
    }
}
