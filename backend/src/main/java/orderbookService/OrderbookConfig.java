package orderbookService;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service settings read from the environment. Unparsable values are logged and replaced by
 * their defaults.
 */
public record OrderbookConfig(
        int port,
        Path walPath,
        int fsyncEveryN,
        Duration snapshotInterval,
        Path snapshotDir) {

    private static final Logger LOG = LoggerFactory.getLogger(OrderbookConfig.class);

    static final int DEFAULT_PORT = 3001;
    static final String DEFAULT_WAL_PATH = "./data/wal/orderbook.wal";
    static final int DEFAULT_FSYNC_EVERY_N = 1;
    static final long DEFAULT_SNAPSHOT_INTERVAL_MS = 10_000L;
    static final String DEFAULT_SNAPSHOT_DIR = "./data/snapshots";

    public static OrderbookConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static OrderbookConfig fromEnvironment(Map<String, String> env) {
        return new OrderbookConfig(
                positiveInt(env, "ORDERBOOK_PORT", DEFAULT_PORT),
                Paths.get(text(env, "ORDERBOOK_WAL_PATH", DEFAULT_WAL_PATH)),
                positiveInt(env, "FSYNC_EVERY_N", DEFAULT_FSYNC_EVERY_N),
                Duration.ofMillis(positiveLong(env, "SNAPSHOT_INTERVAL_MS", DEFAULT_SNAPSHOT_INTERVAL_MS)),
                Paths.get(text(env, "ORDERBOOK_SNAPSHOT_DIR", DEFAULT_SNAPSHOT_DIR)));
    }

    private static String text(Map<String, String> env, String name, String fallback) {
        String value = env.get(name);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int positiveInt(Map<String, String> env, String name, int fallback) {
        long value = positiveLong(env, name, fallback);
        if (value > Integer.MAX_VALUE) {
            LOG.warn("{}={} is out of range, falling back to {}", name, value, fallback);
            return fallback;
        }
        return (int) value;
    }

    private static long positiveLong(Map<String, String> env, String name, long fallback) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        long parsed;
        try {
            parsed = Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            LOG.warn("Invalid {} environment value '{}', falling back to {}", name, value, fallback);
            return fallback;
        }
        if (parsed <= 0) {
            LOG.warn("{} must be positive but was {}, falling back to {}", name, parsed, fallback);
            return fallback;
        }
        return parsed;
    }
}
