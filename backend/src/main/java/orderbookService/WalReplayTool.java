package orderbookService;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Offline entry point that rebuilds the books from a WAL file, optionally on top of the latest
 * snapshot in a directory, and prints the result. The WAL is only read, never opened for append,
 * so it is safe to run against the log of a live service.
 *
 * <pre>
 * WalReplayTool --wal &lt;file&gt; [--symbol &lt;symbol&gt;] [--snapshot-dir &lt;dir&gt;] [--output &lt;dir&gt;] [-v]
 * </pre>
 */
public final class WalReplayTool {
    private static final String VERBOSE_FLAG = "--verbose";
    private static final String VERBOSE_SHORT_FLAG = "-v";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILURE = 1;

    private WalReplayTool() {
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err, Clock.systemUTC());
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err, Clock clock) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            err.println("Usage: WalReplayTool --wal <file> [--symbol <symbol>] [--snapshot-dir <dir>] "
                    + "[--output <dir>] [--verbose]");
            return EXIT_USAGE;
        }

        try {
            replay(arguments, out, clock);
            return EXIT_OK;
        } catch (WalException | SnapshotException | IllegalArgumentException ex) {
            err.println("Replay failed: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static void replay(Arguments arguments, PrintStream out, Clock clock) {
        out.println("Replaying WAL: " + arguments.wal());
        MatchingEngine engine = new MatchingEngine();

        long startSeq = 0;
        if (arguments.snapshotDir() != null) {
            Optional<Snapshot> snapshot = new FileSnapshotStore(arguments.snapshotDir()).loadLatest();
            if (snapshot.isPresent()) {
                engine.restoreState(snapshot.get().books());
                startSeq = snapshot.get().sequence();
                out.printf("Loaded snapshot at sequence %d%n", startSeq);
            } else {
                out.println("No snapshot found in " + arguments.snapshotDir() + "; replaying from the start");
            }
        }

        List<WalEntry> entries = WriteAheadLog.readEntries(arguments.wal());
        List<WalEntry> pending = new ArrayList<>();
        long lastSeq = startSeq;
        for (WalEntry entry : entries) {
            if (entry.seq() > startSeq) {
                pending.add(entry);
            }
            lastSeq = Math.max(lastSeq, entry.seq());
        }
        out.printf("Found %d entries in WAL, %d after sequence %d%n", entries.size(), pending.size(), startSeq);

        if (arguments.verbose()) {
            for (WalEntry entry : pending) {
                out.printf("  #%d %s %s%n", entry.seq(), entry.type(), entry.payload());
            }
        }

        ReplayStats stats = new WalReplayer(engine).replay(pending);

        out.println();
        out.println("Replay Summary:");
        out.printf("  Orders placed: %d%n", stats.placed());
        out.printf("  Orders cancelled: %d%n", stats.cancelled());
        out.printf("  Trades re-derived: %d%n", stats.trades());
        out.printf("  Logged trades ignored: %d%n", stats.matchedIgnored());
        out.printf("  Entries skipped: %d%n", stats.skipped());
        out.printf("  Final sequence: %d%n", lastSeq);

        Set<String> symbols = arguments.symbol() != null ? Set.of(arguments.symbol()) : engine.symbols();
        for (String symbol : symbols.stream().sorted().toList()) {
            printBook(out, symbol, engine);
        }

        if (arguments.output() != null) {
            Snapshot snapshot = new Snapshot(clock.millis(), lastSeq, engine.getFullState());
            FileSnapshotStore store = new FileSnapshotStore(arguments.output());
            store.save(snapshot);
            out.println();
            out.println("Snapshot written to: " + arguments.output().resolve(FileSnapshotStore.fileName(lastSeq)));
        }
    }

    private static void printBook(PrintStream out, String symbol, MatchingEngine engine) {
        OrderbookLevelInfos infos = engine.getSnapshot(symbol);
        out.println();
        out.println("=== " + symbol + " ===");
        printSide(out, "Bids", infos.getBids());
        printSide(out, "Asks", infos.getAsks());
        out.printf("Resting orders: %d%n", engine.restingOrderCount(symbol));
    }

    private static void printSide(PrintStream out, String label, List<LevelInfo> levels) {
        out.println(label + ":");
        if (levels.isEmpty()) {
            out.println("  (none)");
            return;
        }

        out.println("  Price              Quantity");
        for (LevelInfo level : levels) {
            out.printf("  %-18s %s%n",
                    DecimalScale.PRICE.toDecimal(level.getPrice()).toPlainString(),
                    DecimalScale.QUANTITY.toDecimal(level.getQuantity()).toPlainString());
        }
    }

    record Arguments(Path wal, String symbol, Path snapshotDir, Path output, boolean verbose) {

        static Arguments parse(String[] args) {
            Path wal = null;
            String symbol = null;
            Path snapshotDir = null;
            Path output = null;
            boolean verbose = false;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg.toLowerCase(Locale.ROOT)) {
                    case "--wal" -> wal = Path.of(value(args, ++i, arg));
                    case "--symbol" -> symbol = value(args, ++i, arg);
                    case "--snapshot-dir" -> snapshotDir = Path.of(value(args, ++i, arg));
                    case "--output" -> output = Path.of(value(args, ++i, arg));
                    case VERBOSE_FLAG, VERBOSE_SHORT_FLAG -> verbose = true;
                    default -> throw new IllegalArgumentException("Unexpected argument: " + arg);
                }
            }

            if (wal == null) {
                throw new IllegalArgumentException("Missing required --wal argument");
            }
            return new Arguments(wal, symbol, snapshotDir, output, verbose);
        }

        private static String value(String[] args, int index, String flag) {
            if (index >= args.length || args[index].isBlank()) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            return args[index];
        }
    }
}
