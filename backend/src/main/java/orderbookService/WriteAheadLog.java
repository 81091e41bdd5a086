package orderbookService;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, newline-delimited JSON log of state-changing events.
 *
 * <p>Every {@code fsyncEveryN}-th append forces the file to disk; entries written in between
 * are handed to the OS but may be lost on power failure. Append failures are thrown to the
 * caller, which must not report the operation as accepted.
 *
 * <p>A failed append is cut back off the file, so the log never holds an entry the caller was told
 * had failed. If that cut fails too, the log refuses all further appends.
 *
 * <p>Reading is tolerant: lines that do not decode or parse (including a line torn by a crash
 * mid-write) are logged and skipped.
 */
public final class WriteAheadLog implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(WriteAheadLog.class);
    private static final byte NEWLINE = '\n';

    private final Path path;
    private final int fsyncEveryN;
    private final Clock clock;
    private final ChannelOpener opener;
    private FileChannel channel;
    private long sequence;
    private int pendingWrites;
    private boolean failed;

    public WriteAheadLog(Path path, int fsyncEveryN) {
        this(path, fsyncEveryN, Clock.systemUTC());
    }

    public WriteAheadLog(Path path, int fsyncEveryN, Clock clock) {
        this(path, fsyncEveryN, clock, WriteAheadLog::openForAppend);
    }

    WriteAheadLog(Path path, int fsyncEveryN, Clock clock, ChannelOpener opener) {
        if (fsyncEveryN <= 0) {
            throw new IllegalArgumentException("fsyncEveryN must be positive");
        }
        this.path = Objects.requireNonNull(path, "path");
        this.fsyncEveryN = fsyncEveryN;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.opener = Objects.requireNonNull(opener, "opener");
        this.sequence = highestSequence(readEntries(path));
        this.channel = open();
        terminateTornTail();
    }

    @FunctionalInterface
    interface ChannelOpener {
        FileChannel open(Path path) throws IOException;
    }

    static FileChannel openForAppend(Path path) throws IOException {
        return FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    private FileChannel open() {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return opener.open(path);
        } catch (IOException ex) {
            throw new WalException("Unable to open WAL file " + path, ex);
        }
    }

    /**
     * A crash mid-write can leave a final line without its newline. Terminating it keeps the next
     * append on a line of its own, so only the torn entry is lost.
     */
    private void terminateTornTail() {
        try {
            long size = channel.size();
            if (size == 0) {
                return;
            }
            ByteBuffer last = ByteBuffer.allocate(1);
            try (FileChannel reader = FileChannel.open(path, StandardOpenOption.READ)) {
                reader.read(last, size - 1);
            }
            if (last.get(0) != NEWLINE) {
                LOG.warn("WAL {} ends with an incomplete line; terminating it before appending", path);
                writeFully(ByteBuffer.wrap(new byte[] {NEWLINE}));
                channel.force(true);
            }
        } catch (IOException ex) {
            throw new WalException("Unable to inspect tail of WAL file " + path, ex);
        }
    }

    /**
     * Records one event and returns its sequence number.
     *
     * @throws WalException if the entry could not be written or synced
     */
    public synchronized long append(WalEntryType type, Object payload) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        FileChannel current = requireOpen();

        long seq = sequence + 1;
        JsonObject body = Json.GSON.toJsonTree(payload).getAsJsonObject();
        WalEntry entry = new WalEntry(seq, clock.millis(), type, body);
        byte[] line = (Json.GSON.toJson(entry) + "\n").getBytes(StandardCharsets.UTF_8);

        long start;
        try {
            start = current.size();
        } catch (IOException ex) {
            throw new WalException("Unable to determine size of WAL " + path, ex);
        }

        try {
            writeFully(ByteBuffer.wrap(line));
            if (pendingWrites + 1 >= fsyncEveryN) {
                current.force(true);
                pendingWrites = 0;
            } else {
                pendingWrites++;
            }
        } catch (IOException ex) {
            rollBack(current, start, seq, ex);
            throw new WalException("Failed to append " + type + " entry " + seq + " to " + path, ex);
        }

        sequence = seq;
        return seq;
    }

    /**
     * Cuts the file back to {@code start} so a partly written or unsynced entry cannot be replayed,
     * and cannot swallow the next append into its line.
     */
    private void rollBack(FileChannel current, long start, long seq, IOException cause) {
        try {
            current.truncate(start);
            LOG.warn("Rolled back WAL {} to {} bytes after failed append of entry {}", path, start, seq);
        } catch (IOException ex) {
            cause.addSuppressed(ex);
            failed = true;
            LOG.error("Unable to roll back WAL {} after failed append of entry {}; refusing further appends",
                    path, seq, ex);
        }
    }

    private void writeFully(ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    /**
     * Forces every written entry to disk regardless of the fsync counter.
     */
    public synchronized void sync() {
        if (channel == null) {
            return;
        }
        try {
            channel.force(true);
            pendingWrites = 0;
        } catch (IOException ex) {
            throw new WalException("Failed to sync WAL " + path, ex);
        }
    }

    public synchronized List<WalEntry> readAll() {
        List<WalEntry> entries = readEntries(path);
        sequence = Math.max(sequence, highestSequence(entries));
        return entries;
    }

    /**
     * Entries with a sequence number strictly greater than {@code seq}, in file order.
     */
    public synchronized List<WalEntry> readSince(long seq) {
        List<WalEntry> since = new ArrayList<>();
        for (WalEntry entry : readAll()) {
            if (entry.seq() > seq) {
                since.add(entry);
            }
        }
        return since;
    }

    public synchronized long getCurrentSequence() {
        return sequence;
    }

    /**
     * Moves the sequence counter forward so new entries are numbered after {@code seq}. Used when a
     * snapshot is ahead of the log, which happens if the log file was lost or replaced.
     */
    public synchronized void advanceSequenceTo(long seq) {
        if (seq > sequence) {
            LOG.warn("Advancing WAL sequence from {} to {}", sequence, seq);
            sequence = seq;
        }
    }

    public Path getPath() {
        return path;
    }

    int pendingWrites() {
        return pendingWrites;
    }

    @Override
    public synchronized void close() {
        if (channel == null) {
            return;
        }
        try {
            channel.force(true);
            channel.close();
        } catch (IOException ex) {
            throw new WalException("Failed to close WAL " + path, ex);
        } finally {
            channel = null;
            pendingWrites = 0;
        }
    }

    /**
     * Deletes the log and restarts numbering at 1. Test harnesses only.
     */
    public synchronized void truncate() {
        close();
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            throw new WalException("Failed to delete WAL " + path, ex);
        }
        sequence = 0;
        failed = false;
        channel = open();
    }

    private FileChannel requireOpen() {
        if (channel == null) {
            throw new WalException("WAL " + path + " is closed");
        }
        if (failed) {
            throw new WalException("WAL " + path + " holds a partial entry that could not be rolled back");
        }
        return channel;
    }

    /**
     * Parses a WAL file without opening it for writing. A missing file reads as empty.
     *
     * <p>Lines are split on raw newline bytes and decoded one at a time, so a crash that cuts a
     * multi-byte character only costs the line it cut.
     */
    public static List<WalEntry> readEntries(Path path) {
        List<WalEntry> entries = new ArrayList<>();
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder();
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            ByteArrayOutputStream line = new ByteArrayOutputStream();
            int lineNumber = 0;
            int next;
            while ((next = in.read()) != -1) {
                if (next == NEWLINE) {
                    addLine(entries, decoder, path, ++lineNumber, line);
                    line.reset();
                } else {
                    line.write(next);
                }
            }
            if (line.size() > 0) {
                addLine(entries, decoder, path, ++lineNumber, line);
            }
        } catch (NoSuchFileException ex) {
            return List.of();
        } catch (IOException ex) {
            throw new WalException("Failed to read WAL " + path, ex);
        }
        return entries;
    }

    private static void addLine(List<WalEntry> entries, CharsetDecoder decoder, Path path, int lineNumber,
                                ByteArrayOutputStream bytes) {
        String line;
        try {
            line = decoder.decode(ByteBuffer.wrap(bytes.toByteArray())).toString();
        } catch (CharacterCodingException ex) {
            LOG.warn("Skipping WAL line {} in {}: not valid UTF-8", lineNumber, path);
            return;
        }
        if (line.isBlank()) {
            return;
        }
        WalEntry entry = parseLine(path, lineNumber, line);
        if (entry != null) {
            entries.add(entry);
        }
    }

    private static WalEntry parseLine(Path path, int lineNumber, String line) {
        WalEntry entry;
        try {
            entry = Json.GSON.fromJson(line, WalEntry.class);
        } catch (JsonParseException ex) {
            LOG.warn("Skipping malformed WAL line {} in {}: {}", lineNumber, path, ex.getMessage());
            return null;
        }
        if (entry == null || entry.seq() <= 0 || entry.type() == null || entry.payload() == null) {
            LOG.warn("Skipping incomplete WAL line {} in {}", lineNumber, path);
            return null;
        }
        return entry;
    }

    private static long highestSequence(List<WalEntry> entries) {
        long highest = 0;
        for (WalEntry entry : entries) {
            highest = Math.max(highest, entry.seq());
        }
        return highest;
    }
}
