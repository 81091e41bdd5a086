package orderbookService;

import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each snapshot as {@code snapshot-<sequence>.json} in one directory. Files are written to
 * a temporary name, synced and then renamed, so a reader never sees a half-written snapshot.
 * Older snapshots are left in place.
 */
public final class FileSnapshotStore implements SnapshotStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileSnapshotStore.class);
    private static final Pattern FILE_NAME = Pattern.compile("snapshot-(\\d{20})\\.json");

    private final Path directory;

    public FileSnapshotStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path getDirectory() {
        return directory;
    }

    static String fileName(long sequence) {
        return String.format(Locale.ROOT, "snapshot-%020d.json", sequence);
    }

    @Override
    public void save(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        Path target = directory.resolve(fileName(snapshot.sequence()));
        Path temp = directory.resolve(target.getFileName() + ".tmp");
        byte[] bytes = Json.GSON.toJson(snapshot).getBytes(StandardCharsets.UTF_8);

        try {
            Files.createDirectories(directory);
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveIntoPlace(temp, target);
        } catch (IOException ex) {
            throw new SnapshotException("Failed to write snapshot " + target, ex);
        }
        LOG.info("Snapshot saved at sequence {} ({} books, {} bytes)",
                snapshot.sequence(), snapshot.books().size(), bytes.length);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Tries snapshots newest first and returns the first one that parses.
     */
    @Override
    public Optional<Snapshot> loadLatest() {
        for (StoredFile file : listSnapshots()) {
            try {
                Snapshot snapshot = read(file.path());
                if (snapshot.sequence() != file.sequence()) {
                    LOG.warn("Snapshot {} records sequence {}; skipping", file.path(), snapshot.sequence());
                    continue;
                }
                return Optional.of(snapshot);
            } catch (IOException | JsonParseException | IllegalArgumentException ex) {
                LOG.warn("Skipping unreadable snapshot {}: {}", file.path(), ex.getMessage());
            }
        }
        return Optional.empty();
    }

    /**
     * Sequence numbers of all stored snapshots, newest first.
     */
    public List<Long> storedSequences() {
        List<Long> sequences = new ArrayList<>();
        for (StoredFile file : listSnapshots()) {
            sequences.add(file.sequence());
        }
        return sequences;
    }

    private static Snapshot read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Snapshot snapshot = Json.GSON.fromJson(reader, Snapshot.class);
            if (snapshot == null || snapshot.books() == null) {
                throw new IllegalArgumentException("snapshot file is empty");
            }
            return snapshot;
        }
    }

    private List<StoredFile> listSnapshots() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<StoredFile> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path path : stream) {
                Matcher matcher = FILE_NAME.matcher(path.getFileName().toString());
                if (matcher.matches()) {
                    files.add(new StoredFile(Long.parseLong(matcher.group(1)), path));
                }
            }
        } catch (IOException ex) {
            throw new SnapshotException("Failed to list snapshots in " + directory, ex);
        }
        files.sort(Comparator.comparingLong(StoredFile::sequence).reversed());
        return files;
    }

    private record StoredFile(long sequence, Path path) {
    }
}
