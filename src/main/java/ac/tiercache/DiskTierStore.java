package ac.tiercache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * L3: durable entries on the local filesystem.
 * <pre>
 * root/
 *   data/&lt;md5(key)&gt;.bin       serialized value
 *   metadata/&lt;md5(key)&gt;.json  {@link EntryMetadata}
 *   tags/&lt;md5(tag)&gt;.json      {@link TagIndexFile}
 * </pre>
 * Every file is written to a temp file and moved into place atomically. Operations on
 * the same key or tag are serialized by striped locks; a key lock is always taken
 * before a tag lock and at most one of each is held.
 */
public class DiskTierStore implements TierStore {
    private static final Logger logger = LoggerFactory.getLogger(DiskTierStore.class);

    private static final int LOCK_STRIPES = 64;
    private static final String DATA_SUFFIX = ".bin";
    private static final String JSON_SUFFIX = ".json";

    private final Path dataDir;
    private final Path metadataDir;
    private final Path tagsDir;
    private final Duration defaultTtl;
    private final ValueSerializer serializer;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock[] keyLocks = newStripes();
    private final ReentrantLock[] tagLocks = newStripes();
    private final BackgroundSweeper sweeper;

    public DiskTierStore(Path directory, Duration defaultTtl, Duration sweepInterval, ValueSerializer serializer) {
        this(directory, defaultTtl, sweepInterval, serializer, new ObjectMapper(), Clock.systemUTC());
    }

    /**
     * @param sweepInterval period of the background expiry sweep; {@code null} disables it
     */
    public DiskTierStore(Path directory, Duration defaultTtl, Duration sweepInterval, ValueSerializer serializer,
                         ObjectMapper objectMapper, Clock clock) {
        Objects.requireNonNull(directory, "L3 directory cannot be null");
        this.dataDir = directory.resolve("data");
        this.metadataDir = directory.resolve("metadata");
        this.tagsDir = directory.resolve("tags");
        this.defaultTtl = defaultTtl;
        this.serializer = Objects.requireNonNull(serializer, "Serializer cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");

        try {
            Files.createDirectories(dataDir);
            Files.createDirectories(metadataDir);
            Files.createDirectories(tagsDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create L3 cache directories under " + directory, e);
        }

        if (BackgroundSweeper.isEnabled(sweepInterval)) {
            this.sweeper = new BackgroundSweeper("tiercache-disk-sweeper", sweepInterval, this::sweepExpired);
            this.sweeper.start();
        } else {
            this.sweeper = null;
        }
        logger.info("L3 disk tier initialized at {} with defaultTtl={}, sweepInterval={}",
                directory, defaultTtl, sweepInterval);
    }

    @Override
    public CacheLevel getLevel() {
        return CacheLevel.L3;
    }

    @Override
    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    // ==================== GET ====================

    @Override
    public Optional<CacheEntry> getEntry(String key) {
        if (key == null) return Optional.empty();

        String id = fileId(key);
        ReentrantLock lock = keyLock(key);
        lock.lock();
        try {
            EntryMetadata metadata = readMetadata(id);
            if (metadata == null || !key.equals(metadata.getKey())) {
                return Optional.empty();
            }

            Instant now = clock.instant();
            if (metadata.isExpired(now)) {
                logger.debug("L3 entry expired on read: {}", key);
                removeEntryLocked(key, id, metadata);
                return Optional.empty();
            }

            Path dataFile = dataFile(id);
            if (!Files.exists(dataFile)) {
                logger.debug("L3 metadata without data for key {}, cleaning up", key);
                removeEntryLocked(key, id, metadata);
                return Optional.empty();
            }

            Object value = serializer.deserialize(Files.readAllBytes(dataFile));
            EntryMetadata touched = metadata.withAccess(now);
            writeJson(metadataFile(id), touched);

            return Optional.of(new CacheEntry(key, value, touched.getExpiryInstant(), touched.getTags(),
                    Instant.ofEpochMilli(touched.getCreatedAt()), Instant.ofEpochMilli(touched.getAccessedAt()),
                    touched.getAccessCount()));
        } catch (IOException | RuntimeException e) {
            throw new TierAccessException(CacheLevel.L3, "Error reading key '" + key + "' from disk", e);
        } finally {
            lock.unlock();
        }
    }

    // ==================== SET ====================

    @Override
    public boolean set(String key, Object value, Duration ttl, Collection<String> tags) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("Key and value cannot be null");
        }

        String id = fileId(key);
        Set<String> newTags = tags == null ? Collections.emptySet() : new LinkedHashSet<>(tags);
        ReentrantLock lock = keyLock(key);
        lock.lock();
        try {
            EntryMetadata previous = readMetadata(id);
            Instant now = clock.instant();

            writeAtomically(dataFile(id), serializer.serialize(value));
            writeJson(metadataFile(id), EntryMetadata.create(key, newTags, now,
                    TierStore.resolveExpiry(now, ttl, defaultTtl)));

            if (previous != null && key.equals(previous.getKey())) {
                for (String oldTag : previous.getTags()) {
                    if (!newTags.contains(oldTag)) {
                        removeFromTagIndex(oldTag, List.of(key));
                    }
                }
            }
            for (String tag : newTags) {
                addToTagIndex(tag, key);
            }
            return true;
        } catch (IOException | RuntimeException e) {
            throw new TierAccessException(CacheLevel.L3, "Error writing key '" + key + "' to disk", e);
        } finally {
            lock.unlock();
        }
    }

    // ==================== DELETE / INVALIDATE ====================

    @Override
    public boolean delete(String key) {
        if (key == null) return false;

        String id = fileId(key);
        ReentrantLock lock = keyLock(key);
        lock.lock();
        try {
            EntryMetadata metadata = readMetadata(id);
            if (metadata != null && !key.equals(metadata.getKey())) {
                return false;
            }
            return removeEntryLocked(key, id, metadata);
        } catch (IOException | RuntimeException e) {
            throw new TierAccessException(CacheLevel.L3, "Error deleting key '" + key + "' from disk", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int invalidateByTag(String tag) {
        List<String> keys;
        ReentrantLock tagLock = tagLock(tag);
        tagLock.lock();
        try {
            TagIndexFile index = readTagIndex(tag);
            keys = index != null ? index.getKeys() : List.of();
        } catch (IOException | RuntimeException e) {
            throw new TierAccessException(CacheLevel.L3, "Error reading tag index '" + tag + "'", e);
        } finally {
            tagLock.unlock();
        }

        int count = 0;
        for (String key : keys) {
            if (delete(key)) {
                count++;
            }
        }

        // keys tagged concurrently after the read above stay indexed
        try {
            removeFromTagIndex(tag, keys);
        } catch (IOException | RuntimeException e) {
            throw new TierAccessException(CacheLevel.L3, "Error dropping tag index '" + tag + "'", e);
        }
        return count;
    }

    @Override
    public int invalidateByPrefix(String prefix) {
        int count = 0;
        for (Path metadataFile : listMetadataFiles()) {
            String key;
            try {
                EntryMetadata metadata = readJson(metadataFile, EntryMetadata.class);
                key = metadata != null ? metadata.getKey() : null;
            } catch (IOException e) {
                logger.warn("Skipping unreadable L3 metadata {}: {}", metadataFile, e.getMessage());
                continue;
            }
            if (key != null && key.startsWith(prefix) && delete(key)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public void clear() {
        try {
            for (Path dir : List.of(dataDir, metadataDir, tagsDir)) {
                for (Path file : listFiles(dir)) {
                    Files.deleteIfExists(file);
                }
            }
        } catch (IOException | UncheckedIOException e) {
            throw new TierAccessException(CacheLevel.L3, "Error clearing disk tier", e);
        }
    }

    /**
     * Removes every expired entry, stopping early once {@code cancelled} reports true.
     * Unreadable entries are logged and skipped.
     *
     * @return number of entries removed
     */
    public int sweepExpired(BooleanSupplier cancelled) {
        int removed = 0;
        for (Path metadataFile : listMetadataFiles()) {
            if (cancelled.getAsBoolean()) {
                logger.debug("Disk sweep cancelled after removing {} entries", removed);
                break;
            }
            try {
                EntryMetadata metadata = readJson(metadataFile, EntryMetadata.class);
                if (metadata == null || !metadata.isExpired(clock.instant())) {
                    continue;
                }
                if (removeIfExpired(metadata.getKey())) {
                    removed++;
                }
            } catch (IOException | RuntimeException e) {
                logger.warn("Disk sweep failed on {}: {}", metadataFile, e.getMessage());
            }
        }
        return removed;
    }

    public int sweepExpired() {
        return sweepExpired(() -> false);
    }

    private boolean removeIfExpired(String key) throws IOException {
        String id = fileId(key);
        ReentrantLock lock = keyLock(key);
        lock.lock();
        try {
            // re-read under the lock; a concurrent set may have refreshed the entry
            EntryMetadata current = readMetadata(id);
            if (current == null || !current.isExpired(clock.instant())) {
                return false;
            }
            return removeEntryLocked(key, id, current);
        } finally {
            lock.unlock();
        }
    }

    public boolean isSweeperRunning() {
        return sweeper != null && sweeper.isRunning();
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.close();
        }
    }

    // ==================== FILE HELPERS ====================

    /** Caller holds the key lock. */
    private boolean removeEntryLocked(String key, String id, EntryMetadata metadata) throws IOException {
        if (metadata != null) {
            for (String tag : metadata.getTags()) {
                removeFromTagIndex(tag, List.of(key));
            }
        }
        boolean dataRemoved = Files.deleteIfExists(dataFile(id));
        boolean metadataRemoved = Files.deleteIfExists(metadataFile(id));
        return dataRemoved || metadataRemoved;
    }

    private void addToTagIndex(String tag, String key) throws IOException {
        ReentrantLock lock = tagLock(tag);
        lock.lock();
        try {
            TagIndexFile index = readTagIndex(tag);
            List<String> keys = index != null ? new ArrayList<>(index.getKeys()) : new ArrayList<>();
            if (!keys.contains(key)) {
                keys.add(key);
                writeJson(tagFile(tag), new TagIndexFile(tag, keys));
            }
        } finally {
            lock.unlock();
        }
    }

    private void removeFromTagIndex(String tag, Collection<String> keysToRemove) throws IOException {
        ReentrantLock lock = tagLock(tag);
        lock.lock();
        try {
            TagIndexFile index = readTagIndex(tag);
            if (index == null) return;

            List<String> remaining = index.getKeys().stream()
                    .filter(k -> !keysToRemove.contains(k))
                    .collect(Collectors.toList());
            if (remaining.isEmpty()) {
                Files.deleteIfExists(tagFile(tag));
            } else if (remaining.size() != index.getKeys().size()) {
                writeJson(tagFile(tag), new TagIndexFile(tag, remaining));
            }
        } finally {
            lock.unlock();
        }
    }

    private EntryMetadata readMetadata(String id) throws IOException {
        return readJson(metadataFile(id), EntryMetadata.class);
    }

    private TagIndexFile readTagIndex(String tag) throws IOException {
        TagIndexFile index = readJson(tagFile(tag), TagIndexFile.class);
        return index != null && tag.equals(index.getTag()) ? index : null;
    }

    private <T> T readJson(Path file, Class<T> type) throws IOException {
        try {
            return objectMapper.readValue(Files.readAllBytes(file), type);
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    private void writeJson(Path target, Object value) throws IOException {
        writeAtomically(target, objectMapper.writeValueAsBytes(value));
    }

    private void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, bytes);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    private List<Path> listMetadataFiles() {
        return listFiles(metadataDir).stream()
                .filter(p -> p.getFileName().toString().endsWith(JSON_SUFFIX))
                .collect(Collectors.toList());
    }

    private static List<Path> listFiles(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile).collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + dir, e);
        }
    }

    private Path dataFile(String id) {
        return dataDir.resolve(id + DATA_SUFFIX);
    }

    private Path metadataFile(String id) {
        return metadataDir.resolve(id + JSON_SUFFIX);
    }

    private Path tagFile(String tag) {
        return tagsDir.resolve(fileId(tag) + JSON_SUFFIX);
    }

    private ReentrantLock keyLock(String key) {
        return keyLocks[stripe(key)];
    }

    private ReentrantLock tagLock(String tag) {
        return tagLocks[stripe(tag)];
    }

    private static int stripe(String s) {
        return (s.hashCode() & 0x7fffffff) % LOCK_STRIPES;
    }

    private static ReentrantLock[] newStripes() {
        ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
        return locks;
    }

    static String fileId(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] hash = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not available", e);
        }
    }
}
