package io.ricegrep.index.hashing;

import com.google.common.base.Ticker;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A size-bounded map from path to the last known content hash of that file.
 *
 * <p>A cached hash is only handed out while the file still has the mtime and size it was cached
 * with and the entry is younger than {@link #STALENESS_THRESHOLD}. Metadata alone cannot detect a
 * size-preserving rewrite within the mtime resolution, so the age ceiling bounds how long any entry
 * is trusted.
 *
 * <p>When an insertion would exceed the byte budget, entries are evicted oldest {@code cachedAt}
 * first. Reads do not refresh {@code cachedAt}, so this is oldest-write eviction rather than LRU.
 *
 * <p>All operations hold the cache monitor, which also serializes eviction against lookups.
 */
public final class ContentHashCache {

  /** Entries older than this are never trusted, whatever their metadata. */
  public static final Duration STALENESS_THRESHOLD = Duration.ofSeconds(60);

  public static final long DEFAULT_MAX_BYTES = 50L * 1024 * 1024;
  public static final long MIN_MAX_BYTES = 1024L * 1024;

  // per-entry bookkeeping beyond the path characters and hash bytes
  static final int ENTRY_OVERHEAD_BYTES = 96;

  /** The outcome of checking a cache entry against current file metadata. */
  public enum Validation {
    ABSENT,
    VALID,
    STALE_MTIME,
    STALE_SIZE,
    STALE_AGE
  }

  // insertion order == cachedAt order, since replaced entries are removed before re-insertion
  private final LinkedHashMap<Path, CachedHash> entries = new LinkedHashMap<>();
  private final long maxBytes;
  private final long stalenessNanos;
  private final Ticker ticker;

  private long currentBytes;
  private long hits;
  private long misses;
  private long evictions;

  public ContentHashCache() {
    this(DEFAULT_MAX_BYTES);
  }

  public ContentHashCache(long maxBytes) {
    this(maxBytes, Ticker.systemTicker());
  }

  public ContentHashCache(long maxBytes, Ticker ticker) {
    this.maxBytes = Math.max(maxBytes, MIN_MAX_BYTES);
    this.stalenessNanos = STALENESS_THRESHOLD.toNanos();
    this.ticker = ticker;
  }

  /**
   * Caches {@code hash} as the content of {@code path} while it has the given mtime and size,
   * evicting the oldest entries until it fits. An entry bigger than the whole budget is still
   * admitted once everything else is gone.
   */
  public synchronized void add(Path path, ContentHash hash, long mtime, long size) {
    removeEntry(path);
    long entryBytes = estimateSize(path, hash);
    Iterator<Map.Entry<Path, CachedHash>> oldest = entries.entrySet().iterator();
    while (currentBytes + entryBytes > maxBytes && oldest.hasNext()) {
      Map.Entry<Path, CachedHash> evicted = oldest.next();
      currentBytes -= estimateSize(evicted.getKey(), evicted.getValue().hash());
      oldest.remove();
      evictions++;
    }
    entries.put(path, new CachedHash(hash, mtime, size, ticker.read()));
    currentBytes += entryBytes;
  }

  /**
   * @return the cached hash if the entry's mtime and size both match and it is younger than {@link
   *     #STALENESS_THRESHOLD}; otherwise empty, and the caller must recompute.
   */
  public synchronized Optional<ContentHash> getIfValid(
      Path path, long currentMtime, long currentSize) {
    if (validate(path, currentMtime, currentSize) == Validation.VALID) {
      hits++;
      return Optional.of(entries.get(path).hash());
    }
    misses++;
    return Optional.empty();
  }

  /**
   * Classifies the entry for {@code path} without touching it. A stale entry stays in place until
   * the next {@link #add} for the same path overwrites it.
   */
  public synchronized Validation validate(Path path, long currentMtime, long currentSize) {
    CachedHash cached = entries.get(path);
    if (cached == null) {
      return Validation.ABSENT;
    }
    if (cached.mtime() != currentMtime) {
      return Validation.STALE_MTIME;
    }
    if (cached.size() != currentSize) {
      return Validation.STALE_SIZE;
    }
    if (ticker.read() - cached.cachedAt() >= stalenessNanos) {
      return Validation.STALE_AGE;
    }
    return Validation.VALID;
  }

  /** @return the raw entry for {@code path}, valid or not, without counting a hit or miss. */
  public synchronized Optional<CachedHash> peek(Path path) {
    return Optional.ofNullable(entries.get(path));
  }

  public synchronized void invalidate(Path path) {
    removeEntry(path);
  }

  public synchronized void clear() {
    entries.clear();
    currentBytes = 0;
  }

  public synchronized int size() {
    return entries.size();
  }

  public synchronized CacheStats stats() {
    return new CacheStats(entries.size(), maxBytes, currentBytes, hits, misses, evictions);
  }

  private void removeEntry(Path path) {
    CachedHash removed = entries.remove(path);
    if (removed != null) {
      currentBytes -= estimateSize(path, removed.hash());
    }
  }

  static long estimateSize(Path path, ContentHash hash) {
    return 2L * path.toString().length() + hash.sizeInBytes() + ENTRY_OVERHEAD_BYTES;
  }
}
