/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.ricegrep.index;

import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.ricegrep.index.debounce.DebounceBuffer;
import io.ricegrep.index.debounce.DebouncingStats;
import io.ricegrep.index.gating.ChangeReason;
import io.ricegrep.index.gating.FileChangeFilter;
import io.ricegrep.index.gating.FileIndexEntry;
import io.ricegrep.index.gating.FileMetadata;
import io.ricegrep.index.gating.FilterResult;
import io.ricegrep.index.gating.MetadataStore;
import io.ricegrep.index.hashing.CacheStats;
import io.ricegrep.index.hashing.CachedHash;
import io.ricegrep.index.hashing.ContentHash;
import io.ricegrep.index.hashing.ContentHashCache;
import io.ricegrep.index.hashing.ContentHashException;
import io.ricegrep.index.hashing.ContentHasher;
import io.ricegrep.index.visitor.FileTreeVisitor;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns debounced filesystem events into a minimal set of index updates.
 *
 * <p>Events are collected into a {@link DebounceBuffer}. When its window expires the buffer is
 * drained and each path is classified on the worker executor:
 *
 * <ul>
 *   <li>DELETE, or a file that can no longer be stat-ed, becomes a tombstone.
 *   <li>A file whose cached hash is still valid and already live in the index is reused.
 *   <li>Anything else is hashed again, cached, and reindexed.
 * </ul>
 *
 * A flush with more paths than the full-reindex threshold, or a watcher overflow, rebuilds the
 * whole index instead. A failed rebuild keeps its events and is retried by the next flush. A file
 * that fails to stat or hash is retried on later cycles and never aborts the rest of the batch;
 * once its retries run out it is removed from the index rather than left with stale content.
 *
 * <p>Flushes run one at a time. The buffer lock is never held while a file is read.
 */
public class IncrementalIndexCoordinator implements FileChangeListener, Closeable {

  /**
   * A builder for an {@link IncrementalIndexCoordinator}. Use {@code
   * IncrementalIndexCoordinator.builder()} to get a new instance.
   */
  public static final class Builder {
    private List<Path> roots = Collections.emptyList();
    private IndexSettings settings = null;
    private ContentHasher contentHasher = null;
    private ContentHashCache cache = null;
    private IndexWriter indexWriter = null;
    private MetadataStore metadataStore = null;
    private Executor executor = ForkJoinPool.commonPool();
    private Ticker ticker = Ticker.systemTicker();
    private FileTreeVisitor fileTreeVisitor = FileTreeVisitor.DEFAULT_FILE_TREE_VISITOR;
    private Logger logger = null;

    private Builder() {}

    /** Set the roots that a full rebuild or a reconcile covers. */
    public Builder roots(List<Path> roots) {
      this.roots = roots;
      return this;
    }

    public Builder root(Path root) {
      return roots(Collections.singletonList(root));
    }

    /** Defaults to {@link IndexSettings#load()}. */
    public Builder settings(IndexSettings settings) {
      this.settings = settings;
      return this;
    }

    /** Defaults to the hasher named by the settings' {@code hash-algorithm}. */
    public Builder contentHasher(ContentHasher contentHasher) {
      this.contentHasher = contentHasher;
      return this;
    }

    /** Share an existing cache. By default one is created with the configured byte budget. */
    public Builder cache(ContentHashCache cache) {
      this.cache = cache;
      return this;
    }

    public Builder indexWriter(IndexWriter indexWriter) {
      this.indexWriter = indexWriter;
      return this;
    }

    /**
     * Record applied updates in {@code metadataStore}. By default a store is opened only if the
     * settings name a {@code metadata-store} path.
     */
    public Builder metadataStore(MetadataStore metadataStore) {
      this.metadataStore = metadataStore;
      return this;
    }

    /** The executor files are stat-ed and hashed on. Defaults to the common pool. */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    /** The monotonic clock used for the debounce window and cache staleness. */
    public Builder ticker(Ticker ticker) {
      this.ticker = ticker;
      return this;
    }

    public Builder fileTreeVisitor(FileTreeVisitor fileTreeVisitor) {
      this.fileTreeVisitor = fileTreeVisitor;
      return this;
    }

    /**
     * Set a logger to be used by the coordinator. This defaults to {@code
     * LoggerFactory.getLogger(IncrementalIndexCoordinator.class)}
     */
    public Builder logger(Logger logger) {
      this.logger = logger;
      return this;
    }

    /** @throws IOException if the configured metadata store exists but cannot be loaded */
    public IncrementalIndexCoordinator build() throws IOException {
      if (indexWriter == null) {
        throw new IllegalStateException("an IndexWriter is required");
      }
      if (settings == null) {
        settings = IndexSettings.load();
      }
      if (contentHasher == null) {
        contentHasher = settings.contentHasher();
      }
      if (cache == null) {
        cache = new ContentHashCache(settings.getCacheMaxBytes(), ticker);
      }
      if (metadataStore == null && settings.getMetadataStorePath().isPresent()) {
        metadataStore = new MetadataStore(settings.getMetadataStorePath().get(), false);
        metadataStore.load();
      }
      if (logger == null) {
        logger = LoggerFactory.getLogger(IncrementalIndexCoordinator.class);
      }
      return new IncrementalIndexCoordinator(this);
    }
  }

  /** Get a new builder for an {@link IncrementalIndexCoordinator}. */
  public static Builder builder() {
    return new Builder();
  }

  static final long MIN_TICK_MILLIS = 10;

  private final Logger logger;
  private final List<Path> roots;
  private final DebounceBuffer buffer;
  private final ContentHashCache cache;
  private final ContentHasher contentHasher;
  private final IndexWriter indexWriter;
  private final MetadataStore metadataStore;
  private final Executor executor;
  private final FileTreeVisitor fileTreeVisitor;
  private final int fullReindexThreshold;
  private final int maxRetries;

  // guards buffer, failures, rebuildPending and unapplied
  private final Object lock = new Object() {};
  // serializes flush cycles, rebuilds and reconciles
  private final Object flushLock = new Object() {};

  private final Map<Path, Integer> failures = new HashMap<>();
  private boolean rebuildPending = false;
  // index updates that failed after close and could not be re-queued
  private int unapplied = 0;

  private ScheduledExecutorService scheduler;
  private volatile boolean closed = false;

  private IncrementalIndexCoordinator(Builder builder) {
    this.logger = builder.logger;
    this.roots = builder.roots.stream().map(Path::toAbsolutePath).collect(Collectors.toList());
    this.buffer = new DebounceBuffer(builder.settings.getDebounceWindow(), builder.ticker);
    this.cache = builder.cache;
    this.contentHasher = builder.contentHasher;
    this.indexWriter = builder.indexWriter;
    this.metadataStore = builder.metadataStore;
    this.executor = builder.executor;
    this.fileTreeVisitor = builder.fileTreeVisitor;
    this.fullReindexThreshold = builder.settings.getFullReindexThreshold();
    this.maxRetries = builder.settings.getMaxRetries();
  }

  @Override
  public void onEvent(FileChangeEvent event) {
    collectEvent(event);
  }

  @Override
  public void onOverflow(Path root) {
    logger.warn("Watcher overflowed for [{}]; events were lost, rebuilding the index", root);
    try {
      rebuild(Collections.emptyList());
    } catch (IOException | RuntimeException e) {
      logger.error(
          "Full re-index after overflow failed for {}; retrying on the next flush", roots, e);
    }
  }

  @Override
  public boolean isWatching() {
    return !closed;
  }

  @Override
  public void onException(Exception e) {
    logger.warn("Watcher reported an exception", e);
  }

  /** Buffers {@code event}. Never blocks on I/O and never fails. */
  public void collectEvent(FileChangeEvent event) {
    synchronized (lock) {
      // the first event of a burst opens a fresh window, so the burst gets all of it
      if (!buffer.hasEvents() && buffer.isReady()) {
        buffer.takeEvents();
      }
      buffer.collectEvent(event);
    }
    logger.debug("{} [{}]", event.kind(), event.path());
  }

  /** Flushes if the debounce window has expired and anything is buffered. */
  public UpdateBatch flushIfReady() {
    synchronized (flushLock) {
      List<FileChangeEvent> events;
      synchronized (lock) {
        if ((!buffer.hasEvents() && !rebuildPending) || !buffer.isReady()) {
          return UpdateBatch.empty();
        }
        events = buffer.takeEvents();
      }
      return process(events);
    }
  }

  /** Drains the buffer regardless of the window and applies the resulting updates. */
  public UpdateBatch flush() {
    synchronized (flushLock) {
      List<FileChangeEvent> events;
      synchronized (lock) {
        events = buffer.takeEvents();
      }
      return process(events);
    }
  }

  public void handleAdminAction(AdminAction action) throws IOException {
    logger.info("Admin action {}", action);
    switch (action) {
      case REINDEX:
        rebuild(Collections.emptyList());
        break;
      case CLEAR_CACHE:
        cache.clear();
        break;
      case OPTIMIZE:
        indexWriter.optimize();
        break;
    }
  }

  /**
   * Compares every file under the roots with the metadata store and buffers events for what changed
   * while nobody was watching: MODIFY (or CREATE for unknown files) for new and changed files,
   * DELETE for recorded files that are gone.
   *
   * @return the number of events buffered
   * @throws IllegalStateException if no metadata store is configured
   */
  public int reconcile() throws IOException {
    if (metadataStore == null) {
      throw new IllegalStateException("reconcile requires a metadata store");
    }
    synchronized (flushLock) {
      Set<Path> files = new HashSet<>();
      for (Path root : roots) {
        fileTreeVisitor.recursiveVisitFiles(root, dir -> {}, files::add);
      }
      FilterResult result = new FileChangeFilter(metadataStore).filterChanges(files);

      List<FileChangeEvent> events = new ArrayList<>();
      Instant now = Instant.now();
      for (Map.Entry<Path, ChangeReason> e : result.filesToReindex().entrySet()) {
        FileChangeEvent.Kind kind =
            e.getValue().kind() == ChangeReason.Kind.NEW
                ? FileChangeEvent.Kind.CREATE
                : FileChangeEvent.Kind.MODIFY;
        events.add(new FileChangeEvent(e.getKey(), kind, now));
      }
      for (FileIndexEntry entry : metadataStore.allEntries()) {
        if (!entry.isDeleted() && !files.contains(entry.path()) && isUnderRoot(entry.path())) {
          events.add(new FileChangeEvent(entry.path(), FileChangeEvent.Kind.DELETE, now));
        }
      }

      synchronized (lock) {
        for (FileChangeEvent event : events) {
          buffer.collectEvent(event);
        }
      }
      logger.info(
          "Reconciled {} file(s): {} changed, {} unchanged, {} event(s) buffered",
          files.size(),
          result.reindexCount(),
          result.skippedCount(),
          events.size());
      return events.size();
    }
  }

  /**
   * Flushes on a background thread whenever the debounce window expires, checking every fifth of
   * the window.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("coordinator already closed");
    }
    if (scheduler != null) {
      return;
    }
    long tick = Math.max(MIN_TICK_MILLIS, buffer.windowDuration().toMillis() / 5);
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("ricegrep-index-flush-%d")
                .setDaemon(true)
                .build());
    scheduler.scheduleWithFixedDelay(this::tick, tick, tick, TimeUnit.MILLISECONDS);
    logger.debug("Flushing every {}ms", tick);
  }

  /** Stops background flushing and flushes whatever is still buffered. */
  @Override
  public void close() throws IOException {
    ScheduledExecutorService toStop;
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      toStop = scheduler;
      scheduler = null;
    }
    if (toStop != null) {
      toStop.shutdown();
      try {
        toStop.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    flush();
    if (metadataStore != null) {
      metadataStore.save();
    }
    int lost;
    boolean rebuildLost;
    synchronized (lock) {
      lost = buffer.eventCount() + unapplied;
      rebuildLost = rebuildPending;
    }
    if (lost > 0 || rebuildLost) {
      throw new IOException(
          "Closed with "
              + lost
              + " change(s) not applied to the index"
              + (rebuildLost ? " and a full re-index still pending" : ""));
    }
  }

  public boolean isClosed() {
    return closed;
  }

  /** Read-only view of the buffer for telemetry. */
  public DebouncingStats debouncingStats() {
    synchronized (lock) {
      return buffer.stats();
    }
  }

  public CacheStats cacheStats() {
    return cache.stats();
  }

  public List<FileChangeEvent> pendingEvents() {
    synchronized (lock) {
      return buffer.peekEvents();
    }
  }

  public ContentHashCache cache() {
    return cache;
  }

  public Optional<MetadataStore> metadataStore() {
    return Optional.ofNullable(metadataStore);
  }

  private void tick() {
    try {
      flushIfReady();
    } catch (RuntimeException e) {
      // an exception would cancel the scheduled task
      logger.error("Flush failed", e);
    }
  }

  private UpdateBatch process(List<FileChangeEvent> events) {
    boolean retryRebuild;
    synchronized (lock) {
      retryRebuild = rebuildPending;
    }
    if (events.isEmpty() && !retryRebuild) {
      return UpdateBatch.empty();
    }
    int count = events.size();
    logger.info("Tracked {} file change(s)", count);
    if (logger.isDebugEnabled()) {
      events.stream().limit(5).forEach(e -> logger.debug("  - {} {}", e.kind(), e.path()));
      if (count > 5) {
        logger.debug("  ... and {} more", count - 5);
      }
    }

    if (count > fullReindexThreshold || retryRebuild) {
      if (retryRebuild) {
        logger.info("Retrying full re-index");
      } else {
        logger.info("Many files changed ({}), performing full re-index", count);
      }
      try {
        return rebuild(events);
      } catch (IOException | RuntimeException e) {
        logger.error("Full re-index failed for {}; retrying on the next flush", roots, e);
        return UpdateBatch.empty();
      }
    }

    List<CompletableFuture<Optional<IndexUpdate>>> futures = new ArrayList<>(count);
    for (FileChangeEvent event : events) {
      futures.add(CompletableFuture.supplyAsync(() -> classify(event), executor));
    }
    List<IndexUpdate> updates = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      try {
        futures.get(i).join().ifPresent(updates::add);
      } catch (CompletionException e) {
        if (!defer(events.get(i), e.getCause())) {
          synchronized (lock) {
            unapplied++;
          }
        }
      }
    }

    UpdateBatch batch = UpdateBatch.of(updates, count);
    if (batch.updates().isEmpty()) {
      return batch;
    }
    try {
      indexWriter.apply(batch);
    } catch (IOException | RuntimeException e) {
      logger.error("Failed to update index for changes{}", describe(updates), e);
      for (IndexUpdate update : updates) {
        if (update.action() != IndexUpdate.Action.REUSE && !defer(eventFor(update), e)) {
          synchronized (lock) {
            unapplied++;
          }
        }
      }
      return batch;
    }
    if (batch.changeCount() > 0) {
      logger.info("Updated index for {} file(s)", batch.changeCount());
    }
    recordMetadata(batch);
    return batch;
  }

  /** Decides what the index needs for one debounced event. Never throws for I/O failures. */
  Optional<IndexUpdate> classify(FileChangeEvent event) {
    Path path = event.path();
    if (event.kind() == FileChangeEvent.Kind.DELETE) {
      cache.invalidate(path);
      return Optional.of(tombstone(path));
    }

    FileMetadata metadata;
    try {
      metadata = FileMetadata.read(path);
    } catch (NoSuchFileException e) {
      logger.debug("[{}] vanished before it could be read; treating it as deleted", path);
      cache.invalidate(path);
      return Optional.of(tombstone(path));
    } catch (IOException e) {
      if (defer(event, e)) {
        return Optional.empty();
      }
      return Optional.of(unreadable(path));
    }
    if (metadata.isDirectory()) {
      logger.debug("Skipping directory [{}]", path);
      return Optional.empty();
    }

    // capture before getIfValid so the reason reflects what was cached
    Optional<CachedHash> previous = cache.peek(path);
    Optional<ContentHash> cached = cache.getIfValid(path, metadata.mtime(), metadata.size());
    if (cached.isPresent() && indexWriter.hasLiveEntry(path, cached.get())) {
      clearFailures(path);
      return Optional.of(IndexUpdate.reuse(path, cached.get(), metadata));
    }

    ContentHash hash;
    try {
      hash = ContentHasher.compute(contentHasher, path);
    } catch (ContentHashException e) {
      if (Files.notExists(path)) {
        logger.debug("[{}] vanished while it was hashed; treating it as deleted", path);
        cache.invalidate(path);
        return Optional.of(tombstone(path));
      }
      if (defer(event, e)) {
        return Optional.empty();
      }
      return Optional.of(unreadable(path));
    }

    if (unchangedSince(path, metadata)) {
      cache.add(path, hash, metadata.mtime(), metadata.size());
    } else {
      // the hash may belong to newer content than the metadata says; the next event recomputes it
      logger.debug("[{}] changed while it was hashed; not caching its hash", path);
      cache.invalidate(path);
    }
    clearFailures(path);
    ChangeReason reason = reasonFor(path, metadata, previous);
    return Optional.of(IndexUpdate.reindex(path, hash, metadata, reason));
  }

  private boolean unchangedSince(Path path, FileMetadata before) {
    try {
      return FileMetadata.read(path).sameAs(before);
    } catch (IOException e) {
      return false;
    }
  }

  private ChangeReason reasonFor(Path path, FileMetadata current, Optional<CachedHash> previous) {
    if (metadataStore != null) {
      Optional<FileIndexEntry> stored = metadataStore.get(path);
      if (stored.isPresent() && !stored.get().isDeleted()) {
        return stored
            .get()
            .changeAgainst(current.mtime(), current.size())
            .orElse(ChangeReason.content());
      }
    }
    if (previous.isPresent()) {
      CachedHash old = previous.get();
      return ChangeReason.compare(old.mtime(), current.mtime(), old.size(), current.size())
          .orElse(ChangeReason.content());
    }
    return ChangeReason.newFile();
  }

  private IndexUpdate tombstone(Path path) {
    clearFailures(path);
    return IndexUpdate.tombstone(path);
  }

  /** A file that still cannot be read leaves the index rather than keep its old content. */
  private IndexUpdate unreadable(Path path) {
    logger.warn("[{}] cannot be read; removing it from the index", path);
    cache.invalidate(path);
    return tombstone(path);
  }

  /**
   * Puts {@code event} back into the buffer for the next cycle, unless a newer event for the path
   * is already waiting.
   *
   * @return false if the path has used up its retries or the coordinator is closed, in which case
   *     nothing was re-queued and the caller decides what happens to the change
   */
  private boolean defer(FileChangeEvent event, Throwable cause) {
    Path path = event.path();
    synchronized (lock) {
      if (closed) {
        logger.error("Failed to process [{}] while closing; it will not be retried", path, cause);
        return false;
      }
      int attempts = failures.merge(path, 1, Integer::sum);
      if (attempts > maxRetries) {
        failures.remove(path);
        logger.warn("Giving up on [{}] after {} failed attempt(s)", path, attempts, cause);
        return false;
      }
      if (!buffer.hasEventFor(path)) {
        buffer.collectEvent(event);
      }
      logger.warn(
          "Failed to process [{}] (attempt {} of {}); deferring to the next cycle",
          path,
          attempts,
          maxRetries + 1,
          cause);
      return true;
    }
  }

  private void clearFailures(Path path) {
    synchronized (lock) {
      failures.remove(path);
    }
  }

  /**
   * Rebuilds the whole index from the roots. {@code drained} and everything still buffered are
   * covered by the rebuild; if it fails they go back into the buffer and the next flush retries.
   */
  private UpdateBatch rebuild(List<FileChangeEvent> drained) throws IOException {
    synchronized (flushLock) {
      List<FileChangeEvent> covered = new ArrayList<>(drained);
      synchronized (lock) {
        covered.addAll(buffer.takeEvents());
        rebuildPending = true;
      }
      // fingerprints taken before the rebuild must not be reused against the new index
      cache.clear();
      try {
        indexWriter.rebuild(roots);
      } catch (IOException | RuntimeException e) {
        synchronized (lock) {
          for (FileChangeEvent event : covered) {
            if (!buffer.hasEventFor(event.path())) {
              buffer.collectEvent(event);
            }
          }
        }
        throw e;
      }
      synchronized (lock) {
        rebuildPending = false;
        failures.clear();
      }
      logger.info("Full index re-index completed successfully");
      if (metadataStore != null) {
        refreshMetadata();
      }
      return UpdateBatch.fullRebuild(covered.size());
    }
  }

  private void refreshMetadata() {
    try {
      metadataStore.clear();
      List<Path> files = new ArrayList<>();
      for (Path root : roots) {
        fileTreeVisitor.recursiveVisitFiles(root, dir -> {}, files::add);
      }
      int updated = new FileChangeFilter(metadataStore).updateMetadataBatch(files);
      metadataStore.save();
      logger.debug("Recorded metadata for {} of {} file(s) after rebuild", updated, files.size());
    } catch (IOException e) {
      logger.warn("Failed to refresh metadata at [{}]", metadataStore.storagePath(), e);
    }
  }

  private void recordMetadata(UpdateBatch batch) {
    if (metadataStore == null) {
      return;
    }
    long now = System.currentTimeMillis();
    List<FileIndexEntry> stored = new ArrayList<>();
    try {
      for (IndexUpdate update : batch.updates()) {
        switch (update.action()) {
          case REINDEX:
            FileMetadata metadata = update.metadata().get();
            stored.add(
                new FileIndexEntry(
                    update.path(), now, metadata.mtime(), metadata.size(), update.hash().get()));
            break;
          case TOMBSTONE:
            metadataStore.remove(update.path());
            break;
          case REUSE:
            break;
        }
      }
      metadataStore.storeAll(stored);
      metadataStore.save();
    } catch (IOException e) {
      logger.warn("Failed to save metadata to [{}]", metadataStore.storagePath(), e);
    }
  }

  private boolean isUnderRoot(Path path) {
    for (Path root : roots) {
      if (path.startsWith(root)) {
        return true;
      }
    }
    return false;
  }

  private static FileChangeEvent eventFor(IndexUpdate update) {
    FileChangeEvent.Kind kind =
        update.action() == IndexUpdate.Action.TOMBSTONE
            ? FileChangeEvent.Kind.DELETE
            : FileChangeEvent.Kind.MODIFY;
    return new FileChangeEvent(update.path(), kind, Instant.now());
  }

  private static String describe(List<IndexUpdate> updates) {
    if (updates.size() <= 3) {
      return updates.stream()
          .map(u -> u.path().toString())
          .collect(Collectors.joining(", ", " (files: ", ")"));
    }
    return " (" + updates.size() + " files changed)";
  }
}
