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

package io.ricegrep.index.watch;

import static java.nio.file.LinkOption.NOFOLLOW_LINKS;
import static java.nio.file.StandardWatchEventKinds.*;

import com.sun.nio.file.ExtendedWatchEventModifier;
import io.ricegrep.index.FileChangeEvent;
import io.ricegrep.index.FileChangeListener;
import io.ricegrep.index.visitor.FileTreeVisitor;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches directory trees with the JDK {@link WatchService} and reports file-level changes to a
 * {@link FileChangeListener}. Directories are tracked so a new directory is reported as CREATE
 * events for the files inside it and a deleted one as DELETE events for the files known beneath
 * it. Directories the {@link FileTreeVisitor} excludes are neither registered nor reported.
 */
public class IndexWatcher {

  /**
   * A builder for an {@link IndexWatcher}. Use {@code IndexWatcher.builder()} to get a new
   * instance.
   */
  public static final class Builder {
    private List<Path> paths = Collections.emptyList();
    private FileChangeListener listener = (event -> {});
    private Logger logger = null;
    private WatchService watchService = null;
    private FileTreeVisitor fileTreeVisitor = null;

    private Builder() {}

    /** Set multiple paths to watch. */
    public Builder paths(List<Path> paths) {
      this.paths = paths;
      return this;
    }

    /** Set a single path to watch. */
    public Builder path(Path path) {
      return paths(Collections.singletonList(path));
    }

    /** Set the listener events are reported to, usually the index coordinator. */
    public Builder listener(FileChangeListener listener) {
      this.listener = listener;
      return this;
    }

    /** Set a {@link WatchService} implementation. Defaults to the default filesystem's. */
    public Builder watchService(WatchService watchService) {
      this.watchService = watchService;
      return this;
    }

    /**
     * Set a logger to be used by the watcher. This defaults to {@code
     * LoggerFactory.getLogger(IndexWatcher.class)}
     */
    public Builder logger(Logger logger) {
      this.logger = logger;
      return this;
    }

    /** Defines the file tree visitor used to walk and filter the watched trees. */
    public Builder fileTreeVisitor(FileTreeVisitor fileTreeVisitor) {
      this.fileTreeVisitor = fileTreeVisitor;
      return this;
    }

    public IndexWatcher build() throws IOException {
      if (fileTreeVisitor == null) {
        fileTreeVisitor = FileTreeVisitor.DEFAULT_FILE_TREE_VISITOR;
      }
      if (watchService == null) {
        watchService = FileSystems.getDefault().newWatchService();
      }
      if (logger == null) {
        logger = LoggerFactory.getLogger(IndexWatcher.class);
      }
      return new IndexWatcher(paths, listener, watchService, fileTreeVisitor, logger);
    }
  }

  /** Get a new builder for an {@link IndexWatcher}. */
  public static Builder builder() {
    return new Builder();
  }

  private final Logger logger;
  private final WatchService watchService;
  private final List<Path> paths;
  private final FileChangeListener listener;
  private final FileTreeVisitor fileTreeVisitor;

  private final Map<Path, Path> registeredPathToRootPath = new ConcurrentHashMap<>();
  private final NavigableSet<Path> files = new ConcurrentSkipListSet<>();
  private final NavigableSet<Path> directories = new ConcurrentSkipListSet<>();
  private final Map<WatchKey, Path> keyRoots = new ConcurrentHashMap<>();

  private volatile boolean closed = false;

  // set to null until we check if FILE_TREE is supported
  private Boolean fileTreeSupported = null;

  public IndexWatcher(
      List<Path> paths,
      FileChangeListener listener,
      WatchService watchService,
      FileTreeVisitor fileTreeVisitor,
      Logger logger) {
    this.paths = paths.stream().map(Path::toAbsolutePath).collect(Collectors.toList());
    this.listener = listener;
    this.watchService = watchService;
    this.fileTreeVisitor = fileTreeVisitor;
    this.logger = logger;
  }

  /**
   * Asynchronously watch the directories using {@code ForkJoinPool.commonPool()} as the executor
   */
  public CompletableFuture<Void> watchAsync() {
    return watchAsync(ForkJoinPool.commonPool());
  }

  /**
   * Start watching for changes asynchronously.
   *
   * <p>The future completes when the listener stops listening or the watcher is closed.
   *
   * <p>This method will block until the watcher is initialized and successfully watching.
   *
   * @param executor the executor to use to watch asynchronously
   */
  public CompletableFuture<Void> watchAsync(Executor executor) {
    try {
      registerPaths();
      return CompletableFuture.supplyAsync(
          () -> {
            runEventLoop();
            return null;
          },
          executor);
    } catch (Throwable t) {
      CompletableFuture<Void> f = new CompletableFuture<>();
      f.completeExceptionally(t);
      return f;
    }
  }

  /**
   * Watch for changes; block until the listener stops listening or the watcher is closed.
   *
   * @throws IllegalStateException if the watcher is closed when watch() is called.
   */
  public void watch() {
    registerPaths();
    runEventLoop();
  }

  /** The regular files currently known beneath the watched roots. */
  public Set<Path> knownFiles() {
    return Collections.unmodifiableSet(files);
  }

  private void registerPaths() {
    try {
      PathUtils.initWatcherState(paths, fileTreeVisitor, directories, files);

      for (Path path : paths) {
        registerAll(path, path);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private void runEventLoop() {
    if (closed) {
      throw new IllegalStateException("watcher already closed");
    }
    while (listener.isWatching()) {
      // wait for key to be signalled
      WatchKey key;
      try {
        key = watchService.take();
      } catch (InterruptedException | ClosedWatchServiceException e) {
        return;
      }
      for (WatchEvent<?> event : key.pollEvents()) {
        try {
          WatchEvent.Kind<?> kind = event.kind();
          // Context for directory entry event is the file name of entry
          WatchEvent<Path> ev = PathUtils.cast(event);
          Path eventPath = ev.context();
          if (!keyRoots.containsKey(key)) {
            throw new IllegalStateException(
                "WatchService returned key [" + key + "] but it was not found in keyRoots!");
          }
          Path registeredPath = keyRoots.get(key);
          Path rootPath = registeredPathToRootPath.get(registeredPath);
          Path childPath = eventPath == null ? null : registeredPath.resolve(eventPath);
          logger.debug("{} [{}]", kind, childPath);

          if (kind == OVERFLOW) {
            listener.onOverflow(rootPath);
          } else if (eventPath == null) {
            throw new IllegalStateException("WatchService returned a null path for " + kind.name());
          } else if (PathUtils.isExcluded(fileTreeVisitor, rootPath, childPath)) {
            logger.debug("Ignoring {} in excluded directory [{}]", kind, childPath);
          } else {
            switch (FileChangeEvent.Kind.fromWatchEventKind(kind)) {
              case CREATE:
                onCreate(childPath, rootPath);
                break;
              case MODIFY:
                // a directory's own mtime changes whenever its entries do; only files matter
                if (!directories.contains(childPath)) {
                  files.add(childPath);
                  notify(FileChangeEvent.Kind.MODIFY, childPath);
                }
                break;
              case DELETE:
                onDelete(childPath);
                break;
            }
          }
        } catch (Exception e) {
          logger.debug("IndexWatcher got an exception while watching!", e);
          listener.onException(e);
        }
      }
      boolean valid = key.reset();
      if (!valid) {
        logger.debug("WatchKey for [{}] no longer valid; removing.", key.watchable());
        // remove the key from the keyRoots
        Path registeredPath = keyRoots.remove(key);

        // Also remove from the registeredPathToRootPath maps
        if (registeredPath != null) {
          registeredPathToRootPath.remove(registeredPath);
        }

        // if there are no more keys left to watch, we can break out
        if (keyRoots.isEmpty()) {
          logger.debug("No more directories left to watch; terminating watcher.");
          break;
        }
      }
    }
    try {
      close();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private void onCreate(Path childPath, Path rootPath) throws IOException {
    if (Files.isDirectory(childPath, NOFOLLOW_LINKS)) {
      if (!Boolean.TRUE.equals(fileTreeSupported)) {
        registerAll(childPath, rootPath);
      }
      // files may have landed in the directory before it was registered
      List<Path> created = new ArrayList<>();
      fileTreeVisitor.recursiveVisitFiles(childPath, directories::add, created::add);
      for (Path file : created) {
        if (files.add(file)) {
          notify(FileChangeEvent.Kind.CREATE, file);
        }
      }
    } else {
      files.add(childPath);
      notify(FileChangeEvent.Kind.CREATE, childPath);
    }
  }

  private void onDelete(Path childPath) {
    if (directories.contains(childPath)) {
      PathUtils.subtree(directories, childPath).clear();
      NavigableSet<Path> deleted = PathUtils.subtree(files, childPath);
      for (Path file : new ArrayList<>(deleted)) {
        deleted.remove(file);
        notify(FileChangeEvent.Kind.DELETE, file);
      }
    } else {
      files.remove(childPath);
      notify(FileChangeEvent.Kind.DELETE, childPath);
    }
  }

  private void notify(FileChangeEvent.Kind kind, Path path) {
    logger.debug("-> {} [{}]", kind, path);
    listener.onEvent(new FileChangeEvent(path, kind, Instant.now()));
  }

  public void close() throws IOException {
    watchService.close();
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }

  private void registerAll(final Path start, final Path context) throws IOException {
    if (!Boolean.FALSE.equals(fileTreeSupported)) {
      // Try using FILE_TREE modifier since we aren't certain that it's unsupported
      try {
        register(start, true, context);
        // Assume FILE_TREE is supported
        fileTreeSupported = true;
      } catch (UnsupportedOperationException e) {
        // UnsupportedOperationException should only happen if FILE_TREE is unsupported
        logger.debug("Assuming ExtendedWatchEventModifier.FILE_TREE is not supported", e);
        fileTreeSupported = false;
        // If we failed to use the FILE_TREE modifier, try again without
        registerAll(start, context);
      }
    } else {
      // Since FILE_TREE is unsupported, register root directory and sub-directories
      fileTreeVisitor.recursiveVisitFiles(start, dir -> register(dir, false, context), file -> {});
    }
  }

  // Internal method to be used by registerAll
  private void register(Path directory, boolean useFileTreeModifier, Path context)
      throws IOException {
    logger.debug("Registering [{}].", directory);
    WatchEvent.Modifier[] modifiers =
        useFileTreeModifier
            ? new WatchEvent.Modifier[] {ExtendedWatchEventModifier.FILE_TREE}
            : new WatchEvent.Modifier[] {};
    WatchEvent.Kind<?>[] kinds =
        new WatchEvent.Kind<?>[] {ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY};
    WatchKey watchKey = directory.register(watchService, kinds, modifiers);
    keyRoots.put(watchKey, directory);
    registeredPathToRootPath.put(directory, context);
  }
}
