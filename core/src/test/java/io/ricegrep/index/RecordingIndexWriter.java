package io.ricegrep.index;

import io.ricegrep.index.hashing.ContentHash;
import io.ricegrep.index.hashing.ContentHasher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/** An in-memory index that remembers what it was asked to do. */
public class RecordingIndexWriter implements IndexWriter {
  final Map<Path, ContentHash> live = new ConcurrentHashMap<>();
  final List<UpdateBatch> batches = new CopyOnWriteArrayList<>();
  final AtomicInteger rebuilds = new AtomicInteger();
  final AtomicInteger optimizations = new AtomicInteger();
  volatile int failuresToThrow = 0;
  volatile int rebuildFailuresToThrow = 0;

  @Override
  public boolean hasLiveEntry(Path path, ContentHash hash) {
    return hash.equals(live.get(path));
  }

  @Override
  public void apply(UpdateBatch batch) throws IOException {
    if (failuresToThrow > 0) {
      failuresToThrow--;
      throw new IOException("index is read-only");
    }
    batches.add(batch);
    for (IndexUpdate update : batch.updates()) {
      switch (update.action()) {
        case REINDEX:
          live.put(update.path(), update.hash().get());
          break;
        case TOMBSTONE:
          live.remove(update.path());
          break;
        case REUSE:
          break;
      }
    }
  }

  @Override
  public void rebuild(List<Path> roots) throws IOException {
    if (rebuildFailuresToThrow > 0) {
      rebuildFailuresToThrow--;
      throw new IOException("index directory is locked");
    }
    rebuilds.incrementAndGet();
    live.clear();
    for (Path root : roots) {
      try (Stream<Path> files = Files.walk(root)) {
        for (Path file : (Iterable<Path>) files.filter(Files::isRegularFile)::iterator) {
          live.put(file, ContentHasher.MURMUR3_128.hash(file));
        }
      }
    }
  }

  @Override
  public void optimize() {
    optimizations.incrementAndGet();
  }

  UpdateBatch lastBatch() {
    return batches.get(batches.size() - 1);
  }
}
