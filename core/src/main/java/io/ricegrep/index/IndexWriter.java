package io.ricegrep.index;

import io.ricegrep.index.hashing.ContentHash;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The component that owns the lexical and vector index. The coordinator tells it what changed; how
 * the index is stored and written is up to the implementation.
 *
 * <p>{@link #hasLiveEntry} is called concurrently from the hashing workers and must be thread-safe.
 * The other methods are called from one flush at a time. Updates for different paths may be
 * applied in any order.
 */
public interface IndexWriter {

  /** @return true if the index holds a live entry for {@code path} with exactly this content. */
  boolean hasLiveEntry(Path path, ContentHash hash);

  void apply(UpdateBatch batch) throws IOException;

  /** Rebuilds the index from scratch for everything beneath {@code roots}. */
  void rebuild(List<Path> roots) throws IOException;

  default void optimize() throws IOException {}
}
