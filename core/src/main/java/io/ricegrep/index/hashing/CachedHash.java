package io.ricegrep.index.hashing;

import java.util.Objects;

/**
 * A content hash together with the file metadata it was validated against. {@code cachedAt} is a
 * monotonic ticker reading in nanoseconds, not a wall-clock time.
 */
public final class CachedHash {
  private final ContentHash hash;
  private final long mtime;
  private final long size;
  private final long cachedAt;

  CachedHash(ContentHash hash, long mtime, long size, long cachedAt) {
    this.hash = Objects.requireNonNull(hash, "hash");
    this.mtime = mtime;
    this.size = size;
    this.cachedAt = cachedAt;
  }

  public ContentHash hash() {
    return hash;
  }

  public long mtime() {
    return mtime;
  }

  public long size() {
    return size;
  }

  public long cachedAt() {
    return cachedAt;
  }

  @Override
  public String toString() {
    return "CachedHash{hash=" + hash + ", mtime=" + mtime + ", size=" + size + '}';
  }
}
