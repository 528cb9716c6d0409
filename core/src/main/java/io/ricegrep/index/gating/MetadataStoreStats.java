package io.ricegrep.index.gating;

import java.nio.file.Path;

public final class MetadataStoreStats {
  private final int entryCount;
  private final long totalFileSize;
  private final Path storagePath;

  MetadataStoreStats(int entryCount, long totalFileSize, Path storagePath) {
    this.entryCount = entryCount;
    this.totalFileSize = totalFileSize;
    this.storagePath = storagePath;
  }

  public int entryCount() {
    return entryCount;
  }

  public long totalFileSize() {
    return totalFileSize;
  }

  public Path storagePath() {
    return storagePath;
  }

  @Override
  public String toString() {
    return "MetadataStoreStats{entryCount="
        + entryCount
        + ", totalFileSize="
        + totalFileSize
        + ", storagePath="
        + storagePath
        + '}';
  }
}
