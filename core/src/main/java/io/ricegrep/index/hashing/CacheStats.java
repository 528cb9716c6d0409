package io.ricegrep.index.hashing;

/** Snapshot of a {@link ContentHashCache}. */
public final class CacheStats {
  private final int entries;
  private final long capacityBytes;
  private final long currentBytes;
  private final long hits;
  private final long misses;
  private final long evictions;

  CacheStats(
      int entries, long capacityBytes, long currentBytes, long hits, long misses, long evictions) {
    this.entries = entries;
    this.capacityBytes = capacityBytes;
    this.currentBytes = currentBytes;
    this.hits = hits;
    this.misses = misses;
    this.evictions = evictions;
  }

  public int entries() {
    return entries;
  }

  public long capacityBytes() {
    return capacityBytes;
  }

  public long currentBytes() {
    return currentBytes;
  }

  public long hits() {
    return hits;
  }

  public long misses() {
    return misses;
  }

  public long evictions() {
    return evictions;
  }

  public double utilizationPercent() {
    return capacityBytes == 0 ? 0.0 : (currentBytes * 100.0) / capacityBytes;
  }

  @Override
  public String toString() {
    return String.format(
        "CacheStats{entries=%d, currentBytes=%d, capacityBytes=%d (%.1f%%), hits=%d, misses=%d,"
            + " evictions=%d}",
        entries, currentBytes, capacityBytes, utilizationPercent(), hits, misses, evictions);
  }
}
