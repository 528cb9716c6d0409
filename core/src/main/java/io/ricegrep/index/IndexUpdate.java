package io.ricegrep.index;

import io.ricegrep.index.gating.ChangeReason;
import io.ricegrep.index.gating.FileMetadata;
import io.ricegrep.index.hashing.ContentHash;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/** One instruction for the index writer, produced per changed path in a flush. */
public final class IndexUpdate {

  public enum Action {
    /** The indexed entry already holds this exact content; nothing to write. */
    REUSE,
    /** The file's content must be (re)written under the carried hash. */
    REINDEX,
    /** The file is gone; remove it from the index. */
    TOMBSTONE
  }

  private final Action action;
  private final Path path;
  private final ContentHash hash;
  private final FileMetadata metadata;
  private final ChangeReason reason;

  private IndexUpdate(
      Action action, Path path, ContentHash hash, FileMetadata metadata, ChangeReason reason) {
    this.action = action;
    this.path = path;
    this.hash = hash;
    this.metadata = metadata;
    this.reason = reason;
  }

  public static IndexUpdate reuse(Path path, ContentHash hash, FileMetadata metadata) {
    return new IndexUpdate(Action.REUSE, path, hash, metadata, null);
  }

  public static IndexUpdate reindex(
      Path path, ContentHash hash, FileMetadata metadata, ChangeReason reason) {
    return new IndexUpdate(
        Action.REINDEX,
        path,
        Objects.requireNonNull(hash, "hash"),
        metadata,
        Objects.requireNonNull(reason, "reason"));
  }

  public static IndexUpdate tombstone(Path path) {
    return new IndexUpdate(Action.TOMBSTONE, path, null, null, ChangeReason.deleted());
  }

  public Action action() {
    return action;
  }

  public Path path() {
    return path;
  }

  /** Absent for tombstones. */
  public Optional<ContentHash> hash() {
    return Optional.ofNullable(hash);
  }

  /** The metadata the hash was computed against; absent for tombstones. */
  public Optional<FileMetadata> metadata() {
    return Optional.ofNullable(metadata);
  }

  /** Absent for {@link Action#REUSE}. */
  public Optional<ChangeReason> reason() {
    return Optional.ofNullable(reason);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    IndexUpdate that = (IndexUpdate) o;
    return action == that.action
        && path.equals(that.path)
        && Objects.equals(hash, that.hash)
        && Objects.equals(reason, that.reason);
  }

  @Override
  public int hashCode() {
    return Objects.hash(action, path, hash, reason);
  }

  @Override
  public String toString() {
    return "IndexUpdate{"
        + "action="
        + action
        + ", path="
        + path
        + ", hash="
        + ((hash == null) ? "(none)" : hash.asString())
        + ", reason="
        + reason
        + '}';
  }
}
