package io.ricegrep.index.gating;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.ricegrep.index.hashing.ContentHash;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;

/**
 * What was true about a file when it was last written to the index. Persisted by {@link
 * MetadataStore} so a restarted watcher can tell which files changed while it was down.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FileIndexEntry {
  private final Path path;
  private final long indexedAt;
  private final long fileMtime;
  private final long fileSize;
  private final String contentHash;
  private final boolean deleted;

  public FileIndexEntry(
      Path path, long indexedAt, long fileMtime, long fileSize, ContentHash contentHash) {
    this(
        path,
        indexedAt,
        fileMtime,
        fileSize,
        contentHash == null ? null : contentHash.asString(),
        false);
  }

  private FileIndexEntry(
      Path path,
      long indexedAt,
      long fileMtime,
      long fileSize,
      String contentHash,
      boolean deleted) {
    this.path = Objects.requireNonNull(path, "path");
    this.indexedAt = indexedAt;
    this.fileMtime = fileMtime;
    this.fileSize = fileSize;
    this.contentHash = contentHash;
    this.deleted = deleted;
  }

  @JsonCreator
  static FileIndexEntry fromJson(
      @JsonProperty("path") String path,
      @JsonProperty("indexedAt") long indexedAt,
      @JsonProperty("fileMtime") long fileMtime,
      @JsonProperty("fileSize") long fileSize,
      @JsonProperty("contentHash") String contentHash,
      @JsonProperty("deleted") boolean deleted) {
    return new FileIndexEntry(
        Paths.get(path), indexedAt, fileMtime, fileSize, contentHash, deleted);
  }

  /** Reads the current metadata of {@code path}; the entry carries no content hash. */
  public static FileIndexEntry fromFile(Path path) throws IOException {
    return fromFile(path, null);
  }

  public static FileIndexEntry fromFile(Path path, ContentHash hash) throws IOException {
    FileMetadata metadata = FileMetadata.read(path);
    return new FileIndexEntry(
        path, System.currentTimeMillis(), metadata.mtime(), metadata.size(), hash);
  }

  public Path path() {
    return path;
  }

  @JsonProperty("path")
  String pathString() {
    return path.toString();
  }

  /** Epoch milliseconds at which the entry was recorded. */
  @JsonProperty("indexedAt")
  public long indexedAt() {
    return indexedAt;
  }

  @JsonProperty("fileMtime")
  public long fileMtime() {
    return fileMtime;
  }

  @JsonProperty("fileSize")
  public long fileSize() {
    return fileSize;
  }

  public Optional<ContentHash> contentHash() {
    return contentHash == null
        ? Optional.empty()
        : Optional.of(ContentHash.fromString(contentHash));
  }

  @JsonProperty("contentHash")
  String contentHashString() {
    return contentHash;
  }

  /** Soft-delete flag; a deleted entry is kept but no longer describes a live file. */
  @JsonProperty("deleted")
  public boolean isDeleted() {
    return deleted;
  }

  public FileIndexEntry markDeleted() {
    return new FileIndexEntry(path, indexedAt, fileMtime, fileSize, contentHash, true);
  }

  /**
   * Compares the recorded metadata with the file on disk. A soft-deleted entry describes no live
   * file, so whatever is on disk now is {@link ChangeReason.Kind#NEW}.
   *
   * @return the reason to reindex, or empty if mtime and size are unchanged
   */
  public Optional<ChangeReason> shouldReindex() throws IOException {
    if (deleted) {
      return Optional.of(ChangeReason.newFile());
    }
    FileMetadata current;
    try {
      current = FileMetadata.read(path);
    } catch (NoSuchFileException e) {
      return Optional.of(ChangeReason.deleted());
    }
    return changeAgainst(current.mtime(), current.size());
  }

  /** Same as {@link #shouldReindex()} for metadata the caller has already read. */
  public Optional<ChangeReason> changeAgainst(long currentMtime, long currentSize) {
    return ChangeReason.compare(fileMtime, currentMtime, fileSize, currentSize);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    FileIndexEntry that = (FileIndexEntry) o;
    return indexedAt == that.indexedAt
        && fileMtime == that.fileMtime
        && fileSize == that.fileSize
        && deleted == that.deleted
        && path.equals(that.path)
        && Objects.equals(contentHash, that.contentHash);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, indexedAt, fileMtime, fileSize, contentHash, deleted);
  }

  @Override
  public String toString() {
    return "FileIndexEntry{"
        + "path="
        + path
        + ", fileMtime="
        + fileMtime
        + ", fileSize="
        + fileSize
        + ", contentHash="
        + contentHash
        + ", deleted="
        + deleted
        + '}';
  }
}
