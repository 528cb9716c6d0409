package io.ricegrep.index.gating;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/** The cheap-to-read facts about a file used to decide whether its content may have changed. */
public final class FileMetadata {
  private final long mtime;
  private final long size;
  private final boolean directory;

  public FileMetadata(long mtime, long size, boolean directory) {
    this.mtime = mtime;
    this.size = size;
    this.directory = directory;
  }

  /**
   * Stats {@code path}.
   *
   * @throws java.nio.file.NoSuchFileException if the file no longer exists
   */
  public static FileMetadata read(Path path) throws IOException {
    BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
    return new FileMetadata(attrs.lastModifiedTime().toMillis(), attrs.size(), attrs.isDirectory());
  }

  /** Modification time in milliseconds since the epoch. */
  public long mtime() {
    return mtime;
  }

  public long size() {
    return size;
  }

  public boolean isDirectory() {
    return directory;
  }

  public boolean sameAs(FileMetadata other) {
    return mtime == other.mtime && size == other.size;
  }

  @Override
  public String toString() {
    return "FileMetadata{mtime=" + mtime + ", size=" + size + ", directory=" + directory + '}';
  }
}
