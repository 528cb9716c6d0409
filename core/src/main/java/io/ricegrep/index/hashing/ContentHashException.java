package io.ricegrep.index.hashing;

import java.io.IOException;
import java.nio.file.Path;

/** Thrown when the content hash of a file could not be computed. */
public class ContentHashException extends IOException {

  public enum Kind {
    /** The file could not be read: it vanished, or access was denied. */
    IO,
    /** The hasher itself failed or produced no hash. */
    COMPUTATION
  }

  private final Kind kind;
  private final Path path;

  public ContentHashException(Kind kind, Path path, Throwable cause) {
    super("Failed to hash [" + path + "] (" + kind + ")", cause);
    this.kind = kind;
    this.path = path;
  }

  public Kind kind() {
    return kind;
  }

  public Path path() {
    return path;
  }
}
