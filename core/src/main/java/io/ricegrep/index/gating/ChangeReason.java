package io.ricegrep.index.gating;

import java.util.Objects;
import java.util.Optional;

/** Why a file has to be indexed again. */
public final class ChangeReason {

  public enum Kind {
    MTIME,
    SIZE,
    MTIME_AND_SIZE,
    /** Metadata matches but the content hash differs. */
    CONTENT,
    DELETED,
    /** Nothing is known about the file yet. */
    NEW
  }

  private static final ChangeReason DELETED = new ChangeReason(Kind.DELETED, 0, 0, 0, 0);
  private static final ChangeReason NEW = new ChangeReason(Kind.NEW, 0, 0, 0, 0);
  private static final ChangeReason CONTENT = new ChangeReason(Kind.CONTENT, 0, 0, 0, 0);

  private final Kind kind;
  private final long oldMtime;
  private final long newMtime;
  private final long oldSize;
  private final long newSize;

  private ChangeReason(Kind kind, long oldMtime, long newMtime, long oldSize, long newSize) {
    this.kind = kind;
    this.oldMtime = oldMtime;
    this.newMtime = newMtime;
    this.oldSize = oldSize;
    this.newSize = newSize;
  }

  public static ChangeReason mtime(long oldMtime, long newMtime) {
    return new ChangeReason(Kind.MTIME, oldMtime, newMtime, 0, 0);
  }

  public static ChangeReason size(long oldSize, long newSize) {
    return new ChangeReason(Kind.SIZE, 0, 0, oldSize, newSize);
  }

  public static ChangeReason mtimeAndSize(
      long oldMtime, long newMtime, long oldSize, long newSize) {
    return new ChangeReason(Kind.MTIME_AND_SIZE, oldMtime, newMtime, oldSize, newSize);
  }

  /** @return the metadata change between two observations, or empty if neither moved. */
  public static Optional<ChangeReason> compare(
      long oldMtime, long newMtime, long oldSize, long newSize) {
    boolean mtimeChanged = oldMtime != newMtime;
    boolean sizeChanged = oldSize != newSize;
    if (mtimeChanged && sizeChanged) {
      return Optional.of(mtimeAndSize(oldMtime, newMtime, oldSize, newSize));
    } else if (mtimeChanged) {
      return Optional.of(mtime(oldMtime, newMtime));
    } else if (sizeChanged) {
      return Optional.of(size(oldSize, newSize));
    }
    return Optional.empty();
  }

  public static ChangeReason content() {
    return CONTENT;
  }

  public static ChangeReason deleted() {
    return DELETED;
  }

  public static ChangeReason newFile() {
    return NEW;
  }

  public Kind kind() {
    return kind;
  }

  public long oldMtime() {
    return oldMtime;
  }

  public long newMtime() {
    return newMtime;
  }

  public long oldSize() {
    return oldSize;
  }

  public long newSize() {
    return newSize;
  }

  public String description() {
    switch (kind) {
      case MTIME:
        return "mtime changed: " + oldMtime + " -> " + newMtime;
      case SIZE:
        return "size changed: " + oldSize + " -> " + newSize;
      case MTIME_AND_SIZE:
        return "mtime and size changed: mtime "
            + oldMtime
            + " -> "
            + newMtime
            + ", size "
            + oldSize
            + " -> "
            + newSize;
      case CONTENT:
        return "content changed";
      case DELETED:
        return "file deleted";
      case NEW:
        return "not previously indexed";
      default:
        throw new IllegalStateException("Unknown kind " + kind);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ChangeReason that = (ChangeReason) o;
    return kind == that.kind
        && oldMtime == that.oldMtime
        && newMtime == that.newMtime
        && oldSize == that.oldSize
        && newSize == that.newSize;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, oldMtime, newMtime, oldSize, newSize);
  }

  @Override
  public String toString() {
    return description();
  }
}
