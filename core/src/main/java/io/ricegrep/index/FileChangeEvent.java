/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.ricegrep.index;

import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.time.Instant;
import java.util.Objects;

/** A single filesystem change notification, as classified by the watcher that produced it. */
public final class FileChangeEvent {
  public enum Kind {

    /* A new file was created */
    CREATE(StandardWatchEventKinds.ENTRY_CREATE),

    /* An existing file was modified */
    MODIFY(StandardWatchEventKinds.ENTRY_MODIFY),

    /* A file was deleted */
    DELETE(StandardWatchEventKinds.ENTRY_DELETE);

    private final WatchEvent.Kind<?> kind;

    Kind(WatchEvent.Kind<?> kind) {
      this.kind = kind;
    }

    /** @return the matching kind, or null for kinds that carry no path (OVERFLOW). */
    public static Kind fromWatchEventKind(WatchEvent.Kind<?> watchKind) {
      for (Kind k : values()) {
        if (k.kind == watchKind) {
          return k;
        }
      }
      return null;
    }
  }

  private final Path path;
  private final Kind kind;
  private final Instant timestamp;

  public FileChangeEvent(Path path, Kind kind, Instant timestamp) {
    this.path = Objects.requireNonNull(path, "path");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
  }

  public static FileChangeEvent create(Path path) {
    return new FileChangeEvent(path, Kind.CREATE, Instant.now());
  }

  public static FileChangeEvent modify(Path path) {
    return new FileChangeEvent(path, Kind.MODIFY, Instant.now());
  }

  public static FileChangeEvent delete(Path path) {
    return new FileChangeEvent(path, Kind.DELETE, Instant.now());
  }

  public Path path() {
    return path;
  }

  public Kind kind() {
    return kind;
  }

  public Instant timestamp() {
    return timestamp;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    FileChangeEvent that = (FileChangeEvent) o;

    return kind == that.kind && path.equals(that.path) && timestamp.equals(that.timestamp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, kind, timestamp);
  }

  @Override
  public String toString() {
    return "FileChangeEvent{"
        + "kind="
        + kind
        + ", path="
        + path
        + ", timestamp="
        + timestamp
        + '}';
  }
}
