package io.ricegrep.index.debounce;

import io.ricegrep.index.FileChangeEvent;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** A point-in-time summary of a {@link DebounceBuffer}. */
public final class DebouncingStats {

  private final int bufferedEvents;
  private final int creates;
  private final int modifies;
  private final int deletes;
  private final List<Path> changedFiles;
  private final Optional<Duration> windowRemaining;

  DebouncingStats(
      int bufferedEvents,
      int creates,
      int modifies,
      int deletes,
      List<Path> changedFiles,
      Optional<Duration> windowRemaining) {
    this.bufferedEvents = bufferedEvents;
    this.creates = creates;
    this.modifies = modifies;
    this.deletes = deletes;
    this.changedFiles = Collections.unmodifiableList(changedFiles);
    this.windowRemaining = windowRemaining;
  }

  static DebouncingStats of(Collection<FileChangeEvent> events, Optional<Duration> remaining) {
    int creates = 0;
    int modifies = 0;
    int deletes = 0;
    List<Path> changed = new ArrayList<>(events.size());
    for (FileChangeEvent event : events) {
      switch (event.kind()) {
        case CREATE:
          creates++;
          break;
        case MODIFY:
          modifies++;
          break;
        case DELETE:
          deletes++;
          break;
      }
      changed.add(event.path());
    }
    return new DebouncingStats(events.size(), creates, modifies, deletes, changed, remaining);
  }

  public int bufferedEvents() {
    return bufferedEvents;
  }

  public int creates() {
    return creates;
  }

  public int modifies() {
    return modifies;
  }

  public int deletes() {
    return deletes;
  }

  public List<Path> changedFiles() {
    return changedFiles;
  }

  public Optional<Duration> windowRemaining() {
    return windowRemaining;
  }

  @Override
  public String toString() {
    return "DebouncingStats{"
        + "bufferedEvents="
        + bufferedEvents
        + ", creates="
        + creates
        + ", modifies="
        + modifies
        + ", deletes="
        + deletes
        + ", windowRemaining="
        + windowRemaining.map(Duration::toMillis).map(ms -> ms + "ms").orElse("elapsed")
        + '}';
  }
}
