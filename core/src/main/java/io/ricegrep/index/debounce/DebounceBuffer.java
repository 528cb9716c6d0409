package io.ricegrep.index.debounce;

import com.google.common.base.Ticker;
import io.ricegrep.index.FileChangeEvent;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Coalesces bursts of filesystem events into at most one event per path over a fixed time window.
 *
 * <p>The most recently collected event for a path replaces any earlier one; event kinds are not
 * merged, since only the file state observed when the buffer is drained matters. The window is
 * measured on a monotonic {@link Ticker} and restarts only when {@link #takeEvents()} drains the
 * buffer.
 *
 * <p>Not thread-safe. Callers serialize access.
 */
public final class DebounceBuffer {

  public static final Duration DEFAULT_WINDOW = Duration.ofMillis(250);

  private final Map<Path, FileChangeEvent> events = new HashMap<>();
  private final Duration windowDuration;
  private final long windowNanos;
  private final Ticker ticker;

  private long windowStart;

  public DebounceBuffer() {
    this(DEFAULT_WINDOW);
  }

  public DebounceBuffer(Duration windowDuration) {
    this(windowDuration, Ticker.systemTicker());
  }

  public DebounceBuffer(Duration windowDuration, Ticker ticker) {
    if (windowDuration.isNegative()) {
      throw new IllegalArgumentException("window duration must not be negative: " + windowDuration);
    }
    this.windowDuration = windowDuration;
    this.windowNanos = windowDuration.toNanos();
    this.ticker = ticker;
    this.windowStart = ticker.read();
  }

  /** Stores {@code event}, replacing whatever was buffered for the same path. */
  public void collectEvent(FileChangeEvent event) {
    events.put(event.path(), event);
  }

  public boolean isReady() {
    return elapsedNanos() >= windowNanos;
  }

  public Duration elapsed() {
    return Duration.ofNanos(elapsedNanos());
  }

  /** @return the time left in the current window, or empty once it has elapsed. */
  public Optional<Duration> remaining() {
    long remaining = windowNanos - elapsedNanos();
    return remaining > 0 ? Optional.of(Duration.ofNanos(remaining)) : Optional.empty();
  }

  /** Drains every buffered event, in no particular order, and starts a new window. */
  public List<FileChangeEvent> takeEvents() {
    List<FileChangeEvent> taken = new ArrayList<>(events.values());
    events.clear();
    windowStart = ticker.read();
    return taken;
  }

  /** Same contents as {@link #takeEvents()}, leaving the buffer and its window untouched. */
  public List<FileChangeEvent> peekEvents() {
    return new ArrayList<>(events.values());
  }

  public int eventCount() {
    return events.size();
  }

  public boolean hasEvents() {
    return !events.isEmpty();
  }

  public boolean hasEventFor(Path path) {
    return events.containsKey(path);
  }

  public void clear() {
    events.clear();
  }

  public Duration windowDuration() {
    return windowDuration;
  }

  public DebouncingStats stats() {
    return DebouncingStats.of(peekEvents(), remaining());
  }

  private long elapsedNanos() {
    return Math.max(0L, ticker.read() - windowStart);
  }
}
