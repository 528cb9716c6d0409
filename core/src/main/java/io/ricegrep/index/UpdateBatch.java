package io.ricegrep.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The result of one flush: at most one {@link IndexUpdate} per path, in no particular order, or a
 * marker that the whole index was rebuilt instead.
 */
public final class UpdateBatch {
  private static final UpdateBatch EMPTY = new UpdateBatch(Collections.emptyList(), false, 0);

  private final List<IndexUpdate> updates;
  private final boolean fullRebuild;
  private final int eventCount;

  UpdateBatch(List<IndexUpdate> updates, boolean fullRebuild, int eventCount) {
    this.updates = Collections.unmodifiableList(new ArrayList<>(updates));
    this.fullRebuild = fullRebuild;
    this.eventCount = eventCount;
  }

  public static UpdateBatch empty() {
    return EMPTY;
  }

  public static UpdateBatch of(List<IndexUpdate> updates, int eventCount) {
    return new UpdateBatch(updates, false, eventCount);
  }

  public static UpdateBatch fullRebuild(int eventCount) {
    return new UpdateBatch(Collections.emptyList(), true, eventCount);
  }

  public List<IndexUpdate> updates() {
    return updates;
  }

  public boolean isFullRebuild() {
    return fullRebuild;
  }

  /** Number of debounced events this batch was built from. */
  public int eventCount() {
    return eventCount;
  }

  public boolean isEmpty() {
    return updates.isEmpty() && !fullRebuild;
  }

  public List<IndexUpdate> withAction(IndexUpdate.Action action) {
    return updates.stream().filter(u -> u.action() == action).collect(Collectors.toList());
  }

  /** Number of updates that change the index, i.e. everything but REUSE. */
  public int changeCount() {
    int count = 0;
    for (IndexUpdate update : updates) {
      if (update.action() != IndexUpdate.Action.REUSE) {
        count++;
      }
    }
    return count;
  }

  @Override
  public String toString() {
    if (fullRebuild) {
      return "UpdateBatch{fullRebuild, events=" + eventCount + '}';
    }
    return "UpdateBatch{"
        + "reindex="
        + withAction(IndexUpdate.Action.REINDEX).size()
        + ", tombstone="
        + withAction(IndexUpdate.Action.TOMBSTONE).size()
        + ", reuse="
        + withAction(IndexUpdate.Action.REUSE).size()
        + '}';
  }
}
