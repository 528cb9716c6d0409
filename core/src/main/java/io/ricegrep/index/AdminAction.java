package io.ricegrep.index;

/** Out-of-band commands from the admin control plane. */
public enum AdminAction {
  /** Drop pending events and the hash cache, then rebuild the whole index. */
  REINDEX,
  /** Forget every cached content hash so nothing stale can be reused. */
  CLEAR_CACHE,
  /** Ask the index writer to compact its storage. */
  OPTIMIZE
}
