package io.ricegrep.index;

import java.nio.file.Path;

/** Receives the events produced by a filesystem watcher. */
public interface FileChangeListener {

  void onEvent(FileChangeEvent event);

  /**
   * Called when the OS dropped notifications for {@code root}. Nothing is known about which files
   * changed, so the default does nothing and implementations decide how to recover.
   */
  default void onOverflow(Path root) {}

  default boolean isWatching() {
    return true;
  }

  default void onException(Exception e) {}

  static FileChangeListener of(FileChangeListener... listeners) {
    return new FileChangeListener() {
      @Override
      public void onEvent(FileChangeEvent event) {
        for (FileChangeListener listener : listeners) {
          listener.onEvent(event);
        }
      }

      @Override
      public void onOverflow(Path root) {
        for (FileChangeListener listener : listeners) {
          listener.onOverflow(root);
        }
      }

      @Override
      public boolean isWatching() {
        for (FileChangeListener listener : listeners) {
          if (!listener.isWatching()) {
            return false;
          }
        }
        return true;
      }

      @Override
      public void onException(Exception e) {
        for (FileChangeListener listener : listeners) {
          listener.onException(e);
        }
      }
    };
  }
}
