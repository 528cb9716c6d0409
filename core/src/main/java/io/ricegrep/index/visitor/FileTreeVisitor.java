package io.ricegrep.index.visitor;

import java.io.IOException;
import java.nio.file.Path;

public interface FileTreeVisitor {

  /** The default visitor: walks with Files.walkFileTree, skipping VCS and index metadata dirs. */
  FileTreeVisitor DEFAULT_FILE_TREE_VISITOR = new DefaultFileTreeVisitor();

  interface Callback {
    void call(Path p) throws IOException;
  }

  void recursiveVisitFiles(Path file, Callback onDirectory, Callback onFile) throws IOException;

  /** @return true if {@code dir} is never descended into, so changes beneath it are ignored. */
  default boolean isExcluded(Path dir) {
    return false;
  }
}
