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
package io.ricegrep.index.watch;

import io.ricegrep.index.visitor.FileTreeVisitor;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.WatchEvent;
import java.util.List;
import java.util.NavigableSet;
import java.util.Set;

public class PathUtils {

  /** @return the paths in {@code paths} at or beneath {@code treeRoot}. */
  public static NavigableSet<Path> subtree(NavigableSet<Path> paths, Path treeRoot) {
    Path upperBound = Paths.get(treeRoot.toString(), "" + Character.MAX_VALUE);
    return paths.subSet(treeRoot, true, upperBound, false);
  }

  /** Walks every root, recording directories and regular files into the given sets. */
  public static void initWatcherState(
      List<Path> roots, FileTreeVisitor fileTreeVisitor, Set<Path> directories, Set<Path> files)
      throws IOException {
    for (Path root : roots) {
      fileTreeVisitor.recursiveVisitFiles(root, directories::add, files::add);
    }
  }

  /** @return true if any directory between {@code root} and {@code path} is excluded. */
  public static boolean isExcluded(FileTreeVisitor fileTreeVisitor, Path root, Path path) {
    if (root == null || !path.startsWith(root)) {
      return false;
    }
    for (Path element : root.relativize(path)) {
      if (fileTreeVisitor.isExcluded(element)) {
        return true;
      }
    }
    return false;
  }

  @SuppressWarnings("unchecked")
  public static <T> WatchEvent<T> cast(WatchEvent<?> event) {
    return (WatchEvent<T>) event;
  }
}
