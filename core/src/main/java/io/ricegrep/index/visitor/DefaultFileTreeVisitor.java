package io.ricegrep.index.visitor;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DefaultFileTreeVisitor implements FileTreeVisitor {
  private static final Logger logger = LoggerFactory.getLogger(DefaultFileTreeVisitor.class);

  /** Directory names never descended into. {@code .ricegrep} holds the index's own state. */
  public static final Set<String> DEFAULT_EXCLUDED_DIRECTORIES =
      Collections.unmodifiableSet(new HashSet<>(Arrays.asList(".git", ".ricegrep")));

  private final Set<String> excludedDirectories;

  public DefaultFileTreeVisitor() {
    this(DEFAULT_EXCLUDED_DIRECTORIES);
  }

  public DefaultFileTreeVisitor(Set<String> excludedDirectories) {
    this.excludedDirectories = excludedDirectories;
  }

  @Override
  public void recursiveVisitFiles(Path file, Callback onDirectory, Callback onFile)
      throws IOException {
    SimpleFileVisitor<Path> visitor =
        new SimpleFileVisitor<Path>() {
          @Override
          public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs)
              throws IOException {
            if (!dir.equals(file) && isExcluded(dir)) {
              return FileVisitResult.SKIP_SUBTREE;
            }
            onDirectory.call(dir);
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
              throws IOException {
            onFile.call(file);
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            onFailure(file, exc);
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
            if (exc != null) onFailure(dir, exc);
            return FileVisitResult.CONTINUE;
          }
        };
    Files.walkFileTree(file, visitor);
  }

  @Override
  public boolean isExcluded(Path dir) {
    Path name = dir.getFileName();
    return name != null && excludedDirectories.contains(name.toString());
  }

  // To be overridden if needed
  protected void onFailure(Path path, IOException exception) throws IOException {
    logger.debug("Could not visit [{}]; skipping it.", path, exception);
  }
}
