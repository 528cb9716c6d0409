package io.ricegrep.index.gating;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** The outcome of {@link FileChangeFilter#filterChanges}. */
public final class FilterResult {
  private final Map<Path, ChangeReason> filesToReindex;
  private final Map<Path, String> skippedFiles;

  FilterResult(Map<Path, ChangeReason> filesToReindex, Map<Path, String> skippedFiles) {
    this.filesToReindex = Collections.unmodifiableMap(filesToReindex);
    this.skippedFiles = Collections.unmodifiableMap(skippedFiles);
  }

  /** Files that need reindexing, with the reason. Files that could not be checked map to NEW. */
  public Map<Path, ChangeReason> filesToReindex() {
    return filesToReindex;
  }

  /** Files whose metadata is unchanged, with a short note. */
  public Map<Path, String> skippedFiles() {
    return skippedFiles;
  }

  public int reindexCount() {
    return filesToReindex.size();
  }

  public int skippedCount() {
    return skippedFiles.size();
  }

  public int totalCount() {
    return reindexCount() + skippedCount();
  }

  public List<Path> reindexPaths() {
    return Collections.unmodifiableList(new ArrayList<>(filesToReindex.keySet()));
  }
}
