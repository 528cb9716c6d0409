package io.ricegrep.index.gating;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Uses a {@link MetadataStore} to skip files whose mtime and size have not moved. */
public class FileChangeFilter {
  private static final Logger logger = LoggerFactory.getLogger(FileChangeFilter.class);

  private final MetadataStore store;

  public FileChangeFilter(MetadataStore store) {
    this.store = store;
  }

  /** Splits {@code changedFiles} into files to reindex and files to skip. */
  public FilterResult filterChanges(Collection<Path> changedFiles) {
    Map<Path, ChangeReason> reindex = new LinkedHashMap<>();
    Map<Path, String> skipped = new LinkedHashMap<>();
    for (Path file : changedFiles) {
      try {
        Optional<ChangeReason> reason = store.checkReindex(file);
        if (reason.isPresent()) {
          reindex.put(file, reason.get());
        } else {
          skipped.put(file, "unchanged metadata");
        }
      } catch (IOException e) {
        // reindex when in doubt
        logger.debug("Error checking metadata for [{}], reindexing anyway", file, e);
        reindex.put(file, ChangeReason.newFile());
      }
    }
    return new FilterResult(reindex, skipped);
  }

  /** Records the current metadata of {@code file} after it was reindexed. */
  public void updateMetadata(Path file) throws IOException {
    store.store(FileIndexEntry.fromFile(file));
  }

  /** @return the number of files updated; failures are logged and skipped. */
  public int updateMetadataBatch(Collection<Path> files) {
    int updated = 0;
    for (Path file : files) {
      try {
        updateMetadata(file);
        updated++;
      } catch (IOException e) {
        logger.debug("Failed to update metadata for [{}]", file, e);
      }
    }
    return updated;
  }

  public MetadataStore store() {
    return store;
  }
}
