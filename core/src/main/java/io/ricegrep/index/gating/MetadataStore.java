package io.ricegrep.index.gating;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The per-file metadata recorded when files were last written to the index, persisted as JSON so
 * it survives restarts. All access is serialized on the store.
 */
public class MetadataStore {
  private static final Logger logger = LoggerFactory.getLogger(MetadataStore.class);

  private static final TypeReference<List<FileIndexEntry>> ENTRY_LIST =
      new TypeReference<List<FileIndexEntry>>() {};

  private final ObjectMapper mapper =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final Map<Path, FileIndexEntry> entries = new HashMap<>();
  private final Path storagePath;
  private final boolean autoSave;

  /**
   * @param storagePath JSON file the entries are saved to and loaded from
   * @param autoSave whether every modification is written to disk immediately
   */
  public MetadataStore(Path storagePath, boolean autoSave) {
    this.storagePath = storagePath;
    this.autoSave = autoSave;
  }

  /** Replaces the in-memory entries with the ones on disk. A missing file means a fresh start. */
  public synchronized void load() throws IOException {
    if (!Files.exists(storagePath)) {
      logger.debug("No metadata at [{}]; starting fresh.", storagePath);
      return;
    }
    List<FileIndexEntry> loaded = mapper.readValue(storagePath.toFile(), ENTRY_LIST);
    entries.clear();
    for (FileIndexEntry entry : loaded) {
      entries.put(entry.path(), entry);
    }
    logger.debug("Loaded {} metadata entries from [{}].", entries.size(), storagePath);
  }

  public synchronized void save() throws IOException {
    List<FileIndexEntry> sorted = new ArrayList<>(entries.values());
    sorted.sort(Comparator.comparing(FileIndexEntry::path));
    Path parent = storagePath.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = storagePath.resolveSibling(storagePath.getFileName() + ".tmp");
    mapper.writeValue(tmp.toFile(), sorted);
    Files.move(tmp, storagePath, StandardCopyOption.REPLACE_EXISTING);
  }

  public synchronized void store(FileIndexEntry entry) throws IOException {
    entries.put(entry.path(), entry);
    if (autoSave) {
      save();
    }
  }

  /** Records several entries with at most one write to disk. */
  public synchronized void storeAll(List<FileIndexEntry> batch) throws IOException {
    for (FileIndexEntry entry : batch) {
      entries.put(entry.path(), entry);
    }
    if (autoSave && !batch.isEmpty()) {
      save();
    }
  }

  public synchronized Optional<FileIndexEntry> get(Path path) {
    return Optional.ofNullable(entries.get(path));
  }

  public synchronized Optional<FileIndexEntry> remove(Path path) throws IOException {
    FileIndexEntry removed = entries.remove(path);
    if (autoSave && removed != null) {
      save();
    }
    return Optional.ofNullable(removed);
  }

  /**
   * @return why {@code path} must be reindexed, or empty if its metadata is unchanged. A path with
   *     no stored entry, or only a soft-deleted one, is reported as {@link ChangeReason.Kind#NEW}.
   */
  public Optional<ChangeReason> checkReindex(Path path) throws IOException {
    Optional<FileIndexEntry> stored = get(path);
    if (!stored.isPresent()) {
      return Optional.of(ChangeReason.newFile());
    }
    return stored.get().shouldReindex();
  }

  public synchronized List<FileIndexEntry> allEntries() {
    return new ArrayList<>(entries.values());
  }

  public synchronized void clear() throws IOException {
    entries.clear();
    if (autoSave) {
      save();
    }
  }

  public synchronized MetadataStoreStats stats() {
    long totalSize = 0;
    for (FileIndexEntry entry : entries.values()) {
      totalSize += entry.fileSize();
    }
    return new MetadataStoreStats(entries.size(), totalSize, storagePath);
  }

  public Path storagePath() {
    return storagePath;
  }
}
