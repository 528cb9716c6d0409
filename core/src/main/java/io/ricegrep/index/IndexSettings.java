package io.ricegrep.index;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.ricegrep.index.hashing.ContentHasher;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Tunables of the incremental indexing pipeline, read from the {@code ricegrep.index} block. */
public class IndexSettings {
  private static final Logger logger = LoggerFactory.getLogger(IndexSettings.class);

  static final String PREFIX = "ricegrep.index.";

  static final Duration RECOMMENDED_MIN_WINDOW = Duration.ofMillis(200);
  static final Duration RECOMMENDED_MAX_WINDOW = Duration.ofMillis(300);

  private final Duration debounceWindow;
  private final long cacheMaxBytes;
  private final int fullReindexThreshold;
  private final int maxRetries;
  private final String hashAlgorithm;
  private final Path metadataStorePath;

  public IndexSettings(Config config) {
    config.checkValid(ConfigFactory.defaultReference(), "ricegrep.index");
    debounceWindow = config.getDuration(PREFIX + "debounce-window");
    cacheMaxBytes = config.getBytes(PREFIX + "cache-max-bytes");
    fullReindexThreshold = config.getInt(PREFIX + "full-reindex-threshold");
    maxRetries = config.getInt(PREFIX + "max-retries");
    hashAlgorithm = config.getString(PREFIX + "hash-algorithm");
    metadataStorePath =
        config.hasPath(PREFIX + "metadata-store")
            ? Paths.get(config.getString(PREFIX + "metadata-store"))
            : null;

    if (debounceWindow.isNegative()) {
      throw new IllegalArgumentException("debounce-window must not be negative: " + debounceWindow);
    }
    if (fullReindexThreshold < 1) {
      throw new IllegalArgumentException(
          "full-reindex-threshold must be positive: " + fullReindexThreshold);
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("max-retries must not be negative: " + maxRetries);
    }
    // fail on unknown algorithms here rather than on the first flush
    ContentHasher.named(hashAlgorithm);

    if (debounceWindow.compareTo(RECOMMENDED_MIN_WINDOW) < 0
        || debounceWindow.compareTo(RECOMMENDED_MAX_WINDOW) > 0) {
      logger.warn(
          "debounce-window of {}ms is outside the recommended {}-{}ms range",
          debounceWindow.toMillis(),
          RECOMMENDED_MIN_WINDOW.toMillis(),
          RECOMMENDED_MAX_WINDOW.toMillis());
    }
  }

  /** Settings from the application config, {@code reference.conf} and the environment. */
  public static IndexSettings load() {
    return new IndexSettings(ConfigFactory.load());
  }

  /** Settings from {@code reference.conf} alone, ignoring overrides. */
  public static IndexSettings defaults() {
    return new IndexSettings(ConfigFactory.defaultReference().resolve());
  }

  public Duration getDebounceWindow() {
    return debounceWindow;
  }

  public long getCacheMaxBytes() {
    return cacheMaxBytes;
  }

  public int getFullReindexThreshold() {
    return fullReindexThreshold;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public String getHashAlgorithm() {
    return hashAlgorithm;
  }

  public ContentHasher contentHasher() {
    return ContentHasher.named(hashAlgorithm);
  }

  public Optional<Path> getMetadataStorePath() {
    return Optional.ofNullable(metadataStorePath);
  }
}
