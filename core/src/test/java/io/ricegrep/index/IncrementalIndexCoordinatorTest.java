package io.ricegrep.index;

import static org.awaitility.Awaitility.await;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.util.concurrent.MoreExecutors;
import io.ricegrep.index.debounce.DebouncingStats;
import io.ricegrep.index.gating.ChangeReason;
import io.ricegrep.index.gating.FileIndexEntry;
import io.ricegrep.index.gating.MetadataStore;
import io.ricegrep.index.hashing.ContentHash;
import io.ricegrep.index.hashing.ContentHasher;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class IncrementalIndexCoordinatorTest {

  private static final long WINDOW_MILLIS = 250;

  private Path tmpDir;
  private ManualTicker ticker;
  private RecordingIndexWriter writer;
  private IncrementalIndexCoordinator coordinator;

  @Before
  public void setUp() throws IOException {
    tmpDir = Files.createTempDirectory(null);
    ticker = new ManualTicker();
    writer = new RecordingIndexWriter();
    coordinator = builder().build();
  }

  @After
  public void tearDown() throws IOException {
    coordinator.close();
    FileUtils.deleteDirectory(tmpDir.toFile());
  }

  @Test
  public void newFileIsReindexedOnceTheWindowExpires() throws IOException {
    Path file = write("main.rs", "fn main() {}");
    coordinator.collectEvent(FileChangeEvent.create(file));

    assertTrue(coordinator.flushIfReady().isEmpty());
    ticker.advanceMillis(WINDOW_MILLIS);
    UpdateBatch batch = coordinator.flushIfReady();

    assertEquals(1, batch.updates().size());
    IndexUpdate update = batch.updates().get(0);
    assertEquals(IndexUpdate.Action.REINDEX, update.action());
    assertEquals(file, update.path());
    assertEquals(Optional.of(ChangeReason.newFile()), update.reason());
    assertEquals(Optional.of(ContentHasher.MURMUR3_128.hash(file)), update.hash());
    assertTrue(writer.hasLiveEntry(file, update.hash().get()));
    assertTrue(coordinator.cache().peek(file).isPresent());
  }

  @Test
  public void burstForOneFileBecomesOneUpdate() throws IOException {
    Path file = write("main.rs", "fn main() {}");
    for (int i = 0; i < 10; i++) {
      coordinator.collectEvent(FileChangeEvent.modify(file));
      ticker.advanceMillis(10);
    }

    DebouncingStats stats = coordinator.debouncingStats();
    assertEquals(1, stats.bufferedEvents());
    assertEquals(1, stats.modifies());

    ticker.advanceMillis(WINDOW_MILLIS);
    UpdateBatch batch = coordinator.flushIfReady();

    assertEquals(1, batch.eventCount());
    assertEquals(1, batch.updates().size());
    assertEquals(1, writer.batches.size());
    assertTrue(coordinator.pendingEvents().isEmpty());
  }

  @Test
  public void firstEventAfterIdleGetsTheWholeWindow() throws IOException {
    Path file = write("main.rs", "fn main() {}");
    ticker.advanceMillis(10_000);

    coordinator.collectEvent(FileChangeEvent.modify(file));
    assertTrue(coordinator.flushIfReady().isEmpty());
    ticker.advanceMillis(WINDOW_MILLIS - 1);
    assertTrue(coordinator.flushIfReady().isEmpty());
    ticker.advanceMillis(1);

    assertEquals(1, coordinator.flushIfReady().updates().size());
  }

  @Test
  public void unchangedFileWithLiveEntryIsReused() throws IOException {
    Path file = write("main.rs", "fn main() {}");
    indexNow(FileChangeEvent.create(file));

    UpdateBatch batch = indexNow(FileChangeEvent.modify(file));

    assertEquals(1, batch.withAction(IndexUpdate.Action.REUSE).size());
    assertEquals(0, batch.changeCount());
    assertEquals(1, coordinator.cacheStats().hits());
  }

  @Test
  public void cachedHashIsNotReusedWhenTheIndexLostTheEntry() throws IOException {
    Path file = write("main.rs", "fn main() {}");
    indexNow(FileChangeEvent.create(file));
    writer.live.clear();

    UpdateBatch batch = indexNow(FileChangeEvent.modify(file));

    assertEquals(IndexUpdate.Action.REINDEX, batch.updates().get(0).action());
    assertEquals(Optional.of(ChangeReason.content()), batch.updates().get(0).reason());
  }

  @Test
  public void staleCacheEntryIsRehashed() throws IOException {
    Path file = write("main.rs", "fn main() {}");
    indexNow(FileChangeEvent.create(file));
    ticker.advanceMillis(60_000);

    UpdateBatch batch = indexNow(FileChangeEvent.modify(file));

    IndexUpdate update = batch.updates().get(0);
    assertEquals(IndexUpdate.Action.REINDEX, update.action());
    assertEquals(Optional.of(ChangeReason.content()), update.reason());
  }

  @Test
  public void touchedFileIsReindexedForItsMtime() throws IOException {
    Path file = write("main.rs", "fn main() {}");
    Files.setLastModifiedTime(file, FileTime.fromMillis(1_700_000_000_000L));
    indexNow(FileChangeEvent.create(file));
    Files.setLastModifiedTime(file, FileTime.fromMillis(1_700_000_002_000L));

    UpdateBatch batch = indexNow(FileChangeEvent.modify(file));

    IndexUpdate update = batch.updates().get(0);
    assertEquals(IndexUpdate.Action.REINDEX, update.action());
    assertEquals(
        Optional.of(ChangeReason.mtime(1_700_000_000_000L, 1_700_000_002_000L)), update.reason());
  }

  @Test
  public void deleteProducesTombstoneAndDropsTheCachedHash() throws IOException {
    Path file = write("main.rs", "fn main() {}");
    indexNow(FileChangeEvent.create(file));
    Files.delete(file);

    UpdateBatch batch = indexNow(FileChangeEvent.delete(file));

    assertEquals(1, batch.withAction(IndexUpdate.Action.TOMBSTONE).size());
    assertFalse(coordinator.cache().peek(file).isPresent());
    assertFalse(writer.live.containsKey(file));
  }

  @Test
  public void fileThatVanishedBeforeTheFlushIsTombstoned() throws IOException {
    Path file = tmpDir.resolve("gone.rs");

    UpdateBatch batch = indexNow(FileChangeEvent.modify(file));

    assertEquals(IndexUpdate.tombstone(file), batch.updates().get(0));
  }

  @Test
  public void directoriesAreSkipped() throws IOException {
    Path dir = Files.createDirectory(tmpDir.resolve("src"));

    UpdateBatch batch = indexNow(FileChangeEvent.create(dir));

    assertTrue(batch.updates().isEmpty());
    assertTrue(writer.batches.isEmpty());
  }

  @Test
  public void hashFailureIsRetriedThenRemovedFromTheIndex() throws IOException {
    Path locked = write("locked.rs", "fn locked() {}");
    Path fine = write("fine.rs", "fn fine() {}");
    coordinator.close();
    coordinator =
        builder()
            .contentHasher(
                path -> {
                  if (path.equals(locked)) {
                    throw new IOException("permission denied");
                  }
                  return ContentHasher.MURMUR3_128.hash(path);
                })
            .build();

    coordinator.collectEvent(FileChangeEvent.modify(locked));
    UpdateBatch first = indexNow(FileChangeEvent.modify(fine));

    assertEquals(1, first.updates().size());
    assertEquals(fine, first.updates().get(0).path());
    List<FileChangeEvent> pending = coordinator.pendingEvents();
    assertEquals(1, pending.size());
    assertEquals(locked, pending.get(0).path());

    ticker.advanceMillis(WINDOW_MILLIS);
    UpdateBatch second = coordinator.flushIfReady();

    assertEquals(1, second.updates().size());
    assertEquals(IndexUpdate.tombstone(locked), second.updates().get(0));
    assertTrue(coordinator.pendingEvents().isEmpty());
  }

  @Test
  public void pathThatCannotBeStatedIsTombstonedOnceRetriesRunOut() throws IOException {
    Path plain = write("plain", "not a directory");
    Path child = plain.resolve("child.rs");
    ContentHash old = ContentHash.fromBytes(new byte[16]);
    coordinator.cache().add(child, old, 1, 1);
    writer.live.put(child, old);

    UpdateBatch first = indexNow(FileChangeEvent.modify(child));

    assertTrue(first.updates().isEmpty());
    assertEquals(1, coordinator.pendingEvents().size());

    ticker.advanceMillis(WINDOW_MILLIS);
    UpdateBatch second = coordinator.flushIfReady();

    assertEquals(IndexUpdate.tombstone(child), second.updates().get(0));
    assertFalse(coordinator.cache().peek(child).isPresent());
    assertFalse(writer.live.containsKey(child));
    assertTrue(coordinator.pendingEvents().isEmpty());
  }

  @Test
  public void failedIndexWriteIsRetriedNextCycle() throws IOException {
    Path file = write("main.rs", "fn main() {}");
    writer.failuresToThrow = 1;

    indexNow(FileChangeEvent.create(file));

    assertTrue(writer.batches.isEmpty());
    assertEquals(1, coordinator.pendingEvents().size());

    ticker.advanceMillis(WINDOW_MILLIS);
    UpdateBatch retried = coordinator.flushIfReady();

    assertEquals(IndexUpdate.Action.REINDEX, retried.updates().get(0).action());
    assertTrue(writer.live.containsKey(file));
  }

  @Test
  public void tooManyChangesTriggerFullRebuild() throws IOException {
    coordinator.cache().add(tmpDir.resolve("old.rs"), ContentHash.fromBytes(new byte[16]), 1, 1);
    for (int i = 0; i < 4; i++) {
      coordinator.collectEvent(FileChangeEvent.create(write("f" + i + ".rs", "fn f() {}")));
    }

    ticker.advanceMillis(WINDOW_MILLIS);
    UpdateBatch batch = coordinator.flushIfReady();

    assertTrue(batch.isFullRebuild());
    assertEquals(4, batch.eventCount());
    assertEquals(1, writer.rebuilds.get());
    assertEquals(4, writer.live.size());
    assertEquals(0, coordinator.cache().size());
    assertTrue(writer.batches.isEmpty());
  }

  @Test
  public void failedRebuildKeepsTheChangesForTheNextFlush() throws IOException {
    writer.rebuildFailuresToThrow = 1;
    for (int i = 0; i < 4; i++) {
      coordinator.collectEvent(FileChangeEvent.create(write("f" + i + ".rs", "fn f() {}")));
    }

    ticker.advanceMillis(WINDOW_MILLIS);
    UpdateBatch failed = coordinator.flushIfReady();

    assertTrue(failed.isEmpty());
    assertEquals(0, writer.rebuilds.get());
    assertEquals(4, coordinator.pendingEvents().size());

    ticker.advanceMillis(WINDOW_MILLIS);
    UpdateBatch retried = coordinator.flushIfReady();

    assertTrue(retried.isFullRebuild());
    assertEquals(4, retried.eventCount());
    assertEquals(1, writer.rebuilds.get());
    assertEquals(4, writer.live.size());
    assertTrue(coordinator.pendingEvents().isEmpty());
  }

  @Test
  public void failedOverflowRebuildIsRetriedByTheNextFlush() throws IOException {
    write("main.rs", "fn main() {}");
    writer.rebuildFailuresToThrow = 1;

    coordinator.onOverflow(tmpDir);

    assertEquals(0, writer.rebuilds.get());
    assertTrue(coordinator.flushIfReady().isEmpty());

    ticker.advanceMillis(WINDOW_MILLIS);
    UpdateBatch retried = coordinator.flushIfReady();

    assertTrue(retried.isFullRebuild());
    assertEquals(1, writer.rebuilds.get());
    assertEquals(1, writer.live.size());
  }

  @Test
  public void changesAtTheThresholdAreProcessedIncrementally() throws IOException {
    for (int i = 0; i < 3; i++) {
      coordinator.collectEvent(FileChangeEvent.create(write("f" + i + ".rs", "fn f() {}")));
    }

    ticker.advanceMillis(WINDOW_MILLIS);
    UpdateBatch batch = coordinator.flushIfReady();

    assertFalse(batch.isFullRebuild());
    assertEquals(3, batch.changeCount());
    assertEquals(0, writer.rebuilds.get());
  }

  @Test
  public void overflowRebuildsTheIndex() throws IOException {
    write("main.rs", "fn main() {}");

    coordinator.onOverflow(tmpDir);

    assertEquals(1, writer.rebuilds.get());
    assertEquals(1, writer.live.size());
  }

  @Test
  public void adminActions() throws IOException {
    Path file = write("main.rs", "fn main() {}");
    indexNow(FileChangeEvent.create(file));
    assertEquals(1, coordinator.cache().size());

    coordinator.handleAdminAction(AdminAction.CLEAR_CACHE);
    assertEquals(0, coordinator.cache().size());

    coordinator.handleAdminAction(AdminAction.OPTIMIZE);
    assertEquals(1, writer.optimizations.get());

    coordinator.collectEvent(FileChangeEvent.modify(file));
    coordinator.handleAdminAction(AdminAction.REINDEX);
    assertEquals(1, writer.rebuilds.get());
    assertTrue(coordinator.pendingEvents().isEmpty());
  }

  @Test
  public void appliedUpdatesAreRecordedAndReconciledAfterRestart() throws IOException {
    MetadataStore store =
        new MetadataStore(tmpDir.resolve(".ricegrep").resolve("metadata.json"), false);
    coordinator.close();
    coordinator = builder().metadataStore(store).build();

    Path touched = write("touched.rs", "fn touched() {}");
    Path removed = write("removed.rs", "fn removed() {}");
    Path unchanged = write("unchanged.rs", "fn unchanged() {}");
    coordinator.collectEvent(FileChangeEvent.create(touched));
    coordinator.collectEvent(FileChangeEvent.create(removed));
    indexNow(FileChangeEvent.create(unchanged));
    coordinator.close();

    assertEquals(3, store.allEntries().size());
    FileIndexEntry recorded = store.get(touched).get();
    assertEquals(Optional.of(ContentHasher.MURMUR3_128.hash(touched)), recorded.contentHash());

    // changes made while nothing was watching
    Files.setLastModifiedTime(touched, FileTime.fromMillis(recorded.fileMtime() + 5_000));
    Files.delete(removed);
    Path added = write("added.rs", "fn added() {}");

    MetadataStore reloaded = new MetadataStore(store.storagePath(), false);
    reloaded.load();
    coordinator = builder().metadataStore(reloaded).build();
    assertEquals(3, coordinator.reconcile());

    coordinator.flush();

    UpdateBatch batch = writer.lastBatch();
    assertEquals(2, batch.withAction(IndexUpdate.Action.REINDEX).size());
    assertEquals(
        IndexUpdate.tombstone(removed), batch.withAction(IndexUpdate.Action.TOMBSTONE).get(0));
    assertFalse(reloaded.get(removed).isPresent());
    assertTrue(reloaded.get(added).isPresent());
    assertEquals(3, reloaded.allEntries().size());
  }

  @Test(expected = IllegalStateException.class)
  public void reconcileNeedsAMetadataStore() throws IOException {
    coordinator.reconcile();
  }

  @Test(expected = IllegalStateException.class)
  public void indexWriterIsRequired() throws IOException {
    IncrementalIndexCoordinator.builder().settings(IndexSettings.defaults()).build();
  }

  @Test
  public void closeFlushesPendingEvents() throws IOException {
    Path file = write("main.rs", "fn main() {}");
    coordinator.collectEvent(FileChangeEvent.create(file));

    coordinator.close();

    assertTrue(coordinator.isClosed());
    assertFalse(coordinator.isWatching());
    assertEquals(1, writer.batches.size());
  }

  @Test
  public void closeFailsWhenTheFinalFlushCannotBeApplied() throws IOException {
    Path file = write("main.rs", "fn main() {}");
    writer.failuresToThrow = 1;
    coordinator.collectEvent(FileChangeEvent.create(file));

    try {
      coordinator.close();
      fail("expected IOException");
    } catch (IOException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("1 change(s) not applied"));
    }
    assertTrue(coordinator.isClosed());
    assertTrue(writer.batches.isEmpty());
    assertTrue(coordinator.pendingEvents().isEmpty());
  }

  @Test
  public void backgroundFlushRunsOnceTheWindowExpires() throws IOException {
    Path file = write("main.rs", "fn main() {}");
    coordinator.start();
    coordinator.collectEvent(FileChangeEvent.create(file));

    ticker.advanceMillis(WINDOW_MILLIS);

    await().atMost(5, TimeUnit.SECONDS).until(() -> writer.batches.size() == 1);
    assertTrue(writer.live.containsKey(file));
  }

  private IncrementalIndexCoordinator.Builder builder() {
    return IncrementalIndexCoordinator.builder()
        .root(tmpDir)
        .settings(
            IndexSettingsTest.settings(
                "ricegrep.index { full-reindex-threshold = 3, max-retries = 1 }"))
        .indexWriter(writer)
        .executor(MoreExecutors.directExecutor())
        .ticker(ticker);
  }

  /** Collects {@code event}, lets the window expire and flushes. */
  private UpdateBatch indexNow(FileChangeEvent event) {
    coordinator.collectEvent(event);
    ticker.advanceMillis(WINDOW_MILLIS);
    return coordinator.flushIfReady();
  }

  private Path write(String name, String content) throws IOException {
    return Files.write(tmpDir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
  }
}
