package io.ricegrep.index.gating;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import io.ricegrep.index.hashing.ContentHash;
import io.ricegrep.index.hashing.ContentHasher;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Optional;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class FileIndexEntryTest {

  private Path tmpDir;
  private Path file;

  @Before
  public void setUp() throws IOException {
    tmpDir = Files.createTempDirectory(null);
    file = tmpDir.resolve("lib.rs");
    Files.write(file, "pub fn f() {}".getBytes(StandardCharsets.UTF_8));
    Files.setLastModifiedTime(file, FileTime.fromMillis(1_700_000_000_000L));
  }

  @After
  public void tearDown() throws IOException {
    FileUtils.deleteDirectory(tmpDir.toFile());
  }

  @Test
  public void fromFileRecordsCurrentMetadata() throws IOException {
    ContentHash hash = ContentHasher.MURMUR3_128.hash(file);
    FileIndexEntry entry = FileIndexEntry.fromFile(file, hash);

    assertEquals(file, entry.path());
    assertEquals(1_700_000_000_000L, entry.fileMtime());
    assertEquals(13, entry.fileSize());
    assertEquals(Optional.of(hash), entry.contentHash());
    assertFalse(entry.isDeleted());
    assertEquals(Optional.empty(), entry.shouldReindex());
  }

  @Test
  public void touchedFileNeedsReindexForMtime() throws IOException {
    FileIndexEntry entry = FileIndexEntry.fromFile(file);
    Files.setLastModifiedTime(file, FileTime.fromMillis(1_700_000_005_000L));

    ChangeReason reason = entry.shouldReindex().get();

    assertEquals(ChangeReason.Kind.MTIME, reason.kind());
    assertEquals("mtime changed: 1700000000000 -> 1700000005000", reason.description());
  }

  @Test
  public void rewrittenFileNeedsReindexForMtimeAndSize() throws IOException {
    FileIndexEntry entry = FileIndexEntry.fromFile(file);
    Files.write(file, "pub fn f() { g() }".getBytes(StandardCharsets.UTF_8));
    Files.setLastModifiedTime(file, FileTime.fromMillis(1_700_000_005_000L));

    assertEquals(ChangeReason.Kind.MTIME_AND_SIZE, entry.shouldReindex().get().kind());
  }

  @Test
  public void sizeOnlyChangeIsReported() throws IOException {
    FileIndexEntry entry = new FileIndexEntry(file, 0, 1_700_000_000_000L, 1, null);

    ChangeReason reason = entry.shouldReindex().get();

    assertEquals(ChangeReason.size(1, 13), reason);
  }

  @Test
  public void vanishedFileIsReportedAsDeleted() throws IOException {
    FileIndexEntry entry = FileIndexEntry.fromFile(file);
    Files.delete(file);

    assertEquals(Optional.of(ChangeReason.deleted()), entry.shouldReindex());
  }

  @Test
  public void softDeletedEntryTreatsTheFileAsNew() throws IOException {
    FileIndexEntry entry = FileIndexEntry.fromFile(file);

    FileIndexEntry deleted = entry.markDeleted();

    assertTrue(deleted.isDeleted());
    assertFalse(entry.isDeleted());
    // metadata still matches, but nothing live was recorded for it
    assertEquals(Optional.empty(), entry.shouldReindex());
    assertEquals(Optional.of(ChangeReason.newFile()), deleted.shouldReindex());
  }

  @Test
  public void changeAgainstComparesWithTheGivenMetadata() {
    FileIndexEntry entry = new FileIndexEntry(file, 0, 42, 13, null);

    assertEquals(Optional.empty(), entry.changeAgainst(42, 13));
    assertEquals(Optional.of(ChangeReason.mtime(42, 50)), entry.changeAgainst(50, 13));
  }
}
