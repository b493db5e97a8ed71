package io.github.panghy.docsearch.persist;

/**
 * Tests for the on-disk file layout: vectors header, snapshot round trip and backup handling.
 */
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.panghy.docsearch.proto.StoreSnapshot;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IndexFilesTest {
  @TempDir
  Path dir;

  @Test
  void vectors_file_has_header_then_rows() throws IOException {
    IndexFiles files = new IndexFiles(dir);
    files.writeVectors("ix", 2, new float[][] {{1f, 2f}, {3f, 4f}});

    byte[] raw = Files.readAllBytes(dir.resolve("ix.vectors"));
    assertThat(raw).hasSize(16 + 16);
    ByteBuffer bb = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
    byte[] magic = new byte[4];
    bb.get(magic);
    assertThat(new String(magic, java.nio.charset.StandardCharsets.US_ASCII)).isEqualTo("DSVX");
    assertThat(bb.getInt()).isEqualTo(IndexFiles.VERSION);
    assertThat(bb.getInt()).isEqualTo(2);
    assertThat(bb.getInt()).isEqualTo(2);

    IndexFiles.VectorsFile back = files.readVectors("ix");
    assertThat(back.dimension()).isEqualTo(2);
    assertThat(back.rows()).isDeepEqualTo(new float[][] {{1f, 2f}, {3f, 4f}});
  }

  @Test
  void corrupt_vectors_file_is_rejected() throws IOException {
    IndexFiles files = new IndexFiles(dir);
    Files.write(files.vectorsPath("bad"), new byte[] {'N', 'O', 'P', 'E', 1, 0, 0, 0, 1, 0, 0, 0, 0, 0, 0, 0});
    assertThatThrownBy(() -> files.readVectors("bad")).isInstanceOf(IOException.class);

    files.writeVectors("short", 2, new float[][] {{1f, 2f}});
    byte[] raw = Files.readAllBytes(files.vectorsPath("short"));
    Files.write(files.vectorsPath("short"), java.util.Arrays.copyOf(raw, raw.length - 4));
    assertThatThrownBy(() -> files.readVectors("short")).isInstanceOf(IOException.class);
  }

  @Test
  void meta_round_trips() throws IOException {
    IndexFiles files = new IndexFiles(dir);
    StoreSnapshot s = StoreSnapshot.newBuilder().setDimension(3).setSavedAtMs(7).build();
    files.writeMeta("ix", s);
    assertThat(files.readMeta("ix")).isEqualTo(s);
    assertThat(files.exists("ix")).isFalse();
    assertThat(files.anyExists("ix")).isTrue();
  }

  @Test
  void restore_puts_back_old_files_and_removes_new_ones() throws IOException {
    IndexFiles files = new IndexFiles(dir);
    Files.writeString(files.vectorsPath("ix"), "old-vectors");

    List<IndexFiles.Backup> backups = files.backup("ix");
    assertThat(IndexFiles.backupOf(files.vectorsPath("ix"))).exists();
    assertThat(IndexFiles.backupOf(files.metaPath("ix"))).doesNotExist();

    Files.writeString(files.vectorsPath("ix"), "partial");
    Files.writeString(files.metaPath("ix"), "partial");
    files.restore(backups);
    files.discard(backups);

    assertThat(Files.readString(files.vectorsPath("ix"))).isEqualTo("old-vectors");
    assertThat(files.metaPath("ix")).doesNotExist();
    try (var listing = Files.list(dir)) {
      assertThat(listing.map(p -> p.getFileName().toString())).containsExactly("ix.vectors");
    }
  }

  @Test
  void failed_backup_removes_the_copies_it_already_made() throws IOException {
    IndexFiles files = new IndexFiles(dir);
    Files.writeString(files.vectorsPath("ix"), "vectors");
    Files.writeString(files.metaPath("ix"), "meta");
    Path blocker = Files.createDirectory(IndexFiles.backupOf(files.metaPath("ix")));
    Files.writeString(blocker.resolve("keep"), "x");

    assertThatThrownBy(() -> files.backup("ix")).isInstanceOf(IOException.class);

    assertThat(IndexFiles.backupOf(files.vectorsPath("ix"))).doesNotExist();
    assertThat(blocker.resolve("keep")).exists();
    assertThat(Files.readString(files.vectorsPath("ix"))).isEqualTo("vectors");
  }
}
