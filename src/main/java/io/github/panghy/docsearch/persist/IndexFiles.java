package io.github.panghy.docsearch.persist;

import io.github.panghy.docsearch.proto.StoreSnapshot;
import io.github.panghy.docsearch.util.FloatPacker;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * On-disk layout of a named index inside a folder.
 *
 * <p>{@code <name>.vectors} is little-endian binary: the ASCII magic {@code DSVX}, an int32 format
 * version, int32 dimension, int32 vector count, then the packed float32 rows in slot order.
 * {@code <name>.meta} is a serialized {@link StoreSnapshot}. During a save both files are copied to
 * {@code .bak} siblings, which are always removed once the save has finished.</p>
 */
public class IndexFiles {
  static final byte[] MAGIC = "DSVX".getBytes(StandardCharsets.US_ASCII);
  static final int VERSION = 1;
  private static final int HEADER_BYTES = MAGIC.length + 3 * Integer.BYTES;

  public static final String VECTORS_SUFFIX = ".vectors";
  public static final String META_SUFFIX = ".meta";
  public static final String BACKUP_SUFFIX = ".bak";

  private final Path folder;

  public IndexFiles(Path folder) {
    this.folder = Objects.requireNonNull(folder, "folder");
  }

  public Path folder() {
    return folder;
  }

  public Path vectorsPath(String name) {
    return folder.resolve(name + VECTORS_SUFFIX);
  }

  public Path metaPath(String name) {
    return folder.resolve(name + META_SUFFIX);
  }

  public static Path backupOf(Path file) {
    return file.resolveSibling(file.getFileName() + BACKUP_SUFFIX);
  }

  /** True when both files of {@code name} exist. */
  public boolean exists(String name) {
    return Files.isRegularFile(vectorsPath(name)) && Files.isRegularFile(metaPath(name));
  }

  /** True when at least one file of {@code name} exists. */
  public boolean anyExists(String name) {
    return Files.exists(vectorsPath(name)) || Files.exists(metaPath(name));
  }

  /** Vectors read back from a {@code .vectors} file. */
  public record VectorsFile(int dimension, float[][] rows) {}

  public void writeVectors(String name, int dimension, float[][] rows) throws IOException {
    byte[] body = FloatPacker.packRows(rows, dimension);
    ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
    header.put(MAGIC).putInt(VERSION).putInt(dimension).putInt(rows.length);
    try (OutputStream out = Files.newOutputStream(vectorsPath(name))) {
      out.write(header.array());
      out.write(body);
    }
  }

  public VectorsFile readVectors(String name) throws IOException {
    Path path = vectorsPath(name);
    byte[] all = Files.readAllBytes(path);
    if (all.length < HEADER_BYTES) throw new IOException("truncated vectors file: " + path);
    ByteBuffer bb = ByteBuffer.wrap(all).order(ByteOrder.LITTLE_ENDIAN);
    byte[] magic = new byte[MAGIC.length];
    bb.get(magic);
    if (!Arrays.equals(magic, MAGIC)) throw new IOException("bad magic in " + path);
    int version = bb.getInt();
    if (version != VERSION) throw new IOException("unsupported vectors version " + version + " in " + path);
    int dimension = bb.getInt();
    int count = bb.getInt();
    if (dimension <= 0 || count < 0) {
      throw new IOException("invalid header dim=" + dimension + " count=" + count + " in " + path);
    }
    long expected = (long) count * dimension * Float.BYTES;
    if (all.length - HEADER_BYTES != expected) {
      throw new IOException("vectors file " + path + " holds " + (all.length - HEADER_BYTES)
          + " payload bytes, expected " + expected);
    }
    byte[] body = new byte[all.length - HEADER_BYTES];
    bb.get(body);
    return new VectorsFile(dimension, FloatPacker.unpackRows(body, count, dimension));
  }

  public void writeMeta(String name, StoreSnapshot snapshot) throws IOException {
    try (OutputStream out = Files.newOutputStream(metaPath(name))) {
      snapshot.writeTo(out);
    }
  }

  public StoreSnapshot readMeta(String name) throws IOException {
    try (InputStream in = Files.newInputStream(metaPath(name))) {
      return StoreSnapshot.parseFrom(in);
    }
  }

  /** One file protected by a backup copy; {@code existed} is false when there was nothing to copy. */
  public record Backup(Path original, Path copy, boolean existed) {}

  /**
   * Copies the existing files of {@code name} to their {@code .bak} siblings. If a copy fails, the
   * copies already made are deleted before the failure is rethrown.
   */
  public List<Backup> backup(String name) throws IOException {
    List<Backup> out = new ArrayList<>(2);
    try {
      for (Path p : List.of(vectorsPath(name), metaPath(name))) {
        Path copy = backupOf(p);
        boolean existed = Files.exists(p);
        if (existed) Files.copy(p, copy, StandardCopyOption.REPLACE_EXISTING);
        out.add(new Backup(p, copy, existed));
      }
    } catch (IOException e) {
      try {
        discard(out);
      } catch (IOException cleanup) {
        e.addSuppressed(cleanup);
      }
      throw e;
    }
    return out;
  }

  /**
   * Puts every file back the way {@link #backup(String)} found it: restored from its copy, or
   * deleted when it did not exist before.
   */
  public void restore(List<Backup> backups) throws IOException {
    for (Backup b : backups) {
      if (b.existed()) {
        Files.copy(b.copy(), b.original(), StandardCopyOption.REPLACE_EXISTING);
      } else {
        Files.deleteIfExists(b.original());
      }
    }
  }

  /** Deletes the backup copies. */
  public void discard(List<Backup> backups) throws IOException {
    for (Backup b : backups) Files.deleteIfExists(b.copy());
  }
}
