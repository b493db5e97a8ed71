package io.github.panghy.docsearch.util;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Packs float32 rows into little-endian bytes for the {@code .vectors} file and back.
 */
public final class FloatPacker {
  private FloatPacker() {}

  /**
   * Packs rows of equal length into one contiguous little-endian buffer, row after row.
   *
   * @param rows vectors to pack; every row must have {@code dimension} elements
   * @param dimension expected row length
   * @return packed bytes ({@code rows.length * dimension * 4})
   * @throws IllegalArgumentException if a row has the wrong length
   */
  public static byte[] packRows(float[][] rows, int dimension) {
    ByteBuffer bb = ByteBuffer.allocate(rows.length * dimension * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    for (float[] row : rows) {
      if (row.length != dimension) {
        throw new IllegalArgumentException("row length " + row.length + " != dimension " + dimension);
      }
      for (float v : row) bb.putFloat(v);
    }
    return bb.array();
  }

  /**
   * Unpacks {@code count} rows of {@code dimension} floats from a little-endian buffer.
   *
   * @throws IllegalArgumentException if the buffer is shorter than {@code count * dimension * 4}
   */
  public static float[][] unpackRows(byte[] bytes, int count, int dimension) {
    long needed = (long) count * dimension * Float.BYTES;
    if (bytes.length < needed) {
      throw new IllegalArgumentException("expected " + needed + " bytes, got " + bytes.length);
    }
    ByteBuffer bb = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    float[][] out = new float[count][dimension];
    for (int r = 0; r < count; r++) {
      for (int d = 0; d < dimension; d++) out[r][d] = bb.getFloat();
    }
    return out;
  }
}
