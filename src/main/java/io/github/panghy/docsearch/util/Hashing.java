package io.github.panghy.docsearch.util;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/** Identifier helpers for documents and metadata. */
public final class Hashing {
  private Hashing() {}

  /** Hex SHA-256 of the 16 raw bytes of {@code uuid}. */
  public static String sha256(UUID uuid) {
    ByteBuffer bb = ByteBuffer.allocate(16);
    bb.putLong(uuid.getMostSignificantBits());
    bb.putLong(uuid.getLeastSignificantBits());
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(md.digest(bb.array()));
    } catch (NoSuchAlgorithmException e) {
      // every JRE ships SHA-256
      throw new IllegalStateException(e);
    }
  }

  /** Metadata id default: SHA-256 of a freshly generated random UUID. */
  public static String randomMetadataId() {
    return sha256(UUID.randomUUID());
  }

  /** Storage id default: a random UUID string. */
  public static String randomStorageId() {
    return UUID.randomUUID().toString();
  }
}
