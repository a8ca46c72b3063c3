/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.redis;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * Key layout of one database.
 *
 * <pre>
 * kvspace:{db}:version        string, schema version (absent = database does not exist)
 * kvspace:{db}:stores         set of store names
 * kvspace:{db}:store:{name}   hash, entry key to encoded value
 * </pre>
 *
 * <p>The braces make {@code db} the cluster hash tag, so every key of a database lives in one slot
 * and MULTI/EXEC over them is legal in Redis Cluster.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Getter
@EqualsAndHashCode(of = "databaseName")
final class RedisNamespace {

  static final String PREFIX = "kvspace:";

  private final String databaseName;
  private final String prefix;
  private final String versionKey;
  private final String storesKey;

  RedisNamespace(@NonNull final String databaseName) {
    this.databaseName = databaseName;
    this.prefix = PREFIX + "{" + databaseName + "}:";
    this.versionKey = prefix + "version";
    this.storesKey = prefix + "stores";
  }

  String storeKey(final String storeName) {
    return prefix + "store:" + storeName;
  }

  /** SCAN pattern matching every key of this database, glob characters escaped. */
  String scanPattern() {
    final var pattern = new StringBuilder(prefix.length() + 1);
    for (final char c : prefix.toCharArray()) {
      if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
        pattern.append('\\');
      }
      pattern.append(c);
    }
    return pattern.append('*').toString();
  }

  @Override
  public String toString() {
    return prefix;
  }
}
