/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.redis;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import lombok.Getter;

/** Writes staged by a read-write transaction, applied in order clear, deletes, puts. */
@Getter
final class RedisWriteSet {

  private final Map<String, Object> puts = new LinkedHashMap<>();
  private final Set<String> deletes = new LinkedHashSet<>();
  private boolean cleared;

  void put(final String key, final Object value) {
    deletes.remove(key);
    puts.put(key, value);
  }

  void delete(final String key) {
    puts.remove(key);
    if (!cleared) {
      deletes.add(key);
    }
  }

  void clear() {
    puts.clear();
    deletes.clear();
    cleared = true;
  }

  boolean isEmpty() {
    return !cleared && puts.isEmpty() && deletes.isEmpty();
  }
}
