package io.b2mash.hms.hmsadmin.kvstore;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document-oriented store addressed by opaque, colon-delimited string keys.
 *
 * <p>Prefix scans match the literal prefix: callers that need a segment boundary must include the
 * trailing separator themselves ({@code "usage:T-1:"} does not match {@code "usage:T-10:..."}, but
 * {@code "usage:T-1"} does). Scans return values only; callers recover keys from identity fields
 * embedded in the values.
 *
 * <p>The store offers no conditional writes. Read-modify-write sequences built on top of it are
 * subject to lost updates under concurrent writers.
 *
 * @see StoreKeys
 */
public interface KeyPrefixStore {

  <T> Optional<T> get(String key, Class<T> type);

  /** Inserts or replaces the value stored under {@code key}. */
  void set(String key, Object value);

  /** Removes {@code key}; a missing key is not an error. */
  void delete(String key);

  /** Returns every value whose key starts with {@code prefix}, ordered by key. */
  <T> List<T> getByPrefix(String prefix, Class<T> type);

  /** Returns the values present for {@code keys}, in request order, skipping missing keys. */
  <T> List<T> mget(Collection<String> keys, Class<T> type);

  void mset(Map<String, ?> entries);

  void mdel(Collection<String> keys);
}
