package io.b2mash.hms.hmsadmin.kvstore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * {@link KeyPrefixStore} over the {@code kv_store} table ({@code key text primary key, value
 * jsonb}). Values are serialized with the application {@link ObjectMapper}.
 */
@Repository
public class JdbcKeyPrefixStore implements KeyPrefixStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcKeyPrefixStore.class);

  private static final String SELECT_ONE = "SELECT value::text FROM kv_store WHERE key = ?";
  private static final String SELECT_PREFIX =
      "SELECT value::text FROM kv_store WHERE key LIKE ? ESCAPE '\\' ORDER BY key";
  private static final String SELECT_MANY =
      "SELECT key, value::text AS value FROM kv_store WHERE key IN (:keys)";
  private static final String UPSERT =
      """
      INSERT INTO kv_store (key, value, updated_at) VALUES (?, CAST(? AS jsonb), now())
      ON CONFLICT (key) DO UPDATE SET value = EXCLUDED.value, updated_at = EXCLUDED.updated_at
      """;
  private static final String DELETE_ONE = "DELETE FROM kv_store WHERE key = ?";
  private static final String DELETE_MANY = "DELETE FROM kv_store WHERE key IN (:keys)";

  private final JdbcTemplate jdbcTemplate;
  private final NamedParameterJdbcTemplate namedJdbcTemplate;
  private final ObjectMapper objectMapper;

  public JdbcKeyPrefixStore(
      JdbcTemplate jdbcTemplate,
      NamedParameterJdbcTemplate namedJdbcTemplate,
      ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.namedJdbcTemplate = namedJdbcTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public <T> Optional<T> get(String key, Class<T> type) {
    List<String> rows;
    try {
      rows = jdbcTemplate.queryForList(SELECT_ONE, String.class, key);
    } catch (DataAccessException e) {
      throw new KeyValueStoreException("get", key, e);
    }
    return rows.stream().findFirst().map(json -> read("get", key, json, type));
  }

  @Override
  public void set(String key, Object value) {
    String json = write(key, value);
    try {
      jdbcTemplate.update(UPSERT, key, json);
    } catch (DataAccessException e) {
      throw new KeyValueStoreException("set", key, e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      jdbcTemplate.update(DELETE_ONE, key);
    } catch (DataAccessException e) {
      throw new KeyValueStoreException("delete", key, e);
    }
  }

  @Override
  public <T> List<T> getByPrefix(String prefix, Class<T> type) {
    List<String> rows;
    try {
      rows = jdbcTemplate.queryForList(SELECT_PREFIX, String.class, likePrefix(prefix));
    } catch (DataAccessException e) {
      throw new KeyValueStoreException("getByPrefix", prefix, e);
    }
    log.debug("Prefix scan: prefix={}, matches={}", prefix, rows.size());
    return rows.stream().map(json -> read("getByPrefix", prefix, json, type)).toList();
  }

  @Override
  public <T> List<T> mget(Collection<String> keys, Class<T> type) {
    if (keys.isEmpty()) {
      return List.of();
    }
    var byKey = new LinkedHashMap<String, String>();
    try {
      namedJdbcTemplate.query(
          SELECT_MANY,
          new MapSqlParameterSource("keys", keys),
          rs -> {
            byKey.put(rs.getString("key"), rs.getString("value"));
          });
    } catch (DataAccessException e) {
      throw new KeyValueStoreException("mget", String.join(",", keys), e);
    }
    var values = new ArrayList<T>(byKey.size());
    for (String key : keys) {
      String json = byKey.get(key);
      if (json != null) {
        values.add(read("mget", key, json, type));
      }
    }
    return values;
  }

  @Override
  public void mset(Map<String, ?> entries) {
    if (entries.isEmpty()) {
      return;
    }
    var batch = new ArrayList<Object[]>(entries.size());
    entries.forEach((key, value) -> batch.add(new Object[] {key, write(key, value)}));
    try {
      jdbcTemplate.batchUpdate(UPSERT, batch);
    } catch (DataAccessException e) {
      throw new KeyValueStoreException("mset", String.join(",", entries.keySet()), e);
    }
  }

  @Override
  public void mdel(Collection<String> keys) {
    if (keys.isEmpty()) {
      return;
    }
    try {
      int deleted = namedJdbcTemplate.update(DELETE_MANY, new MapSqlParameterSource("keys", keys));
      log.debug("Deleted {} of {} requested keys", deleted, keys.size());
    } catch (DataAccessException e) {
      throw new KeyValueStoreException("mdel", String.join(",", keys), e);
    }
  }

  /** Escapes LIKE wildcards so the prefix is matched literally, then appends {@code %}. */
  static String likePrefix(String prefix) {
    var escaped = new StringBuilder(prefix.length() + 1);
    for (int i = 0; i < prefix.length(); i++) {
      char c = prefix.charAt(i);
      if (c == '\\' || c == '%' || c == '_') {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.append('%').toString();
  }

  private <T> T read(String operation, String key, String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JacksonException e) {
      throw new KeyValueStoreException(operation, key, e);
    }
  }

  private String write(String key, Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JacksonException e) {
      throw new KeyValueStoreException("serialize", key, e);
    }
  }
}
