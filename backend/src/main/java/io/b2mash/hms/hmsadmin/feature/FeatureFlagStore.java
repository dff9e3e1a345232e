package io.b2mash.hms.hmsadmin.feature;

import io.b2mash.hms.hmsadmin.kvstore.KeyPrefixStore;
import io.b2mash.hms.hmsadmin.kvstore.StoreKeys;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/** Feature flags in the fast store, keyed {@code flag:<id>} and looked up by key via a scan. */
@Repository
public class FeatureFlagStore {

  private final KeyPrefixStore store;

  public FeatureFlagStore(KeyPrefixStore store) {
    this.store = store;
  }

  public List<FeatureFlag> findAll() {
    return store.getByPrefix(StoreKeys.FLAG_PREFIX, FeatureFlag.class).stream()
        .sorted(Comparator.comparing(FeatureFlag::key))
        .toList();
  }

  public Optional<FeatureFlag> findByKey(String key) {
    return store.getByPrefix(StoreKeys.FLAG_PREFIX, FeatureFlag.class).stream()
        .filter(flag -> key.equals(flag.key()))
        .findFirst();
  }

  public FeatureFlag save(FeatureFlag flag) {
    store.set(StoreKeys.flag(flag.id()), flag);
    return flag;
  }

  public void delete(FeatureFlag flag) {
    store.delete(StoreKeys.flag(flag.id()));
  }
}
