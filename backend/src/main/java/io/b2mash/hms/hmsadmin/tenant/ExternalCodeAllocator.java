package io.b2mash.hms.hmsadmin.tenant;

import io.b2mash.hms.hmsadmin.kvstore.KeyPrefixStore;
import io.b2mash.hms.hmsadmin.kvstore.KeyValueStoreException;
import io.b2mash.hms.hmsadmin.kvstore.StoreKeys;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Hands out human-facing tenant codes {@code T-<n>} from the shared counter key.
 *
 * <p>Allocation is read-then-write with no compare-and-set: two concurrent creations can draw the
 * same number. {@link TenantService} rejects a code that is already live, so the loser gets a 409.
 */
@Component
public class ExternalCodeAllocator {

  private static final Logger log = LoggerFactory.getLogger(ExternalCodeAllocator.class);

  static final String CODE_PREFIX = "T-";
  private static final long FALLBACK_MODULUS = 10_000;

  private final KeyPrefixStore store;
  private final Clock clock;

  public ExternalCodeAllocator(KeyPrefixStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  public String next() {
    long value;
    try {
      long current = store.get(StoreKeys.TENANT_COUNTER, Long.class).filter(n -> n > 0).orElse(1L);
      store.set(StoreKeys.TENANT_COUNTER, current + 1);
      value = current;
    } catch (KeyValueStoreException e) {
      value = clock.instant().getEpochSecond() % FALLBACK_MODULUS;
      log.warn(
          "Tenant counter unavailable, using clock-derived code: code={}{}, error={}",
          CODE_PREFIX,
          value,
          e.getMessage());
    }
    return CODE_PREFIX + value;
  }
}
