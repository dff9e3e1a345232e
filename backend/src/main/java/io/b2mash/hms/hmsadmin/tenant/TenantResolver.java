package io.b2mash.hms.hmsadmin.tenant;

import io.b2mash.hms.hmsadmin.exception.ResourceNotFoundException;
import io.b2mash.hms.hmsadmin.kvstore.KeyPrefixStore;
import io.b2mash.hms.hmsadmin.kvstore.KeyValueStoreException;
import io.b2mash.hms.hmsadmin.kvstore.StoreKeys;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Maps any tenant identifier (external code, relational UUID, or fast-store key suffix) to one
 * canonical {@link TenantRecord}.
 *
 * <p>Sources are consulted in a fixed order and the first hit wins:
 *
 * <ol>
 *   <li>fast store, key {@code tenant:<identifier>}
 *   <li>relational primary key, only when the identifier is UUID-shaped
 *   <li>relational {@code settings->>'external_id'}
 * </ol>
 *
 * A backend error is logged and counts as a miss for that source only. Misses are not cached.
 */
@Component
public class TenantResolver {

  private static final Logger log = LoggerFactory.getLogger(TenantResolver.class);

  private static final Pattern UUID_PATTERN =
      Pattern.compile(
          "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$",
          Pattern.CASE_INSENSITIVE);

  private final KeyPrefixStore store;
  private final TenantRepository tenantRepository;

  public TenantResolver(KeyPrefixStore store, TenantRepository tenantRepository) {
    this.store = store;
    this.tenantRepository = tenantRepository;
  }

  public TenantIdentity resolve(String identifier) {
    if (identifier == null || identifier.isBlank()) {
      return TenantIdentity.unresolved(identifier);
    }

    var cached = fromFastStore(identifier);
    if (cached.isPresent()) {
      return new TenantIdentity(identifier, TenantIdentity.Source.FAST_STORE, cached.get());
    }

    if (isUuid(identifier)) {
      var byId = fromPrimaryKey(identifier);
      if (byId.isPresent()) {
        return new TenantIdentity(identifier, TenantIdentity.Source.RELATIONAL, byId.get());
      }
    }

    var byCode = fromExternalCode(identifier);
    if (byCode.isPresent()) {
      return new TenantIdentity(identifier, TenantIdentity.Source.RELATIONAL, byCode.get());
    }

    log.debug("Tenant not resolved: identifier={}", identifier);
    return TenantIdentity.unresolved(identifier);
  }

  /** Resolves or throws {@link ResourceNotFoundException}. */
  public TenantRecord require(String identifier) {
    var identity = resolve(identifier);
    if (!identity.isResolved()) {
      throw new ResourceNotFoundException("Tenant", identifier);
    }
    return identity.tenant();
  }

  static boolean isUuid(String identifier) {
    return UUID_PATTERN.matcher(identifier).matches();
  }

  private Optional<TenantRecord> fromFastStore(String identifier) {
    try {
      return store.get(StoreKeys.tenant(identifier), TenantRecord.class);
    } catch (KeyValueStoreException e) {
      log.warn(
          "Fast-store tenant lookup failed, falling back to relational: identifier={}, error={}",
          identifier,
          e.getMessage());
      return Optional.empty();
    }
  }

  private Optional<TenantRecord> fromPrimaryKey(String identifier) {
    try {
      return tenantRepository
          .findById(UUID.fromString(identifier))
          .map(TenantRecordMapper::toRecord);
    } catch (DataAccessException e) {
      log.warn(
          "Relational tenant lookup by id failed: identifier={}, error={}",
          identifier,
          e.getMessage());
      return Optional.empty();
    }
  }

  private Optional<TenantRecord> fromExternalCode(String identifier) {
    try {
      return tenantRepository.findByExternalId(identifier).map(TenantRecordMapper::toRecord);
    } catch (DataAccessException e) {
      log.warn(
          "Relational tenant lookup by external code failed: identifier={}, error={}",
          identifier,
          e.getMessage());
      return Optional.empty();
    }
  }
}
