package io.b2mash.hms.hmsadmin.tenant;

import java.util.List;

/**
 * Per-backend outcome of a tenant creation. At least one of the two stores accepted the write;
 * {@code warnings} describes the one that did not.
 */
public record TenantCreationResult(
    TenantRecord tenant,
    boolean relationalStored,
    boolean fastStoreStored,
    List<String> warnings) {

  public boolean isComplete() {
    return relationalStored && fastStoreStored;
  }
}
