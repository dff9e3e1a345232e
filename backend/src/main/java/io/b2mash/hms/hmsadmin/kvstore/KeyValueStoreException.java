package io.b2mash.hms.hmsadmin.kvstore;

/** A fast-store call failed: connection, SQL or (de)serialization error. */
public class KeyValueStoreException extends RuntimeException {

  private final String operation;
  private final String key;

  public KeyValueStoreException(String operation, String key, Throwable cause) {
    super("Key-value store " + operation + " failed for key '" + key + "'", cause);
    this.operation = operation;
    this.key = key;
  }

  public String getOperation() {
    return operation;
  }

  public String getKey() {
    return key;
  }
}
