package io.b2mash.hms.hmsadmin.common;

/**
 * One-based page request for in-memory list pagination. Out-of-range values are clamped rather
 * than rejected.
 */
public record PageQuery(int page, int limit) {

  public static final int DEFAULT_LIMIT = 50;
  public static final int MAX_LIMIT = 500;

  public PageQuery {
    if (page < 1) {
      page = 1;
    }
    if (limit < 1) {
      limit = DEFAULT_LIMIT;
    }
    if (limit > MAX_LIMIT) {
      limit = MAX_LIMIT;
    }
  }

  public static PageQuery firstPage() {
    return new PageQuery(1, DEFAULT_LIMIT);
  }
}
