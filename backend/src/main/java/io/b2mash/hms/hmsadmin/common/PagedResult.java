package io.b2mash.hms.hmsadmin.common;

import java.util.List;

public record PagedResult<T>(List<T> data, Pagination pagination) {

  public record Pagination(
      int page, int limit, long total, int totalPages, boolean hasNext, boolean hasPrev) {}
}
