package io.b2mash.hms.hmsadmin.common;

import io.b2mash.hms.hmsadmin.exception.InvalidStateException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * In-memory filtering, sorting and pagination for list endpoints backed by fast-store prefix scans.
 */
public final class ListQueries {

  private ListQueries() {}

  public static <T> List<T> filter(List<T> items, Predicate<? super T> predicate) {
    if (predicate == null) {
      return items;
    }
    return items.stream().filter(predicate).toList();
  }

  /**
   * Sorts by a named field. Only fields present in {@code sortableFields} are accepted; the input
   * list is never modified.
   */
  public static <T> List<T> sort(
      List<T> items, SortSpec sort, Map<String, Comparator<T>> sortableFields) {
    if (sort == null) {
      return items;
    }
    Comparator<T> comparator = sortableFields.get(sort.field());
    if (comparator == null) {
      throw new InvalidStateException(
          "Invalid sort field",
          "Cannot sort by '" + sort.field() + "'; allowed fields: " + sortableFields.keySet());
    }
    if (sort.direction() == SortSpec.Direction.DESC) {
      comparator = comparator.reversed();
    }
    var sorted = new ArrayList<>(items);
    sorted.sort(comparator);
    return sorted;
  }

  public static <T> PagedResult<T> paginate(List<T> items, PageQuery query) {
    var page = query != null ? query : PageQuery.firstPage();
    int total = items.size();
    int totalPages = (int) Math.ceil((double) total / page.limit());
    int start = Math.min((page.page() - 1) * page.limit(), total);
    int end = Math.min(start + page.limit(), total);
    return new PagedResult<>(
        List.copyOf(items.subList(start, end)),
        new PagedResult.Pagination(
            page.page(),
            page.limit(),
            total,
            totalPages,
            page.page() < totalPages,
            page.page() > 1));
  }
}
