package io.github.friendsincode.grimnir.client;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Filters for the station and system log endpoints.
 *
 * <p>Blank filters are treated as absent and not sent. The limit is always sent.
 *
 * @param level minimum level ({@code debug}, {@code info}, {@code warn}, {@code error}), or null
 * @param component component name filter, or null
 * @param search substring searched in messages, or null
 * @param limit maximum number of entries
 */
public record LogQuery(
    @Nullable String level, @Nullable String component, @Nullable String search, int limit) {

  /** Number of entries requested when no limit is given. */
  public static final int DEFAULT_LIMIT = 500;

  /** Validates the limit. */
  public LogQuery {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
  }

  /** Returns a query with no filters and the default limit. */
  public static LogQuery defaults() {
    return new LogQuery(null, null, null, DEFAULT_LIMIT);
  }

  /** Returns a copy filtering by level. */
  public LogQuery withLevel(@Nullable String newLevel) {
    return new LogQuery(newLevel, component, search, limit);
  }

  /** Returns a copy filtering by component. */
  public LogQuery withComponent(@Nullable String newComponent) {
    return new LogQuery(level, newComponent, search, limit);
  }

  /** Returns a copy searching message text. */
  public LogQuery withSearch(@Nullable String newSearch) {
    return new LogQuery(level, component, newSearch, limit);
  }

  /** Returns a copy with a different limit. */
  public LogQuery withLimit(int newLimit) {
    return new LogQuery(level, component, search, newLimit);
  }

  Map<String, String> toQueryParams() {
    return new GrimnirClient.QueryBuilder()
        .add("limit", limit)
        .addIfPresent("level", level)
        .addIfPresent("component", component)
        .addIfPresent("search", search)
        .build();
  }
}
