package io.github.friendsincode.grimnir.client.examples;

import io.github.friendsincode.grimnir.client.GrimnirClient;
import io.github.friendsincode.grimnir.client.exception.GrimnirException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Station overview report.
 *
 * <p>Lists every station the caller can see with its current track and the next few schedule
 * entries. A station whose now-playing or schedule call fails is still reported, marked
 * unreachable.
 *
 * <p>Usage: {@code java -cp ... io.github.friendsincode.grimnir.client.examples.StationReport}
 *
 * <p>Reads {@code GRIMNIR_URL} and either {@code GRIMNIR_API_KEY} or {@code GRIMNIR_EMAIL} with
 * {@code GRIMNIR_PASSWORD}.
 */
public final class StationReport {

  static final int SCHEDULE_PREVIEW = 3;

  /** Summary of one station. */
  public record StationSummary(
      String id, String name, boolean reachable, String nowPlaying, List<String> upcoming) {}

  /** Build the summary of every visible station. */
  public static List<StationSummary> buildReport(GrimnirClient client) {
    List<StationSummary> summaries = new ArrayList<>();
    for (Map<String, Object> station : client.getStations()) {
      summaries.add(summarize(client, station));
    }
    return Collections.unmodifiableList(summaries);
  }

  static StationSummary summarize(GrimnirClient client, Map<String, Object> station) {
    String id = text(station.get("id"), "");
    String name = text(station.get("name"), id);
    try {
      String nowPlaying = describeNowPlaying(client.getNowPlaying(id));
      List<String> upcoming = new ArrayList<>();
      for (Map<String, Object> entry : client.getSchedule(id)) {
        if (upcoming.size() == SCHEDULE_PREVIEW) {
          break;
        }
        upcoming.add(text(entry.get("starts_at"), "?") + " " + text(entry.get("title"), "-"));
      }
      return new StationSummary(id, name, true, nowPlaying, List.copyOf(upcoming));
    } catch (GrimnirException e) {
      return new StationSummary(id, name, false, "UNKNOWN", List.of());
    }
  }

  static String describeNowPlaying(Map<String, Object> nowPlaying) {
    String title = text(nowPlaying.get("title"), "");
    if (title.isEmpty()) {
      return "nothing playing";
    }
    String artist = text(nowPlaying.get("artist"), "");
    return artist.isEmpty() ? title : artist + " - " + title;
  }

  private static String text(Object value, String fallback) {
    if (value == null) {
      return fallback;
    }
    String stripped = value.toString().strip();
    return stripped.isEmpty() ? fallback : stripped;
  }

  private static void printSummary(StationSummary summary) {
    System.out.printf("%n=== %s (%s) ===%n", summary.name(), summary.id());
    System.out.printf("  Reachable:   %s%n", summary.reachable());
    System.out.printf("  Now playing: %s%n", summary.nowPlaying());
    for (String entry : summary.upcoming()) {
      System.out.printf("    %s%n", entry);
    }
  }

  /** Build a client from the environment. */
  static GrimnirClient clientFromEnvironment() {
    GrimnirClient.Builder builder =
        new GrimnirClient.Builder(env("GRIMNIR_URL", "http://localhost:8080"));
    String apiKey = System.getenv("GRIMNIR_API_KEY");
    if (apiKey != null && !apiKey.isBlank()) {
      builder.apiKey(apiKey);
    } else {
      String email = System.getenv("GRIMNIR_EMAIL");
      if (email != null) {
        builder.login(email, env("GRIMNIR_PASSWORD", ""));
      }
    }
    return builder.build();
  }

  /** Entry point. */
  public static void main(String[] args) {
    try (GrimnirClient client = clientFromEnvironment()) {
      for (StationSummary summary : buildReport(client)) {
        printSummary(summary);
      }
    }
  }

  private static String env(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null ? value : defaultValue;
  }

  private StationReport() {}
}
