package io.github.friendsincode.grimnir.client.examples;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import io.github.friendsincode.grimnir.client.GrimnirClient;
import io.github.friendsincode.grimnir.client.GrimnirTransport;
import io.github.friendsincode.grimnir.client.TransportResponse;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StationReportTest {

  @Mock private GrimnirTransport transport;

  private GrimnirClient client() {
    return new GrimnirClient.Builder("http://localhost:8080")
        .apiKey("gr_key")
        .transport(transport)
        .build();
  }

  /** Answers each call with the first route whose key occurs in the URL, else 404. */
  private void route(Map<String, TransportResponse> routes) {
    when(transport.send(anyString(), anyString(), anyMap(), any(), any(), any()))
        .thenAnswer(
            invocation -> {
              String url = invocation.getArgument(1);
              return routes.entrySet().stream()
                  .filter(e -> url.contains(e.getKey()))
                  .map(Map.Entry::getValue)
                  .findFirst()
                  .orElse(new TransportResponse(404, "", Map.of()));
            });
  }

  private static TransportResponse ok(String body) {
    return new TransportResponse(200, body, Map.of());
  }

  @Test
  void summarizesNowPlayingAndFirstScheduleEntries() {
    route(
        Map.of(
            "/stations",
            ok("{\"stations\":[{\"id\":\"s1\",\"name\":\"Test FM\"}]}"),
            "/analytics/now-playing",
            ok("{\"title\":\"Song\",\"artist\":\"Band\"}"),
            "/schedule?",
            ok(
                "{\"entries\":["
                    + "{\"starts_at\":\"08:00\",\"title\":\"A\"},"
                    + "{\"starts_at\":\"09:00\",\"title\":\"B\"},"
                    + "{\"starts_at\":\"10:00\",\"title\":\"C\"},"
                    + "{\"starts_at\":\"11:00\",\"title\":\"D\"}]}")));

    List<StationReport.StationSummary> report = StationReport.buildReport(client());

    assertThat(report)
        .containsExactly(
            new StationReport.StationSummary(
                "s1", "Test FM", true, "Band - Song", List.of("08:00 A", "09:00 B", "10:00 C")));
  }

  @Test
  void failingStationIsMarkedUnreachable() {
    route(
        Map.of(
            "/stations",
            ok("{\"stations\":[{\"id\":\"s1\"}]}"),
            "/analytics/now-playing",
            new TransportResponse(503, "unavailable", Map.of())));

    List<StationReport.StationSummary> report = StationReport.buildReport(client());

    assertThat(report).hasSize(1);
    assertThat(report.get(0).reachable()).isFalse();
    assertThat(report.get(0).name()).isEqualTo("s1");
  }

  @Test
  void noStationsYieldsEmptyReport() {
    route(Map.of("/stations", ok("{}")));

    assertThat(StationReport.buildReport(client())).isEmpty();
  }

  @Test
  void describesEmptyNowPlaying() {
    assertThat(StationReport.describeNowPlaying(Map.of())).isEqualTo("nothing playing");
    assertThat(StationReport.describeNowPlaying(Map.of("title", "Solo"))).isEqualTo("Solo");
  }
}
