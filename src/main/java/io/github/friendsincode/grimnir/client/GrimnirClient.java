package io.github.friendsincode.grimnir.client;

import io.github.friendsincode.grimnir.client.auth.ApiKeyAuth;
import io.github.friendsincode.grimnir.client.auth.AuthResult;
import io.github.friendsincode.grimnir.client.auth.BearerTokenAuth;
import io.github.friendsincode.grimnir.client.auth.CredentialManager;
import io.github.friendsincode.grimnir.client.auth.Credentials;
import io.github.friendsincode.grimnir.client.exception.GrimnirAuthException;
import io.github.friendsincode.grimnir.client.exception.GrimnirDecodeException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Client for the Grimnir Radio REST API.
 *
 * <p>Each operation is a single blocking call: build the query or body, dispatch it through the
 * {@link RequestDispatcher}, read the response with the {@link ResponseTranslator} and, for list
 * endpoints, unwrap the envelope key. Errors propagate unchanged as {@link
 * io.github.friendsincode.grimnir.client.exception.GrimnirException} subclasses; nothing is
 * retried.
 *
 * <p>Instances are created via the {@link Builder}, either with a static API key or with a login
 * performed at build time:
 *
 * <pre>{@code
 * try (GrimnirClient client = new GrimnirClient.Builder("https://radio.example.com")
 *     .apiKey("gr_your-api-key")
 *     .build()) {
 *   List<Map<String, Object>> stations = client.getStations();
 * }
 * }</pre>
 *
 * <p>A client is one logical session. Reads of the credential are safe from several threads, but
 * {@link #login} and {@link #refresh} must be serialized externally with other calls on the same
 * instance. The client owns its transport and releases it on {@link #close()}.
 */
public final class GrimnirClient implements AutoCloseable {

  static final String LOGIN_PATH = "/auth/login";
  static final String REFRESH_PATH = "/auth/refresh";
  static final String DEFAULT_UPLOAD_MIME_TYPE = "audio/mpeg";

  static final int DEFAULT_SCHEDULE_HOURS = 24;
  static final int DEFAULT_SPINS_LIMIT = 100;
  static final int DEFAULT_SMART_BLOCK_LIMIT = 10;
  static final String DEFAULT_SMART_BLOCK_SORT = "random";
  static final int DEFAULT_BEST_SLOTS_LIMIT = 10;
  static final int DEFAULT_SHOW_DURATION_MINUTES = 60;
  static final String DEFAULT_SHOW_COLOR = "#3B82F6";
  static final String DEFAULT_TIMEZONE = "UTC";

  private final ClientConfig config;
  private final GrimnirTransport transport;
  private final CredentialManager credentialManager;
  private final RequestDispatcher dispatcher;

  private GrimnirClient(
      ClientConfig config, GrimnirTransport transport, @Nullable Credentials credentials) {
    this.config = config;
    this.transport = transport;
    this.credentialManager = new CredentialManager(credentials);
    this.dispatcher = new RequestDispatcher(config, transport, credentialManager);
  }

  /** Returns the immutable connection settings. */
  public ClientConfig getConfig() {
    return config;
  }

  /** Returns the active credential, or {@code null} for an anonymous client. */
  public @Nullable Credentials getCredentials() {
    return credentialManager.current();
  }

  /** Releases the transport's connection pool. */
  @Override
  public void close() {
    transport.close();
  }

  // ---------------------------------------------------------------------------
  // Authentication
  // ---------------------------------------------------------------------------

  /**
   * Logs in with email and password and switches this client to the returned bearer token.
   *
   * <p>The login call itself is sent without authentication headers.
   *
   * @param email the account email
   * @param password the account password
   * @return the token, its expiry and the user profile
   * @throws GrimnirAuthException if the backend rejects the login or returns no token
   */
  public AuthResult login(String email, String password) {
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(password, "password");
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("email", email);
    body.put("password", password);

    RawResponse response =
        dispatcher.execute(
            OutboundRequest.post(LOGIN_PATH, body), CredentialManager.baselineHeaders());
    AuthResult result = readAuthResult(response);
    credentialManager.replace(result.toCredentials());
    return result;
  }

  /**
   * Exchanges the current bearer token for a new one.
   *
   * <p>The stored expiry is not consulted; callers decide when to refresh.
   *
   * @return the new token and its expiry
   * @throws IllegalStateException if this client does not hold a bearer token
   * @throws GrimnirAuthException if the backend rejects the refresh or returns no token
   */
  public AuthResult refresh() {
    if (!(credentialManager.current() instanceof BearerTokenAuth)) {
      throw new IllegalStateException("refresh requires a logged-in session with a bearer token");
    }
    RawResponse response = dispatcher.execute(OutboundRequest.post(REFRESH_PATH, null));
    AuthResult result = readAuthResult(response);
    credentialManager.replace(result.toCredentials());
    return result;
  }

  static AuthResult readAuthResult(RawResponse response) {
    if (response.isFailure()) {
      throw new GrimnirAuthException(
          "Authentication rejected with HTTP " + response.statusCode(),
          response.endpointPath(),
          response.statusCode(),
          response.bodyText());
    }
    Map<String, Object> payload =
        requireObject(ResponseTranslator.interpretJson(response), response);

    Object token = payload.get("token");
    if (!(token instanceof String tokenText) || tokenText.isBlank()) {
      throw new GrimnirAuthException(
          "Authentication succeeded but no token was returned",
          response.endpointPath(),
          null,
          response.bodyText());
    }

    OffsetDateTime expiresAt = parseExpiry(payload.get("expires_at"), response);

    Map<String, Object> user = new LinkedHashMap<>();
    if (payload.get("user") instanceof Map<?, ?> userMap) {
      userMap.forEach((key, value) -> user.put(String.valueOf(key), value));
    }
    return new AuthResult(tokenText, expiresAt, user);
  }

  /**
   * Parses an ISO-8601 expiry timestamp. A trailing {@code Z} is rewritten as {@code +00:00}
   * before parsing.
   */
  static @Nullable OffsetDateTime parseExpiry(@Nullable Object value, RawResponse response) {
    if (value == null) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw new GrimnirDecodeException(
          "expires_at is not a string", response.bodyText(), response.endpointPath());
    }
    String normalized = text.endsWith("Z") ? text.substring(0, text.length() - 1) + "+00:00" : text;
    try {
      return OffsetDateTime.parse(normalized);
    } catch (DateTimeParseException e) {
      throw new GrimnirDecodeException(
          "expires_at is not an ISO-8601 timestamp: " + text,
          response.bodyText(),
          response.endpointPath(),
          e);
    }
  }

  // ---------------------------------------------------------------------------
  // Health
  // ---------------------------------------------------------------------------

  /** Returns the backend health status (no auth required). */
  public Map<String, Object> getHealth() {
    return getObject("/health", Map.of());
  }

  // ---------------------------------------------------------------------------
  // Stations
  // ---------------------------------------------------------------------------

  /** Returns all stations the caller has access to. */
  public List<Map<String, Object>> getStations() {
    return getList("/stations", Map.of(), "stations");
  }

  /** Returns all public stations (no auth required). */
  public List<Map<String, Object>> getPublicStations() {
    return getList("/public/stations", Map.of(), "stations");
  }

  /**
   * Returns one station.
   *
   * @param stationId the station UUID
   * @return the station object
   */
  public Map<String, Object> getStation(String stationId) {
    return getObject("/stations/" + segment(stationId, "stationId"), Map.of());
  }

  /**
   * Returns the stream mounts of a station.
   *
   * @param stationId the station UUID
   * @return the mount objects, empty if the response carries none
   */
  public List<Map<String, Object>> getStationMounts(String stationId) {
    return getList("/stations/" + segment(stationId, "stationId") + "/mounts", Map.of(), "mounts");
  }

  // ---------------------------------------------------------------------------
  // Media
  // ---------------------------------------------------------------------------

  /**
   * Uploads a file to a station's media library.
   *
   * @param stationId the target station UUID
   * @param file the file to upload, sent as the multipart part {@code file}
   * @return the created media item
   */
  public Map<String, Object> uploadMedia(String stationId, FileAttachment file) {
    Map<String, String> query = new QueryBuilder().add("station_id", stationId).build();
    return interpret(OutboundRequest.upload("/media/upload", query, file));
  }

  /**
   * Uploads an audio file from disk as {@code audio/mpeg}.
   *
   * @param stationId the target station UUID
   * @param file path to the audio file
   * @return the created media item
   * @throws IOException if the file cannot be read
   */
  public Map<String, Object> uploadMedia(String stationId, Path file) throws IOException {
    return uploadMedia(stationId, FileAttachment.fromPath(file, DEFAULT_UPLOAD_MIME_TYPE));
  }

  /** Returns one media item. */
  public Map<String, Object> getMedia(String mediaId) {
    return getObject("/media/" + segment(mediaId, "mediaId"), Map.of());
  }

  // ---------------------------------------------------------------------------
  // Playlists, smart blocks and clocks
  // ---------------------------------------------------------------------------

  /** Returns the playlists of a station. */
  public List<Map<String, Object>> getPlaylists(String stationId) {
    return getList("/playlists", stationQuery(stationId), "playlists");
  }

  /** Returns the smart blocks of a station. */
  public List<Map<String, Object>> getSmartBlocks(String stationId) {
    return getList("/smart-blocks", stationQuery(stationId), "smart_blocks");
  }

  /**
   * Creates a smart block with the default limit, random ordering and no description.
   *
   * @param stationId the station UUID
   * @param name the block name
   * @param rules rule objects with {@code field}, {@code operator}, {@code value} (and {@code
   *     value2} for ranges), passed through unevaluated
   * @return the created smart block
   */
  public Map<String, Object> createSmartBlock(
      String stationId, String name, List<Map<String, Object>> rules) {
    return createSmartBlock(
        stationId, name, rules, DEFAULT_SMART_BLOCK_LIMIT, DEFAULT_SMART_BLOCK_SORT, "");
  }

  /**
   * Creates a smart block.
   *
   * @param stationId the station UUID
   * @param name the block name
   * @param rules rule objects, passed through unevaluated
   * @param limit the maximum number of tracks the block generates
   * @param sortBy the ordering ({@code random}, {@code newest}, {@code oldest}, {@code title},
   *     {@code artist})
   * @param description a free-text description
   * @return the created smart block
   */
  public Map<String, Object> createSmartBlock(
      String stationId,
      String name,
      List<Map<String, Object>> rules,
      int limit,
      String sortBy,
      String description) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("station_id", Objects.requireNonNull(stationId, "stationId"));
    body.put("name", Objects.requireNonNull(name, "name"));
    body.put("description", Objects.requireNonNull(description, "description"));
    body.put("rules", new ArrayList<>(Objects.requireNonNull(rules, "rules")));
    body.put("limit", limit);
    body.put("sort_by", Objects.requireNonNull(sortBy, "sortBy"));
    return postObject("/smart-blocks", body);
  }

  /**
   * Generates tracks from a smart block.
   *
   * @param blockId the smart block UUID
   * @param limit the maximum number of tracks
   * @return the selected media items
   */
  public List<Map<String, Object>> materializeSmartBlock(String blockId, int limit) {
    return postList(
        "/smart-blocks/" + segment(blockId, "blockId") + "/materialize",
        Map.of("limit", limit),
        "tracks");
  }

  /** Returns the clock templates of a station. */
  public List<Map<String, Object>> getClocks(String stationId) {
    return getList("/clocks", stationQuery(stationId), "clocks");
  }

  // ---------------------------------------------------------------------------
  // Schedule
  // ---------------------------------------------------------------------------

  /** Returns the schedule entries of the next 24 hours. */
  public List<Map<String, Object>> getSchedule(String stationId) {
    return getSchedule(stationId, DEFAULT_SCHEDULE_HOURS);
  }

  /**
   * Returns upcoming schedule entries.
   *
   * @param stationId the station UUID
   * @param hours how many hours ahead to fetch
   * @return the schedule entries
   */
  public List<Map<String, Object>> getSchedule(String stationId, int hours) {
    Map<String, String> query =
        new QueryBuilder().add("station_id", stationId).add("hours", hours).build();
    return getList("/schedule", query, "entries");
  }

  /** Forces regeneration of a station's schedule. */
  public Map<String, Object> refreshSchedule(String stationId) {
    return postObject("/schedule/refresh", stationBody(stationId));
  }

  /**
   * Exports the schedule as an iCalendar document.
   *
   * <p>The body is returned verbatim and is never JSON-decoded.
   *
   * @param stationId the station UUID
   * @param start optional start date, ISO format
   * @param end optional end date, ISO format
   * @return the {@code text/calendar} document
   */
  public String exportScheduleIcal(String stationId, @Nullable String start, @Nullable String end) {
    Map<String, String> query =
        new QueryBuilder()
            .add("station_id", stationId)
            .add("format", "ical")
            .addIfPresent("start", start)
            .addIfPresent("end", end)
            .build();
    OutboundRequest request =
        OutboundRequest.get("/schedule/export", query).expecting(ContentContract.RAW_TEXT);
    return ResponseTranslator.interpretText(dispatcher.execute(request));
  }

  // ---------------------------------------------------------------------------
  // Live DJ
  // ---------------------------------------------------------------------------

  /**
   * Generates a token a DJ uses to stream live to a mount.
   *
   * @param stationId the station UUID
   * @param mountId the mount UUID
   * @return the token and its expiry
   */
  public Map<String, Object> generateLiveToken(String stationId, String mountId) {
    Map<String, Object> body = stationBody(stationId);
    body.put("mount_id", Objects.requireNonNull(mountId, "mountId"));
    return postObject("/live/tokens", body);
  }

  /** Returns active live sessions across all stations. */
  public List<Map<String, Object>> getLiveSessions() {
    return getLiveSessions(null);
  }

  /**
   * Returns active live sessions.
   *
   * @param stationId optional station filter
   * @return the live session objects
   */
  public List<Map<String, Object>> getLiveSessions(@Nullable String stationId) {
    Map<String, String> query = new QueryBuilder().addIfPresent("station_id", stationId).build();
    return getList("/live/sessions", query, "sessions");
  }

  /** Returns one live session. */
  public Map<String, Object> getLiveSession(String sessionId) {
    return getObject("/live/sessions/" + segment(sessionId, "sessionId"), Map.of());
  }

  /** Disconnects a live session. */
  public Map<String, Object> disconnectLiveSession(String sessionId) {
    return interpret(OutboundRequest.delete("/live/sessions/" + segment(sessionId, "sessionId")));
  }

  // ---------------------------------------------------------------------------
  // Webstreams
  // ---------------------------------------------------------------------------

  /** Returns the webstream relays of a station. */
  public List<Map<String, Object>> getWebstreams(String stationId) {
    return getList("/webstreams", stationQuery(stationId), "webstreams");
  }

  /**
   * Creates a webstream relay.
   *
   * @param stationId the station UUID
   * @param name the stream name
   * @param url the primary stream URL
   * @param format the audio format ({@code mp3}, {@code ogg}, {@code aac})
   * @param fallbackUrl optional fallback URL, sent only when given
   * @return the created webstream
   */
  public Map<String, Object> createWebstream(
      String stationId, String name, String url, String format, @Nullable String fallbackUrl) {
    Map<String, Object> body = stationBody(stationId);
    body.put("name", Objects.requireNonNull(name, "name"));
    body.put("url", Objects.requireNonNull(url, "url"));
    body.put("format", Objects.requireNonNull(format, "format"));
    if (isPresent(fallbackUrl)) {
      body.put("fallback_url", fallbackUrl);
    }
    return postObject("/webstreams", body);
  }

  /** Returns one webstream. */
  public Map<String, Object> getWebstream(String webstreamId) {
    return getObject("/webstreams/" + segment(webstreamId, "webstreamId"), Map.of());
  }

  /** Deletes a webstream. */
  public Map<String, Object> deleteWebstream(String webstreamId) {
    return interpret(OutboundRequest.delete("/webstreams/" + segment(webstreamId, "webstreamId")));
  }

  /** Switches a webstream to its next fallback URL. */
  public Map<String, Object> triggerWebstreamFailover(String webstreamId) {
    return postObject("/webstreams/" + segment(webstreamId, "webstreamId") + "/failover", null);
  }

  /** Switches a webstream back to its primary URL. */
  public Map<String, Object> resetWebstreamToPrimary(String webstreamId) {
    return postObject("/webstreams/" + segment(webstreamId, "webstreamId") + "/reset", null);
  }

  // ---------------------------------------------------------------------------
  // Playout control
  // ---------------------------------------------------------------------------

  /** Skips the currently playing track. */
  public Map<String, Object> skipTrack(String stationId) {
    return postObject("/playout/skip", stationBody(stationId));
  }

  /** Stops all playout for a station. */
  public Map<String, Object> stopPlayout(String stationId) {
    return postObject("/playout/stop", stationBody(stationId));
  }

  /** Reloads the playout pipeline of a station. */
  public Map<String, Object> reloadPlayout(String stationId) {
    return postObject("/playout/reload", stationBody(stationId));
  }

  // ---------------------------------------------------------------------------
  // Analytics
  // ---------------------------------------------------------------------------

  /** Returns now-playing information across all stations. */
  public Map<String, Object> getNowPlaying() {
    return getNowPlaying(null);
  }

  /** Returns now-playing information, optionally for one station. */
  public Map<String, Object> getNowPlaying(@Nullable String stationId) {
    return getObject(
        "/analytics/now-playing", new QueryBuilder().addIfPresent("station_id", stationId).build());
  }

  /** Returns current listener statistics across all stations. */
  public Map<String, Object> getListeners() {
    return getListeners(null);
  }

  /** Returns current listener statistics, optionally for one station. */
  public Map<String, Object> getListeners(@Nullable String stationId) {
    return getObject(
        "/analytics/listeners", new QueryBuilder().addIfPresent("station_id", stationId).build());
  }

  /** Returns the most recent 100 spins of a station. */
  public List<Map<String, Object>> getSpins(String stationId) {
    return getSpins(stationId, null, DEFAULT_SPINS_LIMIT);
  }

  /**
   * Returns track play history.
   *
   * @param stationId the station UUID
   * @param since optional lower bound, sent as an ISO-8601 timestamp; omitted when null
   * @param limit the maximum number of spins
   * @return the spin records
   */
  public List<Map<String, Object>> getSpins(
      String stationId, @Nullable OffsetDateTime since, int limit) {
    QueryBuilder query = new QueryBuilder().add("station_id", stationId).add("limit", limit);
    if (since != null) {
      query.add("since", DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(since));
    }
    return getList("/analytics/spins", query.build(), "spins");
  }

  // ---------------------------------------------------------------------------
  // Logs
  // ---------------------------------------------------------------------------

  /** Returns station logs with the default limit and no filters. */
  public Map<String, Object> getStationLogs(String stationId) {
    return getStationLogs(stationId, LogQuery.defaults());
  }

  /**
   * Returns logs of one station.
   *
   * @param stationId the station UUID
   * @param query level, component, search and limit filters
   * @return the log response with {@code entries} and {@code count}
   */
  public Map<String, Object> getStationLogs(String stationId, LogQuery query) {
    Objects.requireNonNull(query, "query");
    String path = "/stations/" + segment(stationId, "stationId") + "/logs";
    return getObject(path, query.toQueryParams());
  }

  /** Returns the log component names seen for a station. */
  public Map<String, Object> getStationLogComponents(String stationId) {
    return getObject("/stations/" + segment(stationId, "stationId") + "/logs/components", Map.of());
  }

  /** Returns log statistics for a station. */
  public Map<String, Object> getStationLogStats(String stationId) {
    return getObject("/stations/" + segment(stationId, "stationId") + "/logs/stats", Map.of());
  }

  // ---------------------------------------------------------------------------
  // Shows
  // ---------------------------------------------------------------------------

  /** Returns the shows of a station. */
  public List<Map<String, Object>> getShows(String stationId) {
    return getList("/shows", stationQuery(stationId), "shows");
  }

  /**
   * Creates a recurring show lasting one hour, with no description and the default color.
   *
   * @param stationId the station UUID
   * @param name the show name
   * @param rrule an RFC 5545 recurrence rule (e.g. {@code FREQ=WEEKLY;BYDAY=MO}), passed through
   *     unevaluated
   * @param dtstart the first occurrence, ISO format
   * @return the created show
   */
  public Map<String, Object> createShow(
      String stationId, String name, String rrule, String dtstart) {
    return createShow(
        stationId, name, rrule, dtstart, DEFAULT_SHOW_DURATION_MINUTES, "", DEFAULT_SHOW_COLOR);
  }

  /**
   * Creates a recurring show.
   *
   * @param stationId the station UUID
   * @param name the show name
   * @param rrule an RFC 5545 recurrence rule, passed through unevaluated
   * @param dtstart the first occurrence, ISO format
   * @param durationMinutes the default length of each instance
   * @param description a free-text description
   * @param color the calendar color as a hex string
   * @return the created show
   */
  public Map<String, Object> createShow(
      String stationId,
      String name,
      String rrule,
      String dtstart,
      int durationMinutes,
      String description,
      String color) {
    Map<String, Object> body = stationBody(stationId);
    body.put("name", Objects.requireNonNull(name, "name"));
    body.put("rrule", Objects.requireNonNull(rrule, "rrule"));
    body.put("dtstart", Objects.requireNonNull(dtstart, "dtstart"));
    body.put("default_duration_minutes", durationMinutes);
    body.put("description", Objects.requireNonNull(description, "description"));
    body.put("color", Objects.requireNonNull(color, "color"));
    return postObject("/shows", body);
  }

  /**
   * Returns show instances expanded by the backend for a date range.
   *
   * @param stationId the station UUID
   * @param start range start, ISO format
   * @param end range end, ISO format
   * @return the show instances
   */
  public List<Map<String, Object>> getShowInstances(String stationId, String start, String end) {
    Map<String, String> query =
        new QueryBuilder()
            .add("station_id", stationId)
            .add("start", start)
            .add("end", end)
            .build();
    return getList("/show-instances", query, "instances");
  }

  // ---------------------------------------------------------------------------
  // Schedule analytics
  // ---------------------------------------------------------------------------

  /**
   * Returns show performance metrics. The backend defaults to the last 30 days.
   *
   * @param stationId the station UUID
   * @param start optional start date
   * @param end optional end date
   * @return performance metrics by show
   */
  public Map<String, Object> getShowPerformance(
      String stationId, @Nullable String start, @Nullable String end) {
    return getObject("/schedule-analytics/shows", rangeQuery(stationId, start, end));
  }

  /** Returns the ten best performing time slots. */
  public Map<String, Object> getBestTimeSlots(String stationId) {
    return getBestTimeSlots(stationId, DEFAULT_BEST_SLOTS_LIMIT);
  }

  /** Returns the best performing time slots. */
  public Map<String, Object> getBestTimeSlots(String stationId, int limit) {
    Map<String, String> query =
        new QueryBuilder().add("station_id", stationId).add("limit", limit).build();
    return getObject("/schedule-analytics/best-slots", query);
  }

  /** Returns data-driven scheduling suggestions. */
  public Map<String, Object> getSchedulingSuggestions(String stationId) {
    return getObject("/schedule-analytics/suggestions", stationQuery(stationId));
  }

  // ---------------------------------------------------------------------------
  // Public schedule
  // ---------------------------------------------------------------------------

  /** Returns the public schedule of a station (no auth required). */
  public Map<String, Object> getPublicSchedule(
      String stationId, @Nullable String start, @Nullable String end) {
    return getObject("/public/schedule", rangeQuery(stationId, start, end));
  }

  /** Returns the current and next show of a station (no auth required). */
  public Map<String, Object> getPublicNowPlaying(String stationId) {
    return getObject("/public/now-playing", stationQuery(stationId));
  }

  // ---------------------------------------------------------------------------
  // Syndication
  // ---------------------------------------------------------------------------

  /** Returns all syndication networks. */
  public List<Map<String, Object>> getNetworks() {
    return getNetworks(null);
  }

  /** Returns syndication networks, optionally filtered by owner. */
  public List<Map<String, Object>> getNetworks(@Nullable String ownerId) {
    Map<String, String> query = new QueryBuilder().addIfPresent("owner_id", ownerId).build();
    return getList("/networks", query, "networks");
  }

  /** Returns all network shows available for syndication. */
  public List<Map<String, Object>> getNetworkShows() {
    return getNetworkShows(null);
  }

  /** Returns network shows, optionally filtered by network. */
  public List<Map<String, Object>> getNetworkShows(@Nullable String networkId) {
    Map<String, String> query = new QueryBuilder().addIfPresent("network_id", networkId).build();
    return getList("/network-shows", query, "shows");
  }

  /** Subscribes a station to a network show in the UTC timezone. */
  public Map<String, Object> subscribeToNetworkShow(
      String stationId, String networkShowId, String localTime, String localDays) {
    return subscribeToNetworkShow(
        stationId, networkShowId, localTime, localDays, DEFAULT_TIMEZONE);
  }

  /**
   * Subscribes a station to a network show.
   *
   * @param stationId the station UUID
   * @param networkShowId the network show UUID
   * @param localTime local broadcast time, {@code HH:MM}
   * @param localDays broadcast days, e.g. {@code MO,WE,FR}
   * @param timezone the station timezone
   * @return the subscription
   */
  public Map<String, Object> subscribeToNetworkShow(
      String stationId,
      String networkShowId,
      String localTime,
      String localDays,
      String timezone) {
    Map<String, Object> body = stationBody(stationId);
    body.put("network_show_id", Objects.requireNonNull(networkShowId, "networkShowId"));
    body.put("local_time", Objects.requireNonNull(localTime, "localTime"));
    body.put("local_days", Objects.requireNonNull(localDays, "localDays"));
    body.put("timezone", Objects.requireNonNull(timezone, "timezone"));
    return postObject("/network-subscriptions", body);
  }

  // ---------------------------------------------------------------------------
  // Underwriting
  // ---------------------------------------------------------------------------

  /** Returns the sponsors of a station. */
  public List<Map<String, Object>> getSponsors(String stationId) {
    return getList("/sponsors", stationQuery(stationId), "sponsors");
  }

  /**
   * Creates a sponsor.
   *
   * @param stationId the station UUID
   * @param name the sponsor name
   * @param contactInfo optional contact details, sent only when non-empty
   * @return the created sponsor
   */
  public Map<String, Object> createSponsor(
      String stationId, String name, @Nullable Map<String, String> contactInfo) {
    Map<String, Object> body = stationBody(stationId);
    body.put("name", Objects.requireNonNull(name, "name"));
    if (contactInfo != null && !contactInfo.isEmpty()) {
      body.put("contact_info", new LinkedHashMap<>(contactInfo));
    }
    return postObject("/sponsors", body);
  }

  /** Returns the underwriting fulfillment report with obligations and aired spots. */
  public Map<String, Object> getUnderwritingFulfillment(
      String stationId, @Nullable String start, @Nullable String end) {
    return getObject("/underwriting/fulfillment", rangeQuery(stationId, start, end));
  }

  // ---------------------------------------------------------------------------
  // System (platform admin only)
  // ---------------------------------------------------------------------------

  /** Returns system health status. */
  public Map<String, Object> getSystemStatus() {
    return getObject("/system/status", Map.of());
  }

  /** Returns system logs with the default limit and no filters. */
  public Map<String, Object> getSystemLogs() {
    return getSystemLogs(LogQuery.defaults());
  }

  /**
   * Returns system logs.
   *
   * @param query level, component, search and limit filters
   * @return the log response with {@code entries}, {@code count} and {@code station_names}
   */
  public Map<String, Object> getSystemLogs(LogQuery query) {
    Objects.requireNonNull(query, "query");
    return getObject("/system/logs", query.toQueryParams());
  }

  /** Returns the log component names seen system-wide. */
  public Map<String, Object> getSystemLogComponents() {
    return getObject("/system/logs/components", Map.of());
  }

  /** Returns system-wide log statistics. */
  public Map<String, Object> getSystemLogStats() {
    return getObject("/system/logs/stats", Map.of());
  }

  // ---------------------------------------------------------------------------
  // Dispatch helpers
  // ---------------------------------------------------------------------------

  private Map<String, Object> interpret(OutboundRequest request) {
    RawResponse response = dispatcher.execute(request);
    return requireObject(ResponseTranslator.interpretJson(response), response);
  }

  private Map<String, Object> getObject(String path, Map<String, String> query) {
    return interpret(OutboundRequest.get(path, query));
  }

  private Map<String, Object> postObject(String path, @Nullable Object body) {
    return interpret(OutboundRequest.post(path, body));
  }

  private List<Map<String, Object>> getList(
      String path, Map<String, String> query, String envelopeKey) {
    RawResponse response = dispatcher.execute(OutboundRequest.get(path, query));
    return unwrapList(
        requireObject(ResponseTranslator.interpretJson(response), response), envelopeKey, response);
  }

  private List<Map<String, Object>> postList(String path, Object body, String envelopeKey) {
    RawResponse response = dispatcher.execute(OutboundRequest.post(path, body));
    return unwrapList(
        requireObject(ResponseTranslator.interpretJson(response), response), envelopeKey, response);
  }

  /**
   * Narrows a decoded response to a JSON object.
   *
   * @throws GrimnirDecodeException if the value is an array, a scalar or {@code null}
   */
  @SuppressWarnings("unchecked")
  static Map<String, Object> requireObject(@Nullable Object decoded, RawResponse response) {
    if (!(decoded instanceof Map)) {
      throw new GrimnirDecodeException(
          "Response is not a JSON object", response.bodyText(), response.endpointPath());
    }
    return (Map<String, Object>) decoded;
  }

  /**
   * Extracts the list nested under an envelope key.
   *
   * @param payload the decoded response object
   * @param envelopeKey the key holding the list (e.g. {@code stations})
   * @param response the response the payload came from, for error reporting
   * @return the list items, or an empty list if the key is absent or null
   * @throws GrimnirDecodeException if the value is not a list of objects
   */
  @SuppressWarnings("unchecked")
  static List<Map<String, Object>> unwrapList(
      Map<String, Object> payload, String envelopeKey, RawResponse response) {
    Object value = payload.get(envelopeKey);
    if (value == null) {
      return new ArrayList<>();
    }
    if (!(value instanceof List)) {
      throw new GrimnirDecodeException(
          envelopeKey + " is not a list", response.bodyText(), response.endpointPath());
    }
    List<Map<String, Object>> result = new ArrayList<>();
    for (Object item : (List<Object>) value) {
      if (!(item instanceof Map)) {
        throw new GrimnirDecodeException(
            envelopeKey + " item is not an object", response.bodyText(), response.endpointPath());
      }
      result.add((Map<String, Object>) item);
    }
    return result;
  }

  private static Map<String, String> stationQuery(String stationId) {
    return new QueryBuilder().add("station_id", stationId).build();
  }

  private static Map<String, String> rangeQuery(
      String stationId, @Nullable String start, @Nullable String end) {
    return new QueryBuilder()
        .add("station_id", stationId)
        .addIfPresent("start", start)
        .addIfPresent("end", end)
        .build();
  }

  private static Map<String, Object> stationBody(String stationId) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("station_id", Objects.requireNonNull(stationId, "stationId"));
    return body;
  }

  private static String segment(String id, String name) {
    Objects.requireNonNull(id, name);
    if (id.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return RequestDispatcher.encode(id);
  }

  private static boolean isPresent(@Nullable String value) {
    return value != null && !value.isEmpty();
  }

  /** Insertion-ordered query parameters; optional values are dropped when null or empty. */
  static final class QueryBuilder {

    private final Map<String, String> params = new LinkedHashMap<>();

    QueryBuilder add(String name, String value) {
      params.put(name, Objects.requireNonNull(value, name));
      return this;
    }

    QueryBuilder add(String name, int value) {
      params.put(name, Integer.toString(value));
      return this;
    }

    QueryBuilder addIfPresent(String name, @Nullable String value) {
      if (isPresent(value)) {
        params.put(name, value);
      }
      return this;
    }

    Map<String, String> build() {
      return Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
  }

  /**
   * Builder for {@link GrimnirClient}.
   *
   * <p>Configure at most one authentication mode: a static credential through {@link #apiKey} or
   * {@link #credentials}, or a login through {@link #login}. With neither, the client is anonymous
   * and can reach public endpoints or log in later.
   */
  public static final class Builder {

    private final String baseUrl;
    private @Nullable Credentials credentials;
    private @Nullable String loginEmail;
    private @Nullable String loginPassword;
    private Duration timeout = ClientConfig.DEFAULT_TIMEOUT;
    private @Nullable GrimnirTransport transport;

    /**
     * Creates a builder.
     *
     * @param baseUrl the instance URL, e.g. {@code https://radio.example.com}
     */
    public Builder(String baseUrl) {
      this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    }

    /** Authenticates every call with a static API key. */
    public Builder apiKey(String apiKey) {
      return credentials(new ApiKeyAuth(apiKey));
    }

    /** Authenticates every call with the given credential. */
    public Builder credentials(Credentials credentials) {
      this.credentials = Objects.requireNonNull(credentials, "credentials");
      return this;
    }

    /** Logs in with email and password when the client is built. */
    public Builder login(String email, String password) {
      this.loginEmail = Objects.requireNonNull(email, "email");
      this.loginPassword = Objects.requireNonNull(password, "password");
      return this;
    }

    /** Sets the timeout applied to every call. Defaults to 30 seconds. */
    public Builder timeout(Duration timeout) {
      this.timeout = Objects.requireNonNull(timeout, "timeout");
      return this;
    }

    /**
     * Sets the transport implementation. Defaults to a new {@link HttpClientTransport}. The client
     * takes ownership and closes it.
     */
    public Builder transport(GrimnirTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    /**
     * Builds the client, logging in first if a login was configured. The transport is closed if
     * building fails.
     *
     * @return the configured client
     * @throws IllegalStateException if both a static credential and a login were configured
     * @throws IllegalArgumentException if the base URL or timeout is invalid
     * @throws io.github.friendsincode.grimnir.client.exception.GrimnirAuthException if the login
     *     is rejected
     */
    public GrimnirClient build() {
      GrimnirTransport owned = transport;
      try {
        if (credentials != null && loginEmail != null) {
          throw new IllegalStateException(
              "Configure either a static credential or a login, not both");
        }
        ClientConfig config = ClientConfig.of(baseUrl, timeout);
        if (owned == null) {
          owned = new HttpClientTransport();
        }
        GrimnirClient client = new GrimnirClient(config, owned, credentials);
        if (loginEmail != null && loginPassword != null) {
          client.login(loginEmail, loginPassword);
        }
        return client;
      } catch (RuntimeException e) {
        if (owned != null) {
          owned.close();
        }
        throw e;
      }
    }
  }
}
