package io.github.friendsincode.grimnir.client;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;
import com.google.gson.stream.JsonReader;
import io.github.friendsincode.grimnir.client.exception.GrimnirApiException;
import io.github.friendsincode.grimnir.client.exception.GrimnirDecodeException;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import org.jspecify.annotations.Nullable;

/**
 * Classifies a {@link RawResponse} and reads its body under the declared content contract.
 *
 * <p>Any status of 400 or above is a failure regardless of contract and raises {@link
 * GrimnirApiException} with the body exactly as received. Error bodies are never JSON-decoded.
 *
 * <p>JSON numbers keep their value: integers decode as {@link Long}, or {@link BigInteger} when
 * they overflow a long, and fractions as {@link Double}, or {@link BigDecimal} when a double
 * cannot hold them exactly.
 */
public final class ResponseTranslator {

  private static final Gson GSON =
      new GsonBuilder()
          .setStrictness(Strictness.STRICT)
          .setObjectToNumberStrategy(ResponseTranslator::readNumber)
          .create();

  private ResponseTranslator() {}

  /**
   * Reads a JSON-contract response.
   *
   * @param response the raw response, declared {@link ContentContract#JSON}
   * @return the decoded JSON value, or an empty map for an empty body
   * @throws GrimnirApiException if the status code is 400 or above
   * @throws GrimnirDecodeException if the body is not valid JSON
   */
  public static @Nullable Object interpretJson(RawResponse response) {
    requireContract(response, ContentContract.JSON);
    raiseForStatus(response);
    return parseJson(response.bodyText(), response.endpointPath());
  }

  /**
   * Reads a raw-text-contract response.
   *
   * @param response the raw response, declared {@link ContentContract#RAW_TEXT}
   * @return the body text, verbatim
   * @throws GrimnirApiException if the status code is 400 or above
   */
  public static String interpretText(RawResponse response) {
    requireContract(response, ContentContract.RAW_TEXT);
    raiseForStatus(response);
    return response.bodyText();
  }

  /**
   * Throws if the response status is a failure.
   *
   * @param response the raw response
   * @throws GrimnirApiException if the status code is 400 or above
   */
  public static void raiseForStatus(RawResponse response) {
    if (response.isFailure()) {
      throw new GrimnirApiException(
          response.statusCode(), response.bodyText(), response.endpointPath());
    }
  }

  static @Nullable Object parseJson(String text, String endpointPath) {
    if (text.isEmpty()) {
      return new LinkedHashMap<String, Object>();
    }
    if (text.isBlank()) {
      throw new GrimnirDecodeException("Invalid JSON in response: no value", text, endpointPath);
    }
    try {
      return GSON.fromJson(text, Object.class);
    } catch (JsonParseException e) {
      throw new GrimnirDecodeException("Invalid JSON in response", text, endpointPath, e);
    }
  }

  static Number readNumber(JsonReader in) throws IOException {
    String literal = in.nextString();
    try {
      if (literal.indexOf('.') < 0 && literal.indexOf('e') < 0 && literal.indexOf('E') < 0) {
        try {
          return Long.parseLong(literal);
        } catch (NumberFormatException e) {
          return new BigInteger(literal);
        }
      }
      BigDecimal exact = new BigDecimal(literal);
      double approximate = exact.doubleValue();
      if (!Double.isInfinite(approximate)
          && new BigDecimal(Double.toString(approximate)).compareTo(exact) == 0) {
        return approximate;
      }
      return exact;
    } catch (NumberFormatException e) {
      throw new JsonParseException("Cannot parse " + literal + " at " + in.getPreviousPath(), e);
    }
  }

  private static void requireContract(RawResponse response, ContentContract expected) {
    if (response.contentDeclared() != expected) {
      throw new IllegalArgumentException(
          "Response for "
              + response.endpointPath()
              + " was declared "
              + response.contentDeclared()
              + ", not "
              + expected);
    }
  }
}
