package com.scholary.tracklist.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared HTTP plumbing for recognition services.
 *
 * <p>Handles the transport: posting multipart bodies, timeouts, and translating transport and
 * status-code failures into {@link ProviderException} kinds. Subclasses only build the request
 * and interpret the JSON body.
 *
 * <p>Exactly one HTTP request per {@link #identify} call. No retry loop here.
 */
public abstract class AbstractHttpProviderClient implements ProviderClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractHttpProviderClient.class);

  protected final ObjectMapper objectMapper;
  private final HttpClient httpClient;
  private final Duration readTimeout;

  protected AbstractHttpProviderClient(
      ObjectMapper objectMapper, Duration connectTimeout, Duration readTimeout) {
    this.objectMapper = objectMapper;
    this.readTimeout = readTimeout;
    this.httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
  }

  /**
   * POST a multipart body and return the response text of a 2xx answer.
   *
   * @param uri target endpoint
   * @param body the multipart body
   * @return the response body
   * @throws ProviderException on timeouts, transport errors and non-2xx answers
   */
  protected String postMultipart(URI uri, MultipartBody body) {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(uri)
            .timeout(readTimeout)
            .header("Content-Type", body.contentType())
            .POST(body.publisher())
            .build();

    LOGGER.debug("Sending recognition request to {} ({})", uri, name());

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (HttpTimeoutException e) {
      throw new ProviderException(name(), ErrorKind.TIMEOUT, "Request timed out: " + uri, e);
    } catch (IOException e) {
      throw new ProviderException(
          name(), ErrorKind.UNKNOWN, "Transport error: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderException(name(), ErrorKind.UNKNOWN, "Request interrupted", e);
    }

    int status = response.statusCode();
    if (status / 100 == 2) {
      return response.body();
    }
    String message =
        String.format("%s returned status %d: %s", name(), status, abbreviate(response.body()));
    switch (status) {
      case 429 -> throw ProviderException.rateLimited(
          name(), message, parseRetryAfter(response.headers().firstValue("Retry-After")));
      case 401, 403 -> throw new ProviderException(name(), ErrorKind.AUTH_ERROR, message);
      case 400, 413, 415, 422 -> throw new ProviderException(
          name(), ErrorKind.MALFORMED_REQUEST, message);
      case 408, 504 -> throw new ProviderException(name(), ErrorKind.TIMEOUT, message);
      default -> throw new ProviderException(name(), ErrorKind.UNKNOWN, message);
    }
  }

  /**
   * Parse a JSON body into a response type.
   *
   * @throws ProviderException with {@link ErrorKind#UNKNOWN} if the body is not what we expect
   */
  protected <T> T readJson(String body, Class<T> type) {
    try {
      return objectMapper.readValue(body, type);
    } catch (JsonProcessingException e) {
      throw new ProviderException(
          name(), ErrorKind.UNKNOWN, "Unparseable response: " + abbreviate(body), e);
    }
  }

  /**
   * Retry-After is either delta-seconds or an HTTP date. We only honour delta-seconds.
   */
  static Duration parseRetryAfter(Optional<String> header) {
    if (header.isEmpty()) {
      return null;
    }
    try {
      long seconds = Long.parseLong(header.get().trim());
      return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= 200 ? body : body.substring(0, 200) + "...";
  }
}
