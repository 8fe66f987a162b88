package com.scholary.tracklist.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.tracklist.segment.AudioSegment;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AbstractHttpProviderClientTest {

  private final StubHttpServer server = new StubHttpServer();
  private final StubClient client = new StubClient();

  @AfterEach
  void tearDown() {
    server.close();
  }

  @Test
  void postMultipart_shouldReturnBodyOfSuccessfulAnswer() {
    server.respond(200, "{\"ok\":true}");

    String body = client.post(server);

    assertThat(body).isEqualTo("{\"ok\":true}");
    assertThat(server.requests()).hasSize(1);
    assertThat(server.requests().get(0).contentType()).startsWith("multipart/form-data");
  }

  @Test
  void postMultipart_shouldClassifyTooManyRequestsWithRetryAfter() {
    server.respond(429, "slow down", Map.of("Retry-After", "7"));

    assertThatThrownBy(() -> client.post(server))
        .isInstanceOfSatisfying(
            ProviderException.class,
            e -> {
              assertThat(e.getKind()).isEqualTo(ErrorKind.RATE_LIMITED);
              assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(7));
              assertThat(e.getProviderName()).isEqualTo("stub");
            });
  }

  @Test
  void postMultipart_shouldClassifyUnauthorizedAsAuthError() {
    server.respond(401, "bad token");

    assertKind(ErrorKind.AUTH_ERROR);
  }

  @Test
  void postMultipart_shouldClassifyBadRequestAsMalformed() {
    server.respond(400, "bad audio");

    assertKind(ErrorKind.MALFORMED_REQUEST);
  }

  @Test
  void postMultipart_shouldClassifyServerErrorAsUnknown() {
    server.respond(500, "oops");

    assertKind(ErrorKind.UNKNOWN);
  }

  @Test
  void postMultipart_shouldClassifyGatewayTimeoutAsTimeout() {
    server.respond(504, "");

    assertKind(ErrorKind.TIMEOUT);
  }

  @Test
  void postMultipart_shouldClassifySlowAnswerAsTimeout() {
    server.respond(200, "{}").delay(2500);

    assertKind(ErrorKind.TIMEOUT);
  }

  @Test
  void postMultipart_shouldClassifyRefusedConnectionAsUnknown() {
    String url = server.baseUrl();
    server.close();

    assertThatThrownBy(() -> client.post(url))
        .isInstanceOfSatisfying(
            ProviderException.class, e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNKNOWN));
  }

  @Test
  void readJson_shouldReportUnparseableBodyAsUnknown() {
    assertThatThrownBy(() -> client.readJson("<html>", Map.class))
        .isInstanceOfSatisfying(
            ProviderException.class, e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNKNOWN));
  }

  @Test
  void parseRetryAfter_shouldHonourOnlyDeltaSeconds() {
    assertThat(AbstractHttpProviderClient.parseRetryAfter(Optional.of(" 12 ")))
        .isEqualTo(Duration.ofSeconds(12));
    String httpDate = "Wed, 21 Oct 2015 07:28:00 GMT";
    assertThat(AbstractHttpProviderClient.parseRetryAfter(Optional.of(httpDate))).isNull();
    assertThat(AbstractHttpProviderClient.parseRetryAfter(Optional.of("-1"))).isNull();
    assertThat(AbstractHttpProviderClient.parseRetryAfter(Optional.empty())).isNull();
  }

  private void assertKind(ErrorKind kind) {
    assertThatThrownBy(() -> client.post(server))
        .isInstanceOfSatisfying(
            ProviderException.class, e -> assertThat(e.getKind()).isEqualTo(kind));
  }

  private static final class StubClient extends AbstractHttpProviderClient {

    StubClient() {
      super(new ObjectMapper(), Duration.ofSeconds(1), Duration.ofSeconds(1));
    }

    String post(StubHttpServer server) {
      return post(server.baseUrl());
    }

    String post(String baseUrl) {
      return postMultipart(
          URI.create(baseUrl + "/identify"), new MultipartBody().field("k", "v"));
    }

    @Override
    public String name() {
      return "stub";
    }

    @Override
    public ProviderResult identify(AudioSegment segment) {
      throw new UnsupportedOperationException();
    }
  }
}
