package io.transcribehive.transcriber.usage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.io.HttpClientResponseHandler;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicClassicHttpResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HttpUsageReporterTest {

  private static final UsageEvent EVENT = new UsageEvent("job-1", "audio/a.wav", "http", "jobs-scribe-2",
      Instant.parse("2024-03-01T10:00:00Z"), Duration.ofMillis(1500), "success");

  @Mock
  HttpClient httpClient;

  @Test
  void acceptsBareHostAndPort() {
    assertThat(HttpUsageReporter.endpointOf("eats:9000")).isEqualTo(URI.create("http://eats:9000/"));
    assertThat(HttpUsageReporter.endpointOf(" https://eats.example/v1 "))
        .isEqualTo(URI.create("https://eats.example/v1"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void postsEventAsJson() throws Exception {
    AtomicReference<ClassicHttpRequest> sent = new AtomicReference<>();
    when(httpClient.execute(any(ClassicHttpRequest.class), any(HttpClientResponseHandler.class)))
        .thenAnswer(invocation -> {
          sent.set(invocation.getArgument(0));
          HttpClientResponseHandler<Object> handler = invocation.getArgument(1);
          return handler.handleResponse(new BasicClassicHttpResponse(202));
        });

    reporter().report(EVENT);

    assertThat(sent.get().getUri()).isEqualTo(URI.create("http://eats:9000/"));
    JsonNode body = new ObjectMapper().readTree(EntityUtils.toString(sent.get().getEntity()));
    assertThat(body.path("jobId").asText()).isEqualTo("job-1");
    assertThat(body.path("worker").asText()).isEqualTo("jobs-scribe-2");
    assertThat(body.path("durationMs").asLong()).isEqualTo(1500L);
    assertThat(body.path("startedAt").asText()).isEqualTo("2024-03-01T10:00:00Z");
    assertThat(body.path("outcome").asText()).isEqualTo("success");
  }

  @Test
  void unreachableCollectorIsIgnored() throws Exception {
    when(httpClient.execute(any(ClassicHttpRequest.class), any(HttpClientResponseHandler.class)))
        .thenThrow(new ConnectException("Connection refused"));

    assertThatCode(() -> reporter().report(EVENT)).doesNotThrowAnyException();
  }

  private HttpUsageReporter reporter() {
    return new HttpUsageReporter(httpClient, HttpUsageReporter.endpointOf("eats:9000"), Duration.ofSeconds(2));
  }
}
