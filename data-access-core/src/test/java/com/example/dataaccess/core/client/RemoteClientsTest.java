package com.example.dataaccess.core.client;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.example.dataaccess.core.retry.Retry;
import com.example.dataaccess.core.retry.RetryCancelledException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;

class RemoteClientsTest {

  @Client("billing")
  interface BillingApi {
    void invoices();

    @Client("search")
    void lookup();
  }

  interface Unannotated {
    void ping();
  }

  private final HttpClient http = mock(HttpClient.class);
  private final AtomicInteger created = new AtomicInteger();

  private RemoteClients clients() {
    return RemoteClients.builder()
        .register(
            ClientOptions.builder("billing")
                .baseUri("https://billing.internal/api/")
                .timeout(Duration.ofSeconds(5))
                .header("Accept", "application/json")
                .build())
        .register(ClientOptions.builder("search").baseUri("https://search.internal").build())
        .retryPolicy(Retry.Policy.of(3, Duration.ZERO, IOException.class))
        .httpClientFactory(
            options -> {
              created.incrementAndGet();
              return http;
            })
        .build();
  }

  @Nested
  @DisplayName("Resolution")
  class Resolution {

    @Test
    @DisplayName("Method annotation should take precedence over the type annotation")
    void methodAnnotationWins() throws NoSuchMethodException {
      final var clients = clients();

      assertEquals("billing", clients.resolve(BillingApi.class.getMethod("invoices")).name());
      assertEquals("search", clients.resolve(BillingApi.class.getMethod("lookup")).name());
    }

    @Test
    @DisplayName("Should reject methods without a client and unknown names")
    void shouldRejectUnresolvable() throws NoSuchMethodException {
      final var clients = clients();
      final var ping = Unannotated.class.getMethod("ping");

      assertThrows(IllegalArgumentException.class, () -> clients.resolve(ping));
      assertThrows(IllegalArgumentException.class, () -> clients.options("inventory"));
      assertThrows(IllegalArgumentException.class, () -> clients.resolve(null));
    }

    @Test
    @DisplayName("Should reject duplicate client names")
    void shouldRejectDuplicates() {
      final var builder =
          RemoteClients.builder()
              .register(ClientOptions.builder("billing").baseUri("https://a.example").build());

      assertThrows(
          IllegalArgumentException.class,
          () ->
              builder.register(
                  ClientOptions.builder("billing").baseUri("https://b.example").build()));
    }
  }

  @Nested
  @DisplayName("Requests")
  class Requests {

    @Test
    @DisplayName("Should join base URI and path with exactly one slash")
    void shouldResolveUri() {
      final var withSlash = URI.create("https://billing.internal/api/");
      final var withoutSlash = URI.create("https://billing.internal/api");

      assertEquals(
          URI.create("https://billing.internal/api/invoices"),
          RemoteClients.resolveUri(withSlash, "/invoices"));
      assertEquals(
          URI.create("https://billing.internal/api/invoices?customer=42"),
          RemoteClients.resolveUri(withoutSlash, "invoices?customer=42"));
      assertEquals(withSlash, RemoteClients.resolveUri(withSlash, ""));
    }

    @Test
    @DisplayName("Should apply timeout and default headers")
    void shouldApplyOptions() throws NoSuchMethodException {
      final var request =
          clients().request(BillingApi.class.getMethod("invoices"), "invoices").GET().build();

      assertEquals(URI.create("https://billing.internal/api/invoices"), request.uri());
      assertEquals(Duration.ofSeconds(5), request.timeout().orElseThrow());
      assertEquals(List.of("application/json"), request.headers().allValues("Accept"));
    }

    @Test
    @DisplayName("Should default the timeout to thirty seconds")
    void shouldDefaultTimeout() {
      final var request = clients().request("search", "q").GET().build();

      assertEquals(ClientOptions.DEFAULT_TIMEOUT, request.timeout().orElseThrow());
      assertEquals(Map.of(), clients().options("search").headers());
    }

    @Test
    @DisplayName("Options should validate name, base URI and timeout")
    void optionsShouldValidate() {
      assertThrows(
          IllegalArgumentException.class,
          () -> ClientOptions.builder(" ").baseUri("https://a.example").build());
      assertThrows(
          IllegalArgumentException.class,
          () -> ClientOptions.builder("a").baseUri("relative/path").build());
      assertThrows(IllegalArgumentException.class, () -> ClientOptions.builder("a").build());
      assertThrows(
          IllegalArgumentException.class,
          () ->
              ClientOptions.builder("a")
                  .baseUri("https://a.example")
                  .timeout(Duration.ZERO)
                  .build());
    }
  }

  @Nested
  @DisplayName("Sending")
  class Sending {

    @Test
    @DisplayName("Should retry I/O failures and reuse one HTTP client per name")
    void shouldRetryIoFailures() throws Exception {
      @SuppressWarnings("unchecked")
      final HttpResponse<String> response = mock(HttpResponse.class);
      doThrow(new IOException("connection reset"))
          .doReturn(response)
          .when(http)
          .send(any(), any());
      final var clients = clients();
      final var request = clients.request("billing", "invoices").GET().build();

      final var result =
          clients.send(
              BillingApi.class.getMethod("invoices"),
              request,
              HttpResponse.BodyHandlers.ofString());

      assertSame(response, result);
      verify(http, times(2)).send(any(), any());
      assertEquals(1, created.get());
    }

    @Test
    @DisplayName("Should propagate the last I/O failure")
    void shouldPropagateLastFailure() throws Exception {
      final var last = new IOException("third");
      doThrow(new IOException("first"), new IOException("second"), last)
          .when(http)
          .send(any(), any());
      final var clients = clients();
      final var request = clients.request("billing", "invoices").GET().build();

      final var thrown =
          assertThrows(
              IOException.class,
              () -> clients.send("billing", request, HttpResponse.BodyHandlers.ofString()));

      assertSame(last, thrown);
    }

    @Test
    @DisplayName("Interrupted send should cancel without retrying")
    void interruptedSendShouldCancel() throws Exception {
      doThrow(new InterruptedException()).when(http).send(any(), any());
      final var clients = clients();
      final var request = clients.request("billing", "invoices").GET().build();

      try {
        assertThrows(
            RetryCancelledException.class,
            () -> clients.send("billing", request, HttpResponse.BodyHandlers.ofString()));
        assertTrue(Thread.currentThread().isInterrupted());
        verify(http, times(1)).send(any(), any());
      } finally {
        Thread.interrupted();
      }
    }
  }
}
