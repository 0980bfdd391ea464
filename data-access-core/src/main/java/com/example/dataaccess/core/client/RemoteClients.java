package com.example.dataaccess.core.client;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.dataaccess.core.retry.Retry;
import com.example.dataaccess.core.retry.RetryCancelledException;
import com.example.dataaccess.core.retry.RetryDefaults;
import java.io.IOException;
import java.lang.reflect.Method;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry of named remote clients, resolved from {@link Client} annotations.
 *
 * <pre>{@code
 * var clients = RemoteClients.builder()
 *     .register(ClientOptions.builder("billing")
 *         .baseUri("https://billing.internal/api/")
 *         .header("Accept", "application/json")
 *         .build())
 *     .build();
 *
 * var method = BillingApi.class.getMethod("invoices", String.class);
 * var request = clients.request(method, "invoices?customer=42").GET().build();
 * var response = clients.send(method, request, HttpResponse.BodyHandlers.ofString());
 * }</pre>
 *
 * <p>{@link #send} retries {@link IOException}s under the registry's retry policy; one {@link
 * HttpClient} is created per client name and reused.
 */
public final class RemoteClients {

  private static final System.Logger LOGGER = System.getLogger(RemoteClients.class.getName());

  private final Map<String, ClientOptions> options;
  private final Retry.Policy retryPolicy;
  private final Function<ClientOptions, HttpClient> httpClientFactory;
  private final Map<String, HttpClient> httpClients = new ConcurrentHashMap<>();

  private RemoteClients(final Builder builder) {
    this.options = Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
    this.retryPolicy = builder.retryPolicy;
    this.httpClientFactory = builder.httpClientFactory;
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the options registered under {@code name}.
   *
   * @param name client name
   * @return client options
   * @throws IllegalArgumentException if no client is registered under {@code name}
   */
  public ClientOptions options(final String name) {
    final var found = options.get(name);
    if (found == null)
      throw new IllegalArgumentException("No client registered under name: " + name);
    return found;
  }

  /**
   * Resolves the client for {@code method}: its own {@link Client} annotation, else the one on its
   * declaring type.
   *
   * @param method interface method
   * @return options of the resolved client
   * @throws IllegalArgumentException if neither carries {@link Client}, or the name is unknown
   */
  public ClientOptions resolve(final Method method) {
    if (method == null) throw new IllegalArgumentException("method must not be null");
    var annotation = method.getAnnotation(Client.class);
    if (annotation == null) annotation = method.getDeclaringClass().getAnnotation(Client.class);
    if (annotation == null)
      throw new IllegalArgumentException(
          "No @Client on " + method.getDeclaringClass().getName() + "#" + method.getName());
    return options(annotation.value());
  }

  /**
   * Starts a request for {@code method}'s client. The path is appended to the client's base URI;
   * timeout and default headers are applied.
   *
   * @param method interface method
   * @param path path relative to the base URI, may include a query string
   * @return request builder
   */
  public HttpRequest.Builder request(final Method method, final String path) {
    return request(resolve(method), path);
  }

  /**
   * Starts a request for the named client.
   *
   * @param name client name
   * @param path path relative to the base URI, may include a query string
   * @return request builder
   */
  public HttpRequest.Builder request(final String name, final String path) {
    return request(options(name), path);
  }

  /**
   * Sends {@code request} through {@code method}'s client, retrying on {@link IOException}.
   *
   * @param method interface method
   * @param request request to send
   * @param handler response body handler
   * @param <T> body type
   * @return the response of the first successful attempt
   * @throws IOException the failure of the last attempt
   * @throws RetryCancelledException if interrupted while sending or between attempts
   */
  public <T> HttpResponse<T> send(
      final Method method, final HttpRequest request, final HttpResponse.BodyHandler<T> handler)
      throws IOException {
    return send(resolve(method).name(), request, handler);
  }

  /**
   * Sends {@code request} through the named client, retrying on {@link IOException}.
   *
   * @param name client name
   * @param request request to send
   * @param handler response body handler
   * @param <T> body type
   * @return the response of the first successful attempt
   * @throws IOException the failure of the last attempt
   * @throws RetryCancelledException if interrupted while sending or between attempts
   */
  public <T> HttpResponse<T> send(
      final String name, final HttpRequest request, final HttpResponse.BodyHandler<T> handler)
      throws IOException {
    final var client = httpClient(name);
    return Retry.invoke(
        () -> {
          try {
            LOGGER.log(DEBUG, "Sending {0} {1} via {2}", request.method(), request.uri(), name);
            return client.send(request, handler);
          } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RetryCancelledException("Interrupted while sending request", ie);
          }
        },
        retryPolicy);
  }

  /**
   * Returns the HTTP client for {@code name}, creating it on first use.
   *
   * @param name client name
   * @return shared HTTP client
   */
  public HttpClient httpClient(final String name) {
    final var clientOptions = options(name);
    return httpClients.computeIfAbsent(name, n -> httpClientFactory.apply(clientOptions));
  }

  private static HttpRequest.Builder request(final ClientOptions options, final String path) {
    final var builder = HttpRequest.newBuilder(resolveUri(options.baseUri(), path));
    builder.timeout(options.timeout());
    options.headers().forEach(builder::header);
    return builder;
  }

  static URI resolveUri(final URI baseUri, final String path) {
    if (path == null || path.isEmpty()) return baseUri;
    final var base = baseUri.toString();
    final var relative = path.startsWith("/") ? path.substring(1) : path;
    return URI.create(base.endsWith("/") ? base + relative : base + "/" + relative);
  }

  private static HttpClient defaultHttpClient(final ClientOptions options) {
    return HttpClient.newBuilder().connectTimeout(options.timeout()).build();
  }

  /** Builder for {@link RemoteClients}. */
  public static class Builder {
    private final Map<String, ClientOptions> options = new LinkedHashMap<>();
    private Retry.Policy retryPolicy;
    private Function<ClientOptions, HttpClient> httpClientFactory =
        RemoteClients::defaultHttpClient;

    private Builder() {}

    /**
     * Registers a client.
     *
     * @param clientOptions client options
     * @return this builder
     */
    public Builder register(final ClientOptions clientOptions) {
      if (clientOptions == null)
        throw new IllegalArgumentException("clientOptions must not be null");
      if (options.putIfAbsent(clientOptions.name(), clientOptions) != null)
        throw new IllegalArgumentException("Duplicate client name: " + clientOptions.name());
      return this;
    }

    /**
     * Sets the retry policy used by {@link RemoteClients#send}.
     *
     * <p>Default: {@link RetryDefaults} retrying {@link IOException}
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(final Retry.Policy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    Builder httpClientFactory(final Function<ClientOptions, HttpClient> httpClientFactory) {
      this.httpClientFactory = httpClientFactory;
      return this;
    }

    public RemoteClients build() {
      if (retryPolicy == null) retryPolicy = RetryDefaults.policy(IOException.class);
      return new RemoteClients(this);
    }
  }
}
