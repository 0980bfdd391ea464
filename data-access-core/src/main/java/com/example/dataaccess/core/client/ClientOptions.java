package com.example.dataaccess.core.client;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration of one named remote client.
 *
 * @param name client name referenced by {@link Client}
 * @param baseUri base address that request paths are resolved against
 * @param timeout connect and request timeout
 * @param headers headers added to every request
 */
public record ClientOptions(
    String name, URI baseUri, Duration timeout, Map<String, String> headers) {

  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  public ClientOptions {
    if (name == null || name.isBlank())
      throw new IllegalArgumentException("name must not be blank");
    if (baseUri == null || !baseUri.isAbsolute())
      throw new IllegalArgumentException("baseUri must be absolute");
    if (timeout == null || timeout.isNegative() || timeout.isZero())
      throw new IllegalArgumentException("timeout must be positive");
    headers =
        headers == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }

  /**
   * Creates a new builder instance.
   *
   * @param name client name
   * @return new builder
   */
  public static Builder builder(final String name) {
    return new Builder(name);
  }

  /** Builder for {@link ClientOptions}. */
  public static class Builder {
    private final String name;
    private URI baseUri;
    private Duration timeout = DEFAULT_TIMEOUT;
    private final Map<String, String> headers = new LinkedHashMap<>();

    private Builder(final String name) {
      this.name = name;
    }

    /**
     * Sets the base address (required).
     *
     * @param baseUri absolute base URI
     * @return this builder
     */
    public Builder baseUri(final String baseUri) {
      this.baseUri = URI.create(baseUri);
      return this;
    }

    /**
     * Sets the connect and request timeout.
     *
     * <p>Default: 30 seconds
     *
     * @param timeout timeout
     * @return this builder
     */
    public Builder timeout(final Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /**
     * Adds a header sent with every request.
     *
     * @param name header name
     * @param value header value
     * @return this builder
     */
    public Builder header(final String name, final String value) {
      headers.put(name, value);
      return this;
    }

    public ClientOptions build() {
      return new ClientOptions(name, baseUri, timeout, headers);
    }
  }
}
