package com.example.dataaccess.core.secrets;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.dataaccess.core.registry.ConnectionSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.util.Optional;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;

/**
 * Loads {@link ConnectionSettings} from database secrets stored in AWS Secrets Manager.
 *
 * <pre>{@code
 * try (var loader = SecretSettingsLoader.fromEnvironment()) {
 *   var registry = DataSourceRegistry.builder()
 *       .defaultDataSource(loader.load("prod/main-db"))
 *       .dataSource("reporting", loader.load("prod/reporting-db"))
 *       .build();
 * }
 * }</pre>
 */
public final class SecretSettingsLoader implements AutoCloseable {

  private static final System.Logger LOGGER =
      System.getLogger(SecretSettingsLoader.class.getName());

  private final SecretsManagerClient client;
  private final ObjectMapper mapper;

  public SecretSettingsLoader(final SecretsManagerClient client, final ObjectMapper mapper) {
    if (client == null) throw new IllegalArgumentException("client must not be null");
    if (mapper == null) throw new IllegalArgumentException("mapper must not be null");
    this.client = client;
    this.mapper = mapper;
  }

  /**
   * Creates a loader whose client is configured from system properties or environment variables:
   *
   * <ul>
   *   <li>aws.region / AWS_REGION (default us-east-1)
   *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
   * </ul>
   *
   * <p>Credentials come from the default AWS provider chain.
   *
   * @return loader owning a new client
   */
  public static SecretSettingsLoader fromEnvironment() {
    final var builder =
        SecretsManagerClient.builder()
            .region(
                setting("aws.region", "AWS_REGION").map(Region::of).orElse(Region.US_EAST_1));
    setting("aws.sm.endpoint", "AWS_SM_ENDPOINT")
        .map(URI::create)
        .ifPresent(builder::endpointOverride);
    return new SecretSettingsLoader(builder.build(), new ObjectMapper());
  }

  /**
   * Fetches and parses the secret.
   *
   * @param secretId the Secrets Manager secret ID or name
   * @return the parsed secret
   * @throws IllegalStateException if the secret cannot be fetched or parsed
   */
  public DbSecret secret(final String secretId) {
    if (secretId == null || secretId.isBlank())
      throw new IllegalArgumentException("secretId must not be blank");
    try {
      final var response =
          client.getSecretValue(GetSecretValueRequest.builder().secretId(secretId).build());
      LOGGER.log(DEBUG, "Fetched secret {0} version {1}", secretId, response.versionId());
      return mapper.readValue(response.secretString(), DbSecret.class);
    } catch (final Exception e) {
      throw new IllegalStateException("Failed to load DB secret " + secretId, e);
    }
  }

  /**
   * Fetches the secret and converts it to connection settings with the default pool size.
   *
   * @param secretId the Secrets Manager secret ID or name
   * @return connection settings
   * @throws IllegalStateException if the secret cannot be fetched, parsed or converted
   */
  public ConnectionSettings load(final String secretId) {
    final var secret = secret(secretId);
    return ConnectionSettings.of(secret.jdbcUrl(), secret.username(), secret.password());
  }

  @Override
  public void close() {
    client.close();
  }

  private static Optional<String> setting(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .filter(value -> !value.isBlank())
        .map(String::trim);
  }
}
