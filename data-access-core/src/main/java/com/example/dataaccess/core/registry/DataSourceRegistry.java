package com.example.dataaccess.core.registry;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.dataaccess.core.retry.Retry;
import com.example.dataaccess.core.retry.RetryDefaults;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.sql.DataSource;

/**
 * Explicit registry of the data sources an application uses, built once at startup.
 *
 * <p>Holds a default data source, optional named data sources, optional master/slave pairs and an
 * optional {@link TenantProvider} that routes the current caller to one of the named data sources.
 * Lookups hand out {@link Repository} instances that share the registry's retry policy.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var registry = DataSourceRegistry.builder()
 *     .defaultDataSource(mainPool)
 *     .dataSource("reporting", ConnectionSettings.of(reportingUrl, user, password))
 *     .masterSlave("orders", ordersMaster, ordersReplica1, ordersReplica2)
 *     .build();
 *
 * int users = registry.repository().execute(conn -> countUsers(conn));
 * var rows = registry.masterSlaveRepository("orders").read().query(query, ORDERS);
 * }</pre>
 *
 * <h2>Multi-Tenant Routing</h2>
 *
 * <pre>{@code
 * var registry = DataSourceRegistry.builder()
 *     .defaultDataSource(sharedPool)
 *     .dataSource("acme", acmePool)
 *     .dataSource("globex", globexPool)
 *     .tenantProvider(() -> TenantContext.current())
 *     .build();
 *
 * registry.tenantRepository().execute(conn -> loadInvoices(conn));
 * }</pre>
 */
public final class DataSourceRegistry implements AutoCloseable {

  private static final System.Logger logger = System.getLogger(DataSourceRegistry.class.getName());

  private final DataSource defaultDataSource;
  private final Map<String, DataSource> named;
  private final Map<String, MasterSlaveDataSources> masterSlaves;
  private final TenantProvider tenantProvider;
  private final boolean supportMultiple;
  private final boolean supportMasterSlave;
  private final Retry.Policy retryPolicy;

  private DataSourceRegistry(final Builder builder) {
    this.defaultDataSource = builder.defaultDataSource;
    this.named = Collections.unmodifiableMap(new LinkedHashMap<>(builder.named));
    this.masterSlaves = Collections.unmodifiableMap(new LinkedHashMap<>(builder.masterSlaves));
    this.tenantProvider = builder.tenantProvider;
    this.supportMultiple = builder.supportMultiple;
    this.supportMasterSlave = builder.supportMasterSlave;
    this.retryPolicy = builder.retryPolicy;
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  public DataSource defaultDataSource() {
    return defaultDataSource;
  }

  /**
   * Returns the data source registered under {@code name}.
   *
   * @param name registration name
   * @return the data source
   * @throws IllegalStateException if named data sources are disabled
   * @throws IllegalArgumentException if nothing is registered under {@code name}
   */
  public DataSource dataSource(final String name) {
    if (!supportMultiple) throw new IllegalStateException("Named data sources are disabled");
    final var dataSource = named.get(name);
    if (dataSource == null)
      throw new IllegalArgumentException("No data source registered under name: " + name);
    return dataSource;
  }

  /**
   * Returns the master/slave pair registered under {@code name}.
   *
   * @param name registration name
   * @return master and slaves
   * @throws IllegalStateException if master/slave pairs are disabled
   * @throws IllegalArgumentException if nothing is registered under {@code name}
   */
  public MasterSlaveDataSources masterSlave(final String name) {
    if (!supportMasterSlave)
      throw new IllegalStateException("Master/slave data sources are disabled");
    final var pair = masterSlaves.get(name);
    if (pair == null)
      throw new IllegalArgumentException("No master/slave pair registered under name: " + name);
    return pair;
  }

  public Set<String> names() {
    return named.keySet();
  }

  public Retry.Policy retryPolicy() {
    return retryPolicy;
  }

  public Repository repository() {
    return new Repository(defaultDataSource, retryPolicy);
  }

  public Repository repository(final String name) {
    return new Repository(dataSource(name), retryPolicy);
  }

  public MasterSlaveRepository masterSlaveRepository(final String name) {
    return new MasterSlaveRepository(masterSlave(name), retryPolicy);
  }

  /**
   * Returns a repository over the data source of the current tenant.
   *
   * @return tenant repository, or the default repository when no tenant is set
   * @throws IllegalStateException if no tenant provider is configured
   * @throws IllegalArgumentException if the tenant has no registered data source
   */
  public Repository tenantRepository() {
    return new Repository(tenantDataSource(), retryPolicy);
  }

  /**
   * Resolves the data source of the current tenant.
   *
   * @return tenant data source, or the default data source when no tenant is set
   */
  public DataSource tenantDataSource() {
    if (tenantProvider == null) throw new IllegalStateException("No tenant provider configured");
    final var tenant = tenantProvider.currentTenant();
    if (tenant == null || tenant.isBlank()) {
      logger.log(DEBUG, "No current tenant, using default data source");
      return defaultDataSource;
    }
    final var dataSource = named.get(tenant);
    if (dataSource == null)
      throw new IllegalArgumentException("No data source registered for tenant: " + tenant);
    return dataSource;
  }

  /** Closes every distinct data source that is {@link AutoCloseable}. Failures are logged. */
  @Override
  public void close() {
    final Set<DataSource> all = Collections.newSetFromMap(new IdentityHashMap<>());
    all.add(defaultDataSource);
    all.addAll(named.values());
    for (final var pair : masterSlaves.values()) {
      all.add(pair.master());
      all.addAll(pair.slaves());
    }
    all.forEach(DataSourceRegistry::closeDataSource);
    logger.log(INFO, "Closed {0} data source(s)", all.size());
  }

  private static void closeDataSource(final DataSource ds) {
    if (ds instanceof AutoCloseable ac) {
      try {
        ac.close();
      } catch (final Exception e) {
        logger.log(WARNING, "Failed to close DataSource", e);
      }
    }
  }

  /**
   * Builder for {@link DataSourceRegistry}.
   *
   * <p>Defaults: named and master/slave data sources enabled, no tenant provider, pools created by
   * {@link HikariDataSourceFactory}, and a retry policy from {@link RetryDefaults} that retries
   * {@link SQLTransientException} and {@link SQLRecoverableException}.
   */
  public static class Builder {
    private DataSource defaultDataSource;
    private final Map<String, DataSource> named = new LinkedHashMap<>();
    private final Map<String, MasterSlaveDataSources> masterSlaves = new LinkedHashMap<>();
    private TenantProvider tenantProvider;
    private boolean supportMultiple = true;
    private boolean supportMasterSlave = true;
    private DataSourceFactory factory;
    private Retry.Policy retryPolicy;
    private final List<DataSource> created = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the default data source (required).
     *
     * @param dataSource the default data source
     * @return this builder
     */
    public Builder defaultDataSource(final DataSource dataSource) {
      this.defaultDataSource = dataSource;
      return this;
    }

    /**
     * Sets the default data source, created by the configured factory.
     *
     * @param settings connection parameters
     * @return this builder
     */
    public Builder defaultDataSource(final ConnectionSettings settings) {
      return defaultDataSource(create(settings));
    }

    /**
     * Registers a named data source.
     *
     * @param name registration name, also used as tenant identifier
     * @param dataSource the data source
     * @return this builder
     */
    public Builder dataSource(final String name, final DataSource dataSource) {
      requireName(name);
      if (dataSource == null) throw new IllegalArgumentException("dataSource must not be null");
      if (named.putIfAbsent(name, dataSource) != null)
        throw new IllegalArgumentException("Duplicate data source name: " + name);
      return this;
    }

    /**
     * Registers a named data source created by the configured factory.
     *
     * @param name registration name
     * @param settings connection parameters
     * @return this builder
     */
    public Builder dataSource(final String name, final ConnectionSettings settings) {
      requireName(name);
      if (named.containsKey(name))
        throw new IllegalArgumentException("Duplicate data source name: " + name);
      return dataSource(name, create(settings));
    }

    /**
     * Registers a master/slave pair.
     *
     * @param name registration name
     * @param master data source for writes
     * @param slaves data sources for reads
     * @return this builder
     */
    public Builder masterSlave(
        final String name, final DataSource master, final DataSource... slaves) {
      requireName(name);
      final var pair =
          new MasterSlaveDataSources(
              master, slaves == null ? new ArrayList<>() : Arrays.asList(slaves));
      if (masterSlaves.putIfAbsent(name, pair) != null)
        throw new IllegalArgumentException("Duplicate master/slave name: " + name);
      return this;
    }

    /**
     * Sets the tenant provider. When set, {@link DataSourceRegistry#tenantRepository()} routes
     * to the named data source whose name equals the current tenant.
     *
     * @param tenantProvider tenant provider
     * @return this builder
     */
    public Builder tenantProvider(final TenantProvider tenantProvider) {
      this.tenantProvider = tenantProvider;
      return this;
    }

    /**
     * Enables or disables named data sources.
     *
     * <p>Default: true
     *
     * @param supportMultiple whether named lookups are allowed
     * @return this builder
     */
    public Builder supportMultiple(final boolean supportMultiple) {
      this.supportMultiple = supportMultiple;
      return this;
    }

    /**
     * Enables or disables master/slave pairs.
     *
     * <p>Default: true
     *
     * @param supportMasterSlave whether master/slave lookups are allowed
     * @return this builder
     */
    public Builder supportMasterSlave(final boolean supportMasterSlave) {
      this.supportMasterSlave = supportMasterSlave;
      return this;
    }

    /**
     * Sets the factory used for data sources registered by {@link ConnectionSettings}. Must be set
     * before those registrations.
     *
     * <p>Default: {@link HikariDataSourceFactory}
     *
     * @param factory data source factory
     * @return this builder
     */
    public Builder factory(final DataSourceFactory factory) {
      this.factory = factory;
      return this;
    }

    /**
     * Sets the retry policy shared by all repositories.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(final Retry.Policy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Builds the registry. On failure, pools this builder created from {@link ConnectionSettings}
     * are closed.
     *
     * @return configured registry
     * @throws IllegalStateException if required fields are not set or a disabled feature was used
     */
    public DataSourceRegistry build() {
      try {
        validate();
      } catch (final RuntimeException e) {
        created.forEach(DataSourceRegistry::closeDataSource);
        created.clear();
        throw e;
      }
      if (retryPolicy == null)
        retryPolicy =
            RetryDefaults.policy(SQLTransientException.class, SQLRecoverableException.class);
      return new DataSourceRegistry(this);
    }

    private void validate() {
      if (defaultDataSource == null)
        throw new IllegalStateException("defaultDataSource is required");
      if (!supportMultiple && !named.isEmpty())
        throw new IllegalStateException("Named data sources registered but support is disabled");
      if (!supportMasterSlave && !masterSlaves.isEmpty())
        throw new IllegalStateException("Master/slave pairs registered but support is disabled");
      if (tenantProvider != null && !supportMultiple)
        throw new IllegalStateException("Tenant routing requires named data sources");
    }

    private DataSource create(final ConnectionSettings settings) {
      if (factory == null) factory = new HikariDataSourceFactory();
      final var dataSource = factory.create(settings);
      created.add(dataSource);
      return dataSource;
    }

    private static void requireName(final String name) {
      if (name == null || name.isBlank())
        throw new IllegalArgumentException("name must not be blank");
    }
  }
}
