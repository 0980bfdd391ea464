package com.example.dataaccess.core.registry;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.dataaccess.core.retry.Retry;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;
import org.junit.jupiter.api.*;

class DataSourceRegistryTest {

  private final DataSource main = mock(DataSource.class);
  private final DataSource acme = mock(DataSource.class);
  private final DataSource globex = mock(DataSource.class);

  @Nested
  @DisplayName("Lookups")
  class Lookups {

    @Test
    @DisplayName("Should return registered data sources by name")
    void shouldReturnNamedDataSources() {
      final var registry =
          DataSourceRegistry.builder()
              .defaultDataSource(main)
              .dataSource("acme", acme)
              .dataSource("globex", globex)
              .build();

      assertSame(main, registry.defaultDataSource());
      assertSame(acme, registry.dataSource("acme"));
      assertSame(globex, registry.repository("globex").dataSource());
      assertSame(main, registry.repository().dataSource());
      assertEquals(List.of("acme", "globex"), List.copyOf(registry.names()));
    }

    @Test
    @DisplayName("Should reject unknown names")
    void shouldRejectUnknownNames() {
      final var registry = DataSourceRegistry.builder().defaultDataSource(main).build();

      assertThrows(IllegalArgumentException.class, () -> registry.dataSource("missing"));
      assertThrows(IllegalArgumentException.class, () -> registry.masterSlave("missing"));
    }

    @Test
    @DisplayName("Should create data sources from settings with the configured factory")
    void shouldCreateFromSettings() {
      final var created = new ArrayList<ConnectionSettings>();
      final DataSourceFactory factory =
          settings -> {
            created.add(settings);
            return settings.jdbcUrl().contains("reporting") ? acme : main;
          };

      final var registry =
          DataSourceRegistry.builder()
              .factory(factory)
              .defaultDataSource(ConnectionSettings.of("jdbc:postgresql://db/main", "app", "pw"))
              .dataSource(
                  "reporting", ConnectionSettings.of("jdbc:postgresql://db/reporting", "ro", "pw"))
              .build();

      assertEquals(2, created.size());
      assertSame(main, registry.defaultDataSource());
      assertSame(acme, registry.dataSource("reporting"));
    }

    @Test
    @DisplayName("Should share the configured retry policy across repositories")
    void shouldShareRetryPolicy() {
      final var policy = Retry.Policy.of(5, Duration.ofMillis(20), SQLException.class);
      final var registry =
          DataSourceRegistry.builder()
              .defaultDataSource(main)
              .masterSlave("orders", acme, globex)
              .retryPolicy(policy)
              .build();

      assertSame(policy, registry.retryPolicy());
      assertSame(policy, registry.repository().policy());
      assertSame(policy, registry.masterSlaveRepository("orders").read().policy());
    }

    @Test
    @DisplayName("Should default to a policy retrying transient SQL failures")
    void shouldDefaultRetryPolicy() {
      final var policy = DataSourceRegistry.builder().defaultDataSource(main).build().retryPolicy();

      assertTrue(policy.isRecoverable(new SQLTransientConnectionException("reset")));
      assertTrue(policy.isRecoverable(new SQLRecoverableException("lost")));
      assertFalse(policy.isRecoverable(new SQLException("syntax")));
    }
  }

  @Nested
  @DisplayName("Master/Slave")
  class MasterSlave {

    @Test
    @DisplayName("Writes go to the master and reads rotate over slaves")
    void shouldRouteWritesAndReads() {
      final var registry =
          DataSourceRegistry.builder()
              .defaultDataSource(main)
              .masterSlave("orders", main, acme, globex)
              .build();
      final var orders = registry.masterSlaveRepository("orders");

      assertSame(main, orders.write().dataSource());
      assertSame(acme, orders.read().dataSource());
      assertSame(globex, orders.read().dataSource());
      assertSame(acme, orders.read().dataSource());
    }

    @Test
    @DisplayName("Reads fall back to the master without slaves")
    void shouldFallBackToMaster() {
      final var pair = new MasterSlaveDataSources(main, List.of());

      assertSame(main, pair.slave());
      assertSame(main, pair.slave());
    }

    @Test
    @DisplayName("Should reject null master or null slaves")
    void shouldRejectNulls() {
      assertThrows(
          IllegalArgumentException.class, () -> new MasterSlaveDataSources(null, List.of()));
      assertThrows(IllegalArgumentException.class, () -> new MasterSlaveDataSources(main, null));
      assertThrows(
          IllegalArgumentException.class,
          () -> new MasterSlaveDataSources(main, Arrays.asList(acme, null)));
    }
  }

  @Nested
  @DisplayName("Tenant Routing")
  class TenantRouting {

    private String tenant;

    private DataSourceRegistry registry() {
      return DataSourceRegistry.builder()
          .defaultDataSource(main)
          .dataSource("acme", acme)
          .dataSource("globex", globex)
          .tenantProvider(() -> tenant)
          .build();
    }

    @Test
    @DisplayName("Should route to the current tenant's data source")
    void shouldRouteToTenant() {
      final var registry = registry();

      tenant = "acme";
      assertSame(acme, registry.tenantDataSource());
      tenant = "globex";
      assertSame(globex, registry.tenantRepository().dataSource());
    }

    @Test
    @DisplayName("Should use the default data source without a current tenant")
    void shouldUseDefaultWithoutTenant() {
      final var registry = registry();

      tenant = null;
      assertSame(main, registry.tenantDataSource());
      tenant = "  ";
      assertSame(main, registry.tenantDataSource());
    }

    @Test
    @DisplayName("Should reject a tenant without a data source")
    void shouldRejectUnknownTenant() {
      final var registry = registry();
      tenant = "initech";

      assertThrows(IllegalArgumentException.class, registry::tenantDataSource);
    }

    @Test
    @DisplayName("Should fail when no tenant provider is configured")
    void shouldFailWithoutProvider() {
      final var registry = DataSourceRegistry.builder().defaultDataSource(main).build();

      assertThrows(IllegalStateException.class, registry::tenantRepository);
    }
  }

  @Nested
  @DisplayName("Validation & Error Handling")
  class ValidationAndErrorHandling {

    @Test
    @DisplayName("Build should require a default data source")
    void shouldRequireDefault() {
      assertThrows(IllegalStateException.class, () -> DataSourceRegistry.builder().build());
    }

    @Test
    @DisplayName("Should reject duplicate and blank names")
    void shouldRejectDuplicateNames() {
      final var builder = DataSourceRegistry.builder().dataSource("acme", acme);

      assertThrows(IllegalArgumentException.class, () -> builder.dataSource("acme", globex));
      assertThrows(IllegalArgumentException.class, () -> builder.dataSource(" ", globex));
      builder.masterSlave("orders", main);
      assertThrows(IllegalArgumentException.class, () -> builder.masterSlave("orders", acme));
    }

    @Test
    @DisplayName("Duplicate name from settings should fail before a pool is created")
    void duplicateNameShouldNotCreatePool() {
      final var created = new AtomicInteger();
      final var builder =
          DataSourceRegistry.builder()
              .factory(
                  settings -> {
                    created.incrementAndGet();
                    return acme;
                  })
              .dataSource("acme", acme);

      assertThrows(
          IllegalArgumentException.class,
          () ->
              builder.dataSource(
                  "acme", ConnectionSettings.of("jdbc:postgresql://db/a", "u", "p")));
      assertEquals(0, created.get());
    }

    @Test
    @DisplayName("Failed build should close pools created from settings")
    void failedBuildShouldClosePools() throws Exception {
      final var pooled =
          mock(DataSource.class, withSettings().extraInterfaces(AutoCloseable.class));
      final var builder =
          DataSourceRegistry.builder()
              .factory(settings -> pooled)
              .supportMultiple(false)
              .defaultDataSource(main)
              .dataSource("reporting", ConnectionSettings.of("jdbc:postgresql://db/r", "u", "p"));

      assertThrows(IllegalStateException.class, builder::build);
      verify((AutoCloseable) pooled, times(1)).close();
    }

    @Test
    @DisplayName("Disabled features should fail at build and lookup")
    void disabledFeaturesShouldFail() {
      assertThrows(
          IllegalStateException.class,
          () ->
              DataSourceRegistry.builder()
                  .defaultDataSource(main)
                  .supportMultiple(false)
                  .dataSource("acme", acme)
                  .build());
      assertThrows(
          IllegalStateException.class,
          () ->
              DataSourceRegistry.builder()
                  .defaultDataSource(main)
                  .supportMasterSlave(false)
                  .masterSlave("orders", main, acme)
                  .build());
      assertThrows(
          IllegalStateException.class,
          () ->
              DataSourceRegistry.builder()
                  .defaultDataSource(main)
                  .supportMultiple(false)
                  .tenantProvider(() -> "acme")
                  .build());

      final var registry =
          DataSourceRegistry.builder()
              .defaultDataSource(main)
              .supportMultiple(false)
              .supportMasterSlave(false)
              .build();
      assertThrows(IllegalStateException.class, () -> registry.dataSource("acme"));
      assertThrows(IllegalStateException.class, () -> registry.masterSlave("orders"));
    }
  }

  @Nested
  @DisplayName("Close")
  class Close {

    @Test
    @DisplayName("Should close each closeable data source once and keep going on failure")
    void shouldCloseDistinctDataSources() throws Exception {
      final var pooled =
          mock(DataSource.class, withSettings().extraInterfaces(AutoCloseable.class));
      final var failing =
          mock(DataSource.class, withSettings().extraInterfaces(AutoCloseable.class));
      doThrow(new IllegalStateException("already closed")).when((AutoCloseable) failing).close();

      final var registry =
          DataSourceRegistry.builder()
              .defaultDataSource(pooled)
              .dataSource("acme", failing)
              .dataSource("plain", acme)
              .masterSlave("orders", pooled, failing)
              .build();

      registry.close();

      verify((AutoCloseable) pooled, times(1)).close();
      verify((AutoCloseable) failing, times(1)).close();
    }
  }
}
