package com.example;

import static java.lang.System.Logger.Level.INFO;

import com.example.dataaccess.core.registry.DataSourceRegistry;
import com.example.dataaccess.core.registry.HikariDataSourceFactory;
import com.example.dataaccess.core.secrets.SecretSettingsLoader;
import com.example.dataaccess.core.sql.DataSetQuery;
import com.example.dataaccess.core.sql.ResultSetKey;
import java.math.BigDecimal;
import java.sql.SQLException;
import java.util.List;

/** Demo application reading a customer and its orders in one round trip over a HikariCP pool. */
public class App implements AutoCloseable {

  public record Customer(long id, String name) {}

  public record Order(long id, String status, BigDecimal total) {}

  public record CustomerOrders(Customer customer, List<Order> orders) {}

  static final ResultSetKey<Customer> CUSTOMER =
      ResultSetKey.of(0, (rs, rowNum) -> new Customer(rs.getLong("id"), rs.getString("name")));

  static final ResultSetKey<Order> ORDERS =
      ResultSetKey.of(
          1,
          (rs, rowNum) ->
              new Order(rs.getLong("id"), rs.getString("status"), rs.getBigDecimal("total")));

  private final DataSourceRegistry registry;

  /**
   * Constructs the application with a registry whose default pool is configured from the given
   * secret. The AWS client is configured from the environment and released once the secret is read.
   *
   * @param secretId the secret identifier to load from AWS Secrets Manager
   */
  public App(final String secretId) {
    this(secretId, SecretSettingsLoader.fromEnvironment());
  }

  App(final String secretId, final SecretSettingsLoader loader) {
    try (loader) {
      this.registry =
          DataSourceRegistry.builder()
              .factory(new HikariDataSourceFactory("hikaricp-app"))
              .defaultDataSource(loader.load(secretId))
              .build();
    }
  }

  /**
   * Entry point. Loads the secret named by the first argument (default {@code mydb/secret}) and
   * logs the DB time.
   *
   * @param args CLI args, optional secret id
   * @throws Exception on unexpected failures
   */
  public static void main(String[] args) throws Exception {
    final var logger = System.getLogger(App.class.getName());
    final var secretId = args.length > 0 ? args[0] : "mydb/secret";

    try (final var app = new App(secretId)) {
      logger.log(INFO, "DB Time = {0}", app.getString());
    }
  }

  /**
   * Queries the database for the current time with the registry's retry policy.
   *
   * @return the time string returned by the database
   * @throws SQLException if the query fails
   */
  public String getString() throws SQLException {
    return registry
        .repository()
        .execute(
            conn -> {
              try (final var stmt = conn.createStatement();
                  var rs = stmt.executeQuery("SELECT NOW()")) {
                rs.next();
                return rs.getString(1);
              }
            });
  }

  /**
   * Reads a customer and the customer's orders with a single two-result-set statement.
   *
   * @param customerId customer id
   * @return the customer with orders, or {@code null} when there is no such customer
   * @throws SQLException if the query fails
   */
  public CustomerOrders customerOrders(final long customerId) throws SQLException {
    final var dataSet =
        registry
            .repository()
            .query(
                DataSetQuery.text(
                    "SELECT id, name FROM customers WHERE id = ?;"
                        + " SELECT id, status, total FROM orders WHERE customer_id = ? ORDER BY id",
                    customerId,
                    customerId),
                CUSTOMER,
                ORDERS);

    final var customers = dataSet.get(CUSTOMER);
    if (customers.isEmpty()) return null;
    return new CustomerOrders(customers.get(0), dataSet.get(ORDERS));
  }

  /** Closes the pools held by the registry. */
  @Override
  public void close() {
    registry.close();
  }
}
