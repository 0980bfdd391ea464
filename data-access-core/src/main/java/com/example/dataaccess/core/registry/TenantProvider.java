package com.example.dataaccess.core.registry;

/**
 * Resolves the tenant of the current caller to the name of a registered data source.
 *
 * <p>Typically backed by a request-scoped or thread-local context. A null or blank result selects
 * the default data source.
 */
@FunctionalInterface
public interface TenantProvider {
  String currentTenant();
}
