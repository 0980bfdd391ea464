/**
 * Root package for the data-access library.
 *
 * <p>A small set of explicit building blocks for JDBC-based applications: a bounded retry loop,
 * queries that return several result sets at once, and a registry of the data sources an
 * application talks to, built once at startup.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.dataaccess.core.retry.Retry} – runs an operation up to a fixed number of
 *       attempts with a fixed delay, retrying only listed failure kinds.
 *   <li>{@link com.example.dataaccess.core.retry.RetryDefaults} – default policy from system
 *       properties or environment variables.
 *   <li>{@link com.example.dataaccess.core.reactive.ReactiveRetry} – the same contract for
 *       Reactor's {@code Mono}.
 *   <li>{@link com.example.dataaccess.core.sql.DataSetQuery} – executes one statement and decodes
 *       each of its result sets into a typed list.
 *   <li>{@link com.example.dataaccess.core.registry.DataSourceRegistry} – default, named,
 *       master/slave and per-tenant data sources, with retrying repositories over them.
 *   <li>{@link com.example.dataaccess.core.secrets.SecretSettingsLoader} – connection settings
 *       from database secrets in AWS Secrets Manager.
 *   <li>{@link com.example.dataaccess.core.client.RemoteClients} – named HTTP clients resolved
 *       from {@link com.example.dataaccess.core.client.Client} annotations.
 * </ul>
 */
package com.example.dataaccess.core;
