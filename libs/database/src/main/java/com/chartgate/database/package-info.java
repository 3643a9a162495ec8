/**
 * Durable stores for the gate.
 *
 * <p>Two logical stores, each migrated by its own Flyway instance and history table:
 *
 * <ul>
 *   <li>accounts: plans, tenants and API keys ({@link com.chartgate.database.jdbc.JdbcKeyRepository})
 *   <li>usage: monthly counters and quota reservations
 *       ({@link com.chartgate.database.jdbc.JdbcUsageStore})
 * </ul>
 *
 * <p>They may point at the same database. {@link com.chartgate.database.StoreConfiguration} wires
 * both into a Spring context.
 */
package com.chartgate.database;
