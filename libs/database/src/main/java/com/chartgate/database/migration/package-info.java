/**
 * Flyway configuration and migration status.
 *
 * <ul>
 *   <li>{@link com.chartgate.database.migration.FlywayConfigProperties}: per-store connection and
 *       migration settings
 *   <li>{@link com.chartgate.database.migration.MigrationService}: runs and reports migrations
 * </ul>
 */
package com.chartgate.database.migration;
