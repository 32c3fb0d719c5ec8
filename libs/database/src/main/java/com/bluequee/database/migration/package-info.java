/**
 * Flyway configuration for the records database.
 *
 * <ul>
 *   <li>{@link com.bluequee.database.migration.FlywayConfigProperties} binds
 *       {@code bluequee.flyway.*}
 *   <li>{@link com.bluequee.database.migration.FlywayMigrationConfig} creates the Flyway bean and
 *       migrates on startup
 * </ul>
 */
package com.bluequee.database.migration;
