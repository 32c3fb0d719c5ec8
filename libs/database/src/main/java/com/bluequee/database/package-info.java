/**
 * Database support for the Bluequee platform.
 *
 * <p>Flyway owns the schema of the records database. Versioned scripts live under
 * {@code classpath:db/migration/records} and follow the {@code V{n}__{desc}.sql} naming.
 *
 * @see com.bluequee.database.migration.FlywayMigrationConfig
 * @see com.bluequee.database.migration.FlywayConfigProperties
 */
package com.bluequee.database;
