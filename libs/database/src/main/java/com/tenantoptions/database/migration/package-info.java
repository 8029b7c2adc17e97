/**
 * Migration files and Flyway support.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.tenantoptions.database.migration.MigrationDirectory}: the versioned
 *       {@code V0001__description.sql} files of one app
 *   <li>{@link com.tenantoptions.database.migration.MigrationSequence}: allocates the next version
 *       and the migration it depends on
 *   <li>{@link com.tenantoptions.database.migration.MigrationScript}: renders generated migrations
 *   <li>{@link com.tenantoptions.database.migration.FlywayMigrationRunner}: applies an app's
 *       directory into its own history table
 * </ul>
 */
package com.tenantoptions.database.migration;
