/**
 * JDBC persistence of the permission matrix.
 *
 * <p>The schema and seed are Flyway migrations under {@code db/migration/policy}:
 *
 * <ul>
 *   <li>{@code V1__permission_matrix.sql} creates {@code permissions} and {@code role_permissions}
 *   <li>{@code V2__seed_permissions.sql} provisions every module and action, and the default
 *       grants of each non-admin role
 * </ul>
 *
 * <p>{@link com.wayfarer.database.PolicyStoreConfig} runs them lazily through the guarded
 * initializer of the security library.
 *
 * @see com.wayfarer.database.JdbcPermissionStore
 */
package com.wayfarer.database;
