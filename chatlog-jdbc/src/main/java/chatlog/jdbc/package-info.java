/**
 * JDBC plumbing shared by the message stores: the statement helper, table name rules,
 * schema scripts and a {@link javax.sql.DataSource} connection provider.
 */
package chatlog.jdbc;
