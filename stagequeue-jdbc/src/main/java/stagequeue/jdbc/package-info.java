/**
 * JDBC persistence for the stage scheduler.
 *
 * <p>{@link stagequeue.jdbc.JdbcStageStores} bundles one store per SPI under a shared table
 * prefix; the reference DDL ships as {@code stagequeue/jdbc/schema.sql}.
 *
 * @see stagequeue.jdbc.JdbcStageStores
 * @see stagequeue.jdbc.JdbcTemplate
 */
package stagequeue.jdbc;
