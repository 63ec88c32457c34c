/**
 * Spring Boot auto-configuration for the stage scheduler.
 *
 * <p>Add the starter, a {@code DataSource} and the tables from
 * {@code stagequeue/jdbc/schema.sql}; a {@link stagequeue.StageScheduler} bean is created
 * from {@code stagequeue.*} properties.
 */
package stagequeue.spring.boot;
