/**
 * Service Provider Interfaces (SPI) for plugging persistence, connection provisioning
 * and metrics into the scheduler.
 *
 * <p>Every store method receives the caller's {@link java.sql.Connection}; the scheduler
 * decides auto-commit and transaction boundaries.
 *
 * @see stagequeue.spi.ConnectionProvider
 * @see stagequeue.spi.QueueStore
 * @see stagequeue.spi.StageConfigRepository
 * @see stagequeue.spi.MetricsExporter
 */
package stagequeue.spi;
