package stagequeue.batch;

import stagequeue.model.Stage;
import stagequeue.model.StageConfig;
import stagequeue.spi.StageConfigRepository;

import java.sql.Connection;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Decides when a stage of a factory is due to release.
 *
 * <p>Window lifecycle: {@code Closed -> Open(since) -> Closed}. A window opens on an
 * enqueue into a stage whose {@code releaseAfterMinutes > 0} and closes when its batch is
 * released or the pending set turns out empty. With {@code releaseAfterMinutes == 0} the
 * stage is always due and any leftover window marker is ignored until the next release
 * clears it.
 */
public final class BatchWindowController {
  private static final Logger logger = Logger.getLogger(BatchWindowController.class.getName());

  private final StageConfigRepository configRepository;

  public BatchWindowController(StageConfigRepository configRepository) {
    this.configRepository = Objects.requireNonNull(configRepository, "configRepository");
  }

  /**
   * Returns the stage config, creating an immediate-release default if none exists.
   */
  public StageConfig getOrCreate(Connection conn, String factoryId, Stage stage) {
    return configRepository.find(conn, factoryId, stage).orElseGet(() -> {
      configRepository.saveSettings(conn, factoryId, stage, 0, null);
      return configRepository.find(conn, factoryId, stage)
          .orElse(StageConfig.defaults(factoryId, stage));
    });
  }

  /**
   * Opens the window at {@code nowSimMinute} if the stage batches and no window is open.
   *
   * @return {@code true} if a window was opened
   */
  public boolean openIfClosed(Connection conn, StageConfig config, long nowSimMinute) {
    if (config.isImmediate() || config.isWindowOpen()) {
      return false;
    }
    boolean opened = configRepository.openWindow(conn, config.factoryId(), config.stage(), nowSimMinute);
    if (opened) {
      logger.fine(() -> "Opened " + config.stage().code() + " batch window for factory "
          + config.factoryId() + " at " + nowSimMinute);
    }
    return opened;
  }

  /**
   * Evaluates the window against {@code nowSimMinute}. Reads nothing from the store.
   */
  public WindowCheck checkDue(StageConfig config, long nowSimMinute) {
    if (config.isImmediate()) {
      return WindowCheck.immediate();
    }
    if (!config.isWindowOpen()) {
      return WindowCheck.noActiveBatch();
    }
    long dueAt = config.batchStartSimMinute() + config.releaseAfterMinutes();
    if (nowSimMinute >= dueAt) {
      return WindowCheck.matured();
    }
    return WindowCheck.waiting(dueAt - nowSimMinute);
  }

  /**
   * Closes the window.
   *
   * @return {@code true} if a window was open
   */
  public boolean close(Connection conn, String factoryId, Stage stage) {
    return configRepository.closeWindow(conn, factoryId, stage) > 0;
  }

  /**
   * Re-reads the window marker; used to detect a window that was released or reset while
   * an optimizer call was in flight.
   */
  public Long currentWindowStart(Connection conn, String factoryId, Stage stage) {
    return configRepository.find(conn, factoryId, stage)
        .map(StageConfig::batchStartSimMinute)
        .orElse(null);
  }
}
