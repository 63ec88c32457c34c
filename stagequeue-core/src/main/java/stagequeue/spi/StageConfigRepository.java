package stagequeue.spi;

import stagequeue.model.Stage;
import stagequeue.model.StageConfig;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Per-factory, per-stage release settings and batch-window markers.
 *
 * @see stagequeue.jdbc.store.JdbcStageConfigRepository
 */
public interface StageConfigRepository {

    Optional<StageConfig> find(Connection conn, String factoryId, Stage stage);

    List<StageConfig> findByFactory(Connection conn, String factoryId);

    /**
     * Inserts or updates the release settings of a stage. The window marker of an
     * existing row is left untouched; a new row starts with a closed window.
     *
     * @param optimizerScript script path, or {@code null} for none
     */
    void saveSettings(Connection conn, String factoryId, Stage stage, int releaseAfterMinutes,
        String optimizerScript);

    /**
     * Opens the batch window if it is closed.
     *
     * @return {@code true} if this call opened the window, {@code false} if it was already open
     *     or no config row exists
     */
    boolean openWindow(Connection conn, String factoryId, Stage stage, long simMinute);

    /**
     * Closes the batch window.
     *
     * @return the number of rows updated (0 if already closed)
     */
    int closeWindow(Connection conn, String factoryId, Stage stage);

    /**
     * Closes every open batch window.
     *
     * @return the number of rows updated
     */
    int closeAllWindows(Connection conn);
}
