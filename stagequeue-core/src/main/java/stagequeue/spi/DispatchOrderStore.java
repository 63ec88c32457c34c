package stagequeue.spi;

import stagequeue.model.Stage;

import java.sql.Connection;
import java.util.List;
import java.util.OptionalInt;

/**
 * Per-stage dispatch sequence numbers read by downstream stages.
 */
public interface DispatchOrderStore {

    /**
     * Writes sequence numbers {@code 1..N} for {@code orderIds} in list order, overwriting
     * any previous number of those orders in this stage.
     */
    void write(Connection conn, Stage stage, List<String> orderIds);

    OptionalInt find(Connection conn, Stage stage, String orderId);

    /**
     * Forgets the sequence numbers of every order of {@code factoryId} in this stage.
     *
     * @return the number of orders reset
     */
    int clearFactory(Connection conn, Stage stage, String factoryId);
}
