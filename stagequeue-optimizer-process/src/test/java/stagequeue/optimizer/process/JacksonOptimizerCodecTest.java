package stagequeue.optimizer.process;

import org.junit.jupiter.api.Test;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import stagequeue.model.Stage;
import stagequeue.optimizer.MalformedOptimizerOutputException;
import stagequeue.optimizer.OptimizerOrder;
import stagequeue.optimizer.OptimizerRequest;
import stagequeue.optimizer.OptimizerResult;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JacksonOptimizerCodecTest {
  private final JacksonOptimizerCodec codec = new JacksonOptimizerCodec();

  private OptimizerResult decode(String json) {
    return codec.decode(json.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void decodesBatchesWithExtraFieldsAsMeta() {
    OptimizerResult result = decode("{\"batches\":[{\"id\":\"batch-1\",\"orderIds\":[\"O1\",\"O2\"],"
        + "\"releaseAt\":720,\"window\":{\"start\":480,\"end\":720}}],"
        + "\"deliveryList\":[{\"orderId\":\"O1\"}]}");

    OptimizerResult.Batch batch = result.batches().get(0);
    assertEquals("batch-1", batch.id());
    assertEquals(List.of("O1", "O2"), batch.orderIds());
    assertEquals(720L, batch.releaseAtSimMinute());
    assertNull(batch.score());
    assertEquals(Map.of("start", 480, "end", 720), batch.meta().get("window"));
    assertEquals(List.of("O1", "O2"), result.ranking());
  }

  @Test
  void decodesHoldDecisionsAndPriorities() {
    OptimizerResult result = decode("{\"holdDecisions\":[{\"orderId\":\"O3\","
        + "\"holdUntilSimMinute\":900,\"reason\":\"capacity\"}],"
        + "\"priorities\":[{\"orderId\":\"O1\",\"priority\":0.7,\"dueDate\":1200}],"
        + "\"releaseList\":null}");

    assertEquals(new OptimizerResult.HoldDecision("O3", 900L, "capacity"), result.holdDecisions().get(0));
    assertEquals(new OptimizerResult.Priority("O1", 0.7, 1200L, null), result.priorities().get(0));
    assertNull(result.releaseList());
    assertNull(result.etaList());
  }

  @Test
  void numericIdsAreReadAsText() {
    assertEquals(List.of("17", "4"), decode("{\"releaseList\":[17,4]}").releaseList());
  }

  @Test
  void wrongShapesAreMalformed() {
    assertThrows(MalformedOptimizerOutputException.class, () -> decode("[1,2]"));
    assertThrows(MalformedOptimizerOutputException.class, () -> decode("{\"releaseList\":\"A,B\"}"));
    assertThrows(MalformedOptimizerOutputException.class, () -> decode("{\"releaseList\":[null]}"));
    assertThrows(MalformedOptimizerOutputException.class,
        () -> decode("{\"etaList\":[{\"orderId\":\"A\",\"eta\":\"soon\"}]}"));
    assertThrows(MalformedOptimizerOutputException.class,
        () -> decode("{\"batches\":[{\"id\":\"b\"}]}"));
    assertThrows(MalformedOptimizerOutputException.class, () -> decode("{\"releaseList\":["));
  }

  @Test
  void jsonCodecRoundTripsLogDetails() {
    JacksonJsonCodec json = new JacksonJsonCodec();

    String text = json.toJson(Map.of("releasedOrderIds", List.of("A", "B")));

    assertEquals(List.of("A", "B"), json.parseObject(text).get("releasedOrderIds"));
    assertTrue(json.parseObject(null).isEmpty());
    assertTrue(json.parseObject(" null ").isEmpty());
    assertNull(json.toJson(null));
    assertThrows(IllegalArgumentException.class, () -> json.parseObject("[1]"));
  }

  @Test
  void encodesRequestWithEmbeddedPayloads() throws Exception {
    OptimizerRequest request = new OptimizerRequest("F1", Stage.PRE_INSPECTION, 30,
        List.of(new OptimizerOrder("A", "[\"S1\",\"S2\"]", "not json", Map.of("dueDate", 600))),
        Map.of("horizon", 480));

    JsonNode root = new ObjectMapper().readTree(codec.encode(request));

    assertEquals("PIP", root.get("stage").asText());
    assertEquals(30, root.get("now").asLong());
    JsonNode order = root.get("orders").get(0);
    assertEquals("S2", order.get("payload").get("possibleSequence").get(1).asText());
    assertEquals("not json", order.get("payload").get("processTimes").asText());
    assertEquals(600, order.get("meta").get("dueDate").asInt());
    assertEquals(480, root.get("config").get("horizon").asInt());
  }

  @Test
  void jacksonModulesShareOneVersion() {
    Version databind = com.fasterxml.jackson.databind.cfg.PackageVersion.VERSION;
    Version core = com.fasterxml.jackson.core.json.PackageVersion.VERSION;
    assertEquals(databind.getMajorVersion(), core.getMajorVersion());
    assertEquals(databind.getMinorVersion(), core.getMinorVersion());
  }
}
