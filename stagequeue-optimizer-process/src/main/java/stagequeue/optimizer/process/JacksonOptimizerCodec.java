package stagequeue.optimizer.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import stagequeue.optimizer.MalformedOptimizerOutputException;
import stagequeue.optimizer.OptimizerOrder;
import stagequeue.optimizer.OptimizerRequest;
import stagequeue.optimizer.OptimizerResult;
import stagequeue.optimizer.OptimizerResult.Batch;
import stagequeue.optimizer.OptimizerResult.EtaPrediction;
import stagequeue.optimizer.OptimizerResult.HoldDecision;
import stagequeue.optimizer.OptimizerResult.Priority;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON wire format between the scheduler and an optimizer script.
 *
 * <p>Request:
 * <pre>{@code
 * {"factoryId": "F1", "stage": "PIP", "now": 480,
 *  "orders": [{"id": "O1",
 *              "payload": {"possibleSequence": [...], "processTimes": {...}},
 *              "meta": {"queuedAtSimMinute": 450, "dueDate": 900, ...}}],
 *  "config": {"releaseAfterMinutes": 30, "batchPolicy": {...}, ...}}
 * }</pre>
 *
 * <p>Response: a JSON object with any of {@code batches}, {@code releaseList},
 * {@code etaList}, {@code priorities}, {@code holdDecisions} and {@code debug}. Unknown
 * fields are ignored; a field with the wrong shape makes the whole output malformed.
 */
public final class JacksonOptimizerCodec {
  private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper();

  private final ObjectMapper mapper;

  public JacksonOptimizerCodec() {
    this(DEFAULT_MAPPER);
  }

  public JacksonOptimizerCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public byte[] encode(OptimizerRequest request) {
    ObjectNode root = mapper.createObjectNode();
    root.put("factoryId", request.factoryId());
    root.put("stage", request.stage().code());
    root.put("now", request.nowSimMinute());
    ArrayNode orders = root.putArray("orders");
    for (OptimizerOrder order : request.orders()) {
      ObjectNode item = orders.addObject();
      item.put("id", order.id());
      ObjectNode payload = item.putObject("payload");
      payload.set("possibleSequence", opaque(order.possibleSequence()));
      payload.set("processTimes", opaque(order.processTimes()));
      item.set("meta", mapper.valueToTree(order.meta()));
    }
    root.set("config", mapper.valueToTree(request.config()));
    try {
      return mapper.writeValueAsBytes(root);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode optimizer request", e);
    }
  }

  // payloads are stored as JSON text; embed them as JSON when they parse
  private JsonNode opaque(String text) {
    if (text == null || text.isBlank()) {
      return NullNode.getInstance();
    }
    try {
      return mapper.readTree(text);
    } catch (JsonProcessingException e) {
      return TextNode.valueOf(text);
    }
  }

  /**
   * @throws MalformedOptimizerOutputException if the output is empty, not JSON, not an
   *     object, or a known field has the wrong shape
   */
  public OptimizerResult decode(byte[] output) {
    JsonNode root;
    try {
      root = output.length == 0 ? null : mapper.readTree(output);
    } catch (JsonProcessingException e) {
      throw new MalformedOptimizerOutputException("Optimizer output is not JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new MalformedOptimizerOutputException("Optimizer output could not be read: " + e.getMessage(), e);
    }
    if (root == null || root.isMissingNode()) {
      throw new MalformedOptimizerOutputException("Optimizer produced no output");
    }
    if (!root.isObject()) {
      throw new MalformedOptimizerOutputException("Optimizer output is not a JSON object");
    }
    OptimizerResult result = new OptimizerResult(
        batches(root.get("batches")),
        idList(root.get("releaseList"), "releaseList"),
        etas(root.get("etaList")),
        priorities(root.get("priorities")),
        holds(root.get("holdDecisions")),
        debug(root.get("debug")));
    result.validate();
    return result;
  }

  private List<Batch> batches(JsonNode node) {
    if (absent(node)) {
      return null;
    }
    List<Batch> batches = new ArrayList<>();
    for (JsonNode item : array(node, "batches")) {
      object(item, "batches");
      Map<String, Object> meta = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        if (!List.of("id", "orderIds", "releaseAt", "score").contains(field.getKey())) {
          meta.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
        }
      }
      batches.add(new Batch(
          text(item.get("id"), "batches.id"),
          idList(item.get("orderIds"), "batches.orderIds"),
          integral(item.get("releaseAt"), "batches.releaseAt"),
          number(item.get("score"), "batches.score"),
          meta));
    }
    return batches;
  }

  private List<EtaPrediction> etas(JsonNode node) {
    if (absent(node)) {
      return null;
    }
    List<EtaPrediction> etas = new ArrayList<>();
    for (JsonNode item : array(node, "etaList")) {
      object(item, "etaList");
      etas.add(new EtaPrediction(
          text(item.get("orderId"), "etaList.orderId"),
          number(item.get("eta"), "etaList.eta"),
          number(item.get("lower"), "etaList.lower"),
          number(item.get("upper"), "etaList.upper"),
          number(item.get("confidence"), "etaList.confidence")));
    }
    return etas;
  }

  private List<Priority> priorities(JsonNode node) {
    if (absent(node)) {
      return null;
    }
    List<Priority> priorities = new ArrayList<>();
    for (JsonNode item : array(node, "priorities")) {
      object(item, "priorities");
      priorities.add(new Priority(
          text(item.get("orderId"), "priorities.orderId"),
          number(item.get("priority"), "priorities.priority"),
          integral(item.get("dueDate"), "priorities.dueDate"),
          integral(item.get("expectedCompletion"), "priorities.expectedCompletion")));
    }
    return priorities;
  }

  private List<HoldDecision> holds(JsonNode node) {
    if (absent(node)) {
      return null;
    }
    List<HoldDecision> holds = new ArrayList<>();
    for (JsonNode item : array(node, "holdDecisions")) {
      object(item, "holdDecisions");
      holds.add(new HoldDecision(
          text(item.get("orderId"), "holdDecisions.orderId"),
          integral(item.get("holdUntilSimMinute"), "holdDecisions.holdUntilSimMinute"),
          text(item.get("reason"), "holdDecisions.reason")));
    }
    return holds;
  }

  private List<Object> debug(JsonNode node) {
    if (absent(node)) {
      return null;
    }
    List<Object> debug = new ArrayList<>();
    if (node.isArray()) {
      for (JsonNode item : node) {
        debug.add(mapper.convertValue(item, Object.class));
      }
    } else {
      debug.add(mapper.convertValue(node, Object.class));
    }
    return debug;
  }

  private static List<String> idList(JsonNode node, String field) {
    if (absent(node)) {
      return null;
    }
    List<String> ids = new ArrayList<>();
    for (JsonNode item : array(node, field)) {
      ids.add(text(item, field));
    }
    return ids;
  }

  private static boolean absent(JsonNode node) {
    return node == null || node.isNull();
  }

  private static ArrayNode array(JsonNode node, String field) {
    if (!node.isArray()) {
      throw new MalformedOptimizerOutputException(field + " must be an array");
    }
    return (ArrayNode) node;
  }

  private static void object(JsonNode node, String field) {
    if (node == null || !node.isObject()) {
      throw new MalformedOptimizerOutputException(field + " entries must be objects");
    }
  }

  private static String text(JsonNode node, String field) {
    if (absent(node)) {
      return null;
    }
    if (!node.isValueNode()) {
      throw new MalformedOptimizerOutputException(field + " must be a scalar");
    }
    return node.asText();
  }

  private static Double number(JsonNode node, String field) {
    if (absent(node)) {
      return null;
    }
    if (!node.isNumber()) {
      throw new MalformedOptimizerOutputException(field + " must be a number");
    }
    return node.doubleValue();
  }

  private static Long integral(JsonNode node, String field) {
    Double value = number(node, field);
    return value == null ? null : Math.round(value);
  }
}
