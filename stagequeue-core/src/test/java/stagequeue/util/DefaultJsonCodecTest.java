package stagequeue.util;

import org.junit.jupiter.api.Test;
import stagequeue.model.Stage;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJsonCodecTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void toJsonWithNullMap() {
    assertNull(codec.toJson(null));
  }

  @Test
  void toJsonWritesNestedValuesInOrder() {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("releasedOrderIds", List.of("A", "B"));
    details.put("reorderCount", 2);
    details.put("optimized", true);
    details.put("optimizer", null);
    details.put("stage", Stage.PRE_INSPECTION);
    details.put("batch", Map.of("size", 3));

    String json = codec.toJson(details);

    assertEquals("{\"releasedOrderIds\":[\"A\",\"B\"],\"reorderCount\":2,\"optimized\":true,"
        + "\"optimizer\":null,\"stage\":\"PRE_INSPECTION\",\"batch\":{\"size\":3}}", json);
  }

  @Test
  void toJsonEscapesSpecialCharacters() {
    String json = codec.toJson(Map.of("error", "bad \"input\"\nline\\two\u0001"));

    assertTrue(json.contains("\\\"input\\\""));
    assertTrue(json.contains("\\n"));
    assertTrue(json.contains("\\\\"));
    assertTrue(json.contains("\\u0001"));
  }

  @Test
  void nonFiniteNumbersBecomeNull() {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("nan", Double.NaN);
    details.put("inf", Float.POSITIVE_INFINITY);

    assertEquals("{\"nan\":null,\"inf\":null}", codec.toJson(details));
  }

  @Test
  void toJsonWithNullKeyThrows() {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put(null, "value");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> codec.toJson(details));
    assertTrue(ex.getMessage().contains("null keys"));
  }

  @Test
  void toJsonWithUnsupportedTypeThrows() {
    assertThrows(IllegalArgumentException.class, () -> codec.toJson(Map.of("x", new Object())));
  }

  @Test
  void parseObjectDecodesNumbersBooleansAndNesting() {
    Map<String, Object> parsed = codec.parseObject(
        "{ \"count\": 3, \"ratio\": 0.5, \"ok\": false, \"none\": null,"
            + " \"ids\": [\"A\", 7], \"nested\": {\"k\": \"v\"} }");

    assertEquals(3L, parsed.get("count"));
    assertEquals(0.5, parsed.get("ratio"));
    assertEquals(false, parsed.get("ok"));
    assertTrue(parsed.containsKey("none"));
    assertNull(parsed.get("none"));
    assertEquals(List.of("A", 7L), parsed.get("ids"));
    assertEquals(Map.of("k", "v"), parsed.get("nested"));
  }

  @Test
  void parseObjectHandlesEscapes() {
    Map<String, Object> parsed = codec.parseObject("{\"s\":\"a\\\"b\\\\c\\nd\\u0041\\/\"}");

    assertEquals("a\"b\\c\ndA/", parsed.get("s"));
  }

  @Test
  void parseObjectReturnsEmptyForBlankInput() {
    assertTrue(codec.parseObject(null).isEmpty());
    assertTrue(codec.parseObject("  ").isEmpty());
    assertTrue(codec.parseObject("null").isEmpty());
    assertTrue(codec.parseObject("{}").isEmpty());
  }

  @Test
  void parseObjectRejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1,2]"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":1"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":1} extra"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":tru}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"open}"));
  }

  @Test
  void encodedDetailsParseBack() {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("simMinute", 120L);
    details.put("releaseList", List.of("C", "A"));

    assertEquals(details, codec.parseObject(codec.toJson(details)));
  }
}
