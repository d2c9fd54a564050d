package io.intellixity.quarry.core.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;

/**
 * Helpers around the generic row value.\n
 *
 * Every driver converts native rows into Jackson {@link JsonNode}s so one consumer can render all
 * backends the same way: null, boolean, number, string, array and object.\n
 */
public final class Values {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private Values() {}

  public static ObjectMapper mapper() { return MAPPER; }
  public static ObjectNode object() { return NODES.objectNode(); }
  public static ArrayNode array() { return NODES.arrayNode(); }
  public static JsonNode nul() { return NullNode.getInstance(); }
  public static JsonNode text(String s) { return s == null ? nul() : NODES.textNode(s); }

  /** Converts plain Java values (as returned by JDBC or client libraries) into a value node. */
  public static JsonNode of(Object v) {
    if (v == null) return nul();
    if (v instanceof JsonNode n) return n;
    if (v instanceof Boolean b) return NODES.booleanNode(b);
    if (v instanceof Integer i) return NODES.numberNode(i);
    if (v instanceof Long l) return NODES.numberNode(l);
    if (v instanceof Short s) return NODES.numberNode(s);
    if (v instanceof Byte b) return NODES.numberNode(b);
    if (v instanceof Float f) return NODES.numberNode(f);
    if (v instanceof Double d) return NODES.numberNode(d);
    if (v instanceof BigDecimal d) return NODES.numberNode(d);
    if (v instanceof BigInteger i) return NODES.numberNode(i);
    if (v instanceof CharSequence cs) return NODES.textNode(cs.toString());
    if (v instanceof byte[] bytes) return NODES.textNode("\\x" + hex(bytes));
    if (v instanceof Map<?, ?> m) {
      ObjectNode o = object();
      for (Map.Entry<?, ?> e : m.entrySet()) o.set(String.valueOf(e.getKey()), of(e.getValue()));
      return o;
    }
    if (v instanceof Collection<?> c) {
      ArrayNode a = array();
      for (Object x : c) a.add(of(x));
      return a;
    }
    if (v instanceof Object[] arr) {
      ArrayNode a = array();
      for (Object x : arr) a.add(of(x));
      return a;
    }
    return NODES.textNode(v.toString());
  }

  /** Parses JSON text; text that is not valid JSON is kept as a string value. */
  public static JsonNode parseOrText(String json) {
    if (json == null) return nul();
    try {
      return MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      return NODES.textNode(json);
    }
  }

  /** Compact JSON text of a value. */
  public static String toJson(JsonNode v) {
    try {
      return MAPPER.writeValueAsString(v);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize value", e);
    }
  }

  public static String hex(byte[] bytes) {
    char[] out = new char[bytes.length * 2];
    for (int i = 0; i < bytes.length; i++) {
      int b = bytes[i] & 0xff;
      out[i * 2] = HEX[b >>> 4];
      out[i * 2 + 1] = HEX[b & 0x0f];
    }
    return new String(out);
  }
}
