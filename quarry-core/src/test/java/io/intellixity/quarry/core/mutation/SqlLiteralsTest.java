package io.intellixity.quarry.core.mutation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.quarry.core.value.Values;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqlLiteralsTest {

  @Test
  void escapesEmbeddedDoubleQuotes() {
    assertEquals("a\"\"b", SqlLiterals.escapeIdent("a\"b"));
    assertEquals("\"a\"\"b\"", SqlLiterals.quoteIdent("a\"b"));
  }

  @Test
  void quotedIdentifierHasBalancedQuotes() {
    String q = SqlLiterals.quoteIdent("we\"ird\"\"name");
    assertTrue(q.startsWith("\"") && q.endsWith("\""));
    String inner = q.substring(1, q.length() - 1);
    // every quote inside must come in pairs
    assertEquals("we\"ird\"\"name", inner.replace("\"\"", "\""));
    assertEquals(0, inner.replace("\"\"", "").chars().filter(c -> c == '"').count());
  }

  @Test
  void formatsScalars() {
    assertEquals("NULL", SqlLiterals.formatLiteral(null));
    assertEquals("NULL", SqlLiterals.formatLiteral(Values.nul()));
    assertEquals("TRUE", SqlLiterals.formatLiteral(Values.of(true)));
    assertEquals("FALSE", SqlLiterals.formatLiteral(Values.of(false)));
    assertEquals("42", SqlLiterals.formatLiteral(Values.of(42)));
    assertEquals("-1.5", SqlLiterals.formatLiteral(Values.of(-1.5)));
    assertEquals("12.5", SqlLiterals.formatLiteral(Values.of(new BigDecimal("12.5"))));
    assertEquals("'O''Brien'", SqlLiterals.formatLiteral(Values.of("O'Brien")));
  }

  @Test
  void formatsArraysAndObjectsAsQuotedJson() {
    assertEquals("'[1,\"x\"]'", SqlLiterals.formatLiteral(Values.of(List.of(1, "x"))));

    ObjectNode o = Values.object();
    o.put("note", "it's");
    assertEquals("'{\"note\":\"it''s\"}'", SqlLiterals.formatLiteral(o));
  }
}
