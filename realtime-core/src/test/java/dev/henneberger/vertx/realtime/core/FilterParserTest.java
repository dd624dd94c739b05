package dev.henneberger.vertx.realtime.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonObject;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FilterParserTest {

  @Test
  void objectFormUsesEqualityForLiterals() {
    RowFilter filter = FilterParser.parse(new JsonObject().put("user_id", 42));

    assertTrue(filter.test(row("user_id", 42)));
    assertTrue(filter.test(row("user_id", 42L)));
    assertTrue(filter.test(row("user_id", "42")));
    assertFalse(filter.test(row("user_id", 7)));
    assertFalse(filter.test(row("other", 42)));
  }

  @Test
  void objectFormAcceptsOperatorValues() {
    RowFilter filter = FilterParser.parse(new JsonObject().put("amount", "gt.5").put("status", "neq.void"));

    assertTrue(filter.test(row("amount", 10, "status", "paid")));
    assertFalse(filter.test(row("amount", 5, "status", "paid")));
    assertFalse(filter.test(row("amount", 10, "status", "void")));
  }

  @Test
  void stringFormSupportsAllOperators() {
    assertTrue(FilterParser.parse("n=gte.5").test(row("n", 5)));
    assertTrue(FilterParser.parse("n=lt.5").test(row("n", 4.5)));
    assertFalse(FilterParser.parse("n=lte.5").test(row("n", 6)));
    assertTrue(FilterParser.parse("name=like.Jo%").test(row("name", "John")));
    assertFalse(FilterParser.parse("name=like.jo%").test(row("name", "John")));
    assertTrue(FilterParser.parse("name=ilike.jo*").test(row("name", "John")));
    assertTrue(FilterParser.parse("status=in.(open,paid)").test(row("status", "paid")));
    assertFalse(FilterParser.parse("status=in.(open,paid)").test(row("status", "void")));
    assertTrue(FilterParser.parse("deleted_at=is.null").test(row("other", 1)));
    assertTrue(FilterParser.parse("active=is.true").test(row("active", true)));
    assertFalse(FilterParser.parse("active=is.false").test(row("active", true)));
  }

  @Test
  void termsAreAndedAndInListsMayContainCommas() {
    RowFilter filter = FilterParser.parse("user_id=eq.42,status=in.(open,paid)");

    assertEquals(2, filter.predicates().size());
    assertTrue(filter.test(row("user_id", 42, "status", "open")));
    assertFalse(filter.test(row("user_id", 42, "status", "void")));
  }

  @Test
  void emptyFilterMatchesEverything() {
    assertTrue(FilterParser.parse(null).isMatchAll());
    assertTrue(FilterParser.parse("").isMatchAll());
    assertTrue(FilterParser.parse(new JsonObject()).test(row("anything", 1)));
  }

  @Test
  void rejectsInvalidFilters() {
    assertInvalid("user_id");
    assertInvalid("user_id=between.1");
    assertInvalid("1abc=eq.1");
    assertInvalid("status=in.open");
    assertInvalid("flag=is.maybe");
    assertInvalid("a=eq.1,,b=eq.2");
    assertInvalid(new JsonObject().put("nested", new JsonObject().put("a", 1)));
    assertInvalid(42);
  }

  private static void assertInvalid(Object filter) {
    SubscriptionException error = assertThrows(SubscriptionException.class, () -> FilterParser.parse(filter));
    assertEquals(SubscriptionException.INVALID_FILTER, error.code());
  }

  private static Map<String, Object> row(Object... keyValues) {
    Map<String, Object> row = new HashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      row.put((String) keyValues[i], keyValues[i + 1]);
    }
    return row;
  }
}
