package dev.henneberger.vertx.realtime.core;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses subscription filters into a {@link RowFilter}.
 *
 * <p>Two forms are accepted. A JSON object maps columns either to a literal (equality) or to an
 * {@code op.value} string such as {@code "gt.5"}. A string holds comma separated
 * {@code column=op.value} terms, for example {@code user_id=eq.42,status=in.(open,paid)}.
 * All predicates must hold.
 */
public final class FilterParser {

  private FilterParser() {
  }

  public static RowFilter parse(Object filter) {
    if (filter == null) {
      return RowFilter.matchAll();
    }
    if (filter instanceof Map) {
      filter = new JsonObject(castMap(filter));
    }
    if (filter instanceof JsonObject) {
      return parseObject((JsonObject) filter);
    }
    if (filter instanceof String) {
      return parseString((String) filter);
    }
    throw invalid("filter must be an object or a string");
  }

  private static RowFilter parseObject(JsonObject json) {
    List<RowFilter.Predicate> predicates = new ArrayList<>();
    for (Map.Entry<String, Object> entry : json) {
      String column = requireColumn(entry.getKey());
      Object value = entry.getValue();
      if (value == null) {
        predicates.add(new RowFilter.Predicate(column, RowFilter.Operator.IS, nullOperand()));
      } else if (value instanceof String && hasOperatorPrefix((String) value)) {
        predicates.add(parseTerm(column, (String) value));
      } else if (value instanceof JsonObject || value instanceof JsonArray
        || value instanceof Map || value instanceof List) {
        throw invalid("filter value for '" + column + "' must be a scalar");
      } else {
        predicates.add(new RowFilter.Predicate(column, RowFilter.Operator.EQ, List.of(value)));
      }
    }
    return predicates.isEmpty() ? RowFilter.matchAll() : new RowFilter(predicates);
  }

  private static RowFilter parseString(String filter) {
    String trimmed = filter.trim();
    if (trimmed.isEmpty()) {
      return RowFilter.matchAll();
    }
    List<RowFilter.Predicate> predicates = new ArrayList<>();
    for (String term : splitTerms(trimmed)) {
      int eq = term.indexOf('=');
      if (eq <= 0) {
        throw invalid("filter term '" + term + "' must look like column=op.value");
      }
      String column = requireColumn(term.substring(0, eq).trim());
      predicates.add(parseTerm(column, term.substring(eq + 1).trim()));
    }
    return new RowFilter(predicates);
  }

  private static RowFilter.Predicate parseTerm(String column, String expression) {
    int dot = expression.indexOf('.');
    if (dot <= 0) {
      throw invalid("filter for '" + column + "' must look like op.value");
    }
    RowFilter.Operator operator = operator(expression.substring(0, dot));
    String operand = expression.substring(dot + 1);

    switch (operator) {
      case IS:
        switch (operand.toLowerCase(Locale.ROOT)) {
          case "null":
            return new RowFilter.Predicate(column, operator, nullOperand());
          case "true":
            return new RowFilter.Predicate(column, operator, List.of(Boolean.TRUE));
          case "false":
            return new RowFilter.Predicate(column, operator, List.of(Boolean.FALSE));
          default:
            throw invalid("is. accepts null, true or false");
        }
      case IN:
        if (!operand.startsWith("(") || !operand.endsWith(")") || operand.length() < 3) {
          throw invalid("in. expects a list like in.(a,b)");
        }
        List<Object> values = new ArrayList<>();
        for (String value : operand.substring(1, operand.length() - 1).split(",")) {
          values.add(unquote(value.trim()));
        }
        return new RowFilter.Predicate(column, operator, values);
      default:
        return new RowFilter.Predicate(column, operator, List.of(operand));
    }
  }

  private static List<String> splitTerms(String filter) {
    List<String> terms = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < filter.length(); i++) {
      char c = filter.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (c == ',' && depth == 0) {
        addTerm(terms, filter.substring(start, i));
        start = i + 1;
      }
    }
    if (depth != 0) {
      throw invalid("unbalanced parentheses in filter");
    }
    addTerm(terms, filter.substring(start));
    return terms;
  }

  private static void addTerm(List<String> terms, String term) {
    String trimmed = term.trim();
    if (trimmed.isEmpty()) {
      throw invalid("empty filter term");
    }
    terms.add(trimmed);
  }

  private static boolean hasOperatorPrefix(String value) {
    int dot = value.indexOf('.');
    if (dot <= 0) {
      return false;
    }
    try {
      operator(value.substring(0, dot));
      return true;
    } catch (SubscriptionException e) {
      return false;
    }
  }

  private static RowFilter.Operator operator(String name) {
    try {
      return RowFilter.Operator.valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw invalid("unsupported filter operator '" + name + "'");
    }
  }

  private static String requireColumn(String column) {
    if (!Identifiers.isValid(column)) {
      throw invalid("invalid filter column '" + column + "'");
    }
    return column;
  }

  private static String unquote(String value) {
    if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
      return value.substring(1, value.length() - 1);
    }
    return value;
  }

  private static List<Object> nullOperand() {
    List<Object> operands = new ArrayList<>(1);
    operands.add(null);
    return operands;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> castMap(Object value) {
    return (Map<String, Object>) value;
  }

  private static SubscriptionException invalid(String message) {
    return new SubscriptionException(SubscriptionException.INVALID_FILTER, message);
  }
}
