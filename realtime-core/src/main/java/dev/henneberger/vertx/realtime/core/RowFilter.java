package dev.henneberger.vertx.realtime.core;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Conjunction of column predicates evaluated against a row image. Built by {@link FilterParser}.
 */
public final class RowFilter {

  private static final RowFilter MATCH_ALL = new RowFilter(List.of());

  public enum Operator {
    EQ, NEQ, GT, GTE, LT, LTE, LIKE, ILIKE, IN, IS
  }

  private final List<Predicate> predicates;

  RowFilter(List<Predicate> predicates) {
    this.predicates = List.copyOf(predicates);
  }

  public static RowFilter matchAll() {
    return MATCH_ALL;
  }

  public boolean isMatchAll() {
    return predicates.isEmpty();
  }

  public List<Predicate> predicates() {
    return predicates;
  }

  public boolean test(Map<String, Object> row) {
    for (Predicate predicate : predicates) {
      if (!predicate.test(row)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return predicates.isEmpty() ? "*" : predicates.toString();
  }

  public static final class Predicate {
    private final String column;
    private final Operator operator;
    private final List<Object> operands;
    private final Pattern likePattern;

    Predicate(String column, Operator operator, List<Object> operands) {
      this.column = column;
      this.operator = operator;
      this.operands = operands;
      if (operator == Operator.LIKE || operator == Operator.ILIKE) {
        this.likePattern = compileLike(String.valueOf(operands.get(0)), operator == Operator.ILIKE);
      } else {
        this.likePattern = null;
      }
    }

    public String column() {
      return column;
    }

    public Operator operator() {
      return operator;
    }

    public List<Object> operands() {
      return operands;
    }

    boolean test(Map<String, Object> row) {
      Object value = row.get(column);
      switch (operator) {
        case IS:
          return testIs(value, operands.get(0));
        case IN:
          for (Object operand : operands) {
            if (value != null && compare(value, operand) == 0) {
              return true;
            }
          }
          return false;
        case LIKE:
        case ILIKE:
          return value != null && likePattern.matcher(String.valueOf(value)).matches();
        default:
          break;
      }

      if (value == null) {
        return false;
      }
      int cmp = compare(value, operands.get(0));
      switch (operator) {
        case EQ:
          return cmp == 0;
        case NEQ:
          return cmp != 0;
        case GT:
          return cmp > 0;
        case GTE:
          return cmp >= 0;
        case LT:
          return cmp < 0;
        case LTE:
          return cmp <= 0;
        default:
          throw new IllegalStateException("unhandled operator " + operator);
      }
    }

    @Override
    public String toString() {
      return column + "=" + operator.name().toLowerCase(Locale.ROOT) + "." + operands;
    }

    private static boolean testIs(Object value, Object operand) {
      if (operand == null) {
        return value == null;
      }
      return value instanceof Boolean && value.equals(operand);
    }

    private static int compare(Object value, Object operand) {
      if (value instanceof Number) {
        BigDecimal left = toDecimal(value);
        BigDecimal right = toDecimal(operand);
        if (left != null && right != null) {
          return left.compareTo(right);
        }
      }
      if (value instanceof Boolean) {
        String text = String.valueOf(operand);
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
          return Boolean.compare((Boolean) value, Boolean.parseBoolean(text));
        }
      }
      return String.valueOf(value).compareTo(String.valueOf(operand));
    }

    private static BigDecimal toDecimal(Object value) {
      if (value instanceof BigDecimal) {
        return (BigDecimal) value;
      }
      try {
        return new BigDecimal(String.valueOf(value).trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }

    private static Pattern compileLike(String pattern, boolean caseInsensitive) {
      StringBuilder regex = new StringBuilder();
      StringBuilder literal = new StringBuilder();
      for (int i = 0; i < pattern.length(); i++) {
        char c = pattern.charAt(i);
        if (c == '%' || c == '*' || c == '_') {
          if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
          }
          regex.append(c == '_' ? "." : ".*");
        } else {
          literal.append(c);
        }
      }
      if (literal.length() > 0) {
        regex.append(Pattern.quote(literal.toString()));
      }
      int flags = Pattern.DOTALL;
      if (caseInsensitive) {
        flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
      }
      return Pattern.compile(regex.toString(), flags);
    }
  }
}
