package dev.henneberger.vertx.realtime.core;

public final class OptionValidation {

  private OptionValidation() {
  }

  public static void require(String fieldName, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
  }

  public static void requireMin(String fieldName, long value, long minInclusive) {
    if (value < minInclusive) {
      throw new IllegalArgumentException(fieldName + " must be >= " + minInclusive);
    }
  }

  public static void requireMin(String fieldName, int value, int minInclusive) {
    if (value < minInclusive) {
      throw new IllegalArgumentException(fieldName + " must be >= " + minInclusive);
    }
  }

  public static void requireIdentifier(String fieldName, String value) {
    require(fieldName, value);
    if (!Identifiers.isValid(value)) {
      throw new IllegalArgumentException(fieldName + " must be a plain SQL identifier: " + value);
    }
  }
}
