package dev.henneberger.vertx.realtime.core;

import java.util.regex.Pattern;

/**
 * SQL identifier checks shared by filters, channels and the database collaborators.
 */
public final class Identifiers {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]{0,62}");

  private Identifiers() {
  }

  public static boolean isValid(String name) {
    return name != null && IDENTIFIER.matcher(name).matches();
  }

  /**
   * Double-quotes {@code name}, doubling embedded quotes.
   */
  public static String quote(String name) {
    return '"' + name.replace("\"", "\"\"") + '"';
  }
}
