package org.hypertrace.core.query.compiler.utils;

import java.util.regex.Pattern;

public class TimeUtil {

  // integer magnitude followed by a timespan unit, e.g. 7d, 12h, 30m, 15s, 500ms
  private static final Pattern TIME_SPAN_PATTERN = Pattern.compile("^\\d{1,15}(?:d|h|ms|s|m)$");

  public static boolean isValidTimeSpan(String value) {
    return value != null && TIME_SPAN_PATTERN.matcher(value).matches();
  }
}
