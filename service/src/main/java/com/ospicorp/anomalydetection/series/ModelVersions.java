package com.ospicorp.anomalydetection.series;

import com.ospicorp.anomalydetection.error.ValidationException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ModelVersions {
  private static final Pattern VERSION = Pattern.compile("^[vV]?(-?\\d{1,9})$");
  private static final Pattern ANY_DIGIT = Pattern.compile("\\d");

  private ModelVersions() {
  }

  /**
   * Parses {@code N}, {@code vN} or {@code VN}; blank means latest (0). Range checks are left
   * to {@link SeriesIds#requireVersion(int)}.
   */
  public static int parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return 0;
    }
    String value = raw.strip();
    Matcher matcher = VERSION.matcher(value);
    if (matcher.matches()) {
      return Integer.parseInt(matcher.group(1));
    }
    if (!ANY_DIGIT.matcher(value).find()) {
      throw new ValidationException("Version must contain at least one digit.");
    }
    throw new ValidationException("Version must be an integer, optionally prefixed with 'v'.");
  }
}
