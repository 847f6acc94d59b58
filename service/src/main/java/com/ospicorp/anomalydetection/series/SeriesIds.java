package com.ospicorp.anomalydetection.series;

import com.ospicorp.anomalydetection.error.ConflictException;
import java.util.regex.Pattern;

public final class SeriesIds {
  public static final String SERIES_ID_REGEX = "^[A-Za-z0-9._-]{1,128}$";
  private static final Pattern SERIES_ID = Pattern.compile(SERIES_ID_REGEX);

  private SeriesIds() {
  }

  // Series ids become directory and object key segments, so ".." is never allowed.
  public static String requireValid(String seriesId) {
    if (seriesId == null || seriesId.isBlank()) {
      throw new ConflictException("series_id must be a non-empty string.");
    }
    String value = seriesId.strip();
    if (!SERIES_ID.matcher(value).matches()) {
      throw new ConflictException(
          "series_id must contain only letters, numbers, '.', '_' or '-'.");
    }
    if (value.contains("..")) {
      throw new ConflictException("series_id cannot contain consecutive dots.");
    }
    return value;
  }

  public static int requireVersion(int version) {
    if (version < 0) {
      throw new ConflictException("version must be greater than or equal to 0.");
    }
    return version;
  }
}
