package com.ospicorp.anomalydetection.registry;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class SeriesVersionDao {
  static final String NEXT_VERSION_SQL = """
      INSERT INTO series_versions (series_id, last_version)
      VALUES (?, 1)
      ON CONFLICT (series_id)
      DO UPDATE SET last_version = series_versions.last_version + 1
      RETURNING last_version
      """;

  private final JdbcTemplate jdbc;

  public SeriesVersionDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  /**
   * Allocates the next version for a series in one statement. Concurrent callers serialize on
   * the counter row; the increment belongs to the caller's transaction and is undone with it.
   */
  public int nextVersion(String seriesId) {
    Integer version = jdbc.queryForObject(NEXT_VERSION_SQL, Integer.class, seriesId);
    if (version == null) {
      throw new IllegalStateException("Version allocation returned no row for " + seriesId);
    }
    return version;
  }
}
