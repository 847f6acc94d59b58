package com.ospicorp.anomalydetection.series;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.anomalydetection.error.ConflictException;
import com.ospicorp.anomalydetection.error.ValidationException;
import org.junit.jupiter.api.Test;

class SeriesIdsTest {

  @Test
  void stripsSurroundingWhitespace() {
    assertThat(SeriesIds.requireValid("  sensor_1.a-b ")).isEqualTo("sensor_1.a-b");
  }

  @Test
  void rejectsBlankIds() {
    assertThatThrownBy(() -> SeriesIds.requireValid("   "))
        .isInstanceOf(ConflictException.class)
        .hasMessage("series_id must be a non-empty string.");
  }

  @Test
  void rejectsPathTraversal() {
    assertThatThrownBy(() -> SeriesIds.requireValid("a..b"))
        .isInstanceOf(ConflictException.class);
    assertThatThrownBy(() -> SeriesIds.requireValid("a/b"))
        .isInstanceOf(ConflictException.class);
  }

  @Test
  void rejectsNegativeVersions() {
    assertThat(SeriesIds.requireVersion(0)).isZero();
    assertThatThrownBy(() -> SeriesIds.requireVersion(-1))
        .isInstanceOf(ConflictException.class);
  }

  @Test
  void parsesVersionForms() {
    assertThat(ModelVersions.parse(null)).isZero();
    assertThat(ModelVersions.parse("3")).isEqualTo(3);
    assertThat(ModelVersions.parse("v2")).isEqualTo(2);
    assertThat(ModelVersions.parse(" V7 ")).isEqualTo(7);
    assertThat(ModelVersions.parse("-1")).isEqualTo(-1);
  }

  @Test
  void versionWithoutDigitsIsAValidationError() {
    assertThatThrownBy(() -> ModelVersions.parse("latest"))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Version must contain at least one digit.");
    assertThatThrownBy(() -> ModelVersions.parse("v1.5"))
        .isInstanceOf(ValidationException.class);
  }
}
