package com.ospicorp.anomalydetection.trainingdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.ospicorp.anomalydetection.error.InternalException;
import com.ospicorp.anomalydetection.error.NotFoundException;
import com.ospicorp.anomalydetection.registry.ModelRecordLookup;
import com.ospicorp.anomalydetection.registry.ModelRecordRepository;
import com.ospicorp.anomalydetection.registry.ModelRecordView;
import com.ospicorp.anomalydetection.series.DataPoint;
import com.ospicorp.anomalydetection.series.TimeSeries;
import com.ospicorp.anomalydetection.storage.ArtifactNotFoundException;
import com.ospicorp.anomalydetection.storage.ArtifactStorage;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TrainingDataServiceTest {
  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  @Mock
  private ModelRecordLookup lookup;
  @Mock
  private ModelRecordRepository records;
  @Mock
  private ArtifactStorage storage;

  private TrainingDataService service;

  @BeforeEach
  void setUp() {
    service = new TrainingDataService(lookup, records, storage);
  }

  @Test
  void loadsPointsOfResolvedVersion() {
    when(lookup.resolve("s1", 0)).thenReturn(new ModelRecordView("s1", 2, "/m", "/d", NOW, NOW));
    List<DataPoint> points = List.of(new DataPoint(1, 1.0), new DataPoint(2, 2.0));
    when(storage.loadData("/d")).thenReturn(new TimeSeries(points));

    TrainingDataResponse response = service.load("s1", 0);

    assertThat(response).isEqualTo(new TrainingDataResponse("s1", 2, 2, points));
  }

  @Test
  void missingDataPathIsAnInternalError() {
    when(lookup.resolve("s1", 1)).thenReturn(new ModelRecordView("s1", 1, null, null, NOW, NOW));

    assertThatThrownBy(() -> service.load("s1", 1))
        .isInstanceOf(InternalException.class)
        .hasMessageContaining("Training data path is missing");
  }

  @Test
  void missingArtifactIsNotFound() {
    when(lookup.resolve("s1", 1)).thenReturn(new ModelRecordView("s1", 1, "/m", "/d", NOW, NOW));
    when(storage.loadData("/d")).thenThrow(new ArtifactNotFoundException("/d", null));

    assertThatThrownBy(() -> service.load("s1", 1)).isInstanceOf(NotFoundException.class);
  }

  @Test
  void listsVersionsOldestFirst() {
    when(records.listVersions("s1")).thenReturn(List.of(
        new ModelRecordView("s1", 1, "/m1", "/d1", NOW, NOW),
        new ModelRecordView("s1", 2, "/m2", "/d2", NOW, NOW)));

    ModelVersionsResponse response = service.versions("s1");

    assertThat(response.versions()).extracting(ModelVersionsResponse.VersionEntry::version)
        .containsExactly(1, 2);
  }

  @Test
  void unknownSeriesHasNoVersions() {
    when(records.listVersions("nope")).thenReturn(List.of());

    assertThatThrownBy(() -> service.versions("nope")).isInstanceOf(NotFoundException.class);
  }
}
