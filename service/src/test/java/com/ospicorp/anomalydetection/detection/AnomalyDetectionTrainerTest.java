package com.ospicorp.anomalydetection.detection;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.anomalydetection.series.DataPoint;
import com.ospicorp.anomalydetection.series.ModelState;
import com.ospicorp.anomalydetection.series.TimeSeries;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnomalyDetectionTrainerTest {

  private static final TimeSeries SERIES = new TimeSeries(List.of(
      new DataPoint(1, 1.0), new DataPoint(2, 2.0), new DataPoint(3, 3.0)));

  @Test
  void trainInvokesCallbackOnceWithReturnedState() {
    List<ModelState> callbacks = new ArrayList<>();
    AnomalyDetectionTrainer trainer = new AnomalyDetectionTrainer(SimpleStatModel::new, callbacks::add);

    ModelState state = trainer.train(SERIES);

    assertThat(callbacks).containsExactly(state);
  }

  @Test
  void restoredModelMatchesTrainedOne() {
    AnomalyDetectionTrainer trainer = new AnomalyDetectionTrainer();
    ModelState state = trainer.train(SERIES);

    AnomalyModel model = trainer.restore(state);

    assertThat(model.save()).isEqualTo(state);
    assertThat(model.predict(new DataPoint(4, 10.0))).isTrue();
    assertThat(model.predict(new DataPoint(4, 2.5))).isFalse();
  }

  @Test
  void eachTrainingUsesAFreshModel() {
    AnomalyDetectionTrainer trainer = new AnomalyDetectionTrainer();

    ModelState first = trainer.train(SERIES);
    ModelState second = trainer.train(new TimeSeries(List.of(
        new DataPoint(1, 100.0), new DataPoint(2, 200.0))));

    assertThat(first.parameters().get("mean")).isEqualTo(2.0);
    assertThat(second.parameters().get("mean")).isEqualTo(150.0);
  }
}
