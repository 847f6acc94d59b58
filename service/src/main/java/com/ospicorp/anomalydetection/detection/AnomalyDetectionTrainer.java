package com.ospicorp.anomalydetection.detection;

import com.ospicorp.anomalydetection.series.ModelState;
import com.ospicorp.anomalydetection.series.TimeSeries;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AnomalyDetectionTrainer implements Trainer {
  private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionTrainer.class);

  private final Supplier<AnomalyModel> modelFactory;
  private final Consumer<ModelState> callback;

  public AnomalyDetectionTrainer() {
    this(SimpleStatModel::new, state -> log.debug("Fitted {} with {}", state.model(),
        state.parameters()));
  }

  public AnomalyDetectionTrainer(Supplier<AnomalyModel> modelFactory,
      Consumer<ModelState> callback) {
    this.modelFactory = modelFactory;
    this.callback = callback;
  }

  // Fresh model per call: the trainer bean is shared across request threads.
  @Override
  public ModelState train(TimeSeries data) {
    AnomalyModel model = modelFactory.get();
    model.fit(data, callback);
    return model.save();
  }

  @Override
  public AnomalyModel restore(ModelState state) {
    AnomalyModel model = modelFactory.get();
    model.load(state);
    return model;
  }
}
