package com.ospicorp.anomalydetection.health;

import com.ospicorp.anomalydetection.config.AnomalyProperties;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Bounded, in-process history of request latencies for the training and prediction
 * endpoints. All access goes through one lock.
 */
@Component
public class LatencyTracker {

  public enum Operation {
    TRAINING("/fit/"),
    INFERENCE("/predict/");

    private final String pathPrefix;

    Operation(String pathPrefix) {
      this.pathPrefix = pathPrefix;
    }

    static Operation forPath(String path) {
      if (path == null) {
        return null;
      }
      for (Operation operation : values()) {
        if (path.startsWith(operation.pathPrefix)) {
          return operation;
        }
      }
      return null;
    }
  }

  private final int historyLimit;
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<Operation, Deque<Double>> samples = new EnumMap<>(Operation.class);

  @Autowired
  public LatencyTracker(AnomalyProperties properties) {
    this(properties.health().latencyHistoryLimit());
  }

  LatencyTracker(int historyLimit) {
    if (historyLimit < 1) {
      throw new IllegalArgumentException("latency history limit must be positive");
    }
    this.historyLimit = historyLimit;
    for (Operation operation : Operation.values()) {
      samples.put(operation, new ArrayDeque<>());
    }
  }

  /** Records the latency of a request if its path belongs to a tracked endpoint. */
  public void recordRequest(String path, double millis) {
    Operation operation = Operation.forPath(path);
    if (operation != null) {
      record(operation, millis);
    }
  }

  public void record(Operation operation, double millis) {
    lock.lock();
    try {
      Deque<Double> history = samples.get(operation);
      history.addLast(millis);
      while (history.size() > historyLimit) {
        history.removeFirst();
      }
    } finally {
      lock.unlock();
    }
  }

  public LatencyMetrics snapshot(Operation operation) {
    List<Double> copy;
    lock.lock();
    try {
      copy = new ArrayList<>(samples.get(operation));
    } finally {
      lock.unlock();
    }
    if (copy.isEmpty()) {
      return new LatencyMetrics(0.0, 0.0);
    }
    double sum = 0.0;
    for (double value : copy) {
      sum += value;
    }
    Collections.sort(copy);
    // nearest rank
    int rank = (int) Math.ceil(0.95 * copy.size());
    double p95 = copy.get(Math.max(rank, 1) - 1);
    return new LatencyMetrics(sum / copy.size(), p95);
  }
}
